package com.forge.ledger;

/**
 * Thrown when the underlying store (database, file system) cannot be read or written.
 * The engine logs it; it is propagated only when creating the execution record fails.
 */
public final class PersistenceException extends RuntimeException {

    private final String operation;

    public PersistenceException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
    }

    public PersistenceException(String operation, String message) {
        this(operation, message, null);
    }

    /** Store operation that failed (e.g. "createExecution", "appendNodeLog"). */
    public String getOperation() {
        return operation;
    }
}
