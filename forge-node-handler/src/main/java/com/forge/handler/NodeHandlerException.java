package com.forge.handler;

/**
 * Optional exception type for handlers that want to report a machine-readable error code.
 * The code is copied into the failed node result; other exceptions are reported with their
 * class name as code.
 */
public class NodeHandlerException extends Exception {

    private final String code;

    public NodeHandlerException(String code, String message) {
        super(message);
        this.code = code;
    }

    public NodeHandlerException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /** Error code (e.g. "LOOKUP_NOT_FOUND"); may be null. */
    public String getCode() {
        return code;
    }
}
