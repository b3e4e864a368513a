package com.forge.ledger;

/**
 * Lifecycle status of a workflow execution: CREATED → RUNNING → {COMPLETED, FAILED}.
 * Transitions only move forward; COMPLETED and FAILED are terminal.
 * The persisted value is the lower-case name ("running", "completed", "failed").
 */
public enum ExecutionStatus {
    CREATED,
    RUNNING,
    COMPLETED,
    FAILED;

    public String toValue() {
        return name().toLowerCase();
    }

    public static ExecutionStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Execution status must be non-blank");
        }
        return valueOf(value.trim().toUpperCase());
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** True when moving from this status to {@code next} is a forward transition. */
    public boolean canTransitionTo(ExecutionStatus next) {
        if (next == null) return false;
        return switch (this) {
            case CREATED -> next == RUNNING || next == FAILED;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
