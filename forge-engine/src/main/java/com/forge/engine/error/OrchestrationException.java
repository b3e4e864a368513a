package com.forge.engine.error;

/**
 * Failure outside individual node handlers (planning, dispatch, join, aggregation, cancellation).
 * The execution has been marked FAILED before this is thrown.
 */
public final class OrchestrationException extends RuntimeException {

    private final String workflowId;
    private final String executionId;

    public OrchestrationException(String workflowId, String executionId, String message, Throwable cause) {
        super(message, cause);
        this.workflowId = workflowId;
        this.executionId = executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getExecutionId() {
        return executionId;
    }
}
