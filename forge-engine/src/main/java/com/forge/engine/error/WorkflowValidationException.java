package com.forge.engine.error;

import com.forge.engine.validator.DagValidationResult;

import java.util.List;

/**
 * The workflow failed DAG validation. Carries the full validation result; no execution record
 * is created and the call is not retried.
 */
public final class WorkflowValidationException extends RuntimeException {

    private final String workflowId;
    private final DagValidationResult validationResult;

    public WorkflowValidationException(String workflowId, DagValidationResult validationResult) {
        super("Invalid workflow " + workflowId + ": " + String.join("; ", validationResult.getErrors()));
        this.workflowId = workflowId;
        this.validationResult = validationResult;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public DagValidationResult getValidationResult() {
        return validationResult;
    }

    public List<String> getErrors() {
        return validationResult.getErrors();
    }
}
