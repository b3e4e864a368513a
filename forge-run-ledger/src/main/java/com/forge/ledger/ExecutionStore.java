package com.forge.ledger;

import java.util.List;
import java.util.Optional;

/**
 * Create-then-update store for execution records (table forge_workflow_execution).
 */
public interface ExecutionStore {

    /**
     * Persists a new execution and returns it with its assigned id.
     *
     * @param execution execution without id (status RUNNING)
     * @return stored execution with id
     * @throws PersistenceException on write failure
     */
    WorkflowExecution create(WorkflowExecution execution);

    /**
     * Persists a status change (terminal update with result or error data).
     *
     * @throws PersistenceException on write failure, unknown id, or when the stored record is already terminal
     */
    void update(WorkflowExecution execution);

    Optional<WorkflowExecution> findById(String executionId);

    /** Executions of one workflow, oldest first. */
    List<WorkflowExecution> findByWorkflowId(String workflowId);
}
