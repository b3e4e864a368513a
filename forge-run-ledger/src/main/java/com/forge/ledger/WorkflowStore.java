package com.forge.ledger;

import com.forge.graph.model.Workflow;

import java.util.Optional;

/**
 * Read access to stored workflows. Implementations: in-memory, file directory, PostgreSQL.
 */
public interface WorkflowStore {

    /**
     * Looks up a workflow by id.
     *
     * @param workflowId workflow id
     * @return the workflow, or empty when no workflow has this id
     * @throws PersistenceException when the store cannot be read
     */
    Optional<Workflow> findById(String workflowId);
}
