package com.forge.ledger.memory;

import com.forge.graph.model.Workflow;
import com.forge.ledger.WorkflowStore;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Workflows held in a map; used by tests and embedded runs. */
public final class InMemoryWorkflowStore implements WorkflowStore {

    private final Map<String, Workflow> workflows = new ConcurrentHashMap<>();

    public InMemoryWorkflowStore put(Workflow workflow) {
        Objects.requireNonNull(workflow, "workflow");
        workflows.put(Objects.requireNonNull(workflow.getId(), "workflow.id"), workflow);
        return this;
    }

    @Override
    public Optional<Workflow> findById(String workflowId) {
        return workflowId == null ? Optional.empty() : Optional.ofNullable(workflows.get(workflowId));
    }
}
