package com.forge.ledger.memory;

import com.forge.ledger.ExecutionStore;
import com.forge.ledger.PersistenceException;
import com.forge.ledger.WorkflowExecution;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Execution records held in memory. Same contract as the JDBC store: ids are random UUIDs and a
 * terminal record can no longer be updated.
 */
public final class InMemoryExecutionStore implements ExecutionStore {

    private final Map<String, WorkflowExecution> executions = new ConcurrentHashMap<>();

    @Override
    public WorkflowExecution create(WorkflowExecution execution) {
        WorkflowExecution stored = execution.withId(UUID.randomUUID().toString());
        executions.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public void update(WorkflowExecution execution) {
        String id = execution.getId();
        if (id == null) {
            throw new PersistenceException("updateExecution", "execution has no id");
        }
        WorkflowExecution updated = executions.computeIfPresent(id, (k, current) -> {
            if (current.isTerminal()) {
                throw new PersistenceException("updateExecution", "executionId=" + id + " is already " + current.getStatus().toValue());
            }
            return execution;
        });
        if (updated == null) {
            throw new PersistenceException("updateExecution", "executionId=" + id + " not found");
        }
    }

    @Override
    public Optional<WorkflowExecution> findById(String executionId) {
        return executionId == null ? Optional.empty() : Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<WorkflowExecution> findByWorkflowId(String workflowId) {
        List<WorkflowExecution> out = new ArrayList<>();
        for (WorkflowExecution e : executions.values()) {
            if (e.getWorkflowId().equals(workflowId)) {
                out.add(e);
            }
        }
        out.sort(Comparator.comparing(WorkflowExecution::getStartedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        return out;
    }

    public int size() {
        return executions.size();
    }
}
