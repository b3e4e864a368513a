package com.forge.ledger.memory;

import com.forge.ledger.ExecutionStatus;
import com.forge.ledger.PersistenceException;
import com.forge.ledger.WorkflowExecution;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InMemoryExecutionStoreTest {

    private final InMemoryExecutionStore store = new InMemoryExecutionStore();

    @Test
    void create_assignsIdAndStoresRunningRecord() {
        WorkflowExecution created = store.create(
                WorkflowExecution.created("wf", "api", Map.of()).start(Instant.now()));

        assertNotNull(created.getId());
        assertEquals(ExecutionStatus.RUNNING, store.findById(created.getId()).orElseThrow().getStatus());
        assertEquals(List.of(created.getId()), store.findByWorkflowId("wf").stream().map(WorkflowExecution::getId).toList());
    }

    @Test
    void update_terminalRecord_isRejected() {
        WorkflowExecution running = store.create(WorkflowExecution.created("wf", null, null).start(Instant.now()));
        WorkflowExecution done = running.complete(Map.of("A", 1), List.of(), Instant.now());
        store.update(done);

        assertEquals(ExecutionStatus.COMPLETED, store.findById(running.getId()).orElseThrow().getStatus());
        assertThrows(PersistenceException.class, () -> store.update(done));
    }

    @Test
    void update_unknownId_isRejected() {
        WorkflowExecution ghost = WorkflowExecution.created("wf", null, null).withId("missing").start(Instant.now());

        assertThrows(PersistenceException.class, () -> store.update(ghost));
    }
}
