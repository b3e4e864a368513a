package com.forge.ledger;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowExecutionTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void complete_fromRunning_setsResultAndPartialFailure() {
        WorkflowExecution running = WorkflowExecution.created("wf", "api", Map.of("x", 1)).start(T0);

        WorkflowExecution done = running.complete(Map.of("A", "ok"), List.of("B"), T0.plusSeconds(1));

        assertEquals(ExecutionStatus.COMPLETED, done.getStatus());
        assertEquals(Map.of("A", "ok"), done.getResultData());
        assertTrue(done.isPartialFailure());
        assertEquals(List.of("B"), done.getFailedNodeIds());
        assertNull(done.getErrorData());
        assertEquals(T0, done.getStartedAt());
    }

    @Test
    void complete_withoutFailures_isNotPartial() {
        WorkflowExecution done = WorkflowExecution.created("wf", null, null).start(T0).complete(Map.of(), List.of(), T0);

        assertFalse(done.isPartialFailure());
        assertTrue(done.getInputData().isEmpty());
    }

    @Test
    void terminalStatus_rejectsFurtherTransitions() {
        WorkflowExecution failed = WorkflowExecution.created("wf", null, null).start(T0)
                .fail(Map.of("message", "boom"), T0);

        assertThrows(IllegalStateException.class, () -> failed.complete(Map.of(), List.of(), T0));
        assertThrows(IllegalStateException.class, () -> failed.fail(Map.of(), T0));
        assertThrows(IllegalStateException.class, () -> failed.start(T0));
    }

    @Test
    void created_cannotCompleteWithoutRunning() {
        WorkflowExecution created = WorkflowExecution.created("wf", null, null);

        assertThrows(IllegalStateException.class, () -> created.complete(Map.of(), List.of(), T0));
    }

    @Test
    void statusValues_roundTripLowerCase() {
        assertEquals("running", ExecutionStatus.RUNNING.toValue());
        assertEquals(ExecutionStatus.COMPLETED, ExecutionStatus.fromValue("completed"));
        assertTrue(ExecutionStatus.FAILED.isTerminal());
        assertFalse(ExecutionStatus.COMPLETED.canTransitionTo(ExecutionStatus.RUNNING));
    }
}
