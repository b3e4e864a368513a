package com.forge.features.metrics;

import com.forge.engine.WorkflowOrchestrator;
import com.forge.engine.error.OrchestrationException;
import com.forge.events.ExecutionEventBus;
import com.forge.graph.model.NodeCategory;
import com.forge.graph.model.Workflow;
import com.forge.graph.model.WorkflowEdge;
import com.forge.graph.model.WorkflowNode;
import com.forge.handler.CancellationToken;
import com.forge.handler.NodeHandlerRegistry;
import com.forge.ledger.memory.InMemoryExecutionStore;
import com.forge.ledger.memory.InMemoryWorkflowStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MetricsObserverTest {

    private SimpleMeterRegistry meters;
    private InMemoryWorkflowStore workflows;
    private WorkflowOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        MetricsObserver metrics = new MetricsObserver(meters);
        NodeHandlerRegistry registry = new NodeHandlerRegistry();
        registry.register("ok", ctx -> "fine");
        registry.register("boom", ctx -> {
            throw new IllegalArgumentException("bad");
        });
        workflows = new InMemoryWorkflowStore();
        workflows.put(Workflow.of("wf",
                List.of(WorkflowNode.of("A", "ok", NodeCategory.TRIGGER),
                        WorkflowNode.of("B", "ok", NodeCategory.ACTION),
                        WorkflowNode.of("C", "boom", NodeCategory.ACTION)),
                List.of(WorkflowEdge.of("A", "B"), WorkflowEdge.of("A", "C"))));
        orchestrator = WorkflowOrchestrator.builder()
                .workflowStore(workflows)
                .executionStore(new InMemoryExecutionStore())
                .handlerRegistry(registry)
                .eventBus(new ExecutionEventBus().subscribe(metrics))
                .observer(metrics)
                .build();
    }

    @Test
    void completedExecution_countsNodesByTypeAndOutcome() {
        orchestrator.executeWorkflow("wf", Map.of(), "test");

        assertEquals(2.0, meters.get(MetricsObserver.NODE_EXECUTIONS).tags("nodeType", "ok", "outcome", "success").counter().count());
        assertEquals(1.0, meters.get(MetricsObserver.NODE_EXECUTIONS).tags("nodeType", "boom", "outcome", "failure").counter().count());
        assertEquals(2L, meters.get(MetricsObserver.NODE_LATENCY).tags("nodeType", "ok").timer().count());
        assertEquals(1.0, meters.get(MetricsObserver.WORKFLOW_EXECUTIONS).tags("event", "started").counter().count());
        assertEquals(1.0, meters.get(MetricsObserver.WORKFLOW_EXECUTIONS).tags("event", "completed").counter().count());
    }

    @Test
    void failedExecution_countsFailedEvent() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(OrchestrationException.class, () -> orchestrator.executeWorkflow("wf", Map.of(), "test", token));

        assertEquals(1.0, meters.get(MetricsObserver.WORKFLOW_EXECUTIONS).tags("event", "failed").counter().count());
    }
}
