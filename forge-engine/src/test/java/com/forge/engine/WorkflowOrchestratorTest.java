package com.forge.engine;

import com.forge.engine.error.OrchestrationException;
import com.forge.engine.error.WorkflowNotFoundException;
import com.forge.engine.error.WorkflowValidationException;
import com.forge.engine.node.NodeExecutionResult;
import com.forge.events.ExecutionEvent;
import com.forge.events.ExecutionEventBus;
import com.forge.events.ExecutionEventType;
import com.forge.graph.model.NodeCategory;
import com.forge.graph.model.Workflow;
import com.forge.graph.model.WorkflowEdge;
import com.forge.graph.model.WorkflowNode;
import com.forge.handler.CancellationToken;
import com.forge.handler.NodeHandlerException;
import com.forge.handler.NodeHandlerRegistry;
import com.forge.ledger.ExecutionStatus;
import com.forge.ledger.ExecutionStore;
import com.forge.ledger.PersistenceException;
import com.forge.ledger.WorkflowExecution;
import com.forge.ledger.memory.InMemoryExecutionStore;
import com.forge.ledger.memory.InMemoryNodeLogSink;
import com.forge.ledger.memory.InMemoryWorkflowStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowOrchestratorTest {

    private InMemoryWorkflowStore workflows;
    private InMemoryExecutionStore executions;
    private InMemoryNodeLogSink nodeLogs;
    private NodeHandlerRegistry registry;
    private ExecutionEventBus bus;
    private final List<ExecutionEvent> events = new CopyOnWriteArrayList<>();
    private ExecutorService sharedPool;

    @BeforeEach
    void setUp() {
        workflows = new InMemoryWorkflowStore();
        executions = new InMemoryExecutionStore();
        nodeLogs = new InMemoryNodeLogSink();
        registry = new NodeHandlerRegistry();
        registry.register("test_echo", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>(ctx.getInput());
            out.put("node", ctx.getNodeId());
            return out;
        });
        registry.register("test_fail", ctx -> {
            throw new NodeHandlerException("BAD_INPUT", "cannot process " + ctx.getNodeId());
        });
        bus = new ExecutionEventBus().subscribe(events::add);
    }

    @AfterEach
    void tearDown() {
        if (sharedPool != null) {
            sharedPool.shutdownNow();
        }
    }

    private WorkflowOrchestrator.Builder orchestrator() {
        return WorkflowOrchestrator.builder()
                .workflowStore(workflows)
                .executionStore(executions)
                .handlerRegistry(registry)
                .nodeLogSink(nodeLogs)
                .eventBus(bus);
    }

    private List<ExecutionEventType> eventTypes() {
        return events.stream().map(ExecutionEvent::getType).toList();
    }

    @Test
    void executeWorkflow_diamond_completesWithOutputsInPlanOrder() {
        workflows.put(TestWorkflows.diamond());

        WorkflowExecution execution = orchestrator().build()
                .executeWorkflow("diamond", Map.of("x", 1), "api");

        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        assertEquals(List.of("A", "B", "C", "D"), new ArrayList<>(execution.getResultData().keySet()));
        assertEquals(Map.of("x", 1, "node", "A"), execution.getResultData().get("A"));
        @SuppressWarnings("unchecked")
        Map<String, Object> b = (Map<String, Object>) execution.getResultData().get("B");
        assertEquals(execution.getResultData().get("A"), b.get("input"));
        assertFalse(execution.isPartialFailure());
        assertNotNull(execution.getCompletedAt());
        assertEquals(ExecutionStatus.COMPLETED, executions.findById(execution.getId()).orElseThrow().getStatus());
        assertEquals(4, nodeLogs.forExecution(execution.getId()).size());
        assertEquals(List.of(ExecutionEventType.STARTED, ExecutionEventType.COMPLETED), eventTypes());
        assertEquals("api", events.get(0).getPayload().get("triggeredBy"));
    }

    @Test
    void runWorkflow_failingNode_isIsolatedAndFlagsPartialFailure() {
        workflows.put(Workflow.of("iso",
                List.of(TestWorkflows.trigger("A"), TestWorkflows.node("B", "test_fail"),
                        TestWorkflows.node("C"), TestWorkflows.node("D")),
                List.of(WorkflowEdge.of("A", "B"), WorkflowEdge.of("A", "C"),
                        WorkflowEdge.of("B", "output", "D", "fromB"), WorkflowEdge.of("C", "output", "D", "fromC"))));

        ExecutionReport report = orchestrator().build().runWorkflow("iso", Map.of(), "api", CancellationToken.NONE);

        NodeExecutionResult b = report.getNodeResult("B").orElseThrow();
        NodeExecutionResult c = report.getNodeResult("C").orElseThrow();
        assertFalse(b.isSuccess());
        assertEquals("cannot process B", b.getError().getMessage());
        assertEquals("BAD_INPUT", b.getError().getCode());
        assertTrue(c.isSuccess());

        WorkflowExecution execution = report.getExecution();
        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        assertTrue(execution.isPartialFailure());
        assertEquals(List.of("B"), execution.getFailedNodeIds());
        assertTrue(execution.getResultData().containsKey("B"));
        assertNull(execution.getResultData().get("B"));
        @SuppressWarnings("unchecked")
        Map<String, Object> d = (Map<String, Object>) execution.getResultData().get("D");
        assertFalse(d.containsKey("fromB"));
        assertTrue(d.containsKey("fromC"));
        assertEquals(List.of(b), report.getFailedNodeResults());
    }

    @Test
    void executeWorkflow_groupMembersRunConcurrently() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        registry.register("test_rendezvous", ctx -> {
            bothStarted.countDown();
            if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("sibling never started");
            }
            return ctx.getNodeId();
        });
        workflows.put(Workflow.of("par",
                List.of(TestWorkflows.trigger("A"), TestWorkflows.node("B", "test_rendezvous"),
                        TestWorkflows.node("C", "test_rendezvous")),
                List.of(WorkflowEdge.of("A", "B"), WorkflowEdge.of("A", "C"))));

        WorkflowExecution execution = orchestrator().build().executeWorkflow("par", Map.of(), "api");

        assertFalse(execution.isPartialFailure(), String.valueOf(execution.getFailedNodeIds()));
        assertEquals("B", execution.getResultData().get("B"));
        assertEquals("C", execution.getResultData().get("C"));
    }

    @Test
    void executeWorkflow_sharedExecutor_isUsedAndLeftRunning() {
        sharedPool = Executors.newFixedThreadPool(2);
        List<String> threads = new CopyOnWriteArrayList<>();
        registry.register("test_thread", ctx -> {
            threads.add(Thread.currentThread().getName());
            return ctx.getNodeId();
        });
        workflows.put(Workflow.of("threads",
                List.of(TestWorkflows.node("B", "test_thread"), TestWorkflows.node("C", "test_thread")), List.of()));

        orchestrator().executor(sharedPool).build().executeWorkflow("threads", Map.of(), "api");

        assertEquals(2, threads.size());
        assertTrue(threads.stream().allMatch(t -> t.startsWith("pool-")), threads.toString());
        assertFalse(sharedPool.isShutdown());
    }

    @Test
    void executeWorkflow_unknownWorkflow_createsNothing() {
        assertThrows(WorkflowNotFoundException.class,
                () -> orchestrator().build().executeWorkflow("missing", Map.of(), "api"));

        assertEquals(0, executions.size());
        assertTrue(events.isEmpty());
    }

    @Test
    void executeWorkflow_emptyWorkflow_isRejectedWithoutRecord() {
        workflows.put(Workflow.of("empty", List.of(), List.of()));

        WorkflowValidationException e = assertThrows(WorkflowValidationException.class,
                () -> orchestrator().build().executeWorkflow("empty", Map.of(), "api"));

        assertEquals(List.of("Workflow must have at least one node"), e.getErrors());
        assertEquals(0, executions.size());
        assertTrue(events.isEmpty());
    }

    @Test
    void executeWorkflow_cyclicWorkflow_isRejectedWithoutRecord() {
        workflows.put(TestWorkflows.cyclic());

        WorkflowValidationException e = assertThrows(WorkflowValidationException.class,
                () -> orchestrator().build().executeWorkflow("cyclic", Map.of(), "api"));

        assertEquals(List.of(List.of("A", "B", "C")), e.getValidationResult().getCycles());
        assertEquals(0, executions.size());
    }

    @Test
    void executeWorkflow_cancelledBeforeStart_marksExecutionFailed() {
        workflows.put(TestWorkflows.chain());
        CancellationToken token = new CancellationToken();
        token.cancel();

        OrchestrationException e = assertThrows(OrchestrationException.class,
                () -> orchestrator().build().executeWorkflow("chain", Map.of(), "api", token));

        assertInstanceOf(CancellationException.class, e.getCause());
        WorkflowExecution stored = executions.findById(e.getExecutionId()).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, stored.getStatus());
        assertTrue(String.valueOf(stored.getErrorData().get("message")).contains("cancelled before group 1"));
        assertNotNull(stored.getErrorData().get("stack"));
        assertTrue(nodeLogs.getRecords().isEmpty());
        assertEquals(List.of(ExecutionEventType.STARTED, ExecutionEventType.FAILED), eventTypes());
    }

    @Test
    void executeWorkflow_cancelledByNode_stopsAtNextGroupBoundary() {
        CancellationToken token = new CancellationToken();
        registry.register("test_cancel", ctx -> {
            ctx.getCancellation().cancel();
            return "cancelled";
        });
        workflows.put(Workflow.of("stop",
                List.of(WorkflowNode.of("A", "test_cancel", NodeCategory.TRIGGER), TestWorkflows.node("B")),
                List.of(WorkflowEdge.of("A", "B"))));

        OrchestrationException e = assertThrows(OrchestrationException.class,
                () -> orchestrator().build().executeWorkflow("stop", Map.of(), "api", token));

        assertEquals(List.of("A"), nodeLogs.forExecution(e.getExecutionId()).stream().map(r -> r.getNodeId()).toList());
    }

    @Test
    void executeWorkflow_failOnNodeError_escalatesToOrchestrationFault() {
        workflows.put(Workflow.of("strict",
                List.of(WorkflowNode.of("A", "test_fail", NodeCategory.TRIGGER), TestWorkflows.node("B")),
                List.of(WorkflowEdge.of("A", "B"))));

        OrchestrationException e = assertThrows(OrchestrationException.class,
                () -> orchestrator().failOnNodeError(true).build().executeWorkflow("strict", Map.of(), "api"));

        assertEquals(ExecutionStatus.FAILED, executions.findById(e.getExecutionId()).orElseThrow().getStatus());
        assertEquals(1, nodeLogs.forExecution(e.getExecutionId()).size());
        assertEquals(ExecutionEventType.FAILED, events.get(events.size() - 1).getType());
    }

    @Test
    void executeWorkflow_createFailure_propagatesWithoutEvents() {
        workflows.put(TestWorkflows.chain());
        ExecutionStore broken = new DelegatingExecutionStore(executions) {
            @Override
            public WorkflowExecution create(WorkflowExecution execution) {
                throw new PersistenceException("createExecution", "db down");
            }
        };

        assertThrows(PersistenceException.class,
                () -> orchestrator().executionStore(broken).build().executeWorkflow("chain", Map.of(), "api"));

        assertTrue(events.isEmpty());
    }

    @Test
    void executeWorkflow_terminalUpdateFailure_isLoggedAndExecutionReturned() {
        workflows.put(TestWorkflows.chain());
        ExecutionStore flaky = new DelegatingExecutionStore(executions) {
            @Override
            public void update(WorkflowExecution execution) {
                throw new PersistenceException("updateExecution", "db down");
            }
        };

        WorkflowExecution execution = orchestrator().executionStore(flaky).build()
                .executeWorkflow("chain", Map.of(), "api");

        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        assertEquals(ExecutionStatus.RUNNING, executions.findById(execution.getId()).orElseThrow().getStatus());
        assertEquals(ExecutionEventType.COMPLETED, events.get(events.size() - 1).getType());
    }

    @Test
    void executeWorkflow_handlerErrorInSingleNodeGroup_isRecordedAsNodeFailure() {
        registry.register("test_assert", ctx -> {
            throw new AssertionError("handler bug");
        });
        workflows.put(Workflow.of("solo",
                List.of(WorkflowNode.of("A", "test_assert", NodeCategory.TRIGGER)), List.of()));

        ExecutionReport report = orchestrator().build().runWorkflow("solo", Map.of(), "api", CancellationToken.NONE);

        WorkflowExecution execution = report.getExecution();
        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        assertEquals(List.of("A"), execution.getFailedNodeIds());
        NodeExecutionResult a = report.getNodeResult("A").orElseThrow();
        assertEquals("handler bug", a.getError().getMessage());
        assertEquals(AssertionError.class.getName(), a.getError().getCode());
        assertEquals(ExecutionStatus.COMPLETED, executions.findById(execution.getId()).orElseThrow().getStatus());
        assertEquals(List.of(ExecutionEventType.STARTED, ExecutionEventType.COMPLETED), eventTypes());
    }

    @Test
    void executeWorkflow_handlerErrorInParallelGroup_doesNotFailSibling() {
        registry.register("test_overflow", ctx -> {
            throw new StackOverflowError("deep");
        });
        workflows.put(Workflow.of("pair",
                List.of(TestWorkflows.trigger("A"), TestWorkflows.node("B", "test_overflow"), TestWorkflows.node("C")),
                List.of(WorkflowEdge.of("A", "B"), WorkflowEdge.of("A", "C"))));

        WorkflowExecution execution = orchestrator().build().executeWorkflow("pair", Map.of(), "api");

        assertEquals(ExecutionStatus.COMPLETED, execution.getStatus());
        assertTrue(execution.isPartialFailure());
        assertEquals(List.of("B"), execution.getFailedNodeIds());
        assertNotNull(execution.getResultData().get("C"));
        assertEquals(3, nodeLogs.forExecution(execution.getId()).size());
    }

    @Test
    void executeWorkflow_errorOutsideHandler_marksExecutionFailed() {
        workflows.put(TestWorkflows.chain());
        WorkflowOrchestrator orchestrator = orchestrator()
                .observer((ctx, result) -> {
                    throw new AssertionError("observer bug");
                })
                .build();

        OrchestrationException e = assertThrows(OrchestrationException.class,
                () -> orchestrator.executeWorkflow("chain", Map.of(), "api"));

        assertInstanceOf(AssertionError.class, e.getCause());
        WorkflowExecution stored = executions.findById(e.getExecutionId()).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, stored.getStatus());
        assertEquals("observer bug", stored.getErrorData().get("message"));
        assertEquals(List.of(ExecutionEventType.STARTED, ExecutionEventType.FAILED), eventTypes());
    }

    @Test
    void executeWorkflow_rejectedDispatch_waitsForSubmittedMembers() {
        sharedPool = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new SynchronousQueue<>());
        registry.register("test_slow", ctx -> {
            Thread.sleep(200);
            return ctx.getNodeId();
        });
        workflows.put(Workflow.of("busy",
                List.of(TestWorkflows.node("B", "test_slow"), TestWorkflows.node("C", "test_slow")), List.of()));

        OrchestrationException e = assertThrows(OrchestrationException.class,
                () -> orchestrator().executor(sharedPool).build().executeWorkflow("busy", Map.of(), "api"));

        assertInstanceOf(RejectedExecutionException.class, e.getCause());
        assertEquals(1, nodeLogs.forExecution(e.getExecutionId()).size());
        assertEquals(ExecutionStatus.FAILED, executions.findById(e.getExecutionId()).orElseThrow().getStatus());
    }

    @Test
    void validateAndPlan_areExposed() {
        WorkflowOrchestrator orchestrator = orchestrator().build();

        assertTrue(orchestrator.validateWorkflow(TestWorkflows.diamond()).isValid());
        assertEquals(3, orchestrator.buildExecutionPlan(TestWorkflows.diamond()).getParallelGroups().size());
    }

    private static class DelegatingExecutionStore implements ExecutionStore {
        private final ExecutionStore delegate;

        DelegatingExecutionStore(ExecutionStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public WorkflowExecution create(WorkflowExecution execution) {
            return delegate.create(execution);
        }

        @Override
        public void update(WorkflowExecution execution) {
            delegate.update(execution);
        }

        @Override
        public Optional<WorkflowExecution> findById(String executionId) {
            return delegate.findById(executionId);
        }

        @Override
        public List<WorkflowExecution> findByWorkflowId(String workflowId) {
            return delegate.findByWorkflowId(workflowId);
        }
    }
}
