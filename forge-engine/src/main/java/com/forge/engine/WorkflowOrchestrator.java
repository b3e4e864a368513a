package com.forge.engine;

import com.forge.engine.error.ErrorData;
import com.forge.engine.error.OrchestrationException;
import com.forge.engine.error.WorkflowNotFoundException;
import com.forge.engine.error.WorkflowValidationException;
import com.forge.engine.node.NodeExecutionObserver;
import com.forge.engine.node.NodeExecutionResult;
import com.forge.engine.node.NodeExecutor;
import com.forge.engine.planner.ExecutionPlan;
import com.forge.engine.planner.ExecutionPlanner;
import com.forge.engine.validator.DagValidationResult;
import com.forge.engine.validator.DagValidator;
import com.forge.events.ExecutionEvent;
import com.forge.events.ExecutionEventBus;
import com.forge.graph.model.Workflow;
import com.forge.graph.model.WorkflowNode;
import com.forge.handler.CancellationToken;
import com.forge.handler.NodeHandlerRegistry;
import com.forge.ledger.ExecutionStore;
import com.forge.ledger.NodeLog;
import com.forge.ledger.NodeLogSink;
import com.forge.ledger.WorkflowExecution;
import com.forge.ledger.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs a stored workflow end to end: load, validate, create the execution record, plan, then run
 * the plan group by group. Members of a group run concurrently and the group is joined before the
 * next one starts; outputs go into a write-once {@link ExecutionResults} owned by the calling thread.
 * <p>
 * Node handler failures are recorded as failed node results and the execution still completes
 * (with {@code partialFailure}) unless {@code failOnNodeError} is set. Any other fault marks the
 * execution FAILED and is rethrown as {@link OrchestrationException}, {@link Error}s included.
 */
public final class WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    private final WorkflowStore workflowStore;
    private final ExecutionStore executionStore;
    private final ExecutionEventBus eventBus;
    private final ExecutorService sharedExecutor;
    private final boolean failOnNodeError;
    private final DagValidator validator = new DagValidator();
    private final ExecutionPlanner planner = new ExecutionPlanner();
    private final NodeExecutor nodeExecutor;

    private WorkflowOrchestrator(Builder b) {
        this.workflowStore = Objects.requireNonNull(b.workflowStore, "workflowStore");
        this.executionStore = Objects.requireNonNull(b.executionStore, "executionStore");
        this.eventBus = b.eventBus != null ? b.eventBus : new ExecutionEventBus();
        this.sharedExecutor = b.executor;
        this.failOnNodeError = b.failOnNodeError;
        this.nodeExecutor = new NodeExecutor(
                b.handlerRegistry != null ? b.handlerRegistry : new NodeHandlerRegistry(),
                new NodeLog(b.nodeLogSink),
                b.observers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public DagValidationResult validateWorkflow(Workflow workflow) {
        return validator.validate(workflow);
    }

    public ExecutionPlan buildExecutionPlan(Workflow workflow) {
        return planner.buildExecutionPlan(workflow);
    }

    public WorkflowExecution executeWorkflow(String workflowId, Map<String, Object> inputData, String triggeredBy) {
        return runWorkflow(workflowId, inputData, triggeredBy, CancellationToken.NONE).getExecution();
    }

    public WorkflowExecution executeWorkflow(String workflowId, Map<String, Object> inputData, String triggeredBy,
                                             CancellationToken cancellation) {
        return runWorkflow(workflowId, inputData, triggeredBy, cancellation).getExecution();
    }

    /**
     * Executes the workflow and returns the terminal execution with its plan and node results.
     *
     * @throws WorkflowNotFoundException   no workflow with this id; nothing is persisted
     * @throws WorkflowValidationException the graph is invalid; nothing is persisted
     * @throws com.forge.ledger.PersistenceException the execution record could not be created
     * @throws OrchestrationException      fault after the record was created; the record is FAILED
     */
    public ExecutionReport runWorkflow(String workflowId, Map<String, Object> inputData, String triggeredBy,
                                       CancellationToken cancellation) {
        Workflow workflow = workflowStore.findById(workflowId)
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));

        DagValidationResult validation = validator.validate(workflow);
        if (!validation.isValid()) {
            log.warn("Workflow rejected | workflowId={} | errors={}", workflowId, validation.getErrors());
            throw new WorkflowValidationException(workflowId, validation);
        }
        if (!validation.getWarnings().isEmpty()) {
            log.info("Workflow validation warnings | workflowId={} | warnings={} | unreachableNodes={}",
                    workflowId, validation.getWarnings(), validation.getUnreachableNodes());
        }

        Map<String, Object> input = inputData != null ? inputData : Map.of();
        WorkflowExecution execution = executionStore.create(
                WorkflowExecution.created(workflowId, triggeredBy, input).start(Instant.now()));
        String executionId = execution.getId();
        log.info("Execution started | workflowId={} | executionId={} | triggeredBy={} | nodes={}",
                workflowId, executionId, triggeredBy, workflow.getDefinition().getNodes().size());
        eventBus.publish(ExecutionEvent.started(workflowId, executionId, triggeredBy));

        CancellationToken token = cancellation != null ? cancellation : CancellationToken.NONE;
        ExecutionPlan plan;
        List<NodeExecutionResult> nodeResults = new ArrayList<>();
        ExecutionResults results = new ExecutionResults();
        try {
            plan = planner.buildExecutionPlan(workflow);
            if (plan.size() != workflow.getDefinition().getNodes().size()) {
                throw new IllegalStateException("Plan covers " + plan.size() + " of "
                        + workflow.getDefinition().getNodes().size() + " nodes");
            }
            runPlan(workflow, plan, input, executionId, token, results, nodeResults);
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            WorkflowExecution failed = execution.fail(ErrorData.of(e), Instant.now());
            log.error("Execution failed | workflowId={} | executionId={} | error={}",
                    workflowId, executionId, ErrorData.messageOf(e), e);
            persistTerminal(failed);
            eventBus.publish(ExecutionEvent.failed(workflowId, executionId, failed.getErrorData()));
            throw new OrchestrationException(workflowId, executionId,
                    "Execution " + executionId + " of workflow " + workflowId + " failed: " + ErrorData.messageOf(e), e);
        }

        List<String> failedNodeIds = nodeResults.stream()
                .filter(r -> !r.isSuccess())
                .map(NodeExecutionResult::getNodeId)
                .toList();
        WorkflowExecution completed = execution.complete(results.snapshot(), failedNodeIds, Instant.now());
        log.info("Execution completed | workflowId={} | executionId={} | nodes={} | failedNodes={}",
                workflowId, executionId, nodeResults.size(), failedNodeIds);
        persistTerminal(completed);
        eventBus.publish(ExecutionEvent.completed(workflowId, executionId, completed.getResultData()));
        return new ExecutionReport(completed, plan, nodeResults);
    }

    private void runPlan(Workflow workflow, ExecutionPlan plan, Map<String, Object> input, String executionId,
                         CancellationToken token, ExecutionResults results, List<NodeExecutionResult> nodeResults)
            throws InterruptedException, ExecutionException {
        Map<String, WorkflowNode> nodesById = new HashMap<>();
        for (WorkflowNode n : workflow.getDefinition().getNodes()) {
            nodesById.put(n.getId(), n);
        }
        ExecutorService executor = sharedExecutor;
        boolean ownsExecutor = false;
        List<List<String>> groups = plan.getParallelGroups();
        try {
            for (int g = 0; g < groups.size(); g++) {
                if (token.isCancelled()) {
                    throw new CancellationException("Execution " + executionId + " cancelled before group "
                            + (g + 1) + " of " + groups.size());
                }
                List<String> group = groups.get(g);
                if (group.size() > 1 && executor == null) {
                    executor = Executors.newCachedThreadPool();
                    ownsExecutor = true;
                }
                List<NodeExecutionResult> groupResults =
                        runGroup(workflow, group, nodesById, input, executionId, token, results.snapshot(), executor);
                for (NodeExecutionResult r : groupResults) {
                    results.record(r.getNodeId(), r.isSuccess() ? r.getOutput() : null);
                    nodeResults.add(r);
                }
                log.debug("Group joined | executionId={} | group={}/{} | nodes={}", executionId, g + 1, groups.size(), group);
                if (failOnNodeError) {
                    List<String> failed = groupResults.stream().filter(r -> !r.isSuccess())
                            .map(NodeExecutionResult::getNodeId).toList();
                    if (!failed.isEmpty()) {
                        throw new IllegalStateException("Node execution failed for " + failed + " (fail-on-node-error enabled)");
                    }
                }
            }
        } finally {
            if (ownsExecutor) {
                shutdown(executor);
            }
        }
    }

    /**
     * Runs one group and waits for every member. A single-member group runs on the calling thread.
     * All futures are awaited even when one fails; the first failure is rethrown afterwards.
     */
    private List<NodeExecutionResult> runGroup(Workflow workflow, List<String> group, Map<String, WorkflowNode> nodesById,
                                               Map<String, Object> input, String executionId, CancellationToken token,
                                               Map<String, Object> snapshot, ExecutorService executor)
            throws InterruptedException, ExecutionException {
        if (group.size() == 1) {
            WorkflowNode node = nodesById.get(group.get(0));
            return List.of(nodeExecutor.executeNode(workflow, node, input, snapshot, executionId, token));
        }
        List<Future<NodeExecutionResult>> futures = new ArrayList<>(group.size());
        try {
            for (String nodeId : group) {
                WorkflowNode node = nodesById.get(nodeId);
                futures.add(executor.submit(() -> nodeExecutor.executeNode(workflow, node, input, snapshot, executionId, token)));
            }
        } catch (RuntimeException e) {
            log.error("Group dispatch failed | executionId={} | submitted={}/{} | error={}",
                    executionId, futures.size(), group.size(), e.getMessage(), e);
            awaitSubmitted(futures, e);
            throw e;
        }
        List<NodeExecutionResult> out = new ArrayList<>(group.size());
        ExecutionException firstFailure = null;
        for (int i = 0; i < futures.size(); i++) {
            try {
                out.add(futures.get(i).get());
            } catch (ExecutionException e) {
                log.error("Node dispatch failed | executionId={} | nodeId={} | error={}",
                        executionId, group.get(i), e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
                if (firstFailure == null) firstFailure = e;
            } catch (InterruptedException e) {
                for (Future<NodeExecutionResult> f : futures) {
                    f.cancel(true);
                }
                throw e;
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
        return out;
    }

    /** Waits for members already dispatched before a failed submit; their failures are attached to {@code cause}. */
    private static void awaitSubmitted(List<Future<NodeExecutionResult>> futures, RuntimeException cause) {
        for (Future<NodeExecutionResult> f : futures) {
            try {
                f.get();
            } catch (ExecutionException e) {
                cause.addSuppressed(e.getCause() != null ? e.getCause() : e);
            } catch (InterruptedException e) {
                for (Future<NodeExecutionResult> pending : futures) {
                    pending.cancel(true);
                }
                Thread.currentThread().interrupt();
                cause.addSuppressed(e);
                return;
            }
        }
    }

    private void persistTerminal(WorkflowExecution execution) {
        try {
            executionStore.update(execution);
        } catch (RuntimeException e) {
            log.error("Failed to persist terminal execution state | executionId={} | status={} | error={}",
                    execution.getId(), execution.getStatus().toValue(), e.getMessage(), e);
        }
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.MINUTES)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static final class Builder {
        private WorkflowStore workflowStore;
        private ExecutionStore executionStore;
        private NodeHandlerRegistry handlerRegistry;
        private NodeLogSink nodeLogSink;
        private ExecutionEventBus eventBus;
        private final List<NodeExecutionObserver> observers = new ArrayList<>();
        private ExecutorService executor;
        private boolean failOnNodeError;

        private Builder() {
        }

        public Builder workflowStore(WorkflowStore workflowStore) {
            this.workflowStore = workflowStore;
            return this;
        }

        public Builder executionStore(ExecutionStore executionStore) {
            this.executionStore = executionStore;
            return this;
        }

        public Builder handlerRegistry(NodeHandlerRegistry handlerRegistry) {
            this.handlerRegistry = handlerRegistry;
            return this;
        }

        /** Defaults to a no-op sink. */
        public Builder nodeLogSink(NodeLogSink nodeLogSink) {
            this.nodeLogSink = nodeLogSink;
            return this;
        }

        public Builder eventBus(ExecutionEventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder observer(NodeExecutionObserver observer) {
            this.observers.add(Objects.requireNonNull(observer, "observer"));
            return this;
        }

        /**
         * Executor for multi-node groups, owned by the caller. When unset, each execution creates a
         * cached pool and shuts it down when done.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder failOnNodeError(boolean failOnNodeError) {
            this.failOnNodeError = failOnNodeError;
            return this;
        }

        public WorkflowOrchestrator build() {
            return new WorkflowOrchestrator(this);
        }
    }
}
