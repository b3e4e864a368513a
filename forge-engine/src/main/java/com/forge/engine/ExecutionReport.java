package com.forge.engine;

import com.forge.engine.node.NodeExecutionResult;
import com.forge.engine.planner.ExecutionPlan;
import com.forge.ledger.WorkflowExecution;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal execution together with the plan it ran and the per-node results in plan order.
 * Node results are not persisted; the execution record carries only their outputs.
 */
public final class ExecutionReport {

    private final WorkflowExecution execution;
    private final ExecutionPlan plan;
    private final List<NodeExecutionResult> nodeResults;

    public ExecutionReport(WorkflowExecution execution, ExecutionPlan plan, List<NodeExecutionResult> nodeResults) {
        this.execution = Objects.requireNonNull(execution, "execution");
        this.plan = plan;
        this.nodeResults = nodeResults != null ? List.copyOf(nodeResults) : List.of();
    }

    public WorkflowExecution getExecution() {
        return execution;
    }

    public ExecutionPlan getPlan() {
        return plan;
    }

    public List<NodeExecutionResult> getNodeResults() {
        return nodeResults;
    }

    public Optional<NodeExecutionResult> getNodeResult(String nodeId) {
        return nodeResults.stream().filter(r -> r.getNodeId().equals(nodeId)).findFirst();
    }

    public List<NodeExecutionResult> getFailedNodeResults() {
        return nodeResults.stream().filter(r -> !r.isSuccess()).toList();
    }
}
