package com.forge.engine.planner;

import java.util.List;
import java.util.Objects;

/**
 * Topologically stratified plan: {@code parallelGroups.get(k)} holds the nodes whose predecessors
 * all lie in groups before {@code k}. Steps are listed group by group.
 */
public final class ExecutionPlan {

    private final List<List<String>> parallelGroups;
    private final List<ExecutionStep> steps;

    public ExecutionPlan(List<List<String>> parallelGroups, List<ExecutionStep> steps) {
        this.parallelGroups = parallelGroups.stream().map(List::copyOf).toList();
        this.steps = List.copyOf(steps);
    }

    public List<List<String>> getParallelGroups() {
        return parallelGroups;
    }

    public List<ExecutionStep> getSteps() {
        return steps;
    }

    /** Node ids in plan order (groups flattened). */
    public List<String> getNodeOrder() {
        return steps.stream().map(ExecutionStep::getNodeId).toList();
    }

    /** Sum of step estimates; informational only. */
    public long getEstimatedDurationMillis() {
        long total = 0;
        for (ExecutionStep s : steps) {
            total += s.getEstimatedDurationMillis();
        }
        return total;
    }

    public int size() {
        return steps.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecutionPlan)) return false;
        ExecutionPlan that = (ExecutionPlan) o;
        return parallelGroups.equals(that.parallelGroups) && steps.equals(that.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parallelGroups, steps);
    }

    @Override
    public String toString() {
        return "ExecutionPlan{groups=" + parallelGroups + "}";
    }
}
