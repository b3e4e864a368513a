package com.forge.engine.planner;

import java.util.List;
import java.util.Objects;

/** One node in the plan with its direct predecessors. */
public final class ExecutionStep {

    private final String nodeId;
    private final List<String> dependencies;
    private final boolean canRunInParallel;
    private final long estimatedDurationMillis;

    public ExecutionStep(String nodeId, List<String> dependencies, boolean canRunInParallel, long estimatedDurationMillis) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        this.canRunInParallel = canRunInParallel;
        this.estimatedDurationMillis = estimatedDurationMillis;
    }

    public String getNodeId() {
        return nodeId;
    }

    /** Direct predecessors in edge order, without duplicates. */
    public List<String> getDependencies() {
        return dependencies;
    }

    /** True when the step shares its group with at least one other node. */
    public boolean isCanRunInParallel() {
        return canRunInParallel;
    }

    /** Placeholder estimate; not used for scheduling. */
    public long getEstimatedDurationMillis() {
        return estimatedDurationMillis;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecutionStep)) return false;
        ExecutionStep that = (ExecutionStep) o;
        return canRunInParallel == that.canRunInParallel
                && estimatedDurationMillis == that.estimatedDurationMillis
                && nodeId.equals(that.nodeId)
                && dependencies.equals(that.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, dependencies, canRunInParallel, estimatedDurationMillis);
    }

    @Override
    public String toString() {
        return "ExecutionStep{" + nodeId + " <- " + dependencies + (canRunInParallel ? ", parallel" : "") + "}";
    }
}
