package com.forge.ledger;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only record of one node run (table forge_workflow_execution_log). Exactly one record is
 * written per node per execution, whatever the outcome.
 */
public final class NodeExecutionLog {

    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";

    private final String executionId;
    private final String nodeId;
    private final String nodeKey;
    private final String nodeType;
    private final String status;
    private final Object outputData;
    private final Map<String, Object> errorData;
    private final long latencyMs;
    private final Instant completedAt;

    public NodeExecutionLog(String executionId, String nodeId, String nodeKey, String nodeType, String status,
                            Object outputData, Map<String, Object> errorData, long latencyMs, Instant completedAt) {
        this.executionId = executionId;
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.nodeKey = nodeKey;
        this.nodeType = nodeType;
        this.status = Objects.requireNonNull(status, "status");
        this.outputData = outputData;
        this.errorData = errorData != null ? Collections.unmodifiableMap(new LinkedHashMap<>(errorData)) : null;
        this.latencyMs = latencyMs;
        this.completedAt = completedAt;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getNodeKey() {
        return nodeKey;
    }

    public String getNodeType() {
        return nodeType;
    }

    /** {@value #STATUS_COMPLETED} or {@value #STATUS_FAILED}. */
    public String getStatus() {
        return status;
    }

    public boolean isCompleted() {
        return STATUS_COMPLETED.equals(status);
    }

    /** Handler output; null for failed runs. */
    public Object getOutputData() {
        return outputData;
    }

    /** {@code message} and {@code stack}; null for completed runs. */
    public Map<String, Object> getErrorData() {
        return errorData;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    @Override
    public String toString() {
        return "NodeExecutionLog{executionId=" + executionId + ", nodeId=" + nodeId + ", status=" + status
                + ", latencyMs=" + latencyMs + "}";
    }
}
