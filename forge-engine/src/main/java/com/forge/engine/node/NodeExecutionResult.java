package com.forge.engine.node;

import java.util.Objects;

/**
 * Outcome of one node run: output on success, {@link NodeError} on failure. Latency is always set;
 * retry count is always 0 (no retry layer).
 */
public final class NodeExecutionResult {

    private final String nodeId;
    private final boolean success;
    private final Object output;
    private final NodeError error;
    private final long latencyMs;
    private final int retryCount;

    private NodeExecutionResult(String nodeId, boolean success, Object output, NodeError error, long latencyMs) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.success = success;
        this.output = output;
        this.error = error;
        this.latencyMs = latencyMs;
        this.retryCount = 0;
    }

    public static NodeExecutionResult success(String nodeId, Object output, long latencyMs) {
        return new NodeExecutionResult(nodeId, true, output, null, latencyMs);
    }

    public static NodeExecutionResult failure(String nodeId, NodeError error, long latencyMs) {
        return new NodeExecutionResult(nodeId, false, null, Objects.requireNonNull(error, "error"), latencyMs);
    }

    public String getNodeId() {
        return nodeId;
    }

    public boolean isSuccess() {
        return success;
    }

    public Object getOutput() {
        return output;
    }

    public NodeError getError() {
        return error;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public int getRetryCount() {
        return retryCount;
    }

    @Override
    public String toString() {
        return "NodeExecutionResult{nodeId=" + nodeId + ", success=" + success + ", latencyMs=" + latencyMs
                + (error != null ? ", error=" + error : "") + "}";
    }
}
