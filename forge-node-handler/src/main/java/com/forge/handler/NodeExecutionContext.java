package com.forge.handler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Context passed to a {@link NodeHandler} for one node run: identity (workflow, execution, node),
 * the input assembled from upstream outputs (or the workflow input for root nodes), the node's
 * config, a read-only view of outputs already produced in this execution, and the execution's
 * {@link CancellationToken}.
 */
public final class NodeExecutionContext {

    private final String workflowId;
    private final String executionId;
    private final String nodeId;
    private final String nodeType;
    private final Map<String, Object> input;
    private final Map<String, Object> config;
    private final Map<String, Object> previousNodes;
    private final CancellationToken cancellation;

    public NodeExecutionContext(String workflowId, String executionId, String nodeId, String nodeType,
                                Map<String, Object> input, Map<String, Object> config,
                                Map<String, Object> previousNodes, CancellationToken cancellation) {
        this.workflowId = workflowId;
        this.executionId = executionId;
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.nodeType = nodeType;
        this.input = readOnlyCopy(input);
        this.config = readOnlyCopy(config);
        this.previousNodes = readOnlyCopy(previousNodes);
        this.cancellation = cancellation != null ? cancellation : CancellationToken.NONE;
    }

    /** Copy that tolerates null values (node outputs may be null). */
    private static Map<String, Object> readOnlyCopy(Map<String, Object> m) {
        if (m == null || m.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getNodeType() {
        return nodeType;
    }

    /** Input keyed by target port, or the workflow input when no upstream output was wired. Unmodifiable. */
    public Map<String, Object> getInput() {
        return input;
    }

    /** Node config from the workflow definition. Unmodifiable. */
    public Map<String, Object> getConfig() {
        return config;
    }

    /** Outputs of nodes in earlier groups, keyed by node id. Unmodifiable. */
    public Map<String, Object> getPreviousNodes() {
        return previousNodes;
    }

    public CancellationToken getCancellation() {
        return cancellation;
    }

    /** Typed config lookup; null when absent or of a different type. */
    @SuppressWarnings("unchecked")
    public <T> T getConfigValue(String key, Class<T> type) {
        Object v = config.get(key);
        return (v != null && type.isInstance(v)) ? (T) v : null;
    }

    /** Typed input lookup; null when absent or of a different type. */
    @SuppressWarnings("unchecked")
    public <T> T getInputValue(String key, Class<T> type) {
        Object v = input.get(key);
        return (v != null && type.isInstance(v)) ? (T) v : null;
    }
}
