package com.forge.graph.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Node in a workflow graph. {@code nodeType} selects the handler that runs the node;
 * {@code category} marks trigger nodes (DAG roots); {@code config} is opaque to the engine
 * and handed to the handler as-is.
 */
public final class WorkflowNode {

    private final String id;
    private final String nodeKey;
    private final String nodeType;
    private final NodeCategory category;
    private final Map<String, Object> config;

    @JsonCreator
    public WorkflowNode(
            @JsonProperty("id") String id,
            @JsonProperty("nodeKey") @JsonAlias("node_key") String nodeKey,
            @JsonProperty("nodeType") @JsonAlias("node_type") String nodeType,
            @JsonProperty("category") NodeCategory category,
            @JsonProperty("config") @JsonAlias("node_config") Map<String, Object> config) {
        this.id = id;
        this.nodeKey = nodeKey;
        this.nodeType = nodeType;
        this.category = category != null ? category : NodeCategory.UNKNOWN;
        this.config = config != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(config))
                : Map.of();
    }

    /** Convenience for code-built graphs: no node key, empty config. */
    public static WorkflowNode of(String id, String nodeType, NodeCategory category) {
        return new WorkflowNode(id, null, nodeType, category, null);
    }

    public String getId() {
        return id;
    }

    /** Optional human-readable key (e.g. "fetch_customer"); recorded in the node log. */
    public String getNodeKey() {
        return nodeKey;
    }

    /** Dispatch key for the handler registry (e.g. "trigger_manual", "output_log"). */
    public String getNodeType() {
        return nodeType;
    }

    public NodeCategory getCategory() {
        return category;
    }

    /** Handler configuration. Unmodifiable; never null. */
    public Map<String, Object> getConfig() {
        return config;
    }

    @JsonIgnore
    public boolean isTrigger() {
        return category.isTrigger();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowNode that = (WorkflowNode) o;
        return Objects.equals(id, that.id)
                && Objects.equals(nodeKey, that.nodeKey)
                && Objects.equals(nodeType, that.nodeType)
                && category == that.category
                && Objects.equals(config, that.config);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, nodeKey, nodeType, category, config);
    }

    @Override
    public String toString() {
        return "WorkflowNode{id=" + id + ", nodeType=" + nodeType + ", category=" + category.toValue() + "}";
    }
}
