package com.forge.graph.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Directed wiring from an upstream node's output port to a downstream node's input port. */
public final class WorkflowEdge {

    private final String id;
    private final String sourceNodeId;
    private final String targetNodeId;
    private final String sourcePort;
    private final String targetPort;

    @JsonCreator
    public WorkflowEdge(
            @JsonProperty("id") String id,
            @JsonProperty("sourceNodeId") @JsonAlias("source_node_id") String sourceNodeId,
            @JsonProperty("targetNodeId") @JsonAlias("target_node_id") String targetNodeId,
            @JsonProperty("sourcePort") @JsonAlias("source_port") String sourcePort,
            @JsonProperty("targetPort") @JsonAlias("target_port") String targetPort) {
        this.id = id;
        this.sourceNodeId = sourceNodeId;
        this.targetNodeId = targetNodeId;
        this.sourcePort = sourcePort;
        this.targetPort = targetPort;
    }

    /** Edge with default ports ("output" → "input") and no id. */
    public static WorkflowEdge of(String sourceNodeId, String targetNodeId) {
        return new WorkflowEdge(null, sourceNodeId, targetNodeId, "output", "input");
    }

    /** Edge with no id and the given ports. */
    public static WorkflowEdge of(String sourceNodeId, String sourcePort, String targetNodeId, String targetPort) {
        return new WorkflowEdge(null, sourceNodeId, targetNodeId, sourcePort, targetPort);
    }

    public String getId() {
        return id;
    }

    public String getSourceNodeId() {
        return sourceNodeId;
    }

    public String getTargetNodeId() {
        return targetNodeId;
    }

    public String getSourcePort() {
        return sourcePort;
    }

    /** Key under which the source node's output is placed in the target node's input. */
    public String getTargetPort() {
        return targetPort;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowEdge that = (WorkflowEdge) o;
        return Objects.equals(id, that.id)
                && Objects.equals(sourceNodeId, that.sourceNodeId)
                && Objects.equals(targetNodeId, that.targetNodeId)
                && Objects.equals(sourcePort, that.sourcePort)
                && Objects.equals(targetPort, that.targetPort);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sourceNodeId, targetNodeId, sourcePort, targetPort);
    }

    @Override
    public String toString() {
        return sourceNodeId + "." + sourcePort + " -> " + targetNodeId + "." + targetPort;
    }
}
