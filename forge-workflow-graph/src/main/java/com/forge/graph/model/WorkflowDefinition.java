package com.forge.graph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Graph part of a workflow: ordered nodes and ordered edges. Order is significant: the planner
 * and validator iterate in definition order, which keeps plans deterministic.
 */
public final class WorkflowDefinition {

    private final List<WorkflowNode> nodes;
    private final List<WorkflowEdge> edges;

    @JsonCreator
    public WorkflowDefinition(
            @JsonProperty("nodes") List<WorkflowNode> nodes,
            @JsonProperty("edges") List<WorkflowEdge> edges) {
        this.nodes = nodes != null ? copyWithoutNulls(nodes) : List.of();
        this.edges = edges != null ? copyWithoutNulls(edges) : List.of();
    }

    private static <T> List<T> copyWithoutNulls(List<T> in) {
        List<T> out = new ArrayList<>(in.size());
        for (T t : in) {
            if (t != null) out.add(t);
        }
        return List.copyOf(out);
    }

    public List<WorkflowNode> getNodes() {
        return nodes;
    }

    public List<WorkflowEdge> getEdges() {
        return edges;
    }

    /** First node with the given id, or empty. */
    public Optional<WorkflowNode> findNode(String nodeId) {
        if (nodeId == null) return Optional.empty();
        for (WorkflowNode n : nodes) {
            if (nodeId.equals(n.getId())) return Optional.of(n);
        }
        return Optional.empty();
    }

    /** Edges whose target is the given node, in definition order. */
    public List<WorkflowEdge> incomingEdges(String nodeId) {
        List<WorkflowEdge> out = new ArrayList<>();
        for (WorkflowEdge e : edges) {
            if (Objects.equals(nodeId, e.getTargetNodeId())) out.add(e);
        }
        return out;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return nodes.equals(that.nodes) && edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges);
    }
}
