package com.forge.graph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A stored workflow: id, optional name and its graph definition. Read-only to the engine.
 */
public final class Workflow {

    private final String id;
    private final String name;
    private final WorkflowDefinition definition;

    @JsonCreator
    public Workflow(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("definition") WorkflowDefinition definition) {
        this.id = id;
        this.name = name;
        this.definition = definition != null ? definition : new WorkflowDefinition(null, null);
    }

    public static Workflow of(String id, List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        return new Workflow(id, null, new WorkflowDefinition(nodes, edges));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public WorkflowDefinition getDefinition() {
        return definition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Workflow that = (Workflow) o;
        return Objects.equals(id, that.id) && Objects.equals(name, that.name) && definition.equals(that.definition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, definition);
    }
}
