package com.forge.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forge.graph.model.Workflow;
import com.forge.graph.model.WorkflowDefinition;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of workflows and workflow definitions.
 * JSON excludes null values when serializing; unknown properties (e.g. UI layout) are ignored
 * when reading, and snake_case store columns are accepted as aliases.
 */
public final class WorkflowGraphConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private WorkflowGraphConfig() {
    }

    /**
     * Deserializes a workflow (id, name, definition) from a JSON string.
     *
     * @param json the JSON string (e.g. from file or store)
     * @return the parsed {@link Workflow}
     * @throws UncheckedIOException on parse failure
     */
    public static Workflow fromJson(String json) {
        try {
            return MAPPER.readValue(json, Workflow.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes a workflow to a JSON string (nulls excluded).
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(Workflow workflow) {
        try {
            return MAPPER.writeValueAsString(workflow);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Deserializes a definition ({@code {"nodes": [...], "edges": [...]}}) on its own, e.g. from a
     * {@code definition} jsonb column.
     */
    public static WorkflowDefinition definitionFromJson(String json) {
        try {
            return MAPPER.readValue(json, WorkflowDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Serializes a single definition to JSON. */
    public static String toJson(WorkflowDefinition definition) {
        try {
            return MAPPER.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
