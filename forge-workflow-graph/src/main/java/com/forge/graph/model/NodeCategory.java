package com.forge.graph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of a workflow node. JSON uses the lower-case name ("trigger", "action", ...);
 * unknown values deserialize as {@link #UNKNOWN}.
 *
 * @see WorkflowNode#getCategory()
 */
public enum NodeCategory {
    /** DAG root: reachability is computed from trigger nodes. */
    TRIGGER,
    DATA,
    TRANSFORM,
    ACTION,
    CONTROL,
    OUTPUT,
    /** Used when the definition contains an unknown or missing category string. */
    UNKNOWN;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static NodeCategory fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toUpperCase();
        for (NodeCategory c : values()) {
            if (c != UNKNOWN && c.name().equals(normalized)) return c;
        }
        return UNKNOWN;
    }

    public boolean isTrigger() {
        return this == TRIGGER;
    }
}
