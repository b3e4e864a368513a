package com.forge.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Workflow execution lifecycle notification. Payload keys depend on the type:
 * started carries {@code triggeredBy}, completed carries {@code result}, failed carries {@code error}.
 */
public final class ExecutionEvent {

    private final ExecutionEventType type;
    private final String workflowId;
    private final String executionId;
    private final Map<String, Object> payload;
    private final long timestamp;

    private ExecutionEvent(ExecutionEventType type, String workflowId, String executionId,
                           Map<String, Object> payload, long timestamp) {
        this.type = Objects.requireNonNull(type, "type");
        this.workflowId = workflowId;
        this.executionId = executionId;
        this.payload = Collections.unmodifiableMap(payload);
        this.timestamp = timestamp;
    }

    public static ExecutionEvent started(String workflowId, String executionId, String triggeredBy) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("triggeredBy", triggeredBy);
        return new ExecutionEvent(ExecutionEventType.STARTED, workflowId, executionId, p, System.currentTimeMillis());
    }

    public static ExecutionEvent completed(String workflowId, String executionId, Map<String, Object> result) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("result", result);
        return new ExecutionEvent(ExecutionEventType.COMPLETED, workflowId, executionId, p, System.currentTimeMillis());
    }

    public static ExecutionEvent failed(String workflowId, String executionId, Map<String, Object> error) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("error", error);
        return new ExecutionEvent(ExecutionEventType.FAILED, workflowId, executionId, p, System.currentTimeMillis());
    }

    @JsonIgnore
    public ExecutionEventType getType() {
        return type;
    }

    /** Wire name, e.g. {@code workflow:execution:started}. */
    @JsonProperty("event")
    public String getName() {
        return type.getName();
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    /** Epoch millis at creation. */
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "ExecutionEvent{" + type.getName() + ", workflowId=" + workflowId + ", executionId=" + executionId + "}";
    }
}
