package com.forge.ledger;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One run of a workflow against specific input. Immutable: status changes produce a new
 * instance via {@link #start}, {@link #complete} or {@link #fail}, each of which rejects
 * backward transitions.
 * <p>
 * {@code partialFailure} is true when the execution completed but at least one node result
 * was a failure; {@code failedNodeIds} lists those nodes in plan order.
 */
public final class WorkflowExecution {

    private final String id;
    private final String workflowId;
    private final ExecutionStatus status;
    private final String triggeredBy;
    private final Map<String, Object> inputData;
    private final Map<String, Object> resultData;
    private final Map<String, Object> errorData;
    private final boolean partialFailure;
    private final List<String> failedNodeIds;
    private final Instant startedAt;
    private final Instant completedAt;

    public WorkflowExecution(String id, String workflowId, ExecutionStatus status, String triggeredBy,
                             Map<String, Object> inputData, Map<String, Object> resultData,
                             Map<String, Object> errorData, boolean partialFailure, List<String> failedNodeIds,
                             Instant startedAt, Instant completedAt) {
        this.id = id;
        this.workflowId = Objects.requireNonNull(workflowId, "workflowId");
        this.status = Objects.requireNonNull(status, "status");
        this.triggeredBy = triggeredBy;
        this.inputData = readOnly(inputData);
        this.resultData = resultData != null ? readOnly(resultData) : null;
        this.errorData = errorData != null ? readOnly(errorData) : null;
        this.partialFailure = partialFailure;
        this.failedNodeIds = failedNodeIds != null ? List.copyOf(failedNodeIds) : List.of();
        this.startedAt = startedAt;
        this.completedAt = completedAt;
    }

    /** New, not yet persisted execution in status CREATED (id assigned by the store). */
    public static WorkflowExecution created(String workflowId, String triggeredBy, Map<String, Object> inputData) {
        return new WorkflowExecution(null, workflowId, ExecutionStatus.CREATED, triggeredBy, inputData,
                null, null, false, null, null, null);
    }

    private static Map<String, Object> readOnly(Map<String, Object> m) {
        if (m == null || m.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }

    private void requireTransition(ExecutionStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal execution status transition " + status + " -> " + next + " (executionId=" + id + ")");
        }
    }

    /** Copy with the given id (used by stores on create). */
    public WorkflowExecution withId(String newId) {
        return new WorkflowExecution(newId, workflowId, status, triggeredBy, inputData, resultData, errorData,
                partialFailure, failedNodeIds, startedAt, completedAt);
    }

    /** CREATED → RUNNING. */
    public WorkflowExecution start(Instant at) {
        requireTransition(ExecutionStatus.RUNNING);
        return new WorkflowExecution(id, workflowId, ExecutionStatus.RUNNING, triggeredBy, inputData, null, null,
                false, null, at, null);
    }

    /** RUNNING → COMPLETED with the aggregated node-id → output map. */
    public WorkflowExecution complete(Map<String, Object> result, List<String> failedNodes, Instant at) {
        requireTransition(ExecutionStatus.COMPLETED);
        boolean partial = failedNodes != null && !failedNodes.isEmpty();
        return new WorkflowExecution(id, workflowId, ExecutionStatus.COMPLETED, triggeredBy, inputData,
                result != null ? result : Map.of(), null, partial, failedNodes, startedAt, at);
    }

    /** CREATED|RUNNING → FAILED with error data ({@code message}, {@code stack}). */
    public WorkflowExecution fail(Map<String, Object> error, Instant at) {
        requireTransition(ExecutionStatus.FAILED);
        return new WorkflowExecution(id, workflowId, ExecutionStatus.FAILED, triggeredBy, inputData, null,
                error != null ? error : Map.of(), false, null, startedAt, at);
    }

    public String getId() {
        return id;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public String getTriggeredBy() {
        return triggeredBy;
    }

    /** Workflow-level input. Unmodifiable; never null. */
    public Map<String, Object> getInputData() {
        return inputData;
    }

    /** Node id → output, set when COMPLETED; null otherwise. */
    public Map<String, Object> getResultData() {
        return resultData;
    }

    /** {@code message} and {@code stack}, set when FAILED; null otherwise. */
    public Map<String, Object> getErrorData() {
        return errorData;
    }

    public boolean isPartialFailure() {
        return partialFailure;
    }

    public List<String> getFailedNodeIds() {
        return failedNodeIds;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    @Override
    public String toString() {
        return "WorkflowExecution{id=" + id + ", workflowId=" + workflowId + ", status=" + status.toValue()
                + ", partialFailure=" + partialFailure + "}";
    }
}
