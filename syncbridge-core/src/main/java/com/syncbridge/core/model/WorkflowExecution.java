package com.syncbridge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One durable run of a declared multi-activity business operation.
 *
 * Primary Key: workflowId
 * Unique Constraint: requestId (when present)
 *
 * Invariants:
 * - history is append-only and ordered by completion
 * - result set only when state == COMPLETED
 * - version increases by one on every update; stores compare-and-swap on it
 */
public record WorkflowExecution(
    UUID workflowId,
    String workflowType,
    String tenantId,
    String requestId,
    WorkflowState state,
    List<ActivityInvocation> history,
    JsonNode input,
    JsonNode result,
    String lastError,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt,
    long version
) {
    public WorkflowExecution {
        history = history == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(history));
    }

    public static WorkflowExecution start(
            String workflowType, String tenantId, String requestId, JsonNode input, Instant now) {
        return new WorkflowExecution(
            UUID.randomUUID(),
            workflowType,
            tenantId,
            requestId,
            WorkflowState.RUNNING,
            List.of(),
            input,
            null,
            null,
            now,
            now,
            null,
            1L
        );
    }

    /**
     * Append an activity result to the history.
     * Allowed while RUNNING and after cancellation, since in-flight activities may still finish.
     */
    public WorkflowExecution withInvocation(ActivityInvocation invocation, Instant now) {
        if (state == WorkflowState.COMPLETED || state == WorkflowState.FAILED) {
            throw new IllegalStateException("Workflow " + workflowId + " already " + state);
        }
        List<ActivityInvocation> appended = new ArrayList<>(history);
        appended.add(invocation);
        return new WorkflowExecution(
            workflowId, workflowType, tenantId, requestId, state, appended,
            input, result, lastError, createdAt, now, completedAt, version + 1
        );
    }

    public WorkflowExecution withCompleted(JsonNode workflowResult, Instant now) {
        return transition(WorkflowState.COMPLETED, workflowResult, null, now);
    }

    public WorkflowExecution withFailed(String error, Instant now) {
        return transition(WorkflowState.FAILED, null, error, now);
    }

    public WorkflowExecution withCancelled(String reason, Instant now) {
        return transition(WorkflowState.CANCELLED, null, reason, now);
    }

    private WorkflowExecution transition(WorkflowState target, JsonNode workflowResult, String error, Instant now) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                "Workflow %s cannot move from %s to %s", workflowId, state, target));
        }
        return new WorkflowExecution(
            workflowId, workflowType, tenantId, requestId, target, history,
            input, workflowResult, error, createdAt, now, now, version + 1
        );
    }

    /**
     * All recorded attempts of the given step, oldest first.
     */
    public List<ActivityInvocation> attemptsOf(int stepIndex) {
        return history.stream()
            .filter(inv -> inv.stepIndex() == stepIndex)
            .toList();
    }

    public boolean hasSucceeded(int stepIndex) {
        return history.stream().anyMatch(inv -> inv.stepIndex() == stepIndex && inv.isSuccess());
    }

    public boolean hasRecorded(int stepIndex, int attempt) {
        return history.stream().anyMatch(inv -> inv.stepIndex() == stepIndex && inv.attempt() == attempt);
    }

    /**
     * Output of the latest successful invocation of the named activity.
     */
    public Optional<JsonNode> outputOf(String activityName) {
        JsonNode found = null;
        for (ActivityInvocation inv : history) {
            if (inv.isSuccess() && inv.activityName().equals(activityName)) {
                found = inv.output();
            }
        }
        return Optional.ofNullable(found);
    }
}
