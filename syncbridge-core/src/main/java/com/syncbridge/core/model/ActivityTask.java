package com.syncbridge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A persisted request to run one attempt of one workflow step.
 *
 * Primary Key: taskId
 *
 * Invariants:
 * - leaseHolder and leaseExpiresAt set iff state == RUNNING
 * - fenceToken increases on every claim and every reclaim, so a worker that lost
 *   its lease can no longer report
 */
public record ActivityTask(
    UUID taskId,
    UUID workflowId,
    String tenantId,
    String activityName,
    int stepIndex,
    int attempt,
    String idempotencyKey,
    JsonNode input,
    TaskState state,
    Instant enqueuedAt,
    Instant availableAt,
    Instant startedAt,
    String leaseHolder,
    Instant leaseExpiresAt,
    long fenceToken,
    Duration timeout
) {
    public static ActivityTask create(
            UUID workflowId,
            String tenantId,
            String activityName,
            int stepIndex,
            int attempt,
            String idempotencyKey,
            JsonNode input,
            Duration timeout,
            Instant enqueuedAt,
            Instant availableAt) {
        return new ActivityTask(
            UUID.randomUUID(),
            workflowId,
            tenantId,
            activityName,
            stepIndex,
            attempt,
            idempotencyKey,
            input,
            TaskState.QUEUED,
            enqueuedAt,
            availableAt,
            null,
            null,
            null,
            0L,
            timeout
        );
    }

    public boolean isDue(Instant now) {
        return state == TaskState.QUEUED && !availableAt.isAfter(now);
    }

    public boolean isLeaseExpired(Instant now) {
        return state == TaskState.RUNNING && leaseExpiresAt != null && leaseExpiresAt.isBefore(now);
    }

    /**
     * Lease length granted on claim and on every renewal.
     */
    public Duration leaseDuration(Duration grace) {
        return timeout.plus(grace);
    }

    public ActivityTask withClaimed(String workerId, Instant now, Duration grace) {
        return new ActivityTask(
            taskId, workflowId, tenantId, activityName, stepIndex, attempt, idempotencyKey, input,
            TaskState.RUNNING, enqueuedAt, availableAt, now,
            workerId, now.plus(leaseDuration(grace)), fenceToken + 1, timeout
        );
    }

    public ActivityTask withLeaseRenewed(Instant newExpiresAt) {
        return new ActivityTask(
            taskId, workflowId, tenantId, activityName, stepIndex, attempt, idempotencyKey, input,
            state, enqueuedAt, availableAt, startedAt,
            leaseHolder, newExpiresAt, fenceToken, timeout
        );
    }

    /**
     * Return the task to the queue after its lease expired. The fence token moves on.
     */
    public ActivityTask withRequeued(Instant availableFrom) {
        return new ActivityTask(
            taskId, workflowId, tenantId, activityName, stepIndex, attempt, idempotencyKey, input,
            TaskState.QUEUED, enqueuedAt, availableFrom, null,
            null, null, fenceToken + 1, timeout
        );
    }

    public ActivityTask withDone() {
        return new ActivityTask(
            taskId, workflowId, tenantId, activityName, stepIndex, attempt, idempotencyKey, input,
            TaskState.DONE, enqueuedAt, availableAt, startedAt,
            null, null, fenceToken, timeout
        );
    }
}
