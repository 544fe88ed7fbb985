package com.syncbridge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * One recorded attempt of one workflow step.
 * Every attempt of a step shares the same idempotency key.
 */
public record ActivityInvocation(
    String activityName,
    int stepIndex,
    int attempt,
    String idempotencyKey,
    Instant startedAt,
    Instant completedAt,
    ActivityOutcome outcome,
    JsonNode output,
    String errorCode,
    String errorDetail
) {
    /**
     * Record the result a worker reported for a task.
     */
    public static ActivityInvocation of(ActivityTask task, ActivityResult result, Instant completedAt) {
        Instant started = task.startedAt() != null ? task.startedAt() : task.enqueuedAt();
        return new ActivityInvocation(
            task.activityName(),
            task.stepIndex(),
            task.attempt(),
            task.idempotencyKey(),
            started,
            completedAt,
            result.outcome(),
            result.output(),
            result.errorCode(),
            result.errorDetail()
        );
    }

    public boolean isSuccess() {
        return outcome == ActivityOutcome.SUCCESS;
    }
}
