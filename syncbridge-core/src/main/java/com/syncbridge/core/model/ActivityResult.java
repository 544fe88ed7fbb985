package com.syncbridge.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Explicit result of one activity attempt. Activities return failures instead of throwing them,
 * so retriability never depends on an exception type.
 */
public record ActivityResult(
    ActivityOutcome outcome,
    JsonNode output,
    String errorCode,
    String errorDetail
) {
    public static final String ACTIVITY_TIMEOUT = "ACTIVITY_TIMEOUT";
    public static final String UNCAUGHT_EXCEPTION = "UNCAUGHT_EXCEPTION";

    public static ActivityResult success(JsonNode output) {
        return new ActivityResult(ActivityOutcome.SUCCESS, output, null, null);
    }

    public static ActivityResult retryable(String errorCode, String errorDetail) {
        return new ActivityResult(ActivityOutcome.RETRYABLE_FAILURE, null, errorCode, errorDetail);
    }

    public static ActivityResult fatal(String errorCode, String errorDetail) {
        return new ActivityResult(ActivityOutcome.FATAL_FAILURE, null, errorCode, errorDetail);
    }

    public boolean isSuccess() {
        return outcome == ActivityOutcome.SUCCESS;
    }
}
