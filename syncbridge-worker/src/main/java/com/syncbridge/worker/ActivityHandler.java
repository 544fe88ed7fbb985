package com.syncbridge.worker;

import com.syncbridge.core.model.ActivityResult;

/**
 * Implementation of one named activity.
 *
 * Handlers classify their own failures by returning {@link ActivityResult#retryable} or
 * {@link ActivityResult#fatal}. Anything thrown is treated as a retryable
 * {@link ActivityResult#UNCAUGHT_EXCEPTION}.
 */
@FunctionalInterface
public interface ActivityHandler {

    /**
     * Execute the activity.
     *
     * @param context Execution context providing input, prior results and the idempotency key
     * @return The explicit result of this attempt
     */
    ActivityResult execute(ActivityContext context) throws Exception;
}
