package com.syncbridge.core.model;

/**
 * Classification an activity returns for one attempt.
 */
public enum ActivityOutcome {
    SUCCESS,

    /**
     * Expected to succeed when re-invoked, e.g. downstream rate limiting.
     */
    RETRYABLE_FAILURE,

    /**
     * Will not succeed on retry, e.g. invalid business input.
     */
    FATAL_FAILURE
}
