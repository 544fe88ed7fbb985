package com.syncbridge.core.model;

/**
 * States of an activity task in the persistent queue.
 */
public enum TaskState {
    /**
     * Waiting for a worker; eligible once availableAt has passed.
     */
    QUEUED,

    /**
     * Claimed by a worker under a lease.
     */
    RUNNING,

    /**
     * Result reported, or withdrawn because its workflow was cancelled.
     */
    DONE
}
