package com.syncbridge.core.repository;

import com.syncbridge.core.exception.TransientIOException;
import com.syncbridge.core.model.ActivityTask;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent, bounded queue of activity tasks shared by all workers.
 *
 * Invariants:
 * - at most {@link #capacity()} tasks are outstanding (QUEUED or RUNNING)
 * - a claim hands a task to exactly one worker and bumps its fence token
 * - lease operations and completion succeed only with the current fence token
 */
public interface ActivityTaskQueue {

    /**
     * Add a task, blocking while the queue is at capacity.
     *
     * @throws TransientIOException if no room frees up within the dispatch wait
     */
    void enqueue(ActivityTask task);

    /**
     * Atomically claim the oldest due task for one of the given activities.
     *
     * @param activityNames Activities the caller can run
     * @param workerId The claiming worker
     * @param now Current time
     * @param leaseGrace Added to the task timeout to form the lease
     * @return The claimed task, in RUNNING state with a new fence token
     */
    Optional<ActivityTask> claimNext(Collection<String> activityNames, String workerId, Instant now, Duration leaseGrace);

    /**
     * Extend the lease of a running task.
     *
     * @return false if the task is no longer held with this fence token
     */
    boolean renewLease(UUID taskId, long fenceToken, Instant newExpiresAt);

    /**
     * Mark a running task DONE.
     *
     * @return false if the task is no longer held with this fence token
     */
    boolean complete(UUID taskId, long fenceToken);

    /**
     * Put a running task whose lease expired back in the queue under a new fence token.
     *
     * @return false if the task changed since it was observed with this fence token
     */
    boolean requeue(UUID taskId, long fenceToken, Instant availableAt);

    /**
     * Mark every QUEUED task of a workflow DONE. Running tasks are left alone.
     *
     * @return Number of withdrawn tasks
     */
    int withdrawQueued(UUID workflowId);

    Optional<ActivityTask> findById(UUID taskId);

    /**
     * QUEUED and RUNNING tasks of a workflow.
     */
    List<ActivityTask> findOutstanding(UUID workflowId);

    List<ActivityTask> findExpiredLeases(Instant now, int limit);

    /**
     * Delete DONE tasks enqueued before the given instant. Outstanding tasks are never deleted.
     *
     * @return Number of tasks deleted
     */
    int deleteDoneBefore(Instant enqueuedBefore);

    int outstandingCount();

    int capacity();
}
