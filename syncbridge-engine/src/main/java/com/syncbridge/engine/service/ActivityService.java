package com.syncbridge.engine.service;

import com.syncbridge.core.model.ActivityResult;
import com.syncbridge.core.model.ActivityTask;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Worker-facing side of the orchestrator: claiming tasks, holding leases and reporting results.
 */
public interface ActivityService {

    /**
     * Claim the next due task for one of the given activities.
     */
    Optional<ActivityTask> claimTask(Collection<String> activityNames, String workerId);

    /**
     * Extend the lease of a claimed task.
     *
     * @return The new lease expiry
     * @throws com.syncbridge.core.exception.LeaseLostException if the fence token is stale
     */
    Instant renewLease(UUID taskId, long fenceToken);

    /**
     * Report the result of a claimed task.
     *
     * @throws com.syncbridge.core.exception.LeaseLostException if the fence token is stale
     */
    void reportResult(UUID taskId, long fenceToken, ActivityResult result);

    /**
     * Requeue running tasks whose lease expired, under a new fence token.
     *
     * @return Number of tasks requeued
     */
    int reclaimExpiredLeases(int batchSize);

    /**
     * Delete finished tasks older than the retention. Workflow history keeps their results.
     *
     * @return Number of tasks deleted
     */
    int purgeFinishedTasks(Duration retention);
}
