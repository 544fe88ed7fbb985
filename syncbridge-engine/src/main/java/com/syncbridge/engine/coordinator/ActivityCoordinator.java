package com.syncbridge.engine.coordinator;

import com.syncbridge.core.exception.LeaseLostException;
import com.syncbridge.core.model.ActivityResult;
import com.syncbridge.core.model.ActivityTask;
import com.syncbridge.core.model.TaskState;
import com.syncbridge.core.model.WorkflowExecution;
import com.syncbridge.core.repository.ActivityTaskQueue;
import com.syncbridge.engine.metrics.SyncMetrics;
import com.syncbridge.engine.service.ActivityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Hands activity tasks to workers and feeds their results back into the workflow coordinator.
 *
 * Fence tokens guard every lease operation: a worker whose lease was reclaimed holds a stale
 * token and can neither renew nor report.
 */
public class ActivityCoordinator implements ActivityService {

    private static final Logger log = LoggerFactory.getLogger(ActivityCoordinator.class);

    private final ActivityTaskQueue taskQueue;
    private final WorkflowCoordinator workflowCoordinator;
    private final Duration leaseGrace;
    private final SyncMetrics metrics;
    private final Clock clock;

    public ActivityCoordinator(
            ActivityTaskQueue taskQueue,
            WorkflowCoordinator workflowCoordinator,
            Duration leaseGrace,
            SyncMetrics metrics,
            Clock clock) {
        this.taskQueue = taskQueue;
        this.workflowCoordinator = workflowCoordinator;
        this.leaseGrace = leaseGrace;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Optional<ActivityTask> claimTask(Collection<String> activityNames, String workerId) {
        Optional<ActivityTask> claimed = taskQueue.claimNext(activityNames, workerId, clock.instant(), leaseGrace);
        claimed.ifPresent(t -> log.debug("Worker {} claimed {} attempt {} (fence {})",
            workerId, t.activityName(), t.attempt(), t.fenceToken()));
        return claimed;
    }

    @Override
    public Instant renewLease(UUID taskId, long fenceToken) {
        ActivityTask task = taskQueue.findById(taskId)
            .filter(t -> t.fenceToken() == fenceToken)
            .orElseThrow(() -> new LeaseLostException(taskId, fenceToken));
        Instant expiresAt = clock.instant().plus(task.leaseDuration(leaseGrace));
        if (!taskQueue.renewLease(taskId, fenceToken, expiresAt)) {
            throw new LeaseLostException(taskId, fenceToken);
        }
        return expiresAt;
    }

    /**
     * The result is recorded while the task is still outstanding, then the task is completed,
     * then the workflow advances. A resume sweep therefore never sees the task gone with its
     * attempt unrecorded.
     */
    @Override
    public void reportResult(UUID taskId, long fenceToken, ActivityResult result) {
        ActivityTask task = taskQueue.findById(taskId)
            .filter(t -> t.fenceToken() == fenceToken && t.state() == TaskState.RUNNING)
            .orElseThrow(() -> new LeaseLostException(taskId, fenceToken));
        Optional<WorkflowExecution> recorded = workflowCoordinator.recordResult(task, result);
        if (!taskQueue.complete(taskId, fenceToken)) {
            // reclaimed after the result was recorded; the requeued run of this attempt is ignored
            log.warn("Lease on {} attempt {} was reclaimed while its result was recorded",
                task.activityName(), task.attempt());
        }
        recorded.ifPresent(workflowCoordinator::continueAfter);
    }

    @Override
    public int reclaimExpiredLeases(int batchSize) {
        Instant now = clock.instant();
        List<ActivityTask> expired = taskQueue.findExpiredLeases(now, batchSize);
        int reclaimed = 0;
        for (ActivityTask task : expired) {
            if (taskQueue.requeue(task.taskId(), task.fenceToken(), now)) {
                reclaimed++;
                metrics.leaseReclaimed(task.activityName());
                log.warn("Reclaimed {} attempt {} of workflow {} from {} (lease expired {})",
                    task.activityName(), task.attempt(), task.workflowId(), task.leaseHolder(), task.leaseExpiresAt());
            }
        }
        return reclaimed;
    }

    @Override
    public int purgeFinishedTasks(Duration retention) {
        int purged = taskQueue.deleteDoneBefore(clock.instant().minus(retention));
        if (purged > 0) {
            log.info("Purged {} finished activity tasks older than {}", purged, retention);
        }
        return purged;
    }

    public Duration getLeaseGrace() {
        return leaseGrace;
    }
}
