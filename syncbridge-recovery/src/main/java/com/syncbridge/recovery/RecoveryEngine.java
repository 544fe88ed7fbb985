package com.syncbridge.recovery;

import com.syncbridge.core.model.WorkflowExecution;
import com.syncbridge.core.model.WorkflowState;
import com.syncbridge.core.repository.WorkflowExecutionRepository;
import com.syncbridge.engine.service.ActivityService;
import com.syncbridge.engine.service.WorkflowService;
import com.syncbridge.engine.tracking.TrackingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Recovery Engine responsible for detecting and recovering from failures.
 *
 * Responsibilities:
 * - Requeue activity tasks whose worker stopped renewing its lease
 * - Expire events that were never acknowledged
 * - Resume running workflows that lost their outstanding task
 * - Restore tracking records for events that reached a stream untracked
 * - Purge terminal tracking records and finished activity tasks past retention
 *
 * Every sweep is safe to run concurrently with itself on other nodes.
 */
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    private final ActivityService activityService;
    private final WorkflowService workflowService;
    private final WorkflowExecutionRepository executionRepository;
    private final TrackingService trackingService;
    private final TrackingReconciler reconciler;
    private final RecoverySettings settings;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    // last workflow examined by the periodic resume sweep; null restarts from the oldest
    private WorkflowExecution resumePosition;

    public RecoveryEngine(
            ActivityService activityService,
            WorkflowService workflowService,
            WorkflowExecutionRepository executionRepository,
            TrackingService trackingService,
            TrackingReconciler reconciler,
            RecoverySettings settings,
            Clock clock) {
        this.activityService = activityService;
        this.workflowService = workflowService;
        this.executionRepository = executionRepository;
        this.trackingService = trackingService;
        this.reconciler = reconciler;
        this.settings = settings;
        this.clock = clock;
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "syncbridge-recovery");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Resume every running workflow once, then start the periodic sweeps.
     */
    public void start() {
        if (running) {
            log.warn("Recovery engine already running");
            return;
        }

        running = true;
        log.info("Starting recovery engine");

        guarded("startup resume", this::resumeAllRunningWorkflows);

        schedule("lease reclaim", settings.leaseCheckInterval(), this::reclaimExpiredLeases);
        schedule("event expiry", settings.expiryCheckInterval(), this::expireStaleEvents);
        schedule("workflow resume", settings.resumeInterval(), () -> resumeRunningWorkflows(settings.stalledAfter()));
        schedule("tracking purge", settings.purgeInterval(), this::purgeTerminalEvents);
        schedule("task purge", settings.purgeInterval(), this::purgeFinishedTasks);
        if (!settings.reconcileApplications().isEmpty()) {
            schedule("tracking reconcile", settings.reconcileInterval(), this::reconcileTracking);
        }

        log.info("Recovery engine started");
    }

    /**
     * Stop the recovery engine.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Recovery engine stopped");
    }

    /**
     * Requeue tasks with expired leases.
     * Workers may have crashed without reporting.
     */
    public int reclaimExpiredLeases() {
        int reclaimed = activityService.reclaimExpiredLeases(settings.batchSize());
        if (reclaimed > 0) {
            log.info("Requeued {} tasks with expired leases", reclaimed);
        }
        return reclaimed;
    }

    /**
     * Move events left unacknowledged past the ack window to EXPIRED.
     */
    public int expireStaleEvents() {
        return trackingService.expireStale(settings.ackWindow(), settings.batchSize());
    }

    /**
     * Resume one page of running workflows that have not changed for the given time.
     * Workflows with an outstanding task are left alone by the coordinator.
     *
     * Successive sweeps walk the candidates in {@code (updatedAt, workflowId)} order and wrap
     * around after a short page, so waiting workflows never hide stalled ones behind them.
     *
     * @return Number of workflows examined
     */
    public synchronized int resumeRunningWorkflows(Duration idleFor) {
        Instant threshold = clock.instant().minus(idleFor);
        List<WorkflowExecution> page = executionRepository.findByStateUpdatedBefore(
            WorkflowState.RUNNING, threshold, resumePosition, settings.batchSize());

        resumeEach(page);
        resumePosition = page.size() < settings.batchSize() ? null : page.get(page.size() - 1);
        if (!page.isEmpty()) {
            log.debug("Checked {} running workflows idle since {}", page.size(), threshold);
        }
        return page.size();
    }

    /**
     * Resume every running workflow, page by page.
     *
     * @return Number of workflows examined
     */
    public int resumeAllRunningWorkflows() {
        // inclusive of workflows updated at this very instant
        Instant threshold = clock.instant().plusMillis(1);
        WorkflowExecution after = null;
        int examined = 0;
        while (true) {
            List<WorkflowExecution> page = executionRepository.findByStateUpdatedBefore(
                WorkflowState.RUNNING, threshold, after, settings.batchSize());
            resumeEach(page);
            examined += page.size();
            if (page.size() < settings.batchSize()) {
                break;
            }
            after = page.get(page.size() - 1);
        }
        if (examined > 0) {
            log.info("Checked {} running workflows at startup", examined);
        }
        return examined;
    }

    /**
     * Delete terminal tracking records past retention.
     */
    public int purgeTerminalEvents() {
        return trackingService.purgeTerminal(settings.retention());
    }

    /**
     * Delete finished activity tasks past retention.
     */
    public int purgeFinishedTasks() {
        return activityService.purgeFinishedTasks(settings.retention());
    }

    /**
     * Restore missing tracking records for every configured application.
     */
    public int reconcileTracking() {
        int restored = 0;
        for (String application : settings.reconcileApplications()) {
            try {
                restored += reconciler.reconcileApplication(application, settings.batchSize());
            } catch (Exception e) {
                log.error("Tracking reconciliation for {} failed", application, e);
            }
        }
        return restored;
    }

    // ========== Helper Methods ==========

    private void resumeEach(List<WorkflowExecution> executions) {
        for (WorkflowExecution execution : executions) {
            try {
                workflowService.resumeWorkflow(execution.workflowId());
            } catch (Exception e) {
                log.error("Failed to resume workflow {}", execution.workflowId(), e);
            }
        }
    }

    private void schedule(String name, Duration interval, Runnable sweep) {
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(() -> guarded(name, sweep), millis, millis, TimeUnit.MILLISECONDS);
    }

    private void guarded(String name, Runnable sweep) {
        if (!running) return;

        try {
            sweep.run();
        } catch (Exception e) {
            log.error("Error in {}", name, e);
        }
    }
}
