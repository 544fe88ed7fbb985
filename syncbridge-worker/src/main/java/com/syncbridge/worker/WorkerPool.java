package com.syncbridge.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncbridge.core.exception.LeaseLostException;
import com.syncbridge.core.model.ActivityResult;
import com.syncbridge.core.model.ActivityTask;
import com.syncbridge.engine.logging.LoggingContext;
import com.syncbridge.engine.metrics.SyncMetrics;
import com.syncbridge.engine.service.ActivityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs activity handlers for claimed tasks with bounded concurrency.
 *
 * Usage:
 * <pre>
 * WorkerPool pool = new WorkerPool("worker-1", activityService, settings, objectMapper, metrics);
 * pool.registerActivity("sync-users", context -> {
 *     // push users downstream
 *     return ActivityResult.success(context.toJsonNode(Map.of("synced", 3)));
 * });
 * pool.start();
 * </pre>
 *
 * Each slot thread claims the next due task, runs its handler on a separate thread so the
 * task timeout can be enforced, renews the lease on a fixed interval and reports the result.
 * A result reported after the lease was lost is rejected by the fence token and dropped.
 */
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final String workerId;
    private final ActivityService activityService;
    private final WorkerSettings settings;
    private final ObjectMapper objectMapper;
    private final SyncMetrics metrics;
    private final Map<String, ActivityHandler> handlers = new ConcurrentHashMap<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ExecutorService slotExecutor;
    private final ExecutorService handlerExecutor;
    private final ScheduledExecutorService heartbeatScheduler;

    public WorkerPool(
            String workerId,
            ActivityService activityService,
            WorkerSettings settings,
            ObjectMapper objectMapper,
            SyncMetrics metrics) {
        this.workerId = workerId;
        this.activityService = activityService;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.handlerExecutor = Executors.newCachedThreadPool(namedDaemon(workerId + "-handler"));
        this.heartbeatScheduler = Executors.newScheduledThreadPool(1, namedDaemon(workerId + "-heartbeat"));
    }

    /**
     * Register the handler for an activity name. Only registered names are claimed.
     */
    public void registerActivity(String activityName, ActivityHandler handler) {
        handlers.put(activityName, handler);
        log.info("Registered activity handler: {}", activityName);
    }

    public Set<String> getActivityNames() {
        return Set.copyOf(handlers.keySet());
    }

    /**
     * Start one polling loop per slot.
     */
    public void start() {
        if (handlers.isEmpty()) {
            throw new IllegalStateException("No activity handlers registered for worker " + workerId);
        }
        if (running.compareAndSet(false, true)) {
            log.info("Starting worker {} with {} slots for {}", workerId, settings.slots(), handlers.keySet());
            ExecutorService slots = Executors.newFixedThreadPool(settings.slots(), namedDaemon(workerId + "-slot"));
            slotExecutor = slots;
            for (int i = 0; i < settings.slots(); i++) {
                slots.submit(this::slotLoop);
            }
        }
    }

    /**
     * Stop claiming new tasks and wait for running handlers to finish. A stopped pool cannot be restarted.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping worker {}", workerId);
            ExecutorService slots = slotExecutor;
            slots.shutdown();
            try {
                if (!slots.awaitTermination(30, TimeUnit.SECONDS)) {
                    slots.shutdownNow();
                }
            } catch (InterruptedException e) {
                slots.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        handlerExecutor.shutdownNow();
        heartbeatScheduler.shutdownNow();
    }

    /**
     * Claim and run at most one task on the calling thread.
     *
     * @return true if a task was run
     */
    public boolean runOnce() {
        Optional<ActivityTask> claimed = activityService.claimTask(handlers.keySet(), workerId);
        claimed.ifPresent(this::execute);
        return claimed.isPresent();
    }

    public String getWorkerId() {
        return workerId;
    }

    // ========== Helper Methods ==========

    private void slotLoop() {
        while (running.get()) {
            try {
                if (!runOnce()) {
                    Thread.sleep(settings.pollInterval().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Error in worker {} slot loop", workerId, e);
                try {
                    Thread.sleep(settings.pollInterval().toMillis() * 2);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    private void execute(ActivityTask task) {
        try (LoggingContext workerCtx = LoggingContext.forWorker(workerId);
             LoggingContext ctx = LoggingContext.forActivity(task.workflowId(), task.activityName(), task.attempt())) {
            ActivityHandler handler = handlers.get(task.activityName());
            AtomicBoolean leaseLost = new AtomicBoolean(false);
            ActivityContext context = new ActivityContext(task, objectMapper, () -> renew(task, leaseLost));

            long intervalMs = settings.heartbeatInterval().toMillis();
            ScheduledFuture<?> heartbeat = heartbeatScheduler.scheduleAtFixedRate(
                () -> renew(task, leaseLost), intervalMs, intervalMs, TimeUnit.MILLISECONDS);

            metrics.activityStarted();
            ActivityResult result;
            try {
                log.info("Executing {} attempt {} (task {})", task.activityName(), task.attempt(), task.taskId());
                result = invoke(handler, context, task);
            } finally {
                heartbeat.cancel(false);
                metrics.activityEnded();
            }

            if (leaseLost.get()) {
                log.warn("Lease on task {} was lost while running; dropping {} result", task.taskId(), result.outcome());
                return;
            }
            try {
                activityService.reportResult(task.taskId(), task.fenceToken(), result);
                log.info("Task {} finished with {}", task.taskId(), result.outcome());
            } catch (LeaseLostException e) {
                log.warn("Result for task {} rejected: {}", task.taskId(), e.getMessage());
            }
        }
    }

    private ActivityResult invoke(ActivityHandler handler, ActivityContext context, ActivityTask task) {
        Future<ActivityResult> future = handlerExecutor.submit(() -> handler.execute(context));
        try {
            ActivityResult result = future.get(task.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ActivityResult.retryable(ActivityResult.UNCAUGHT_EXCEPTION, "handler returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Task {} exceeded its {}ms timeout", task.taskId(), task.timeout().toMillis());
            return ActivityResult.retryable(ActivityResult.ACTIVITY_TIMEOUT,
                "timed out after " + task.timeout().toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Task {} failed with unexpected error", task.taskId(), cause);
            return ActivityResult.retryable(ActivityResult.UNCAUGHT_EXCEPTION,
                cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ActivityResult.retryable(ActivityResult.UNCAUGHT_EXCEPTION, "worker interrupted");
        }
    }

    private boolean renew(ActivityTask task, AtomicBoolean leaseLost) {
        if (leaseLost.get()) {
            return false;
        }
        try {
            activityService.renewLease(task.taskId(), task.fenceToken());
            return true;
        } catch (LeaseLostException e) {
            leaseLost.set(true);
            log.warn("Lost lease on task {}: {}", task.taskId(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            // the lease may still be valid; the next heartbeat tries again
            log.warn("Heartbeat for task {} failed: {}", task.taskId(), e.getMessage());
            return true;
        }
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
