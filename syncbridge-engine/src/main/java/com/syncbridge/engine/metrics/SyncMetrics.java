package com.syncbridge.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics for event delivery, acknowledgment processing and workflow execution.
 *
 * Metrics exposed:
 * - Events published, failed to publish, republished
 * - Acknowledgments applied by outcome, malformed, unknown
 * - Tracking records expired and purged
 * - Workflow counts by outcome and activity durations
 * - Outstanding activity tasks and reclaimed leases
 *
 * Recording before {@link #bindTo(MeterRegistry)} is a no-op.
 */
public class SyncMetrics implements MeterBinder {

    public static final String EVENTS_PUBLISHED = "syncbridge.events.published";
    public static final String EVENTS_PUBLISH_FAILED = "syncbridge.events.publish.failed";
    public static final String EVENTS_REPUBLISHED = "syncbridge.events.republished";
    public static final String EVENTS_EXPIRED = "syncbridge.events.expired";
    public static final String EVENTS_PURGED = "syncbridge.events.purged";

    public static final String ACKS_APPLIED = "syncbridge.acks.applied";
    public static final String ACKS_MALFORMED = "syncbridge.acks.malformed";
    public static final String ACKS_UNKNOWN = "syncbridge.acks.unknown";
    public static final String ACK_STORE_RETRIES = "syncbridge.acks.store.retries";

    public static final String WORKFLOWS_STARTED = "syncbridge.workflows.started";
    public static final String WORKFLOWS_COMPLETED = "syncbridge.workflows.completed";
    public static final String WORKFLOWS_FAILED = "syncbridge.workflows.failed";
    public static final String WORKFLOWS_CANCELLED = "syncbridge.workflows.cancelled";

    public static final String ACTIVITY_DURATION = "syncbridge.activity.duration";
    public static final String ACTIVITY_RETRIES = "syncbridge.activity.retries";
    public static final String LEASES_RECLAIMED = "syncbridge.leases.reclaimed";
    public static final String ACTIVE_ACTIVITIES = "syncbridge.activities.active";

    private volatile MeterRegistry registry;
    private final AtomicInteger activeActivities = new AtomicInteger();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(ACTIVE_ACTIVITIES, activeActivities, AtomicInteger::get)
            .description("Activities currently executing in this process")
            .register(registry);
    }

    // ========== Event Metrics ==========

    public void eventPublished(String eventType, String targetApplication) {
        count(Counter.builder(EVENTS_PUBLISHED)
            .tag("event_type", eventType)
            .tag("target", targetApplication)
            .description("Events appended and tracked"));
    }

    public void publishFailed(String eventType, String stage) {
        count(Counter.builder(EVENTS_PUBLISH_FAILED)
            .tag("event_type", eventType)
            .tag("stage", stage)
            .description("Publications that exhausted local retries"));
    }

    public void eventRepublished(String eventType) {
        count(Counter.builder(EVENTS_REPUBLISHED)
            .tag("event_type", eventType)
            .description("Events appended again for redelivery"));
    }

    public void eventsExpired(int count) {
        count(Counter.builder(EVENTS_EXPIRED)
            .description("Tracking records expired without acknowledgment"), count);
    }

    public void eventsPurged(int count) {
        count(Counter.builder(EVENTS_PURGED)
            .description("Terminal tracking records removed after retention"), count);
    }

    // ========== Acknowledgment Metrics ==========

    public void ackApplied(String consumer, String outcome) {
        count(Counter.builder(ACKS_APPLIED)
            .tag("consumer", consumer)
            .tag("outcome", outcome)
            .description("Acknowledgments processed by outcome"));
    }

    public void ackMalformed(String consumer) {
        count(Counter.builder(ACKS_MALFORMED)
            .tag("consumer", consumer)
            .description("Acknowledgments skipped for schema violations"));
    }

    public void ackUnknown(String consumer) {
        count(Counter.builder(ACKS_UNKNOWN)
            .tag("consumer", consumer)
            .description("Acknowledgments discarded for unknown events"));
    }

    public void ackStoreRetried(String consumer) {
        count(Counter.builder(ACK_STORE_RETRIES)
            .tag("consumer", consumer)
            .description("Local retries while the tracking store was unavailable"));
    }

    // ========== Workflow Metrics ==========

    public void workflowStarted(String workflowType) {
        count(Counter.builder(WORKFLOWS_STARTED)
            .tag("workflow", workflowType)
            .description("Total workflows started"));
    }

    public void workflowCompleted(String workflowType, Duration duration) {
        count(Counter.builder(WORKFLOWS_COMPLETED)
            .tag("workflow", workflowType)
            .description("Total workflows completed successfully"));
        MeterRegistry current = registry;
        if (current != null) {
            Timer.builder("syncbridge.workflow.duration")
                .tag("workflow", workflowType)
                .description("Workflow execution duration")
                .register(current)
                .record(duration);
        }
    }

    public void workflowFailed(String workflowType, String errorCode) {
        count(Counter.builder(WORKFLOWS_FAILED)
            .tag("workflow", workflowType)
            .tag("error_code", errorCode != null ? errorCode : "unspecified")
            .description("Total workflows failed"));
    }

    public void workflowCancelled(String workflowType) {
        count(Counter.builder(WORKFLOWS_CANCELLED)
            .tag("workflow", workflowType)
            .description("Total workflows cancelled"));
    }

    // ========== Activity Metrics ==========

    public void activityStarted() {
        activeActivities.incrementAndGet();
    }

    public void activityEnded() {
        activeActivities.updateAndGet(v -> Math.max(0, v - 1));
    }

    public void activityFinished(String activity, String outcome, Duration duration) {
        MeterRegistry current = registry;
        if (current != null) {
            Timer.builder(ACTIVITY_DURATION)
                .tag("activity", activity)
                .tag("outcome", outcome)
                .description("Activity execution duration")
                .register(current)
                .record(duration);
        }
    }

    public void activityRetried(String activity, int attempt) {
        count(Counter.builder(ACTIVITY_RETRIES)
            .tag("activity", activity)
            .tag("attempt", String.valueOf(attempt))
            .description("Activity re-dispatches after retryable failures"));
    }

    public void leaseReclaimed(String activity) {
        count(Counter.builder(LEASES_RECLAIMED)
            .tag("activity", activity)
            .description("Tasks requeued after their lease expired"));
    }

    // ========== Helper Methods ==========

    private void count(Counter.Builder builder) {
        count(builder, 1);
    }

    private void count(Counter.Builder builder, double amount) {
        MeterRegistry current = registry;
        if (current != null && amount > 0) {
            builder.register(current).increment(amount);
        }
    }
}
