package com.syncbridge.engine.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * MDC helper for structured logging.
 * Every log line written inside a context carries the event, tenant, workflow or worker it concerns.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forEvent(eventId, tenantId, eventType)) {
 *     log.info("Appended to {}", streamKey); // includes eventId, tenantId, eventType
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String EVENT_ID = "eventId";
    public static final String EVENT_TYPE = "eventType";
    public static final String TENANT_ID = "tenantId";
    public static final String CONSUMER = "consumer";
    public static final String WORKFLOW_ID = "workflowId";
    public static final String ACTIVITY = "activity";
    public static final String ATTEMPT = "attempt";
    public static final String WORKER_ID = "workerId";
    public static final String TRACE_ID = "traceId";

    private final List<String> keys = new ArrayList<>();

    private LoggingContext() {
    }

    public static LoggingContext forEvent(String eventId, String tenantId, String eventType) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(EVENT_ID, eventId);
        ctx.put(TENANT_ID, tenantId);
        ctx.put(EVENT_TYPE, eventType);
        ensureTraceId();
        return ctx;
    }

    public static LoggingContext forConsumer(String consumer) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(CONSUMER, consumer);
        ensureTraceId();
        return ctx;
    }

    public static LoggingContext forWorkflow(UUID workflowId, String tenantId) {
        LoggingContext ctx = new LoggingContext();
        if (workflowId != null) {
            ctx.put(WORKFLOW_ID, workflowId.toString());
        }
        ctx.put(TENANT_ID, tenantId);
        ensureTraceId();
        return ctx;
    }

    public static LoggingContext forActivity(UUID workflowId, String activity, int attempt) {
        LoggingContext ctx = new LoggingContext();
        if (workflowId != null) {
            ctx.put(WORKFLOW_ID, workflowId.toString());
        }
        ctx.put(ACTIVITY, activity);
        ctx.put(ATTEMPT, String.valueOf(attempt));
        ensureTraceId();
        return ctx;
    }

    public static LoggingContext forWorker(String workerId) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(WORKER_ID, workerId);
        ensureTraceId();
        return ctx;
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private void put(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
            keys.add(key);
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        keys.forEach(MDC::remove);
        // TRACE_ID stays for the rest of the request or loop iteration
    }

    /**
     * Clear all MDC context. Call at the end of a request or worker loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
