package com.syncbridge.core.model;

import java.time.Instant;

/**
 * Downstream confirmation or rejection of exactly one event, correlated by eventId.
 */
public record AcknowledgmentMessage(
    String eventId,
    String tenantId,
    String consumerApplication,
    AckResult result,
    String errorDetail,
    Instant ackTimestamp
) {
    public static AcknowledgmentMessage ok(String eventId, String tenantId, String consumerApplication, Instant at) {
        return new AcknowledgmentMessage(eventId, tenantId, consumerApplication, AckResult.OK, null, at);
    }

    public static AcknowledgmentMessage error(
            String eventId, String tenantId, String consumerApplication, String errorDetail, Instant at) {
        return new AcknowledgmentMessage(eventId, tenantId, consumerApplication, AckResult.ERROR, errorDetail, at);
    }
}
