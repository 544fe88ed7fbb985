package com.syncbridge.core.model;

import java.time.Instant;

/**
 * System-of-record entry describing one event's delivery lifecycle.
 *
 * Primary Key: eventId
 *
 * Invariants:
 * - exactly one record per eventId
 * - acknowledgedAt set iff status == ACKNOWLEDGED, and never before publishedAt
 * - terminal records never change again
 * - version increases by one on every transition; stores compare-and-swap on it
 * - lastAckOffset only moves forward; an ack at or below it was already applied
 */
public record TrackingRecord(
    String eventId,
    String tenantId,
    String eventType,
    String entityId,

    // Routing
    String targetApplication,
    String streamKey,
    long streamOffset,

    // State
    TrackingStatus status,
    Instant publishedAt,
    Instant acknowledgedAt,
    int retryCount,
    String lastError,
    Instant lastAckAt,
    long lastAckOffset,

    // Audit
    String publishedBy,
    long version
) {
    /**
     * Offset of an acknowledgment that did not come from an ack stream.
     */
    public static final long NO_ACK_OFFSET = 0L;

    /**
     * Create a PUBLISHED record for an envelope that was appended at the given stream position.
     */
    public static TrackingRecord published(
            EventEnvelope envelope,
            String targetApplication,
            String streamKey,
            long streamOffset,
            Instant publishedAt) {
        return new TrackingRecord(
            envelope.eventId(),
            envelope.tenantId(),
            envelope.eventType(),
            envelope.entityId(),
            targetApplication,
            streamKey,
            streamOffset,
            TrackingStatus.PUBLISHED,
            publishedAt,
            null,
            0,
            null,
            null,
            NO_ACK_OFFSET,
            envelope.publishedBy(),
            1L
        );
    }

    /**
     * Apply a positive acknowledgment read at the given ack-stream offset.
     */
    public TrackingRecord withAcknowledged(Instant ackTimestamp, long ackOffset) {
        requireTransition(TrackingStatus.ACKNOWLEDGED);
        Instant acknowledged = ackTimestamp.isBefore(publishedAt) ? publishedAt : ackTimestamp;
        return new TrackingRecord(
            eventId, tenantId, eventType, entityId,
            targetApplication, streamKey, streamOffset,
            TrackingStatus.ACKNOWLEDGED, publishedAt, acknowledged, retryCount, lastError, ackTimestamp,
            Math.max(lastAckOffset, ackOffset), publishedBy, version + 1
        );
    }

    /**
     * Apply a negative acknowledgment. The record fails once the error count reaches the budget.
     */
    public TrackingRecord withErrorAck(String errorDetail, Instant ackTimestamp, long ackOffset, int retryBudget) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Tracking record " + eventId + " is terminal: " + status);
        }
        int retries = retryCount + 1;
        TrackingStatus next = retries >= retryBudget ? TrackingStatus.FAILED : TrackingStatus.PUBLISHED;
        return new TrackingRecord(
            eventId, tenantId, eventType, entityId,
            targetApplication, streamKey, streamOffset,
            next, publishedAt, null, retries, errorDetail, ackTimestamp,
            Math.max(lastAckOffset, ackOffset), publishedBy, version + 1
        );
    }

    /**
     * Mark the record expired after its ack window elapsed.
     */
    public TrackingRecord withExpired(Instant now) {
        requireTransition(TrackingStatus.EXPIRED);
        String reason = "No acknowledgment received by " + now;
        return new TrackingRecord(
            eventId, tenantId, eventType, entityId,
            targetApplication, streamKey, streamOffset,
            TrackingStatus.EXPIRED, publishedAt, null, retryCount,
            lastError != null ? lastError : reason, lastAckAt,
            lastAckOffset, publishedBy, version + 1
        );
    }

    /**
     * Whether the acknowledgment at the given ack-stream offset was already applied.
     * Acks without a stream offset are never treated as replays.
     */
    public boolean isReplayedAck(long ackOffset) {
        return ackOffset != NO_ACK_OFFSET && ackOffset <= lastAckOffset;
    }

    private void requireTransition(TrackingStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                "Tracking record %s cannot move from %s to %s", eventId, status, target));
        }
    }
}
