package com.syncbridge.engine.publisher;

import com.fasterxml.jackson.databind.JsonNode;
import com.syncbridge.core.exception.InvalidStateTransitionException;
import com.syncbridge.core.exception.MalformedMessageException;
import com.syncbridge.core.exception.NotFoundException;
import com.syncbridge.core.exception.PublishFailedException;
import com.syncbridge.core.model.EventEnvelope;
import com.syncbridge.core.model.RetryPolicy;
import com.syncbridge.core.model.StreamEntry;
import com.syncbridge.core.model.TrackingRecord;
import com.syncbridge.core.model.TrackingStatus;
import com.syncbridge.core.payload.PayloadRegistry;
import com.syncbridge.core.repository.TrackingRepository;
import com.syncbridge.core.stream.StreamTransport;
import com.syncbridge.engine.codec.SyncMessageCodec;
import com.syncbridge.engine.logging.LoggingContext;
import com.syncbridge.engine.metrics.SyncMetrics;
import com.syncbridge.engine.stream.StreamKeyResolver;
import com.syncbridge.engine.support.TransientFailures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * Publishes domain changes onto per-application event streams and records them for tracking.
 *
 * The stream append happens first and is the source of truth. The tracking insert follows;
 * if it cannot be written the reconciler recreates it from the stream later.
 * Publishing never waits for consumers.
 */
public class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    static final String STAGE_APPEND = "append";
    static final String STAGE_TRACK = "track";

    private final StreamTransport transport;
    private final TrackingRepository trackingRepository;
    private final SyncMessageCodec codec;
    private final StreamKeyResolver keyResolver;
    private final PayloadRegistry payloadRegistry;
    private final RetryPolicy retryPolicy;
    private final String defaultConsumerApplication;
    private final SyncMetrics metrics;
    private final Clock clock;

    public EventPublisher(
            StreamTransport transport,
            TrackingRepository trackingRepository,
            SyncMessageCodec codec,
            StreamKeyResolver keyResolver,
            PayloadRegistry payloadRegistry,
            RetryPolicy retryPolicy,
            String defaultConsumerApplication,
            SyncMetrics metrics,
            Clock clock) {
        this.transport = transport;
        this.trackingRepository = trackingRepository;
        this.codec = codec;
        this.keyResolver = keyResolver;
        this.payloadRegistry = payloadRegistry;
        this.retryPolicy = retryPolicy;
        this.defaultConsumerApplication = defaultConsumerApplication;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Publish a change to the default consumer application.
     *
     * @return The eventId assigned to the change
     */
    public String publish(
            String eventType,
            String tenantId,
            String entityType,
            String entityId,
            JsonNode data,
            String publishedBy) {
        return publish(PublishRequest.of(eventType, tenantId, entityType, entityId, data, publishedBy));
    }

    /**
     * Publish a change.
     *
     * @return The eventId assigned to the change
     * @throws MalformedMessageException if a field is missing or the data fails validation
     * @throws PublishFailedException if the stream or the tracking store stayed unavailable
     */
    public String publish(PublishRequest request) {
        requireText(request.eventType(), "eventType");
        requireText(request.tenantId(), "tenantId");
        requireText(request.entityType(), "entityType");
        requireText(request.entityId(), "entityId");
        requireText(request.publishedBy(), "publishedBy");

        String target = request.targetApplication() != null
            ? request.targetApplication() : defaultConsumerApplication;
        String streamKey = keyResolver.eventStreamKey(target, request.eventType());
        payloadRegistry.decode(request.eventType(), request.data());

        EventEnvelope envelope = EventEnvelope.create(
            request.eventType(),
            request.tenantId(),
            request.entityType(),
            request.entityId(),
            request.data(),
            request.publishedBy(),
            clock.instant()
        );

        try (LoggingContext ctx = LoggingContext.forEvent(envelope.eventId(), envelope.tenantId(), envelope.eventType())) {
            String payload = codec.encodeEnvelope(envelope);
            long offset = withRetries(STAGE_APPEND, envelope, () -> transport.append(streamKey, payload));

            TrackingRecord record = TrackingRecord.published(envelope, target, streamKey, offset, clock.instant());
            withRetries(STAGE_TRACK, envelope, () -> trackingRepository.insertIfAbsent(record));

            metrics.eventPublished(envelope.eventType(), target);
            log.info("Published {} for {} {} to {} at offset {}",
                envelope.eventType(), envelope.entityType(), envelope.entityId(), streamKey, offset);
            return envelope.eventId();
        }
    }

    /**
     * Append a still-pending event to its stream again, under the same eventId.
     *
     * @throws NotFoundException if no tracking record exists for the event
     * @throws InvalidStateTransitionException if the event already reached a terminal state
     */
    public void republish(String eventId) {
        TrackingRecord record = trackingRepository.findById(eventId)
            .orElseThrow(() -> new NotFoundException("TrackingRecord", eventId));
        if (record.status().isTerminal()) {
            throw new InvalidStateTransitionException(
                "TrackingRecord", eventId, record.status(), TrackingStatus.PUBLISHED);
        }

        try (LoggingContext ctx = LoggingContext.forEvent(eventId, record.tenantId(), record.eventType())) {
            StreamEntry original = transport.readAt(record.streamKey(), record.streamOffset())
                .orElseThrow(() -> new NotFoundException("StreamEntry", record.streamKey() + "@" + record.streamOffset()));
            EventEnvelope envelope = codec.decodeEnvelope(original.payload());

            long offset = withRetries(STAGE_APPEND, envelope,
                () -> transport.append(record.streamKey(), original.payload()));
            metrics.eventRepublished(record.eventType());
            log.info("Republished event {} to {} at offset {}", eventId, record.streamKey(), offset);
        }
    }

    // ========== Helper Methods ==========

    private <T> T withRetries(String stage, EventEnvelope envelope, Supplier<T> operation) {
        int attempt = 1;
        while (true) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                if (!TransientFailures.isTransient(e) || !retryPolicy.hasMoreAttempts(attempt)) {
                    metrics.publishFailed(envelope.eventType(), stage);
                    log.error("Publish of {} failed at {} after {} attempt(s)", envelope.eventId(), stage, attempt, e);
                    throw new PublishFailedException(envelope.eventId(), envelope.eventType(), stage, attempt, e);
                }
                long backoffMs = retryPolicy.computeBackoff(attempt).toMillis();
                log.warn("Transient failure at {} for event {} (attempt {}), retrying in {}ms: {}",
                    stage, envelope.eventId(), attempt, backoffMs, e.getMessage());
                if (!TransientFailures.pause(backoffMs)) {
                    throw new PublishFailedException(envelope.eventId(), envelope.eventType(), stage, attempt, e);
                }
                attempt++;
            }
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new MalformedMessageException(field + " is required");
        }
    }
}
