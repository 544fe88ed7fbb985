package com.syncbridge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * The canonical unit of cross-application communication.
 *
 * Invariants:
 * - eventId is assigned once at publish time and never reused for another change
 * - eventType is a dotted tag whose first segment is the domain (credit, role, user, organization)
 * - data is opaque to the transport and tracking layers
 */
public record EventEnvelope(
    String eventId,
    Instant timestamp,
    String eventType,
    String tenantId,
    String entityType,
    String entityId,
    JsonNode data,
    String publishedBy
) {
    /**
     * Create an envelope for a new logical change with a fresh event id.
     */
    public static EventEnvelope create(
            String eventType,
            String tenantId,
            String entityType,
            String entityId,
            JsonNode data,
            String publishedBy,
            Instant now) {
        return new EventEnvelope(
            UUID.randomUUID().toString(),
            now,
            eventType,
            tenantId,
            entityType,
            entityId,
            data,
            publishedBy
        );
    }

    /**
     * Domain segment of the event type, e.g. {@code credit} for {@code credit.allocated}.
     */
    public String domain() {
        return domainOf(eventType);
    }

    public static String domainOf(String eventType) {
        int dot = eventType.indexOf('.');
        return dot < 0 ? eventType : eventType.substring(0, dot);
    }
}
