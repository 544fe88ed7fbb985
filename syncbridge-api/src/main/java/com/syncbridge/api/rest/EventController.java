package com.syncbridge.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.syncbridge.core.exception.NotFoundException;
import com.syncbridge.core.model.TrackingRecord;
import com.syncbridge.core.model.TrackingStatus;
import com.syncbridge.engine.publisher.EventPublisher;
import com.syncbridge.engine.publisher.PublishRequest;
import com.syncbridge.engine.tracking.TrackingService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * REST API for publishing events and inspecting their delivery.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventPublisher publisher;
    private final TrackingService trackingService;

    public EventController(EventPublisher publisher, TrackingService trackingService) {
        this.publisher = publisher;
        this.trackingService = trackingService;
    }

    /**
     * Publish a change. Returns once the event is on its stream and tracked.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> publish(@RequestBody PublishEventRequest request) {
        String eventId = publisher.publish(new PublishRequest(
            request.eventType(),
            request.tenantId(),
            request.entityType(),
            request.entityId(),
            request.data(),
            request.publishedBy(),
            request.targetApplication()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("eventId", eventId));
    }

    /**
     * Delivery status of one event.
     */
    @GetMapping("/{eventId}")
    public ResponseEntity<TrackingRecordResponse> getEvent(@PathVariable String eventId) {
        TrackingRecord record = trackingService.getEventStatus(eventId)
            .orElseThrow(() -> new NotFoundException("TrackingRecord", eventId));
        return ResponseEntity.ok(TrackingRecordResponse.from(record));
    }

    /**
     * Append a still-pending event to its stream again.
     */
    @PostMapping("/{eventId}/republish")
    public ResponseEntity<Map<String, Object>> republish(@PathVariable String eventId) {
        publisher.republish(eventId);
        return ResponseEntity.accepted().body(Map.of("eventId", eventId, "republished", true));
    }

    // ========== DTOs ==========

    public record PublishEventRequest(
        String eventType,
        String tenantId,
        String entityType,
        String entityId,
        JsonNode data,
        String publishedBy,
        String targetApplication
    ) {}

    public record TrackingRecordResponse(
        String eventId,
        String tenantId,
        String eventType,
        String entityId,
        String targetApplication,
        TrackingStatus status,
        Instant publishedAt,
        Instant acknowledgedAt,
        int retryCount,
        String lastError,
        String publishedBy
    ) {
        public static TrackingRecordResponse from(TrackingRecord record) {
            return new TrackingRecordResponse(
                record.eventId(),
                record.tenantId(),
                record.eventType(),
                record.entityId(),
                record.targetApplication(),
                record.status(),
                record.publishedAt(),
                record.acknowledgedAt(),
                record.retryCount(),
                record.lastError(),
                record.publishedBy()
            );
        }
    }
}
