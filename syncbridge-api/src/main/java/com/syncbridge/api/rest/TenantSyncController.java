package com.syncbridge.api.rest;

import com.syncbridge.api.rest.EventController.TrackingRecordResponse;
import com.syncbridge.core.model.ChannelHealth;
import com.syncbridge.core.model.HealthStatus;
import com.syncbridge.core.model.SyncHealthMetrics;
import com.syncbridge.engine.tracking.SyncHealthAggregator;
import com.syncbridge.engine.tracking.TrackingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Per-tenant sync health and unacknowledged event listing.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}")
public class TenantSyncController {

    private final SyncHealthAggregator healthAggregator;
    private final TrackingService trackingService;

    public TenantSyncController(SyncHealthAggregator healthAggregator, TrackingService trackingService) {
        this.healthAggregator = healthAggregator;
        this.trackingService = trackingService;
    }

    @GetMapping("/sync-health")
    public ResponseEntity<SyncHealthResponse> getSyncHealth(@PathVariable String tenantId) {
        return ResponseEntity.ok(SyncHealthResponse.from(healthAggregator.getHealthMetrics(tenantId)));
    }

    /**
     * Events still waiting for an acknowledgment, oldest first.
     */
    @GetMapping("/events/unacknowledged")
    public ResponseEntity<List<TrackingRecordResponse>> getUnacknowledged(
            @PathVariable String tenantId,
            @RequestParam(defaultValue = "60") long olderThanMinutes,
            @RequestParam(defaultValue = "100") int limit) {
        if (olderThanMinutes < 0 || limit < 1) {
            throw new IllegalArgumentException("olderThanMinutes must be >= 0 and limit >= 1");
        }
        List<TrackingRecordResponse> records = trackingService
            .getUnacknowledged(tenantId, Duration.ofMinutes(olderThanMinutes), limit).stream()
            .map(TrackingRecordResponse::from)
            .toList();
        return ResponseEntity.ok(records);
    }

    // ========== DTOs ==========

    public record SyncHealthResponse(
        String tenantId,
        Instant windowStart,
        Instant windowEnd,
        Double ackRate,
        Long avgAckLatencyMs,
        long totalEvents,
        long pendingCount,
        long acknowledgedCount,
        long failedCount,
        long expiredCount,
        long retryingCount,
        HealthStatus status,
        List<ChannelHealth> channels
    ) {
        public static SyncHealthResponse from(SyncHealthMetrics metrics) {
            return new SyncHealthResponse(
                metrics.tenantId(),
                metrics.windowStart(),
                metrics.windowEnd(),
                metrics.ackRate(),
                metrics.avgAckLatency() != null ? metrics.avgAckLatency().toMillis() : null,
                metrics.totalEvents(),
                metrics.pendingCount(),
                metrics.acknowledgedCount(),
                metrics.failedCount(),
                metrics.expiredCount(),
                metrics.retryingCount(),
                metrics.status(),
                metrics.channels()
            );
        }
    }
}
