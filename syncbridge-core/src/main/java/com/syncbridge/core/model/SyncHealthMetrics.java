package com.syncbridge.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Rolling-window delivery metrics for one tenant.
 *
 * ackRate and avgAckLatency are null, not zero, when there is nothing to compute them from.
 */
public record SyncHealthMetrics(
    String tenantId,
    Instant windowStart,
    Instant windowEnd,
    Double ackRate,
    Duration avgAckLatency,
    long pendingCount,
    long failedCount,
    long acknowledgedCount,
    long expiredCount,
    long retryingCount,
    HealthStatus status,
    List<ChannelHealth> channels
) {
    public long totalEvents() {
        return pendingCount + failedCount + acknowledgedCount + expiredCount;
    }

    /**
     * Share of decided events that failed or expired; null when nothing was decided.
     */
    public Double failureRate() {
        long decided = acknowledgedCount + failedCount + expiredCount;
        return decided == 0 ? null : (double) (failedCount + expiredCount) / decided;
    }

    /**
     * Alerting hook: true only when an ack rate exists and is below the floor.
     */
    public boolean isBelowAckRateFloor(double floor) {
        return ackRate != null && ackRate < floor;
    }
}
