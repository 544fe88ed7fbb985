package com.syncbridge.engine.tracking;

import com.syncbridge.core.model.ChannelHealth;
import com.syncbridge.core.model.HealthStatus;
import com.syncbridge.core.model.SyncHealthMetrics;
import com.syncbridge.core.model.TrackingRecord;
import com.syncbridge.core.model.TrackingStatus;
import com.syncbridge.core.repository.TrackingRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes rolling-window delivery health for a tenant from its tracking records. Read-only.
 */
public class SyncHealthAggregator {

    public static final Duration DEFAULT_WINDOW = Duration.ofHours(24);

    private final TrackingRepository repository;
    private final Duration window;
    private final Clock clock;

    public SyncHealthAggregator(TrackingRepository repository, Duration window, Clock clock) {
        this.repository = repository;
        this.window = window;
        this.clock = clock;
    }

    public SyncHealthMetrics getHealthMetrics(String tenantId) {
        Instant windowEnd = clock.instant();
        Instant windowStart = windowEnd.minus(window);
        List<TrackingRecord> records = repository.findByTenantPublishedSince(tenantId, windowStart).stream()
            .filter(r -> !r.publishedAt().isAfter(windowEnd))
            .toList();

        Counts total = new Counts();
        Map<String, Counts> byChannel = new TreeMap<>();
        long latencyMillis = 0;
        for (TrackingRecord record : records) {
            total.add(record);
            byChannel.computeIfAbsent(record.targetApplication(), k -> new Counts()).add(record);
            if (record.status() == TrackingStatus.ACKNOWLEDGED) {
                latencyMillis += Duration.between(record.publishedAt(), record.acknowledgedAt()).toMillis();
            }
        }

        Duration avgLatency = total.acknowledged == 0 ? null : Duration.ofMillis(latencyMillis / total.acknowledged);

        List<ChannelHealth> channels = new ArrayList<>();
        byChannel.forEach((app, c) -> {
            Double failureRate = c.failureRate();
            channels.add(new ChannelHealth(
                app,
                c.published,
                c.acknowledged,
                c.pending,
                c.failed,
                c.expired,
                c.ackRate(),
                failureRate != null && failureRate > ChannelHealth.DEGRADED_FAILURE_RATE
            ));
        });

        return new SyncHealthMetrics(
            tenantId,
            windowStart,
            windowEnd,
            total.ackRate(),
            avgLatency,
            total.pending,
            total.failed,
            total.acknowledged,
            total.expired,
            total.retrying,
            HealthStatus.fromFailureRate(total.failureRate()),
            channels
        );
    }

    public Duration getWindow() {
        return window;
    }

    private static final class Counts {
        long published;
        long acknowledged;
        long pending;
        long failed;
        long expired;
        long retrying;

        void add(TrackingRecord record) {
            published++;
            switch (record.status()) {
                case ACKNOWLEDGED -> acknowledged++;
                case FAILED -> failed++;
                case EXPIRED -> expired++;
                case PUBLISHED -> {
                    pending++;
                    if (record.retryCount() > 0) {
                        retrying++;
                    }
                }
            }
        }

        long decided() {
            return acknowledged + failed + expired;
        }

        Double ackRate() {
            return decided() == 0 ? null : (double) acknowledged / decided();
        }

        Double failureRate() {
            return decided() == 0 ? null : (double) (failed + expired) / decided();
        }
    }
}
