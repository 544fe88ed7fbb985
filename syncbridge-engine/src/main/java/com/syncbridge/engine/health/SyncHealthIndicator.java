package com.syncbridge.engine.health;

import com.syncbridge.core.model.TrackingStatus;
import com.syncbridge.core.repository.ActivityTaskQueue;
import com.syncbridge.core.repository.TrackingRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.HashMap;
import java.util.Map;

/**
 * Actuator health for the sync core.
 * Reports:
 * - tracking record counts by status
 * - activity queue saturation; a full queue is reported as OUT_OF_SERVICE
 */
public class SyncHealthIndicator implements HealthIndicator {

    private final TrackingRepository trackingRepository;
    private final ActivityTaskQueue taskQueue;

    public SyncHealthIndicator(TrackingRepository trackingRepository, ActivityTaskQueue taskQueue) {
        this.trackingRepository = trackingRepository;
        this.taskQueue = taskQueue;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        try {
            Map<TrackingStatus, Long> counts = trackingRepository.countByStatus();
            counts.forEach((status, count) -> details.put("events." + status.name().toLowerCase(), count));

            int outstanding = taskQueue.outstandingCount();
            int capacity = taskQueue.capacity();
            details.put("activityQueue.outstanding", outstanding);
            details.put("activityQueue.capacity", capacity);

            if (outstanding >= capacity) {
                return Health.outOfService()
                    .withDetail("reason", "activity queue at capacity")
                    .withDetails(details)
                    .build();
            }
            return Health.up()
                .withDetails(details)
                .build();
        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
