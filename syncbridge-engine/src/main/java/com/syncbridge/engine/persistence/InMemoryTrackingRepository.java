package com.syncbridge.engine.persistence;

import com.syncbridge.core.exception.OptimisticLockException;
import com.syncbridge.core.model.TrackingRecord;
import com.syncbridge.core.model.TrackingStatus;
import com.syncbridge.core.repository.TrackingRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of TrackingRepository.
 * For single-process deployments and testing.
 */
public class InMemoryTrackingRepository implements TrackingRepository {

    private final Map<String, TrackingRecord> records = new ConcurrentHashMap<>();

    @Override
    public boolean insertIfAbsent(TrackingRecord record) {
        return records.putIfAbsent(record.eventId(), record) == null;
    }

    @Override
    public synchronized void update(TrackingRecord record) {
        TrackingRecord existing = records.get(record.eventId());
        long expected = record.version() - 1;
        if (existing == null || existing.version() != expected) {
            throw new OptimisticLockException("TrackingRecord", record.eventId(), expected);
        }
        records.put(record.eventId(), record);
    }

    @Override
    public Optional<TrackingRecord> findById(String eventId) {
        return Optional.ofNullable(records.get(eventId));
    }

    @Override
    public List<TrackingRecord> findByTenantPublishedSince(String tenantId, Instant since) {
        return records.values().stream()
            .filter(r -> r.tenantId().equals(tenantId))
            .filter(r -> !r.publishedAt().isBefore(since))
            .sorted(Comparator.comparing(TrackingRecord::publishedAt))
            .toList();
    }

    @Override
    public List<TrackingRecord> findUnacknowledged(String tenantId, Instant publishedBefore, int limit) {
        return records.values().stream()
            .filter(r -> r.tenantId().equals(tenantId))
            .filter(r -> r.status() == TrackingStatus.PUBLISHED)
            .filter(r -> r.publishedAt().isBefore(publishedBefore))
            .sorted(Comparator.comparing(TrackingRecord::publishedAt))
            .limit(limit)
            .toList();
    }

    @Override
    public List<TrackingRecord> findPublishedBefore(Instant publishedBefore, int limit) {
        return records.values().stream()
            .filter(r -> r.status() == TrackingStatus.PUBLISHED)
            .filter(r -> r.publishedAt().isBefore(publishedBefore))
            .sorted(Comparator.comparing(TrackingRecord::publishedAt))
            .limit(limit)
            .toList();
    }

    @Override
    public synchronized int deleteTerminalBefore(Instant publishedBefore) {
        List<String> doomed = records.values().stream()
            .filter(r -> r.status().isTerminal())
            .filter(r -> r.publishedAt().isBefore(publishedBefore))
            .map(TrackingRecord::eventId)
            .toList();
        doomed.forEach(records::remove);
        return doomed.size();
    }

    @Override
    public Map<TrackingStatus, Long> countByStatus() {
        Map<TrackingStatus, Long> counts = new EnumMap<>(TrackingStatus.class);
        for (TrackingStatus status : TrackingStatus.values()) {
            counts.put(status, 0L);
        }
        records.values().forEach(r -> counts.merge(r.status(), 1L, Long::sum));
        return counts;
    }
}
