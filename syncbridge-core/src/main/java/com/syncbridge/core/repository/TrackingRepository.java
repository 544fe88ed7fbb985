package com.syncbridge.core.repository;

import com.syncbridge.core.exception.OptimisticLockException;
import com.syncbridge.core.model.TrackingRecord;
import com.syncbridge.core.model.TrackingStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for tracking records, keyed by eventId.
 */
public interface TrackingRepository {

    /**
     * Insert a record unless one already exists for its eventId.
     *
     * @param record The tracking record
     * @return true if inserted, false if a record for the eventId was already present
     */
    boolean insertIfAbsent(TrackingRecord record);

    /**
     * Replace a record, provided nobody else changed it since it was read.
     * The stored version must equal {@code record.version() - 1}.
     *
     * @throws OptimisticLockException if the stored version differs
     */
    void update(TrackingRecord record);

    Optional<TrackingRecord> findById(String eventId);

    /**
     * Records of a tenant published at or after the given instant.
     */
    List<TrackingRecord> findByTenantPublishedSince(String tenantId, Instant since);

    /**
     * PUBLISHED records of a tenant published before the given instant, oldest first.
     */
    List<TrackingRecord> findUnacknowledged(String tenantId, Instant publishedBefore, int limit);

    /**
     * PUBLISHED records of any tenant published before the given instant, oldest first.
     */
    List<TrackingRecord> findPublishedBefore(Instant publishedBefore, int limit);

    /**
     * Delete terminal records published before the given instant.
     *
     * @return Number of deleted records
     */
    int deleteTerminalBefore(Instant publishedBefore);

    Map<TrackingStatus, Long> countByStatus();
}
