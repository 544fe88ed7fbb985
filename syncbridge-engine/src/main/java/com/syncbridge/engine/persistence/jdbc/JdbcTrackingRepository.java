package com.syncbridge.engine.persistence.jdbc;

import com.syncbridge.core.exception.OptimisticLockException;
import com.syncbridge.core.model.TrackingRecord;
import com.syncbridge.core.model.TrackingStatus;
import com.syncbridge.core.repository.TrackingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of TrackingRepository.
 * Updates compare-and-swap on the version column.
 */
public class JdbcTrackingRepository implements TrackingRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTrackingRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final TrackingRecordRowMapper rowMapper = new TrackingRecordRowMapper();

    public JdbcTrackingRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean insertIfAbsent(TrackingRecord record) {
        String sql = """
            INSERT INTO event_tracking (
                event_id, tenant_id, event_type, entity_id,
                target_application, stream_key, stream_offset,
                status, published_at, acknowledged_at, retry_count, last_error, last_ack_at,
                last_ack_offset, published_by, version
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (event_id) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            record.eventId(),
            record.tenantId(),
            record.eventType(),
            record.entityId(),
            record.targetApplication(),
            record.streamKey(),
            record.streamOffset(),
            record.status().name(),
            toTimestamp(record.publishedAt()),
            toTimestamp(record.acknowledgedAt()),
            record.retryCount(),
            record.lastError(),
            toTimestamp(record.lastAckAt()),
            record.lastAckOffset(),
            record.publishedBy(),
            record.version()
        );

        if (rows == 0) {
            log.debug("Tracking record {} already exists", record.eventId());
        }
        return rows > 0;
    }

    @Override
    public void update(TrackingRecord record) {
        String sql = """
            UPDATE event_tracking SET
                status = ?,
                acknowledged_at = ?,
                retry_count = ?,
                last_error = ?,
                last_ack_at = ?,
                last_ack_offset = ?,
                version = ?
            WHERE event_id = ? AND version = ?
            """;

        long expectedVersion = record.version() - 1;
        int rows = jdbcTemplate.update(sql,
            record.status().name(),
            toTimestamp(record.acknowledgedAt()),
            record.retryCount(),
            record.lastError(),
            toTimestamp(record.lastAckAt()),
            record.lastAckOffset(),
            record.version(),
            record.eventId(),
            expectedVersion
        );

        if (rows == 0) {
            throw new OptimisticLockException("TrackingRecord", record.eventId(), expectedVersion);
        }
    }

    @Override
    public Optional<TrackingRecord> findById(String eventId) {
        String sql = "SELECT * FROM event_tracking WHERE event_id = ?";
        List<TrackingRecord> results = jdbcTemplate.query(sql, rowMapper, eventId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<TrackingRecord> findByTenantPublishedSince(String tenantId, Instant since) {
        String sql = """
            SELECT * FROM event_tracking
            WHERE tenant_id = ? AND published_at >= ?
            ORDER BY published_at
            """;
        return jdbcTemplate.query(sql, rowMapper, tenantId, Timestamp.from(since));
    }

    @Override
    public List<TrackingRecord> findUnacknowledged(String tenantId, Instant publishedBefore, int limit) {
        String sql = """
            SELECT * FROM event_tracking
            WHERE tenant_id = ? AND status = 'PUBLISHED' AND published_at < ?
            ORDER BY published_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, tenantId, Timestamp.from(publishedBefore), limit);
    }

    @Override
    public List<TrackingRecord> findPublishedBefore(Instant publishedBefore, int limit) {
        String sql = """
            SELECT * FROM event_tracking
            WHERE status = 'PUBLISHED' AND published_at < ?
            ORDER BY published_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, Timestamp.from(publishedBefore), limit);
    }

    @Override
    public int deleteTerminalBefore(Instant publishedBefore) {
        String sql = """
            DELETE FROM event_tracking
            WHERE status IN ('ACKNOWLEDGED', 'FAILED', 'EXPIRED') AND published_at < ?
            """;
        return jdbcTemplate.update(sql, Timestamp.from(publishedBefore));
    }

    @Override
    public Map<TrackingStatus, Long> countByStatus() {
        Map<TrackingStatus, Long> counts = new EnumMap<>(TrackingStatus.class);
        for (TrackingStatus status : TrackingStatus.values()) {
            counts.put(status, 0L);
        }
        jdbcTemplate.query("SELECT status, COUNT(*) AS total FROM event_tracking GROUP BY status",
            (RowCallbackHandler) rs -> counts.put(TrackingStatus.valueOf(rs.getString("status")), rs.getLong("total")));
        return counts;
    }

    // ========== Helper Methods ==========

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static class TrackingRecordRowMapper implements RowMapper<TrackingRecord> {
        @Override
        public TrackingRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new TrackingRecord(
                rs.getString("event_id"),
                rs.getString("tenant_id"),
                rs.getString("event_type"),
                rs.getString("entity_id"),
                rs.getString("target_application"),
                rs.getString("stream_key"),
                rs.getLong("stream_offset"),
                TrackingStatus.valueOf(rs.getString("status")),
                toInstant(rs.getTimestamp("published_at")),
                toInstant(rs.getTimestamp("acknowledged_at")),
                rs.getInt("retry_count"),
                rs.getString("last_error"),
                toInstant(rs.getTimestamp("last_ack_at")),
                rs.getLong("last_ack_offset"),
                rs.getString("published_by"),
                rs.getLong("version")
            );
        }
    }
}
