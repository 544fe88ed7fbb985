package com.syncbridge.engine.persistence.jdbc;

import com.syncbridge.core.model.StreamEntry;
import com.syncbridge.core.stream.StreamTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of StreamTransport.
 *
 * Each stream key owns a head row holding its last offset. Appends bump the head
 * and insert the entry in one statement, so offsets are dense and strictly increasing
 * per key even with concurrent publishers.
 */
public class JdbcStreamTransport implements StreamTransport {

    private static final Logger log = LoggerFactory.getLogger(JdbcStreamTransport.class);

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final StreamEntryRowMapper rowMapper = new StreamEntryRowMapper();

    public JdbcStreamTransport(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public long append(String streamKey, String payload) {
        String sql = """
            WITH head AS (
                INSERT INTO stream_heads (stream_key, last_offset) VALUES (?, 1)
                ON CONFLICT (stream_key) DO UPDATE SET last_offset = stream_heads.last_offset + 1
                RETURNING last_offset
            )
            INSERT INTO stream_entries (stream_key, entry_offset, payload, appended_at)
            SELECT ?, head.last_offset, ?, ? FROM head
            RETURNING entry_offset
            """;

        Long offset = jdbcTemplate.queryForObject(sql, Long.class,
            streamKey,
            streamKey,
            payload,
            Timestamp.from(clock.instant())
        );
        log.debug("Appended entry {} to stream {}", offset, streamKey);
        return offset != null ? offset : 0L;
    }

    @Override
    public List<StreamEntry> read(String streamKey, long afterOffset, int maxEntries) {
        String sql = """
            SELECT * FROM stream_entries
            WHERE stream_key = ? AND entry_offset > ?
            ORDER BY entry_offset
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, streamKey, afterOffset, maxEntries);
    }

    @Override
    public Optional<StreamEntry> readAt(String streamKey, long offset) {
        String sql = "SELECT * FROM stream_entries WHERE stream_key = ? AND entry_offset = ?";
        List<StreamEntry> results = jdbcTemplate.query(sql, rowMapper, streamKey, offset);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public long latestOffset(String streamKey) {
        String sql = "SELECT last_offset FROM stream_heads WHERE stream_key = ?";
        List<Long> results = jdbcTemplate.queryForList(sql, Long.class, streamKey);
        return results.isEmpty() ? 0L : results.get(0);
    }

    @Override
    public List<String> streamKeys(String prefix) {
        String sql = "SELECT stream_key FROM stream_heads WHERE stream_key LIKE ? ORDER BY stream_key";
        return jdbcTemplate.queryForList(sql, String.class, escapeLike(prefix) + "%");
    }

    private String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static class StreamEntryRowMapper implements RowMapper<StreamEntry> {
        @Override
        public StreamEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new StreamEntry(
                rs.getString("stream_key"),
                rs.getLong("entry_offset"),
                rs.getString("payload"),
                rs.getTimestamp("appended_at").toInstant()
            );
        }
    }
}
