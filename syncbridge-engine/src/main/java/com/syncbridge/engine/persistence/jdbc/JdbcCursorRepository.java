package com.syncbridge.engine.persistence.jdbc;

import com.syncbridge.core.model.StreamCursor;
import com.syncbridge.core.repository.CursorRepository;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of CursorRepository.
 */
public class JdbcCursorRepository implements CursorRepository {

    private final JdbcTemplate jdbcTemplate;

    public JdbcCursorRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<StreamCursor> find(String streamKey, String consumerName) {
        String sql = "SELECT * FROM stream_cursors WHERE stream_key = ? AND consumer_name = ?";
        List<StreamCursor> results = jdbcTemplate.query(sql, (rs, rowNum) -> {
            Timestamp updatedAt = rs.getTimestamp("updated_at");
            return new StreamCursor(
                rs.getString("stream_key"),
                rs.getString("consumer_name"),
                rs.getLong("cursor_offset"),
                updatedAt != null ? updatedAt.toInstant() : null
            );
        }, streamKey, consumerName);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public void commit(StreamCursor cursor) {
        String sql = """
            INSERT INTO stream_cursors (stream_key, consumer_name, cursor_offset, updated_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (stream_key, consumer_name) DO UPDATE SET
                cursor_offset = EXCLUDED.cursor_offset,
                updated_at = EXCLUDED.updated_at
            WHERE stream_cursors.cursor_offset <= EXCLUDED.cursor_offset
            """;
        jdbcTemplate.update(sql,
            cursor.streamKey(),
            cursor.consumerName(),
            cursor.offset(),
            cursor.updatedAt() != null ? Timestamp.from(cursor.updatedAt()) : null
        );
    }
}
