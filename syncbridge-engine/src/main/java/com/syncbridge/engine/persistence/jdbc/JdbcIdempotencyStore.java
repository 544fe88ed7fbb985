package com.syncbridge.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.syncbridge.core.repository.IdempotencyStore;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of IdempotencyStore.
 */
public class JdbcIdempotencyStore implements IdempotencyStore {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcIdempotencyStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<JsonNode> find(String idempotencyKey) {
        String sql = "SELECT output FROM idempotency_records WHERE idempotency_key = ?";
        List<String> results = jdbcTemplate.queryForList(sql, String.class, idempotencyKey);
        if (results.isEmpty()) {
            return Optional.empty();
        }
        JsonNode output = JsonColumns.parse(objectMapper, results.get(0));
        return Optional.of(output != null ? output : NullNode.getInstance());
    }

    @Override
    public boolean record(String idempotencyKey, JsonNode output) {
        String sql = """
            INSERT INTO idempotency_records (idempotency_key, output)
            VALUES (?, ?::jsonb)
            ON CONFLICT (idempotency_key) DO NOTHING
            """;
        return jdbcTemplate.update(sql, idempotencyKey, JsonColumns.write(objectMapper, output)) > 0;
    }
}
