package com.syncbridge.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.syncbridge.core.exception.OptimisticLockException;
import com.syncbridge.core.model.ActivityInvocation;
import com.syncbridge.core.model.ActivityOutcome;
import com.syncbridge.core.model.WorkflowExecution;
import com.syncbridge.core.model.WorkflowState;
import com.syncbridge.core.repository.WorkflowExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of WorkflowExecutionRepository.
 * The activity history is stored as a jsonb array on the execution row.
 */
public class JdbcWorkflowExecutionRepository implements WorkflowExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowExecutionRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final WorkflowExecutionRowMapper rowMapper;

    public JdbcWorkflowExecutionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new WorkflowExecutionRowMapper();
    }

    @Override
    public boolean save(WorkflowExecution execution) {
        String sql = """
            INSERT INTO workflow_executions (
                workflow_id, workflow_type, tenant_id, request_id, state,
                history, input, result, last_error,
                created_at, updated_at, completed_at, version
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            execution.workflowId(),
            execution.workflowType(),
            execution.tenantId(),
            execution.requestId(),
            execution.state().name(),
            toJson(execution.history()),
            JsonColumns.write(objectMapper, execution.input()),
            JsonColumns.write(objectMapper, execution.result()),
            execution.lastError(),
            toTimestamp(execution.createdAt()),
            toTimestamp(execution.updatedAt()),
            toTimestamp(execution.completedAt()),
            execution.version()
        );

        if (rows == 0) {
            log.debug("Workflow execution for request {} already exists", execution.requestId());
        }
        return rows > 0;
    }

    @Override
    public void update(WorkflowExecution execution) {
        String sql = """
            UPDATE workflow_executions SET
                state = ?,
                history = ?::jsonb,
                result = ?::jsonb,
                last_error = ?,
                updated_at = ?,
                completed_at = ?,
                version = ?
            WHERE workflow_id = ? AND version = ?
            """;

        long expectedVersion = execution.version() - 1;
        int rows = jdbcTemplate.update(sql,
            execution.state().name(),
            toJson(execution.history()),
            JsonColumns.write(objectMapper, execution.result()),
            execution.lastError(),
            toTimestamp(execution.updatedAt()),
            toTimestamp(execution.completedAt()),
            execution.version(),
            execution.workflowId(),
            expectedVersion
        );

        if (rows == 0) {
            throw new OptimisticLockException(
                "WorkflowExecution", execution.workflowId().toString(), expectedVersion);
        }
    }

    @Override
    public Optional<WorkflowExecution> findById(UUID workflowId) {
        String sql = "SELECT * FROM workflow_executions WHERE workflow_id = ?";
        List<WorkflowExecution> results = jdbcTemplate.query(sql, rowMapper, workflowId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<WorkflowExecution> findByRequestId(String requestId) {
        String sql = "SELECT * FROM workflow_executions WHERE request_id = ?";
        List<WorkflowExecution> results = jdbcTemplate.query(sql, rowMapper, requestId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowExecution> findByStateUpdatedBefore(
            WorkflowState state, Instant updatedBefore, WorkflowExecution after, int limit) {
        if (after == null) {
            String sql = """
                SELECT * FROM workflow_executions
                WHERE state = ? AND updated_at < ?
                ORDER BY updated_at, workflow_id
                LIMIT ?
                """;
            return jdbcTemplate.query(sql, rowMapper, state.name(), Timestamp.from(updatedBefore), limit);
        }
        String sql = """
            SELECT * FROM workflow_executions
            WHERE state = ? AND updated_at < ? AND (updated_at, workflow_id) > (?, ?)
            ORDER BY updated_at, workflow_id
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, state.name(), Timestamp.from(updatedBefore),
            Timestamp.from(after.updatedAt()), after.workflowId(), limit);
    }

    @Override
    public List<WorkflowExecution> findByTenant(String tenantId, WorkflowState state, int limit) {
        if (state == null) {
            String sql = """
                SELECT * FROM workflow_executions
                WHERE tenant_id = ?
                ORDER BY created_at DESC
                LIMIT ?
                """;
            return jdbcTemplate.query(sql, rowMapper, tenantId, limit);
        }
        String sql = """
            SELECT * FROM workflow_executions
            WHERE tenant_id = ? AND state = ?
            ORDER BY created_at DESC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, tenantId, state.name(), limit);
    }

    // ========== Helper Methods ==========

    private String toJson(List<ActivityInvocation> history) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ActivityInvocation inv : history) {
            ObjectNode node = array.addObject();
            node.put("activityName", inv.activityName());
            node.put("stepIndex", inv.stepIndex());
            node.put("attempt", inv.attempt());
            node.put("idempotencyKey", inv.idempotencyKey());
            node.put("startedAt", inv.startedAt() != null ? inv.startedAt().toString() : null);
            node.put("completedAt", inv.completedAt() != null ? inv.completedAt().toString() : null);
            node.put("outcome", inv.outcome().name());
            node.set("output", inv.output());
            node.put("errorCode", inv.errorCode());
            node.put("errorDetail", inv.errorDetail());
        }
        return JsonColumns.write(objectMapper, array);
    }

    private List<ActivityInvocation> parseHistory(String json) {
        JsonNode array = JsonColumns.parse(objectMapper, json);
        List<ActivityInvocation> history = new ArrayList<>();
        if (array == null) {
            return history;
        }
        for (JsonNode node : array) {
            JsonNode output = node.get("output");
            history.add(new ActivityInvocation(
                node.get("activityName").asText(),
                node.get("stepIndex").asInt(),
                node.get("attempt").asInt(),
                node.get("idempotencyKey").asText(),
                parseInstant(node.get("startedAt")),
                parseInstant(node.get("completedAt")),
                ActivityOutcome.valueOf(node.get("outcome").asText()),
                output == null || output.isNull() ? null : output,
                textOrNull(node.get("errorCode")),
                textOrNull(node.get("errorDetail"))
            ));
        }
        return history;
    }

    private static Instant parseInstant(JsonNode node) {
        return node == null || node.isNull() ? null : Instant.parse(node.asText());
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private class WorkflowExecutionRowMapper implements RowMapper<WorkflowExecution> {
        @Override
        public WorkflowExecution mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new WorkflowExecution(
                UUID.fromString(rs.getString("workflow_id")),
                rs.getString("workflow_type"),
                rs.getString("tenant_id"),
                rs.getString("request_id"),
                WorkflowState.valueOf(rs.getString("state")),
                parseHistory(rs.getString("history")),
                JsonColumns.parse(objectMapper, rs.getString("input")),
                JsonColumns.parse(objectMapper, rs.getString("result")),
                rs.getString("last_error"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")),
                toInstant(rs.getTimestamp("completed_at")),
                rs.getLong("version")
            );
        }
    }
}
