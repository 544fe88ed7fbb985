package com.syncbridge.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncbridge.core.exception.TransientIOException;
import com.syncbridge.core.model.ActivityTask;
import com.syncbridge.core.model.TaskState;
import com.syncbridge.core.repository.ActivityTaskQueue;
import com.syncbridge.engine.support.TransientFailures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of ActivityTaskQueue.
 *
 * Claims use FOR UPDATE SKIP LOCKED so concurrent workers never receive the same task.
 * Every claim and requeue bumps the fence token; lease operations match on it.
 * Capacity is checked before insert, so concurrent dispatchers may overshoot it slightly.
 */
public class JdbcActivityTaskQueue implements ActivityTaskQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcActivityTaskQueue.class);
    private static final long CAPACITY_POLL_MS = 50;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final int capacity;
    private final Duration dispatchWait;
    private final ActivityTaskRowMapper rowMapper = new ActivityTaskRowMapper();

    public JdbcActivityTaskQueue(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper,
                                 int capacity, Duration dispatchWait) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.capacity = capacity;
        this.dispatchWait = dispatchWait;
    }

    @Override
    public void enqueue(ActivityTask task) {
        long deadline = System.nanoTime() + dispatchWait.toNanos();
        int outstanding;
        while ((outstanding = outstandingCount()) >= capacity) {
            if (System.nanoTime() >= deadline) {
                throw new TransientIOException("activity task queue",
                    String.format("full with %d outstanding tasks after waiting %s", outstanding, dispatchWait));
            }
            if (!TransientFailures.pause(CAPACITY_POLL_MS)) {
                throw new TransientIOException("activity task queue", "interrupted while waiting for capacity");
            }
        }

        String sql = """
            INSERT INTO activity_tasks (
                task_id, workflow_id, tenant_id, activity_name, step_index, attempt,
                idempotency_key, input, state, enqueued_at, available_at,
                fence_token, timeout_ms
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            task.taskId(),
            task.workflowId(),
            task.tenantId(),
            task.activityName(),
            task.stepIndex(),
            task.attempt(),
            task.idempotencyKey(),
            JsonColumns.write(objectMapper, task.input()),
            task.state().name(),
            toTimestamp(task.enqueuedAt()),
            toTimestamp(task.availableAt()),
            task.fenceToken(),
            task.timeout().toMillis()
        );
        log.debug("Enqueued task {} ({} attempt {})", task.taskId(), task.activityName(), task.attempt());
    }

    @Override
    public Optional<ActivityTask> claimNext(
            Collection<String> activityNames, String workerId, Instant now, Duration leaseGrace) {
        if (activityNames.isEmpty()) {
            return Optional.empty();
        }
        String placeholders = String.join(", ", Collections.nCopies(activityNames.size(), "?"));
        String sql = """
            UPDATE activity_tasks SET
                state = 'RUNNING',
                started_at = ?,
                lease_holder = ?,
                lease_expires_at = CAST(? AS TIMESTAMPTZ) + make_interval(secs => (timeout_ms + CAST(? AS BIGINT)) / 1000.0),
                fence_token = fence_token + 1
            WHERE task_id = (
                SELECT task_id FROM activity_tasks
                WHERE state = 'QUEUED' AND available_at <= ? AND activity_name IN (%s)
                ORDER BY available_at, enqueued_at
                LIMIT 1
                FOR UPDATE SKIP LOCKED
            )
            RETURNING *
            """.formatted(placeholders);

        Timestamp claimedAt = Timestamp.from(now);
        List<Object> args = new ArrayList<>();
        args.add(claimedAt);
        args.add(workerId);
        args.add(claimedAt);
        args.add(leaseGrace.toMillis());
        args.add(claimedAt);
        args.addAll(activityNames);

        List<ActivityTask> claimed = jdbcTemplate.query(sql, rowMapper, args.toArray());
        return claimed.isEmpty() ? Optional.empty() : Optional.of(claimed.get(0));
    }

    @Override
    public boolean renewLease(UUID taskId, long fenceToken, Instant newExpiresAt) {
        String sql = """
            UPDATE activity_tasks SET lease_expires_at = ?
            WHERE task_id = ? AND fence_token = ? AND state = 'RUNNING'
            """;
        return jdbcTemplate.update(sql, Timestamp.from(newExpiresAt), taskId, fenceToken) > 0;
    }

    @Override
    public boolean complete(UUID taskId, long fenceToken) {
        String sql = """
            UPDATE activity_tasks SET
                state = 'DONE',
                lease_holder = NULL,
                lease_expires_at = NULL
            WHERE task_id = ? AND fence_token = ? AND state = 'RUNNING'
            """;
        return jdbcTemplate.update(sql, taskId, fenceToken) > 0;
    }

    @Override
    public boolean requeue(UUID taskId, long fenceToken, Instant availableAt) {
        String sql = """
            UPDATE activity_tasks SET
                state = 'QUEUED',
                available_at = ?,
                started_at = NULL,
                lease_holder = NULL,
                lease_expires_at = NULL,
                fence_token = fence_token + 1
            WHERE task_id = ? AND fence_token = ? AND state = 'RUNNING'
            """;
        return jdbcTemplate.update(sql, Timestamp.from(availableAt), taskId, fenceToken) > 0;
    }

    @Override
    public int withdrawQueued(UUID workflowId) {
        String sql = "UPDATE activity_tasks SET state = 'DONE' WHERE workflow_id = ? AND state = 'QUEUED'";
        return jdbcTemplate.update(sql, workflowId);
    }

    @Override
    public Optional<ActivityTask> findById(UUID taskId) {
        String sql = "SELECT * FROM activity_tasks WHERE task_id = ?";
        List<ActivityTask> results = jdbcTemplate.query(sql, rowMapper, taskId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<ActivityTask> findOutstanding(UUID workflowId) {
        String sql = """
            SELECT * FROM activity_tasks
            WHERE workflow_id = ? AND state <> 'DONE'
            ORDER BY enqueued_at
            """;
        return jdbcTemplate.query(sql, rowMapper, workflowId);
    }

    @Override
    public List<ActivityTask> findExpiredLeases(Instant now, int limit) {
        String sql = """
            SELECT * FROM activity_tasks
            WHERE state = 'RUNNING' AND lease_expires_at < ?
            ORDER BY lease_expires_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, Timestamp.from(now), limit);
    }

    @Override
    public int deleteDoneBefore(Instant enqueuedBefore) {
        String sql = "DELETE FROM activity_tasks WHERE state = 'DONE' AND enqueued_at < ?";
        return jdbcTemplate.update(sql, Timestamp.from(enqueuedBefore));
    }

    @Override
    public int outstandingCount() {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM activity_tasks WHERE state <> 'DONE'", Integer.class);
        return count != null ? count : 0;
    }

    @Override
    public int capacity() {
        return capacity;
    }

    // ========== Helper Methods ==========

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private class ActivityTaskRowMapper implements RowMapper<ActivityTask> {
        @Override
        public ActivityTask mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ActivityTask(
                UUID.fromString(rs.getString("task_id")),
                UUID.fromString(rs.getString("workflow_id")),
                rs.getString("tenant_id"),
                rs.getString("activity_name"),
                rs.getInt("step_index"),
                rs.getInt("attempt"),
                rs.getString("idempotency_key"),
                JsonColumns.parse(objectMapper, rs.getString("input")),
                TaskState.valueOf(rs.getString("state")),
                toInstant(rs.getTimestamp("enqueued_at")),
                toInstant(rs.getTimestamp("available_at")),
                toInstant(rs.getTimestamp("started_at")),
                rs.getString("lease_holder"),
                toInstant(rs.getTimestamp("lease_expires_at")),
                rs.getLong("fence_token"),
                Duration.ofMillis(rs.getLong("timeout_ms"))
            );
        }
    }
}
