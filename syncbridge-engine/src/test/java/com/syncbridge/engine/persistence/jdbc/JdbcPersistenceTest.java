package com.syncbridge.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.syncbridge.core.exception.OptimisticLockException;
import com.syncbridge.core.exception.TransientIOException;
import com.syncbridge.core.model.ActivityInvocation;
import com.syncbridge.core.model.ActivityResult;
import com.syncbridge.core.model.ActivityTask;
import com.syncbridge.core.model.EventEnvelope;
import com.syncbridge.core.model.StreamCursor;
import com.syncbridge.core.model.StreamEntry;
import com.syncbridge.core.model.TaskState;
import com.syncbridge.core.model.TrackingRecord;
import com.syncbridge.core.model.TrackingStatus;
import com.syncbridge.core.model.WorkflowExecution;
import com.syncbridge.core.model.WorkflowState;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JDBC stores against a real PostgreSQL.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class JdbcPersistenceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("syncbridge_test")
        .withUsername("test")
        .withPassword("test")
        .withInitScript("db/syncbridge-schema.sql");

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private JdbcTemplate jdbcTemplate;

    @BeforeAll
    void connect() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @BeforeEach
    void clean() {
        jdbcTemplate.execute("""
            TRUNCATE stream_heads, stream_entries, stream_cursors, event_tracking,
                     workflow_executions, activity_tasks, idempotency_records
            """);
    }

    @Test
    @DisplayName("Stream appends get dense per-stream offsets and read back in order")
    void streamTransport() {
        JdbcStreamTransport transport = new JdbcStreamTransport(jdbcTemplate, Clock.fixed(NOW, ZoneOffset.UTC));

        assertThat(transport.append("crm:sync:credits:credit_allocated", "{\"n\":1}")).isEqualTo(1);
        assertThat(transport.append("crm:sync:credits:credit_allocated", "{\"n\":2}")).isEqualTo(2);
        assertThat(transport.append("crm:sync:role:role_created", "{\"n\":3}")).isEqualTo(1);
        transport.append("crm_x:sync:ack", "{}");

        List<StreamEntry> entries = transport.read("crm:sync:credits:credit_allocated", 0, 10);
        assertThat(entries).extracting(StreamEntry::offset).containsExactly(1L, 2L);
        assertThat(transport.readAt("crm:sync:credits:credit_allocated", 2)).map(StreamEntry::payload).hasValue("{\"n\":2}");
        assertThat(transport.latestOffset("crm:sync:role:role_created")).isEqualTo(1);
        assertThat(transport.streamKeys("crm:sync:"))
            .containsExactly("crm:sync:credits:credit_allocated", "crm:sync:role:role_created");
    }

    @Test
    @DisplayName("Cursor commits never move a cursor backwards")
    void cursorRepository() {
        JdbcCursorRepository cursors = new JdbcCursorRepository(jdbcTemplate);
        StreamCursor initial = StreamCursor.initial("crm:sync:ack", "ack-consumer-crm");

        cursors.commit(initial.advanceTo(5, NOW));
        cursors.commit(initial.advanceTo(3, NOW));

        assertThat(cursors.find("crm:sync:ack", "ack-consumer-crm")).map(StreamCursor::offset).hasValue(5L);
        assertThat(cursors.find("crm:sync:ack", "someone-else")).isEmpty();
    }

    @Test
    @DisplayName("Tracking records insert once and update only from the version they were read at")
    void trackingRepository() {
        JdbcTrackingRepository repository = new JdbcTrackingRepository(jdbcTemplate);
        EventEnvelope envelope = EventEnvelope.create("credit.allocated", "T1", "Organization", "E1",
            objectMapper.createObjectNode(), "billing", NOW);
        TrackingRecord record = TrackingRecord.published(envelope, "crm", "crm:sync:credits:credit_allocated", 1, NOW);

        assertThat(repository.insertIfAbsent(record)).isTrue();
        assertThat(repository.insertIfAbsent(record)).isFalse();

        TrackingRecord acked = record.withAcknowledged(NOW.plusSeconds(2), 1);
        repository.update(acked);
        assertThatThrownBy(() -> repository.update(record.withErrorAck("late", NOW.plusSeconds(3), 2, 3)))
            .isInstanceOf(OptimisticLockException.class);

        TrackingRecord stored = repository.findById(envelope.eventId()).orElseThrow();
        assertThat(stored.status()).isEqualTo(TrackingStatus.ACKNOWLEDGED);
        assertThat(stored.acknowledgedAt()).isEqualTo(NOW.plusSeconds(2));
        assertThat(stored.version()).isEqualTo(2);
        assertThat(stored.lastAckOffset()).isEqualTo(1);
        assertThat(repository.findByTenantPublishedSince("T1", NOW.minusSeconds(1))).hasSize(1);
        assertThat(repository.findUnacknowledged("T1", NOW.plusSeconds(60), 10)).isEmpty();
        assertThat(repository.countByStatus()).containsEntry(TrackingStatus.ACKNOWLEDGED, 1L);

        assertThat(repository.deleteTerminalBefore(NOW.plusSeconds(1))).isEqualTo(1);
        assertThat(repository.findById(envelope.eventId())).isEmpty();
    }

    @Test
    @DisplayName("Workflow executions round-trip their history and reject stale updates")
    void workflowRepository() {
        JdbcWorkflowExecutionRepository repository = new JdbcWorkflowExecutionRepository(jdbcTemplate, objectMapper);
        WorkflowExecution execution = WorkflowExecution.start("credit.allocation", "T1", "req-1",
            objectMapper.createObjectNode().put("orgId", "T1"), NOW);

        assertThat(repository.save(execution)).isTrue();
        assertThat(repository.save(WorkflowExecution.start("credit.allocation", "T1", "req-1", NullNode.getInstance(), NOW)))
            .isFalse();

        ActivityTask task = ActivityTask.create(execution.workflowId(), "T1", "allocate-credits", 0, 1,
            "allocate-credits:T1", NullNode.getInstance(), Duration.ofSeconds(30), NOW, NOW);
        WorkflowExecution recorded = execution.withInvocation(
            ActivityInvocation.of(task, ActivityResult.success(objectMapper.createObjectNode().put("granted", 100)),
                NOW.plusSeconds(1)),
            NOW.plusSeconds(1));
        repository.update(recorded);
        assertThatThrownBy(() -> repository.update(execution.withCancelled("stale", NOW)))
            .isInstanceOf(OptimisticLockException.class);

        WorkflowExecution stored = repository.findByRequestId("req-1").orElseThrow();
        assertThat(stored.workflowId()).isEqualTo(execution.workflowId());
        assertThat(stored.history()).hasSize(1);
        assertThat(stored.history().get(0).output().get("granted").asInt()).isEqualTo(100);
        assertThat(stored.history().get(0).idempotencyKey()).isEqualTo("allocate-credits:T1");
        WorkflowExecution firstPage = repository.findByStateUpdatedBefore(
            WorkflowState.RUNNING, NOW.plusSeconds(60), null, 10).get(0);
        assertThat(firstPage.workflowId()).isEqualTo(execution.workflowId());
        assertThat(repository.findByStateUpdatedBefore(WorkflowState.RUNNING, NOW.plusSeconds(60), firstPage, 10))
            .isEmpty();
        assertThat(repository.findByTenant("T1", null, 10)).hasSize(1);
    }

    @Test
    @DisplayName("The task queue claims each task once, fences stale holders and bounds outstanding work")
    void activityTaskQueue() {
        JdbcActivityTaskQueue queue = new JdbcActivityTaskQueue(jdbcTemplate, objectMapper, 2, Duration.ofMillis(100));
        UUID workflowId = UUID.randomUUID();
        ActivityTask first = ActivityTask.create(workflowId, "T1", "sync-users", 0, 1, "k1",
            objectMapper.createObjectNode().put("n", 1), Duration.ofSeconds(10), NOW, NOW);
        ActivityTask second = ActivityTask.create(workflowId, "T1", "sync-users", 1, 1, "k2",
            objectMapper.createObjectNode().put("n", 2), Duration.ofSeconds(10), NOW.plusSeconds(1), NOW.plusSeconds(60));
        queue.enqueue(first);
        queue.enqueue(second);
        assertThatThrownBy(() -> queue.enqueue(ActivityTask.create(workflowId, "T1", "sync-users", 2, 1, "k3",
                NullNode.getInstance(), Duration.ofSeconds(10), NOW, NOW)))
            .isInstanceOf(TransientIOException.class);

        ActivityTask claimed = queue.claimNext(Set.of("sync-users"), "w1", NOW, Duration.ofSeconds(5)).orElseThrow();
        assertThat(claimed.taskId()).isEqualTo(first.taskId());
        assertThat(claimed.state()).isEqualTo(TaskState.RUNNING);
        assertThat(claimed.fenceToken()).isEqualTo(1);
        assertThat(claimed.leaseExpiresAt()).isEqualTo(NOW.plusSeconds(15));
        assertThat(claimed.input().get("n").asInt()).isEqualTo(1);
        assertThat(queue.claimNext(Set.of("sync-users"), "w2", NOW, Duration.ofSeconds(5))).isEmpty();

        assertThat(queue.findExpiredLeases(NOW.plusSeconds(16), 10)).hasSize(1);
        assertThat(queue.requeue(claimed.taskId(), claimed.fenceToken(), NOW.plusSeconds(16))).isTrue();
        assertThat(queue.complete(claimed.taskId(), claimed.fenceToken())).isFalse();

        ActivityTask reclaimed = queue.claimNext(Set.of("sync-users"), "w2", NOW.plusSeconds(16), Duration.ofSeconds(5))
            .orElseThrow();
        assertThat(reclaimed.taskId()).isEqualTo(first.taskId());
        assertThat(reclaimed.fenceToken()).isEqualTo(3);
        assertThat(queue.renewLease(reclaimed.taskId(), reclaimed.fenceToken(), NOW.plusSeconds(60))).isTrue();
        assertThat(queue.complete(reclaimed.taskId(), reclaimed.fenceToken())).isTrue();

        assertThat(queue.withdrawQueued(workflowId)).isEqualTo(1);
        assertThat(queue.outstandingCount()).isZero();
        assertThat(queue.findOutstanding(workflowId)).isEmpty();

        assertThat(queue.deleteDoneBefore(NOW.plusMillis(500))).isEqualTo(1);
        assertThat(queue.findById(first.taskId())).isEmpty();
        assertThat(queue.findById(second.taskId())).isPresent();
    }

    @Test
    @DisplayName("Idempotency records keep the first output")
    void idempotencyStore() {
        JdbcIdempotencyStore store = new JdbcIdempotencyStore(jdbcTemplate, objectMapper);

        assertThat(store.record("allocate-credits:T1", objectMapper.createObjectNode().put("granted", 100))).isTrue();
        assertThat(store.record("allocate-credits:T1", objectMapper.createObjectNode().put("granted", 999))).isFalse();
        assertThat(store.record("notify:T1", null)).isTrue();

        assertThat(store.find("allocate-credits:T1")).hasValueSatisfying(
            node -> assertThat(node.get("granted").asInt()).isEqualTo(100));
        assertThat(store.find("notify:T1")).hasValueSatisfying(node -> assertThat(node.isNull()).isTrue());
        assertThat(store.find("missing")).isEmpty();
    }
}
