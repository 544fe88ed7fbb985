package com.syncbridge.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncbridge.core.repository.ActivityTaskQueue;
import com.syncbridge.core.repository.CursorRepository;
import com.syncbridge.core.repository.IdempotencyStore;
import com.syncbridge.core.repository.TrackingRepository;
import com.syncbridge.core.repository.WorkflowExecutionRepository;
import com.syncbridge.core.stream.StreamTransport;
import com.syncbridge.engine.persistence.jdbc.JdbcActivityTaskQueue;
import com.syncbridge.engine.persistence.jdbc.JdbcCursorRepository;
import com.syncbridge.engine.persistence.jdbc.JdbcIdempotencyStore;
import com.syncbridge.engine.persistence.jdbc.JdbcStreamTransport;
import com.syncbridge.engine.persistence.jdbc.JdbcTrackingRepository;
import com.syncbridge.engine.persistence.jdbc.JdbcWorkflowExecutionRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * PostgreSQL-backed stores over the auto-configured DataSource.
 * The schema is applied from db/syncbridge-schema.sql through spring.sql.init.
 */
@Configuration
@ConditionalOnProperty(prefix = "syncbridge", name = "store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcStoreConfiguration {

    @Bean
    public StreamTransport streamTransport(JdbcTemplate jdbcTemplate, Clock clock) {
        return new JdbcStreamTransport(jdbcTemplate, clock);
    }

    @Bean
    public TrackingRepository trackingRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcTrackingRepository(jdbcTemplate);
    }

    @Bean
    public CursorRepository cursorRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcCursorRepository(jdbcTemplate);
    }

    @Bean
    public WorkflowExecutionRepository workflowExecutionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcWorkflowExecutionRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    public ActivityTaskQueue activityTaskQueue(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper,
                                               SyncBridgeProperties properties) {
        return new JdbcActivityTaskQueue(jdbcTemplate, objectMapper,
            properties.getQueue().getCapacity(), properties.getQueue().getDispatchWait());
    }

    @Bean
    public IdempotencyStore idempotencyStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcIdempotencyStore(jdbcTemplate, objectMapper);
    }
}
