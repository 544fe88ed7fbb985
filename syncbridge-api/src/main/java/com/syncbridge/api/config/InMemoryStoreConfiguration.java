package com.syncbridge.api.config;

import com.syncbridge.core.repository.ActivityTaskQueue;
import com.syncbridge.core.repository.CursorRepository;
import com.syncbridge.core.repository.IdempotencyStore;
import com.syncbridge.core.repository.TrackingRepository;
import com.syncbridge.core.repository.WorkflowExecutionRepository;
import com.syncbridge.core.stream.StreamTransport;
import com.syncbridge.engine.persistence.InMemoryActivityTaskQueue;
import com.syncbridge.engine.persistence.InMemoryCursorRepository;
import com.syncbridge.engine.persistence.InMemoryIdempotencyStore;
import com.syncbridge.engine.persistence.InMemoryTrackingRepository;
import com.syncbridge.engine.persistence.InMemoryWorkflowExecutionRepository;
import com.syncbridge.engine.stream.InMemoryStreamTransport;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Process-local stores. State is lost on restart; meant for development and demos.
 */
@Configuration
@ConditionalOnProperty(prefix = "syncbridge", name = "store", havingValue = "memory")
public class InMemoryStoreConfiguration {

    @Bean
    public StreamTransport streamTransport(Clock clock) {
        return new InMemoryStreamTransport(clock);
    }

    @Bean
    public TrackingRepository trackingRepository() {
        return new InMemoryTrackingRepository();
    }

    @Bean
    public CursorRepository cursorRepository() {
        return new InMemoryCursorRepository();
    }

    @Bean
    public WorkflowExecutionRepository workflowExecutionRepository() {
        return new InMemoryWorkflowExecutionRepository();
    }

    @Bean
    public ActivityTaskQueue activityTaskQueue(SyncBridgeProperties properties) {
        return new InMemoryActivityTaskQueue(
            properties.getQueue().getCapacity(), properties.getQueue().getDispatchWait());
    }

    @Bean
    public IdempotencyStore idempotencyStore() {
        return new InMemoryIdempotencyStore();
    }
}
