package com.syncbridge.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncbridge.core.payload.PayloadRegistry;
import com.syncbridge.core.repository.ActivityTaskQueue;
import com.syncbridge.core.repository.CursorRepository;
import com.syncbridge.core.repository.IdempotencyStore;
import com.syncbridge.core.repository.TrackingRepository;
import com.syncbridge.core.repository.WorkflowExecutionRepository;
import com.syncbridge.core.stream.StreamTransport;
import com.syncbridge.engine.codec.SyncMessageCodec;
import com.syncbridge.engine.consumer.AcknowledgmentConsumer;
import com.syncbridge.engine.coordinator.ActivityCoordinator;
import com.syncbridge.engine.coordinator.WorkflowCoordinator;
import com.syncbridge.engine.coordinator.WorkflowDefinitionRegistry;
import com.syncbridge.engine.health.SyncHealthIndicator;
import com.syncbridge.engine.metrics.MetricsConfiguration;
import com.syncbridge.engine.metrics.SyncMetrics;
import com.syncbridge.engine.publisher.EventPublisher;
import com.syncbridge.engine.stream.StreamKeyResolver;
import com.syncbridge.engine.tracking.SyncHealthAggregator;
import com.syncbridge.engine.tracking.TrackingService;
import com.syncbridge.recovery.RecoveryEngine;
import com.syncbridge.recovery.TrackingReconciler;
import com.syncbridge.workflows.TenantSyncActivities;
import com.syncbridge.workflows.TenantSyncWorkflows;
import com.syncbridge.worker.WorkerPool;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Wires the sync core over whichever store configuration is active.
 * Background components are started and stopped by {@link SyncBridgeLifecycle}.
 */
@Configuration
@EnableConfigurationProperties(SyncBridgeProperties.class)
@Import({MetricsConfiguration.class, InMemoryStoreConfiguration.class, JdbcStoreConfiguration.class})
public class SyncBridgeConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SyncMessageCodec syncMessageCodec(ObjectMapper objectMapper) {
        return new SyncMessageCodec(objectMapper);
    }

    @Bean
    public StreamKeyResolver streamKeyResolver() {
        return new StreamKeyResolver();
    }

    @Bean
    public PayloadRegistry payloadRegistry(ObjectMapper objectMapper) {
        return PayloadRegistry.withDefaults(objectMapper);
    }

    // ========== Event Tracking ==========

    @Bean
    public TrackingService trackingService(TrackingRepository trackingRepository, SyncBridgeProperties properties,
                                           SyncMetrics metrics, Clock clock) {
        return new TrackingService(trackingRepository, properties.getAckRetryBudget(), metrics, clock);
    }

    @Bean
    public SyncHealthAggregator syncHealthAggregator(TrackingRepository trackingRepository,
                                                     SyncBridgeProperties properties, Clock clock) {
        return new SyncHealthAggregator(trackingRepository, properties.getHealthWindow(), clock);
    }

    @Bean
    public EventPublisher eventPublisher(
            StreamTransport transport,
            TrackingRepository trackingRepository,
            SyncMessageCodec codec,
            StreamKeyResolver keyResolver,
            PayloadRegistry payloadRegistry,
            SyncBridgeProperties properties,
            SyncMetrics metrics,
            Clock clock) {
        return new EventPublisher(transport, trackingRepository, codec, keyResolver, payloadRegistry,
            properties.getPublisher().toRetryPolicy(), properties.getDefaultConsumerApplication(), metrics, clock);
    }

    @Bean
    public List<AcknowledgmentConsumer> acknowledgmentConsumers(
            SyncBridgeProperties properties,
            StreamKeyResolver keyResolver,
            StreamTransport transport,
            CursorRepository cursorRepository,
            SyncMessageCodec codec,
            TrackingService trackingService,
            SyncMetrics metrics,
            Clock clock) {
        return properties.getConsumerApplications().stream()
            .map(application -> new AcknowledgmentConsumer(application, keyResolver, transport, cursorRepository,
                codec, trackingService, properties.getConsumer().toSettings(), metrics, clock))
            .toList();
    }

    @Bean
    public SyncHealthIndicator syncHealthIndicator(TrackingRepository trackingRepository, ActivityTaskQueue taskQueue) {
        return new SyncHealthIndicator(trackingRepository, taskQueue);
    }

    // ========== Workflow Orchestration ==========

    @Bean
    public WorkflowDefinitionRegistry workflowDefinitionRegistry() {
        WorkflowDefinitionRegistry registry = new WorkflowDefinitionRegistry();
        TenantSyncWorkflows.registerAll(registry);
        return registry;
    }

    @Bean
    public WorkflowCoordinator workflowCoordinator(
            WorkflowDefinitionRegistry definitions,
            WorkflowExecutionRepository executionRepository,
            ActivityTaskQueue taskQueue,
            ObjectMapper objectMapper,
            SyncMetrics metrics,
            Clock clock) {
        return new WorkflowCoordinator(definitions, executionRepository, taskQueue, objectMapper, metrics, clock);
    }

    @Bean
    public ActivityCoordinator activityCoordinator(ActivityTaskQueue taskQueue, WorkflowCoordinator workflowCoordinator,
                                                   SyncBridgeProperties properties, SyncMetrics metrics, Clock clock) {
        return new ActivityCoordinator(taskQueue, workflowCoordinator, properties.getQueue().getLeaseGrace(), metrics, clock);
    }

    @Bean
    public WorkerPool workerPool(ActivityCoordinator activityCoordinator, EventPublisher publisher,
                                 IdempotencyStore idempotencyStore, SyncBridgeProperties properties,
                                 ObjectMapper objectMapper, SyncMetrics metrics) {
        String workerId = properties.getWorker().getWorkerId() != null
            ? properties.getWorker().getWorkerId()
            : "worker-" + UUID.randomUUID().toString().substring(0, 8);
        WorkerPool pool = new WorkerPool(workerId, activityCoordinator, properties.getWorker().toSettings(),
            objectMapper, metrics);
        new TenantSyncActivities(publisher, idempotencyStore).registerWith(pool);
        return pool;
    }

    // ========== Recovery ==========

    @Bean
    public TrackingReconciler trackingReconciler(
            StreamTransport transport,
            CursorRepository cursorRepository,
            TrackingRepository trackingRepository,
            SyncMessageCodec codec,
            PayloadRegistry payloadRegistry,
            StreamKeyResolver keyResolver,
            Clock clock) {
        return new TrackingReconciler(
            transport, cursorRepository, trackingRepository, codec, payloadRegistry, keyResolver, clock);
    }

    @Bean
    public RecoveryEngine recoveryEngine(
            ActivityCoordinator activityCoordinator,
            WorkflowCoordinator workflowCoordinator,
            WorkflowExecutionRepository executionRepository,
            TrackingService trackingService,
            TrackingReconciler reconciler,
            SyncBridgeProperties properties,
            Clock clock) {
        return new RecoveryEngine(activityCoordinator, workflowCoordinator, executionRepository, trackingService,
            reconciler, properties.getRecovery().toSettings(properties.getConsumerApplications()), clock);
    }
}
