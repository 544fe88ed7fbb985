package com.syncbridge.api.config;

import com.syncbridge.engine.consumer.AcknowledgmentConsumer;
import com.syncbridge.recovery.RecoveryEngine;
import com.syncbridge.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts the background components once the application is ready and stops them on shutdown.
 *
 * Startup order: acknowledgment consumers, recovery (which resumes running workflows), workers.
 * Shutdown runs in reverse so in-flight activities can still report while the stores are up.
 */
@Component
public class SyncBridgeLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SyncBridgeLifecycle.class);

    private final List<AcknowledgmentConsumer> consumers;
    private final RecoveryEngine recoveryEngine;
    private final WorkerPool workerPool;
    private final SyncBridgeProperties properties;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public SyncBridgeLifecycle(
            @Qualifier("acknowledgmentConsumers") List<AcknowledgmentConsumer> consumers,
            RecoveryEngine recoveryEngine,
            WorkerPool workerPool,
            SyncBridgeProperties properties) {
        this.consumers = consumers;
        this.recoveryEngine = recoveryEngine;
        this.workerPool = workerPool;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        consumers.forEach(AcknowledgmentConsumer::start);
        if (properties.getRecovery().isEnabled()) {
            recoveryEngine.start();
        }
        if (properties.getWorker().isEnabled()) {
            workerPool.start();
        }
        log.info("SyncBridge started: {} ack consumers, store {}", consumers.size(), properties.getStore());
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Initiating graceful shutdown");
        workerPool.stop();
        recoveryEngine.stop();
        consumers.forEach(AcknowledgmentConsumer::stop);
        log.info("Graceful shutdown complete");
    }
}
