package com.syncbridge.api.config;

import com.syncbridge.core.model.RetryPolicy;
import com.syncbridge.engine.consumer.ConsumerSettings;
import com.syncbridge.recovery.RecoverySettings;
import com.syncbridge.worker.WorkerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the sync core.
 *
 * @see SyncBridgeConfiguration
 */
@ConfigurationProperties(prefix = "syncbridge")
public class SyncBridgeProperties {

    /**
     * Backing store for streams, tracking, workflows and the task queue.
     */
    private StoreType store = StoreType.JDBC;

    /**
     * Consumer application events go to when a publish request names none.
     */
    private String defaultConsumerApplication = "crm";

    /**
     * Applications whose acknowledgment streams are consumed.
     */
    private List<String> consumerApplications = new ArrayList<>(List.of("crm"));

    /**
     * Failed acknowledgments tolerated before an event is FAILED.
     */
    private int ackRetryBudget = 3;

    /**
     * Rolling window of the per-tenant sync health metrics.
     */
    private Duration healthWindow = Duration.ofHours(24);

    private final Publisher publisher = new Publisher();
    private final Consumer consumer = new Consumer();
    private final Worker worker = new Worker();
    private final Queue queue = new Queue();
    private final Recovery recovery = new Recovery();

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public String getDefaultConsumerApplication() {
        return defaultConsumerApplication;
    }

    public void setDefaultConsumerApplication(String defaultConsumerApplication) {
        this.defaultConsumerApplication = defaultConsumerApplication;
    }

    public List<String> getConsumerApplications() {
        return consumerApplications;
    }

    public void setConsumerApplications(List<String> consumerApplications) {
        this.consumerApplications = consumerApplications;
    }

    public int getAckRetryBudget() {
        return ackRetryBudget;
    }

    public void setAckRetryBudget(int ackRetryBudget) {
        this.ackRetryBudget = ackRetryBudget;
    }

    public Duration getHealthWindow() {
        return healthWindow;
    }

    public void setHealthWindow(Duration healthWindow) {
        this.healthWindow = healthWindow;
    }

    public Publisher getPublisher() {
        return publisher;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public Worker getWorker() {
        return worker;
    }

    public Queue getQueue() {
        return queue;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public enum StoreType {
        MEMORY,
        JDBC
    }

    /**
     * Local retries of a publish before it fails with PUBLISH_FAILED.
     */
    public static class Publisher {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(100);
        private Duration maxBackoff = Duration.ofSeconds(2);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public RetryPolicy toRetryPolicy() {
            return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .initialBackoff(initialBackoff)
                .maxBackoff(maxBackoff)
                .backoffMultiplier(2.0)
                .build();
        }
    }

    public static class Consumer {
        private int batchSize = 100;
        private Duration pollInterval = Duration.ofMillis(500);
        private Duration maxStoreBackoff = Duration.ofSeconds(30);

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getMaxStoreBackoff() {
            return maxStoreBackoff;
        }

        public void setMaxStoreBackoff(Duration maxStoreBackoff) {
            this.maxStoreBackoff = maxStoreBackoff;
        }

        public ConsumerSettings toSettings() {
            return new ConsumerSettings(batchSize, pollInterval, RetryPolicy.builder()
                .maxAttempts(Integer.MAX_VALUE)
                .initialBackoff(Duration.ofMillis(200))
                .maxBackoff(maxStoreBackoff)
                .backoffMultiplier(2.0)
                .build());
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private String workerId;
        private int slots = 4;
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration heartbeatInterval = Duration.ofSeconds(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        /**
         * Null assigns a random {@code worker-xxxxxxxx} id at startup.
         */
        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }

        public int getSlots() {
            return slots;
        }

        public void setSlots(int slots) {
            this.slots = slots;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public WorkerSettings toSettings() {
            return new WorkerSettings(slots, pollInterval, heartbeatInterval);
        }
    }

    public static class Queue {
        private int capacity = 1000;
        private Duration dispatchWait = Duration.ofSeconds(5);
        private Duration leaseGrace = Duration.ofSeconds(15);

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public Duration getDispatchWait() {
            return dispatchWait;
        }

        public void setDispatchWait(Duration dispatchWait) {
            this.dispatchWait = dispatchWait;
        }

        public Duration getLeaseGrace() {
            return leaseGrace;
        }

        public void setLeaseGrace(Duration leaseGrace) {
            this.leaseGrace = leaseGrace;
        }
    }

    public static class Recovery {
        private boolean enabled = true;
        private Duration leaseCheckInterval = Duration.ofSeconds(5);
        private Duration expiryCheckInterval = Duration.ofMinutes(1);
        private Duration ackWindow = Duration.ofHours(24);
        private Duration resumeInterval = Duration.ofMinutes(1);
        private Duration stalledAfter = Duration.ofMinutes(1);
        private Duration purgeInterval = Duration.ofHours(1);
        private Duration retention = Duration.ofDays(7);
        private Duration reconcileInterval = Duration.ofMinutes(5);
        private int batchSize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getLeaseCheckInterval() {
            return leaseCheckInterval;
        }

        public void setLeaseCheckInterval(Duration leaseCheckInterval) {
            this.leaseCheckInterval = leaseCheckInterval;
        }

        public Duration getExpiryCheckInterval() {
            return expiryCheckInterval;
        }

        public void setExpiryCheckInterval(Duration expiryCheckInterval) {
            this.expiryCheckInterval = expiryCheckInterval;
        }

        public Duration getAckWindow() {
            return ackWindow;
        }

        public void setAckWindow(Duration ackWindow) {
            this.ackWindow = ackWindow;
        }

        public Duration getResumeInterval() {
            return resumeInterval;
        }

        public void setResumeInterval(Duration resumeInterval) {
            this.resumeInterval = resumeInterval;
        }

        public Duration getStalledAfter() {
            return stalledAfter;
        }

        public void setStalledAfter(Duration stalledAfter) {
            this.stalledAfter = stalledAfter;
        }

        public Duration getPurgeInterval() {
            return purgeInterval;
        }

        public void setPurgeInterval(Duration purgeInterval) {
            this.purgeInterval = purgeInterval;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public Duration getReconcileInterval() {
            return reconcileInterval;
        }

        public void setReconcileInterval(Duration reconcileInterval) {
            this.reconcileInterval = reconcileInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        /**
         * Reconciliation covers every consumer application.
         */
        public RecoverySettings toSettings(List<String> applications) {
            return new RecoverySettings(
                leaseCheckInterval,
                expiryCheckInterval,
                ackWindow,
                resumeInterval,
                stalledAfter,
                purgeInterval,
                retention,
                reconcileInterval,
                applications,
                batchSize
            );
        }
    }
}
