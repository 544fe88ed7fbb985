package com.syncbridge.engine.consumer;

import com.syncbridge.core.model.RetryPolicy;

import java.time.Duration;

/**
 * Tuning of an acknowledgment consumer.
 *
 * @param batchSize Entries read per poll
 * @param pollInterval Delay between polls when the stream is drained
 * @param storeRetry Backoff between attempts while the tracking store is unavailable; attempts are unbounded
 */
public record ConsumerSettings(int batchSize, Duration pollInterval, RetryPolicy storeRetry) {

    public ConsumerSettings {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
    }

    public static ConsumerSettings defaults() {
        return new ConsumerSettings(100, Duration.ofMillis(500), RetryPolicy.builder()
            .maxAttempts(Integer.MAX_VALUE)
            .initialBackoff(Duration.ofMillis(200))
            .maxBackoff(Duration.ofSeconds(30))
            .backoffMultiplier(2.0)
            .jitterFactor(0.1)
            .build());
    }
}
