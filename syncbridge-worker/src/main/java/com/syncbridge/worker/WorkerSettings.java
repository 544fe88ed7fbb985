package com.syncbridge.worker;

import java.time.Duration;

/**
 * Worker pool sizing and timing.
 *
 * @param slots Activities run concurrently by one pool
 * @param pollInterval Wait before polling again when no task was due
 * @param heartbeatInterval Lease renewal interval while a handler runs
 */
public record WorkerSettings(
    int slots,
    Duration pollInterval,
    Duration heartbeatInterval
) {
    public WorkerSettings {
        if (slots < 1) {
            throw new IllegalArgumentException("slots must be >= 1");
        }
        if (pollInterval.isNegative() || heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be >= 0 and heartbeatInterval > 0");
        }
    }

    public static WorkerSettings defaults() {
        return new WorkerSettings(4, Duration.ofSeconds(1), Duration.ofSeconds(10));
    }
}
