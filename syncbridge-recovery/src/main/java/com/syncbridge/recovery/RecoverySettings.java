package com.syncbridge.recovery;

import java.time.Duration;
import java.util.List;

/**
 * Sweep intervals and thresholds for the recovery engine.
 *
 * @param leaseCheckInterval How often expired activity leases are reclaimed
 * @param expiryCheckInterval How often unacknowledged events are expired
 * @param ackWindow Age after which a PUBLISHED event is expired
 * @param resumeInterval How often running workflows are checked for lost progress
 * @param stalledAfter Idle time after which a running workflow without a task is resumed
 * @param purgeInterval How often terminal tracking records and finished activity tasks are purged
 * @param retention Age after which terminal tracking records and finished activity tasks are purged
 * @param reconcileInterval How often event streams are scanned for untracked events
 * @param reconcileApplications Applications whose event streams are reconciled
 * @param batchSize Upper bound of items handled per sweep
 */
public record RecoverySettings(
    Duration leaseCheckInterval,
    Duration expiryCheckInterval,
    Duration ackWindow,
    Duration resumeInterval,
    Duration stalledAfter,
    Duration purgeInterval,
    Duration retention,
    Duration reconcileInterval,
    List<String> reconcileApplications,
    int batchSize
) {
    public RecoverySettings {
        reconcileApplications = reconcileApplications == null ? List.of() : List.copyOf(reconcileApplications);
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
    }

    public static RecoverySettings defaults() {
        return new RecoverySettings(
            Duration.ofSeconds(5),
            Duration.ofMinutes(1),
            Duration.ofHours(24),
            Duration.ofMinutes(1),
            Duration.ofMinutes(1),
            Duration.ofHours(1),
            Duration.ofDays(7),
            Duration.ofMinutes(5),
            List.of(),
            100
        );
    }
}
