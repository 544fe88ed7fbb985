package com.syncbridge.core.model;

import java.time.Duration;
import java.util.SplittableRandom;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with a hard attempt ceiling.
 * Used for workflow activity retries and for the local retries of publishing and acknowledgment processing.
 *
 * Invariants:
 * - maxAttempts >= 1
 * - initialBackoff >= 0
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("Backoff bounds must satisfy 0 <= initial <= max");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1]");
        }
    }

    /**
     * Default retry policy: 3 attempts, exponential backoff starting at 1s.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofMinutes(5), 2.0, 0.1);
    }

    /**
     * Single attempt only.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0, 0.0);
    }

    /**
     * Retries without any wait. Meant for tests and in-process stores.
     */
    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, Duration.ZERO, 1.0, 0.0);
    }

    /**
     * Compute the backoff before the attempt that follows the given one, with random jitter.
     *
     * @param attemptNumber 1-indexed number of the attempt that just failed
     * @return Duration to wait before next attempt
     */
    public Duration computeBackoff(int attemptNumber) {
        return backoff(attemptNumber, ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Compute the backoff with jitter derived from the seed. The same seed always yields the same delay,
     * which is what replayed orchestration decisions need.
     *
     * @param attemptNumber 1-indexed number of the attempt that just failed
     * @param seed Stable identity of the retry, e.g. derived from workflow, step and attempt
     */
    public Duration computeBackoff(int attemptNumber, long seed) {
        return backoff(attemptNumber, new SplittableRandom(seed).nextDouble());
    }

    /**
     * Check if more attempts are available.
     *
     * @param currentAttempt Current attempt number (1-indexed)
     * @return true if more attempts can be made
     */
    public boolean hasMoreAttempts(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }

    private Duration backoff(int attemptNumber, double unit) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }

        // initialBackoff * (multiplier ^ (attempt - 1)), capped
        double baseBackoffMs = initialBackoff.toMillis() *
            Math.pow(backoffMultiplier, attemptNumber - 1);
        double cappedBackoffMs = Math.min(baseBackoffMs, maxBackoff.toMillis());

        // backoff * (1 - jitter + unit * 2 * jitter)
        double jitterRange = cappedBackoffMs * jitterFactor;
        double jitteredBackoffMs = cappedBackoffMs - jitterRange + unit * 2 * jitterRange;

        return Duration.ofMillis((long) jitteredBackoffMs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofMinutes(5);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.1;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff, backoffMultiplier, jitterFactor);
        }
    }
}
