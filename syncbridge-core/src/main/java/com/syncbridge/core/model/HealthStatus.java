package com.syncbridge.core.model;

/**
 * Coarse sync health classification derived from the failure rate of decided events.
 */
public enum HealthStatus {
    HEALTHY,
    WARNING,
    DEGRADED;

    static final double WARNING_FAILURE_RATE = 0.05;
    static final double DEGRADED_FAILURE_RATE = 0.20;

    /**
     * Classify a failure rate; an undefined rate (nothing decided yet) counts as healthy.
     */
    public static HealthStatus fromFailureRate(Double failureRate) {
        if (failureRate == null) {
            return HEALTHY;
        }
        if (failureRate > DEGRADED_FAILURE_RATE) {
            return DEGRADED;
        }
        if (failureRate > WARNING_FAILURE_RATE) {
            return WARNING;
        }
        return HEALTHY;
    }
}
