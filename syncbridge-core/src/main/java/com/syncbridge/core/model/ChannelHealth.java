package com.syncbridge.core.model;

/**
 * Delivery figures for one target application within a tenant's health window.
 */
public record ChannelHealth(
    String targetApplication,
    long publishedCount,
    long acknowledgedCount,
    long pendingCount,
    long failedCount,
    long expiredCount,
    Double ackRate,
    boolean degraded
) {
    /**
     * A channel is degraded when more than this share of decided events failed or expired.
     */
    public static final double DEGRADED_FAILURE_RATE = 0.10;
}
