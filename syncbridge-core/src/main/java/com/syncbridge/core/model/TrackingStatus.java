package com.syncbridge.core.model;

/**
 * Delivery state of a published event.
 */
public enum TrackingStatus {
    /**
     * Appended to the stream, no decisive acknowledgment yet.
     * Transitions: -> ACKNOWLEDGED, FAILED, EXPIRED
     */
    PUBLISHED,

    /**
     * Consumer confirmed the change. Terminal state.
     */
    ACKNOWLEDGED,

    /**
     * Retry budget exhausted by negative acknowledgments. Terminal state.
     */
    FAILED,

    /**
     * No acknowledgment arrived within the ack window. Terminal state.
     */
    EXPIRED;

    public boolean isTerminal() {
        return this != PUBLISHED;
    }

    public boolean canTransitionTo(TrackingStatus target) {
        return switch (this) {
            case PUBLISHED -> target == ACKNOWLEDGED || target == FAILED || target == EXPIRED;
            case ACKNOWLEDGED, FAILED, EXPIRED -> false;
        };
    }
}
