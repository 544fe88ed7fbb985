package com.syncbridge.core.exception;

/**
 * Thrown by the publisher once local retries of the stream append or the
 * tracking write are exhausted. The caller may submit the change again.
 */
public class PublishFailedException extends SyncBridgeException {

    public static final String ERROR_CODE = "PUBLISH_FAILED";

    private final String eventId;

    public PublishFailedException(String eventId, String eventType, String stage, int attempts, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Publishing %s event %s failed at %s after %d attempts",
            eventType, eventId, stage, attempts
        ), cause);
        this.eventId = eventId;
    }

    /**
     * Identifier assigned to the failed publication.
     */
    public String getEventId() {
        return eventId;
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
