package com.syncbridge.core.exception;

/**
 * Thrown when an acknowledgment references an event that has no tracking record.
 */
public class UnknownEventReferenceException extends SyncBridgeException {

    public static final String ERROR_CODE = "UNKNOWN_EVENT_REFERENCE";

    public UnknownEventReferenceException(String eventId, String reason) {
        super(ERROR_CODE, String.format(
            "Acknowledgment references unknown event %s: %s",
            eventId, reason
        ));
    }
}
