package com.syncbridge.core.exception;

/**
 * Thrown when a tracking record or workflow is asked to move to a state
 * its lifecycle does not allow.
 */
public class InvalidStateTransitionException extends SyncBridgeException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(String entityType, String entityId, Enum<?> from, Enum<?> to) {
        super(ERROR_CODE, String.format(
            "Invalid state transition for %s[%s]: %s -> %s",
            entityType, entityId, from, to
        ));
    }
}
