package com.syncbridge.core.exception;

/**
 * Thrown when a tracking record, workflow or task is not found.
 */
public class NotFoundException extends SyncBridgeException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
