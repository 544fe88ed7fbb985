package com.syncbridge.core.exception;

/**
 * Thrown when a compare-and-swap update loses against a concurrent writer.
 */
public class OptimisticLockException extends SyncBridgeException {

    public static final String ERROR_CODE = "OPTIMISTIC_LOCK_CONFLICT";

    public OptimisticLockException(String entityType, String entityId, long expectedVersion) {
        super(ERROR_CODE, String.format(
            "Optimistic lock conflict on %s[%s]: expected version %d",
            entityType, entityId, expectedVersion
        ));
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
