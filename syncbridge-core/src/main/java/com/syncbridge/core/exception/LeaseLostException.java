package com.syncbridge.core.exception;

import java.util.UUID;

/**
 * Thrown when a worker reports on a task whose lease was reclaimed
 * and re-issued under a newer fence token.
 */
public class LeaseLostException extends SyncBridgeException {

    public static final String ERROR_CODE = "LEASE_LOST";

    public LeaseLostException(UUID taskId, long fenceToken) {
        super(ERROR_CODE, String.format(
            "Lease on task %s no longer held with fence token %d",
            taskId, fenceToken
        ));
    }
}
