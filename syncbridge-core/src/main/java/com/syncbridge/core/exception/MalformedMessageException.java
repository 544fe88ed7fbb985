package com.syncbridge.core.exception;

/**
 * Thrown when an envelope, acknowledgment or payload violates its schema.
 */
public class MalformedMessageException extends SyncBridgeException {

    public static final String ERROR_CODE = "MALFORMED_MESSAGE";

    public MalformedMessageException(String detail) {
        super(ERROR_CODE, "Malformed message: " + detail);
    }

    public MalformedMessageException(String detail, Throwable cause) {
        super(ERROR_CODE, "Malformed message: " + detail, cause);
    }
}
