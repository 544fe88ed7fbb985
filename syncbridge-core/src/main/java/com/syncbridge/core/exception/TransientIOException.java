package com.syncbridge.core.exception;

/**
 * Thrown when the stream or a store is temporarily unavailable.
 * Callers retry locally with backoff.
 */
public class TransientIOException extends SyncBridgeException {

    public static final String ERROR_CODE = "TRANSIENT_IO_FAILURE";

    public TransientIOException(String operation, String detail) {
        super(ERROR_CODE, String.format("%s unavailable: %s", operation, detail));
    }

    public TransientIOException(String operation, Throwable cause) {
        super(ERROR_CODE, String.format("%s unavailable: %s", operation, cause.getMessage()), cause);
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
