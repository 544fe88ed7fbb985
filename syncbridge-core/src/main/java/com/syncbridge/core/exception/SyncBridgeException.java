package com.syncbridge.core.exception;

/**
 * Base exception for all sync and orchestration errors.
 * Every subclass carries a stable error code that operators and API clients can match on.
 */
public class SyncBridgeException extends RuntimeException {

    private final String errorCode;

    public SyncBridgeException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SyncBridgeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether the failed operation may succeed when attempted again unchanged.
     */
    public boolean isRetriable() {
        return false;
    }
}
