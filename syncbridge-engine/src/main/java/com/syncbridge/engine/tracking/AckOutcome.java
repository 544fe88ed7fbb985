package com.syncbridge.engine.tracking;

/**
 * Effect an acknowledgment had on its tracking record.
 */
public enum AckOutcome {
    ACKNOWLEDGED,
    RETRY_RECORDED,
    FAILED,
    /** Already applied, older than one applied, or the record is terminal. Nothing changed. */
    DUPLICATE
}
