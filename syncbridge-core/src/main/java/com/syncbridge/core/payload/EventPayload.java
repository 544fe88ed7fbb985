package com.syncbridge.core.payload;

import com.syncbridge.core.exception.MalformedMessageException;

/**
 * Typed form of an envelope's {@code data}, selected by event type.
 */
public interface EventPayload {

    /**
     * Check business-level constraints that JSON decoding cannot express.
     *
     * @throws MalformedMessageException if the payload is unusable
     */
    void validate();

    static void require(boolean condition, String detail) {
        if (!condition) {
            throw new MalformedMessageException(detail);
        }
    }

    static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
