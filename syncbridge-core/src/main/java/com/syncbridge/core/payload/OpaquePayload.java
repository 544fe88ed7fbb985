package com.syncbridge.core.payload;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Payload of an event type without a registered schema. Carried through untouched.
 */
public record OpaquePayload(JsonNode data) implements EventPayload {

    @Override
    public void validate() {
        // no schema to check against
    }
}
