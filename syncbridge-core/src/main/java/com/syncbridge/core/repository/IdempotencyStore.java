package com.syncbridge.core.repository;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * Remembers the output of side effects that already happened, keyed by idempotency key.
 * Activities consult it before acting so a re-invocation returns the recorded output.
 */
public interface IdempotencyStore {

    Optional<JsonNode> find(String idempotencyKey);

    /**
     * Record the output of an effect unless one is already recorded.
     *
     * @return true if recorded, false if the key was already present
     */
    boolean record(String idempotencyKey, JsonNode output);
}
