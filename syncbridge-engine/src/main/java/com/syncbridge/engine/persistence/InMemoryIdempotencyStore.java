package com.syncbridge.engine.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.syncbridge.core.repository.IdempotencyStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of IdempotencyStore.
 */
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final Map<String, JsonNode> outputs = new ConcurrentHashMap<>();

    @Override
    public Optional<JsonNode> find(String idempotencyKey) {
        return Optional.ofNullable(outputs.get(idempotencyKey));
    }

    @Override
    public boolean record(String idempotencyKey, JsonNode output) {
        return outputs.putIfAbsent(idempotencyKey, output != null ? output : NullNode.getInstance()) == null;
    }
}
