package com.syncbridge.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Conversions between JsonNode values and jsonb columns.
 */
final class JsonColumns {

    private JsonColumns() {
    }

    static String write(ObjectMapper objectMapper, JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node != null ? node : NullNode.getInstance());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize JSON column", e);
        }
    }

    static JsonNode parse(ObjectMapper objectMapper, String json) {
        if (json == null) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            return node.isNull() ? null : node;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize JSON column", e);
        }
    }
}
