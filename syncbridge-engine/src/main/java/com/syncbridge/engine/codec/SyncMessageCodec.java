package com.syncbridge.engine.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.syncbridge.core.exception.MalformedMessageException;
import com.syncbridge.core.model.AckResult;
import com.syncbridge.core.model.AcknowledgmentMessage;
import com.syncbridge.core.model.EventEnvelope;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * JSON wire format of envelopes and acknowledgments.
 *
 * Decoding tolerates unknown fields and rejects messages missing a required one.
 * Timestamps are ISO-8601 strings; acknowledgments may also carry epoch milliseconds.
 */
public class SyncMessageCodec {

    private final ObjectMapper objectMapper;

    public SyncMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ========== Envelope ==========

    public String encodeEnvelope(EventEnvelope envelope) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("eventId", envelope.eventId());
        node.put("timestamp", envelope.timestamp().toString());
        node.put("eventType", envelope.eventType());
        node.put("tenantId", envelope.tenantId());
        node.put("entityType", envelope.entityType());
        node.put("entityId", envelope.entityId());
        node.set("data", envelope.data() != null ? envelope.data() : NullNode.getInstance());
        node.put("publishedBy", envelope.publishedBy());
        return write(node);
    }

    public EventEnvelope decodeEnvelope(String payload) {
        JsonNode root = parse(payload);
        if (!root.has("data")) {
            throw new MalformedMessageException("envelope missing required field 'data'");
        }
        return new EventEnvelope(
            requiredText(root, "eventId", "envelope"),
            requiredInstant(root, "timestamp", "envelope"),
            requiredText(root, "eventType", "envelope"),
            requiredText(root, "tenantId", "envelope"),
            requiredText(root, "entityType", "envelope"),
            requiredText(root, "entityId", "envelope"),
            root.get("data"),
            requiredText(root, "publishedBy", "envelope")
        );
    }

    // ========== Acknowledgment ==========

    public String encodeAck(AcknowledgmentMessage ack) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("eventId", ack.eventId());
        node.put("tenantId", ack.tenantId());
        node.put("consumerApplication", ack.consumerApplication());
        node.put("result", ack.result().name());
        if (ack.errorDetail() != null) {
            node.put("errorDetail", ack.errorDetail());
        }
        node.put("ackTimestamp", ack.ackTimestamp().toString());
        return write(node);
    }

    public AcknowledgmentMessage decodeAck(String payload) {
        JsonNode root = parse(payload);
        String resultText = requiredText(root, "result", "acknowledgment");
        AckResult result;
        try {
            result = AckResult.valueOf(resultText.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("acknowledgment result must be OK or ERROR, got " + resultText);
        }
        JsonNode errorDetail = root.get("errorDetail");
        return new AcknowledgmentMessage(
            requiredText(root, "eventId", "acknowledgment"),
            requiredText(root, "tenantId", "acknowledgment"),
            requiredText(root, "consumerApplication", "acknowledgment"),
            result,
            errorDetail != null && !errorDetail.isNull() ? errorDetail.asText() : null,
            requiredInstant(root, "ackTimestamp", "acknowledgment")
        );
    }

    // ========== Helper Methods ==========

    private JsonNode parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedMessageException("empty message");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMessageException("message is not a JSON object");
        }
        return root;
    }

    private String requiredText(JsonNode root, String field, String kind) {
        JsonNode value = root.get(field);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isBlank()) {
            throw new MalformedMessageException(kind + " missing required field '" + field + "'");
        }
        return value.asText();
    }

    private Instant requiredInstant(JsonNode root, String field, String kind) {
        JsonNode value = root.get(field);
        if (value != null && value.isIntegralNumber()) {
            return Instant.ofEpochMilli(value.asLong());
        }
        String text = requiredText(root, field, kind);
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new MalformedMessageException(kind + " field '" + field + "' is not an ISO-8601 instant", e);
        }
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize message", e);
        }
    }
}
