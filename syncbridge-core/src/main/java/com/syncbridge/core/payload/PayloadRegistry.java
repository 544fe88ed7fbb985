package com.syncbridge.core.payload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncbridge.core.exception.MalformedMessageException;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps event types to payload schemas and decodes envelope data into them.
 * Unknown fields are tolerated; unknown event types decode to {@link OpaquePayload}.
 */
public class PayloadRegistry {

    private final ObjectMapper objectMapper;
    private final Map<String, Class<? extends EventPayload>> schemas = new ConcurrentHashMap<>();

    public PayloadRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Registry preloaded with every event type the suite exchanges today.
     */
    public static PayloadRegistry withDefaults(ObjectMapper objectMapper) {
        PayloadRegistry registry = new PayloadRegistry(objectMapper);
        registry.register("credit.allocated", CreditAllocatedPayload.class);
        registry.register("credit.config_updated", CreditConfigUpdatedPayload.class);
        registry.register("role.created", RolePayload.class);
        registry.register("role.updated", RolePayload.class);
        registry.register("role.deleted", RolePayload.class);
        registry.register("role.permissions_changed", RolePayload.class);
        registry.register("role.assigned", RoleAssignmentPayload.class);
        registry.register("role.unassigned", RoleAssignmentPayload.class);
        registry.register("user.created", UserPayload.class);
        registry.register("user.deactivated", UserPayload.class);
        registry.register("user.deleted", UserPayload.class);
        registry.register("organization.created", OrganizationPayload.class);
        return registry;
    }

    public void register(String eventType, Class<? extends EventPayload> schema) {
        schemas.put(eventType, schema);
    }

    public Optional<Class<? extends EventPayload>> schemaFor(String eventType) {
        return Optional.ofNullable(schemas.get(eventType));
    }

    public boolean isKnown(String eventType) {
        return schemas.containsKey(eventType);
    }

    /**
     * Decode and validate the data of an event.
     *
     * @throws MalformedMessageException if the data is missing, does not fit the schema or fails validation
     */
    public EventPayload decode(String eventType, JsonNode data) {
        Class<? extends EventPayload> schema = schemas.get(eventType);
        if (schema == null) {
            return new OpaquePayload(data);
        }
        if (data == null || data.isNull() || !data.isObject()) {
            throw new MalformedMessageException(eventType + " requires an object payload");
        }
        EventPayload payload;
        try {
            payload = objectMapper.readerFor(schema)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .readValue(data);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException(eventType + " payload: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedMessageException(eventType + " payload unreadable", e);
        }
        payload.validate();
        return payload;
    }

    /**
     * Decode into a specific payload type.
     */
    public <T extends EventPayload> T decode(String eventType, JsonNode data, Class<T> expected) {
        EventPayload payload = decode(eventType, data);
        if (!expected.isInstance(payload)) {
            throw new MalformedMessageException(String.format(
                "%s decodes to %s, not %s",
                eventType, payload.getClass().getSimpleName(), expected.getSimpleName()));
        }
        return expected.cast(payload);
    }
}
