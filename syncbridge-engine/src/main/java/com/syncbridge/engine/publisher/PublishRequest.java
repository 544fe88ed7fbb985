package com.syncbridge.engine.publisher;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Everything needed to publish one change.
 * A null targetApplication selects the publisher's default consumer application.
 */
public record PublishRequest(
    String eventType,
    String tenantId,
    String entityType,
    String entityId,
    JsonNode data,
    String publishedBy,
    String targetApplication
) {
    public static PublishRequest of(
            String eventType, String tenantId, String entityType, String entityId,
            JsonNode data, String publishedBy) {
        return new PublishRequest(eventType, tenantId, entityType, entityId, data, publishedBy, null);
    }

    public PublishRequest withTargetApplication(String application) {
        return new PublishRequest(eventType, tenantId, entityType, entityId, data, publishedBy, application);
    }
}
