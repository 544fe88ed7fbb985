package com.syncbridge.engine.stream;

import com.syncbridge.core.exception.MalformedMessageException;
import com.syncbridge.core.model.EventEnvelope;

import java.util.Map;

/**
 * Stream naming contract shared with downstream applications:
 * events go to {@code {app}:sync:{domain}:{eventSubtype}}, acknowledgments come back on {@code {app}:sync:ack}.
 *
 * Event types downstream consumers already read keep their established routes, so
 * {@code credit.allocated} for {@code crm} lands on {@code crm:sync:credits:credit_allocated}.
 * Any other type derives its route: the prefix before the first dot, then the whole type with
 * dots replaced by underscores.
 */
public class StreamKeyResolver {

    public static final String SYNC_SEGMENT = ":sync:";
    public static final String ACK_SUFFIX = "ack";

    private static final Map<String, String> ROUTES = Map.ofEntries(
        Map.entry("user.created", "user:user_created"),
        Map.entry("user.deactivated", "user:user_deactivated"),
        Map.entry("user.deleted", "user:user_deleted"),
        Map.entry("role.created", "role:role_created"),
        Map.entry("role.updated", "role:role_updated"),
        Map.entry("role.deleted", "role:role_deleted"),
        Map.entry("role.permissions_changed", "role:role_permissions_changed"),
        Map.entry("role.assigned", "permissions:role_assigned"),
        Map.entry("role.unassigned", "permissions:role_unassigned"),
        Map.entry("organization.created", "organization:org_created"),
        Map.entry("credit.allocated", "credits:credit_allocated"),
        Map.entry("credit.config_updated", "credits:credit_config_updated")
    );

    public String eventStreamKey(String consumerApplication, String eventType) {
        requireSegment(consumerApplication, "consumerApplication");
        requireSegment(eventType, "eventType");
        if (!eventType.contains(".") || eventType.startsWith(".") || eventType.endsWith(".")) {
            throw new MalformedMessageException("eventType must be a dotted tag such as credit.allocated: " + eventType);
        }
        return consumerApplication + SYNC_SEGMENT + routeOf(eventType);
    }

    /**
     * The {@code {domain}:{eventSubtype}} part of an event type's stream key.
     */
    public String routeOf(String eventType) {
        String route = ROUTES.get(eventType);
        if (route != null) {
            return route;
        }
        return EventEnvelope.domainOf(eventType) + ":" + eventType.replace('.', '_');
    }

    public String ackStreamKey(String consumerApplication) {
        requireSegment(consumerApplication, "consumerApplication");
        return consumerApplication + SYNC_SEGMENT + ACK_SUFFIX;
    }

    /**
     * Prefix shared by every stream of one application.
     */
    public String applicationPrefix(String consumerApplication) {
        return consumerApplication + SYNC_SEGMENT;
    }

    public boolean isAckStream(String streamKey) {
        return streamKey.endsWith(SYNC_SEGMENT + ACK_SUFFIX);
    }

    private void requireSegment(String value, String name) {
        if (value == null || value.isBlank() || value.contains(":")) {
            throw new MalformedMessageException(name + " must be a non-empty key segment without ':' but was " + value);
        }
    }
}
