package com.syncbridge.workflows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.syncbridge.core.exception.MalformedMessageException;
import com.syncbridge.core.exception.SyncBridgeException;
import com.syncbridge.core.model.ActivityResult;
import com.syncbridge.core.repository.IdempotencyStore;
import com.syncbridge.engine.publisher.EventPublisher;
import com.syncbridge.engine.publisher.PublishRequest;
import com.syncbridge.worker.ActivityContext;
import com.syncbridge.worker.ActivityHandler;
import com.syncbridge.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Activity handlers for the tenant sync workflows.
 *
 * Every handler is safe to re-invoke: each published event is recorded in the
 * {@link IdempotencyStore} under the step's idempotency key (plus the entity id for
 * per-user and per-application effects), and a recorded effect is returned as-is
 * instead of being published again.
 */
public class TenantSyncActivities {

    private static final Logger log = LoggerFactory.getLogger(TenantSyncActivities.class);

    public static final String INVALID_INPUT = "INVALID_INPUT";
    public static final String PUBLISHED_BY = "tenant-sync-workflow";

    static final String ORGANIZATION_CREATED = "organization.created";
    static final String CREDIT_ALLOCATED = "credit.allocated";
    static final String USER_CREATED = "user.created";

    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private final EventPublisher publisher;
    private final IdempotencyStore idempotencyStore;

    public TenantSyncActivities(EventPublisher publisher, IdempotencyStore idempotencyStore) {
        this.publisher = publisher;
        this.idempotencyStore = idempotencyStore;
    }

    /**
     * Register every tenant sync activity on a worker pool.
     */
    public void registerWith(WorkerPool pool) {
        pool.registerActivity(TenantSyncWorkflows.CREATE_ORGANIZATION, guarded(this::createOrganization));
        pool.registerActivity(TenantSyncWorkflows.ALLOCATE_CREDITS, guarded(this::allocateCredits));
        pool.registerActivity(TenantSyncWorkflows.SYNC_USERS, guarded(this::syncUsers));
        pool.registerActivity(TenantSyncWorkflows.NOTIFY_APPLICATIONS, guarded(this::notifyApplications));
    }

    /**
     * Publish organization.created.
     * Output: {organizationId, eventId}
     */
    public ActivityResult createOrganization(ActivityContext ctx) {
        JsonNode input = ctx.getWorkflowInput();
        String organizationId = requireText(input, "organizationId");
        String name = requireText(input, "name");

        JsonNode output = once(ctx.getIdempotencyKey(), () -> {
            ObjectNode data = nodes.objectNode()
                .put("organizationId", organizationId)
                .put("name", name);
            if (input.hasNonNull("parentOrganizationId")) {
                data.put("parentOrganizationId", input.get("parentOrganizationId").asText());
            }
            String eventId = publisher.publish(
                ORGANIZATION_CREATED, ctx.getTenantId(), "organization", organizationId, data, PUBLISHED_BY);
            log.info("[{}] Announced organization {}", ctx.getIdempotencyKey(), organizationId);
            return nodes.objectNode()
                .put("organizationId", organizationId)
                .put("eventId", eventId);
        });
        return ActivityResult.success(output);
    }

    /**
     * Publish credit.allocated for the organization. The credits come from
     * {@code initialCredits} during onboarding and from the input itself otherwise.
     * Output: {organizationId, allocationId, amount, reason, eventId}
     */
    public ActivityResult allocateCredits(ActivityContext ctx) {
        JsonNode input = ctx.getWorkflowInput();
        String organizationId = requireText(input, "organizationId");
        JsonNode credits = TenantSyncWorkflows.hasInitialCredits(input)
            ? input.get(TenantSyncWorkflows.INITIAL_CREDITS) : input;
        JsonNode amount = credits.get("amount");
        if (amount == null || !amount.isNumber() && !amount.isTextual()) {
            throw new MalformedMessageException("amount is required");
        }
        // Stable across attempts so consumers can deduplicate the grant
        String allocationId = credits.hasNonNull("allocationId")
            ? credits.get("allocationId").asText() : ctx.getWorkflowId().toString();
        String reason = credits.path("reason").asText("workflow allocation");

        JsonNode output = once(ctx.getIdempotencyKey(), () -> {
            ObjectNode data = nodes.objectNode()
                .put("allocationId", allocationId)
                .put("reason", reason);
            data.set("amount", amount);
            String eventId = publisher.publish(
                CREDIT_ALLOCATED, ctx.getTenantId(), "organization", organizationId, data, PUBLISHED_BY);
            log.info("[{}] Allocated {} credits to {} ({})", ctx.getIdempotencyKey(), amount.asText(), organizationId, allocationId);

            ObjectNode result = data.deepCopy();
            result.put("organizationId", organizationId);
            result.put("eventId", eventId);
            return result;
        });
        return ActivityResult.success(output);
    }

    /**
     * Publish user.created for every user in {@code users}. Users already announced by an
     * earlier attempt are not announced again.
     * Output: {synced, eventIds: {userId: eventId}}
     */
    public ActivityResult syncUsers(ActivityContext ctx) {
        JsonNode users = ctx.getWorkflowInput().path("users");
        if (!users.isMissingNode() && !users.isArray()) {
            throw new MalformedMessageException("users must be an array");
        }
        for (JsonNode user : users) {
            requireText(user, "userId");
        }

        JsonNode output = once(ctx.getIdempotencyKey(), () -> {
            ObjectNode eventIds = nodes.objectNode();
            for (JsonNode user : users) {
                String userId = user.get("userId").asText();
                JsonNode published = once(ctx.getIdempotencyKey() + ":" + userId, () -> {
                    ObjectNode data = nodes.objectNode().put("userId", userId);
                    copyText(user, data, "email");
                    copyText(user, data, "name");
                    String eventId = publisher.publish(
                        USER_CREATED, ctx.getTenantId(), "user", userId, data, PUBLISHED_BY);
                    return nodes.objectNode().put("eventId", eventId);
                });
                eventIds.put(userId, published.path("eventId").asText());
                // lets a long user list keep its lease
                ctx.heartbeat();
            }
            log.info("[{}] Synced {} users", ctx.getIdempotencyKey(), eventIds.size());
            ObjectNode result = nodes.objectNode().put("synced", eventIds.size());
            result.set("eventIds", eventIds);
            return result;
        });
        return ActivityResult.success(output);
    }

    /**
     * Forward the allocation made by allocate-credits to each application listed in
     * {@code applications}, one credit.allocated per application under the same allocationId.
     * Output: {notified: [{application, eventId}]}
     */
    public ActivityResult notifyApplications(ActivityContext ctx) {
        Optional<JsonNode> allocation = ctx.getResult(TenantSyncWorkflows.ALLOCATE_CREDITS);
        if (allocation.isEmpty()) {
            return ActivityResult.fatal(INVALID_INPUT, "no allocate-credits result to forward");
        }
        JsonNode allocated = allocation.get();
        JsonNode applications = ctx.getWorkflowInput().path("applications");
        if (!applications.isMissingNode() && !applications.isArray()) {
            throw new MalformedMessageException("applications must be an array");
        }

        JsonNode output = once(ctx.getIdempotencyKey(), () -> {
            ArrayNode notified = nodes.arrayNode();
            for (JsonNode application : applications) {
                String target = application.asText();
                JsonNode published = once(ctx.getIdempotencyKey() + ":" + target, () -> {
                    ObjectNode data = nodes.objectNode()
                        .put("allocationId", allocated.path("allocationId").asText())
                        .put("reason", allocated.path("reason").asText());
                    data.set("amount", allocated.get("amount"));
                    PublishRequest request = PublishRequest.of(
                        CREDIT_ALLOCATED, ctx.getTenantId(), "organization",
                        allocated.path("organizationId").asText(), data, PUBLISHED_BY)
                        .withTargetApplication(target);
                    return nodes.objectNode()
                        .put("application", target)
                        .put("eventId", publisher.publish(request));
                });
                notified.add(published);
            }
            log.info("[{}] Notified {} applications", ctx.getIdempotencyKey(), notified.size());
            ObjectNode result = nodes.objectNode();
            result.set("notified", notified);
            return result;
        });
        return ActivityResult.success(output);
    }

    // ========== Helper Methods ==========

    /**
     * Run an effect unless its output is already recorded under the key.
     * If a concurrent attempt recorded first, its output wins.
     */
    private JsonNode once(String key, Supplier<JsonNode> effect) {
        Optional<JsonNode> recorded = idempotencyStore.find(key);
        if (recorded.isPresent()) {
            log.debug("Effect {} already recorded, returning recorded output", key);
            return recorded.get();
        }
        JsonNode output = effect.get();
        if (!idempotencyStore.record(key, output)) {
            return idempotencyStore.find(key).orElse(output);
        }
        return output;
    }

    /**
     * Translate sync errors into explicit results: bad input is fatal, retriable
     * errors (publish exhaustion, store outages) are retried by the workflow.
     */
    private static ActivityHandler guarded(ActivityHandler handler) {
        return ctx -> {
            try {
                return handler.execute(ctx);
            } catch (MalformedMessageException e) {
                log.warn("[{}] Rejected input: {}", ctx.getIdempotencyKey(), e.getMessage());
                return ActivityResult.fatal(INVALID_INPUT, e.getMessage());
            } catch (SyncBridgeException e) {
                if (!e.isRetriable()) {
                    throw e;
                }
                log.warn("[{}] Attempt {} failed with {}: {}",
                    ctx.getIdempotencyKey(), ctx.getAttempt(), e.getErrorCode(), e.getMessage());
                return ActivityResult.retryable(e.getErrorCode(), e.getMessage());
            }
        };
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new MalformedMessageException(field + " is required");
        }
        return value.asText();
    }

    private static void copyText(JsonNode from, ObjectNode to, String field) {
        if (from.hasNonNull(field)) {
            to.put(field, from.get(field).asText());
        }
    }
}
