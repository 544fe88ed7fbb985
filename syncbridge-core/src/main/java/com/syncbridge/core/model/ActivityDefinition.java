package com.syncbridge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * One step of a workflow: which activity runs, how often it may be retried,
 * how long one attempt may take, when it runs at all, and how its idempotency key is derived.
 */
public record ActivityDefinition(
    String name,
    RetryPolicy retryPolicy,
    Duration timeout,
    StepCondition condition,
    IdempotencyKeyFunction idempotencyKey
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Deterministic guard over the workflow input and the history of earlier steps.
     * Must not read clocks, randomness or external state.
     */
    @FunctionalInterface
    public interface StepCondition {
        boolean shouldRun(JsonNode workflowInput, List<ActivityInvocation> earlierHistory);

        static StepCondition always() {
            return (input, history) -> true;
        }
    }

    /**
     * Derives the key an activity's external effect uses to detect duplicates.
     * The same key is used for every attempt of the step.
     */
    @FunctionalInterface
    public interface IdempotencyKeyFunction {
        String keyFor(UUID workflowId, String tenantId, String activityName, JsonNode workflowInput);

        static IdempotencyKeyFunction perWorkflow() {
            return (workflowId, tenantId, activityName, input) -> workflowId + ":" + activityName;
        }

        /**
         * Key on a business entity id found in the input, scoped to the tenant.
         * Falls back to the workflow id when the input lacks the field.
         */
        static IdempotencyKeyFunction byInputField(String field) {
            return (workflowId, tenantId, activityName, input) -> {
                JsonNode value = input != null ? input.get(field) : null;
                if (value == null || value.isNull()) {
                    return workflowId + ":" + activityName;
                }
                return activityName + ":" + tenantId + ":" + value.asText();
            };
        }
    }

    public String keyFor(UUID workflowId, String tenantId, JsonNode workflowInput) {
        return idempotencyKey.keyFor(workflowId, tenantId, name, workflowInput);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();
        private Duration timeout = DEFAULT_TIMEOUT;
        private StepCondition condition = StepCondition.always();
        private IdempotencyKeyFunction idempotencyKey = IdempotencyKeyFunction.perWorkflow();

        private Builder(String name) {
            this.name = name;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder runIf(StepCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder idempotencyKey(IdempotencyKeyFunction idempotencyKey) {
            this.idempotencyKey = idempotencyKey;
            return this;
        }

        public ActivityDefinition build() {
            return new ActivityDefinition(name, retryPolicy, timeout, condition, idempotencyKey);
        }
    }
}
