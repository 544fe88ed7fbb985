package com.syncbridge.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncbridge.core.model.ActivityTask;

import java.util.Optional;
import java.util.UUID;

/**
 * Context provided to activity handlers during execution.
 */
public class ActivityContext {

    private final ActivityTask task;
    private final ObjectMapper objectMapper;
    private final HeartbeatCallback heartbeatCallback;

    public ActivityContext(
            ActivityTask task,
            ObjectMapper objectMapper,
            HeartbeatCallback heartbeatCallback) {
        this.task = task;
        this.objectMapper = objectMapper;
        this.heartbeatCallback = heartbeatCallback;
    }

    public ActivityTask getTask() {
        return task;
    }

    /**
     * The input the workflow was started with.
     */
    public JsonNode getWorkflowInput() {
        return task.input().path("input");
    }

    /**
     * The workflow input converted to a specific type.
     */
    public <T> T getWorkflowInput(Class<T> type) {
        return objectMapper.convertValue(getWorkflowInput(), type);
    }

    /**
     * Output of an earlier step of the same workflow, if it succeeded.
     */
    public Optional<JsonNode> getResult(String activityName) {
        JsonNode result = task.input().path("results").get(activityName);
        return Optional.ofNullable(result);
    }

    public UUID getWorkflowId() {
        return task.workflowId();
    }

    public String getTenantId() {
        return task.tenantId();
    }

    public String getActivityName() {
        return task.activityName();
    }

    public int getAttempt() {
        return task.attempt();
    }

    /**
     * Key shared by every attempt of this step.
     * Use it to guard external effects so a retried attempt does not repeat them.
     */
    public String getIdempotencyKey() {
        return task.idempotencyKey();
    }

    /**
     * Renew the lease now. Long-running handlers may call this between units of work;
     * the pool also renews on a fixed interval.
     *
     * @return true if the lease is still held, false if it was lost and the result will be discarded
     */
    public boolean heartbeat() {
        return heartbeatCallback.sendHeartbeat();
    }

    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }

    /**
     * Callback for lease renewal.
     */
    @FunctionalInterface
    public interface HeartbeatCallback {
        boolean sendHeartbeat();
    }
}
