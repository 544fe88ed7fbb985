package com.syncbridge.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.syncbridge.core.exception.WorkflowValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class WorkflowExecutionTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private ActivityTask task(WorkflowExecution execution, String activity, int step, int attempt) {
        return ActivityTask.create(execution.workflowId(), execution.tenantId(), activity, step, attempt,
            execution.workflowId() + ":" + activity, execution.input(), Duration.ofSeconds(30), NOW, NOW);
    }

    @Test
    @DisplayName("History is appended in order and version increases per update")
    void historyAppend() {
        WorkflowExecution execution = WorkflowExecution.start("tenant.onboarding", "T1", null, null, NOW);
        ObjectNode output = JsonNodeFactory.instance.objectNode().put("organizationId", "org-1");

        execution = execution.withInvocation(ActivityInvocation.of(
            task(execution, "create-organization", 0, 1), ActivityResult.success(output), NOW), NOW);
        execution = execution.withInvocation(ActivityInvocation.of(
            task(execution, "allocate-credits", 1, 1), ActivityResult.retryable("RATE_LIMITED", "429"), NOW), NOW);

        assertThat(execution.version()).isEqualTo(3L);
        assertThat(execution.history()).extracting(ActivityInvocation::activityName)
            .containsExactly("create-organization", "allocate-credits");
        assertThat(execution.hasSucceeded(0)).isTrue();
        assertThat(execution.hasSucceeded(1)).isFalse();
        assertThat(execution.attemptsOf(1)).hasSize(1);
        assertThat(execution.hasRecorded(1, 1)).isTrue();
        assertThat(execution.outputOf("create-organization")).contains(output);
        assertThat(execution.outputOf("allocate-credits")).isEmpty();
    }

    @Test
    @DisplayName("History cannot be modified from outside")
    void historyIsImmutable() {
        WorkflowExecution execution = WorkflowExecution.start("user.sync", "T1", null, null, NOW);

        assertThatThrownBy(() -> execution.history().add(null))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Cancelled workflows still record results of in-flight activities")
    void cancelledStillRecords() {
        WorkflowExecution execution = WorkflowExecution.start("user.sync", "T1", null, null, NOW);
        ActivityTask inFlight = task(execution, "sync-users", 0, 1);

        WorkflowExecution cancelled = execution.withCancelled("operator request", NOW);
        WorkflowExecution recorded = cancelled.withInvocation(
            ActivityInvocation.of(inFlight, ActivityResult.success(null), NOW), NOW);

        assertThat(recorded.state()).isEqualTo(WorkflowState.CANCELLED);
        assertThat(recorded.history()).hasSize(1);
    }

    @Test
    @DisplayName("Terminal workflows refuse further transitions")
    void terminalTransitions() {
        WorkflowExecution completed = WorkflowExecution.start("user.sync", "T1", null, null, NOW)
            .withCompleted(null, NOW);

        assertThatThrownBy(() -> completed.withCancelled("late", NOW)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> completed.withFailed("late", NOW)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Claim and requeue move the fence token forward")
    void fenceTokens() {
        WorkflowExecution execution = WorkflowExecution.start("user.sync", "T1", null, null, NOW);
        ActivityTask queued = task(execution, "sync-users", 0, 1);

        ActivityTask claimed = queued.withClaimed("worker-1", NOW, Duration.ofSeconds(5));
        assertThat(claimed.state()).isEqualTo(TaskState.RUNNING);
        assertThat(claimed.fenceToken()).isEqualTo(1L);
        assertThat(claimed.leaseExpiresAt()).isEqualTo(NOW.plusSeconds(35));

        ActivityTask requeued = claimed.withRequeued(NOW.plusSeconds(40));
        assertThat(requeued.state()).isEqualTo(TaskState.QUEUED);
        assertThat(requeued.fenceToken()).isEqualTo(2L);
        assertThat(requeued.leaseHolder()).isNull();
        assertThat(requeued.isDue(NOW)).isFalse();
        assertThat(requeued.isDue(NOW.plusSeconds(40))).isTrue();
    }

    @Test
    void idempotencyKey_isStablePerStep() {
        UUID workflowId = UUID.randomUUID();
        ObjectNode input = JsonNodeFactory.instance.objectNode().put("organizationId", "org-7");

        ActivityDefinition perWorkflow = ActivityDefinition.builder("sync-users").build();
        ActivityDefinition perEntity = ActivityDefinition.builder("allocate-credits")
            .idempotencyKey(ActivityDefinition.IdempotencyKeyFunction.byInputField("organizationId"))
            .build();

        assertThat(perWorkflow.keyFor(workflowId, "tenant-a", input)).isEqualTo(workflowId + ":sync-users");
        assertThat(perEntity.keyFor(workflowId, "tenant-a", input)).isEqualTo("allocate-credits:tenant-a:org-7");
        assertThat(perEntity.keyFor(UUID.randomUUID(), "tenant-a", input))
            .isEqualTo(perEntity.keyFor(workflowId, "tenant-a", input));
        assertThat(perEntity.keyFor(workflowId, "tenant-b", input))
            .isNotEqualTo(perEntity.keyFor(workflowId, "tenant-a", input));
        assertThat(perEntity.keyFor(workflowId, "tenant-a", JsonNodeFactory.instance.objectNode()))
            .isEqualTo(workflowId + ":allocate-credits");
    }

    @Test
    void definitionValidation_reportsEveryProblem() {
        WorkflowDefinition definition = WorkflowDefinition.builder("broken")
            .step("a")
            .step("a")
            .step(ActivityDefinition.builder("b").timeout(Duration.ZERO).build())
            .build();

        assertThatThrownBy(definition::validate)
            .isInstanceOf(WorkflowValidationException.class)
            .satisfies(e -> assertThat(((WorkflowValidationException) e).getErrors()).hasSize(2));
    }
}
