package com.syncbridge.engine.coordinator;

import com.syncbridge.core.exception.LeaseLostException;
import com.syncbridge.core.model.ActivityDefinition;
import com.syncbridge.core.model.ActivityResult;
import com.syncbridge.core.model.ActivityTask;
import com.syncbridge.core.model.RetryPolicy;
import com.syncbridge.core.model.TaskState;
import com.syncbridge.core.model.WorkflowDefinition;
import com.syncbridge.core.model.WorkflowExecution;
import com.syncbridge.core.model.WorkflowState;
import com.syncbridge.engine.persistence.InMemoryActivityTaskQueue;
import com.syncbridge.engine.service.WorkflowService.StartWorkflowRequest;
import com.syncbridge.engine.test.SyncTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActivityCoordinatorTest {

    private SyncTestHarness harness;
    private WorkflowExecution workflow;

    @BeforeEach
    void setUp() {
        harness = new SyncTestHarness();
        harness.definitions.register(WorkflowDefinition.builder("lease-test")
            .step(ActivityDefinition.builder("sync-users")
                .retryPolicy(RetryPolicy.immediate(3))
                .timeout(Duration.ofSeconds(10))
                .build())
            .build());
        workflow = harness.workflowCoordinator.startWorkflow(
            new StartWorkflowRequest("lease-test", "T1", harness.json(), null));
    }

    @Test
    @DisplayName("Claiming grants a lease of timeout plus grace and a fresh fence token")
    void claimGrantsLease() {
        ActivityTask task = claim("worker-1");

        assertThat(task.state()).isEqualTo(TaskState.RUNNING);
        assertThat(task.leaseHolder()).isEqualTo("worker-1");
        assertThat(task.fenceToken()).isEqualTo(1);
        assertThat(task.leaseExpiresAt()).isEqualTo(harness.clock.instant().plusSeconds(15));
        assertThat(harness.activityCoordinator.claimTask(Set.of("sync-users"), "worker-2")).isEmpty();
    }

    @Test
    @DisplayName("Only the names a worker registered are handed to it")
    void claimFiltersByActivity() {
        assertThat(harness.activityCoordinator.claimTask(Set.of("allocate-credits"), "worker-1")).isEmpty();
        assertThat(harness.activityCoordinator.claimTask(Set.of("sync-users"), "worker-1")).isPresent();
    }

    @Test
    @DisplayName("Heartbeats push the lease out from the current time")
    void renewExtendsLease() {
        ActivityTask task = claim("worker-1");
        harness.clock.advanceSeconds(8);

        Instant expiresAt = harness.activityCoordinator.renewLease(task.taskId(), task.fenceToken());

        assertThat(expiresAt).isEqualTo(harness.clock.instant().plusSeconds(15));
        harness.clock.advanceSeconds(10);
        assertThat(harness.activityCoordinator.reclaimExpiredLeases(10)).isZero();
    }

    @Test
    @DisplayName("An expired lease is reclaimed and the old holder can no longer renew or report")
    void reclaimFencesOutOldHolder() {
        ActivityTask stale = claim("worker-1");
        harness.clock.advanceSeconds(16);

        assertThat(harness.activityCoordinator.reclaimExpiredLeases(10)).isEqualTo(1);

        ActivityTask fresh = claim("worker-2");
        assertThat(fresh.taskId()).isEqualTo(stale.taskId());
        assertThat(fresh.attempt()).isEqualTo(1);
        assertThat(fresh.fenceToken()).isGreaterThan(stale.fenceToken());

        assertThatThrownBy(() -> harness.activityCoordinator.renewLease(stale.taskId(), stale.fenceToken()))
            .isInstanceOf(LeaseLostException.class);
        assertThatThrownBy(() -> harness.activityCoordinator.reportResult(
                stale.taskId(), stale.fenceToken(), ActivityResult.success(harness.json())))
            .isInstanceOf(LeaseLostException.class);

        harness.activityCoordinator.reportResult(fresh.taskId(), fresh.fenceToken(),
            ActivityResult.success(harness.json()));
        WorkflowExecution finished = harness.workflowCoordinator.getWorkflow(workflow.workflowId());
        assertThat(finished.state()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(finished.history()).hasSize(1);
        assertThat(harness.meterRegistry.counter("syncbridge.leases.reclaimed", "activity", "sync-users").count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("A result can be reported only once per claim")
    void secondReportRejected() {
        ActivityTask task = claim("worker-1");
        harness.activityCoordinator.reportResult(task.taskId(), task.fenceToken(),
            ActivityResult.success(harness.json()));

        assertThatThrownBy(() -> harness.activityCoordinator.reportResult(
                task.taskId(), task.fenceToken(), ActivityResult.success(harness.json())))
            .isInstanceOf(LeaseLostException.class);
        assertThat(harness.taskQueue.findById(task.taskId()).orElseThrow().state()).isEqualTo(TaskState.DONE);
    }

    @Test
    @DisplayName("The result is in the workflow history before the task leaves the queue")
    void resultRecordedBeforeTaskCompletes() {
        List<Boolean> recordedAtCompletion = new ArrayList<>();
        InMemoryActivityTaskQueue observed = new InMemoryActivityTaskQueue(10, Duration.ofMillis(100)) {
            @Override
            public boolean complete(UUID taskId, long fenceToken) {
                findById(taskId).ifPresent(t -> recordedAtCompletion.add(harness.executionRepository
                    .findById(t.workflowId()).orElseThrow().hasRecorded(t.stepIndex(), t.attempt())));
                return super.complete(taskId, fenceToken);
            }
        };
        WorkflowCoordinator workflows = new WorkflowCoordinator(harness.definitions, harness.executionRepository,
            observed, harness.objectMapper, harness.metrics, harness.clock);
        ActivityCoordinator activities = new ActivityCoordinator(observed, workflows, SyncTestHarness.LEASE_GRACE,
            harness.metrics, harness.clock);
        WorkflowExecution started = workflows.startWorkflow(
            new StartWorkflowRequest("lease-test", "T1", harness.json(), null));
        ActivityTask task = activities.claimTask(Set.of("sync-users"), "worker-1").orElseThrow();

        activities.reportResult(task.taskId(), task.fenceToken(), ActivityResult.success(harness.json()));

        assertThat(recordedAtCompletion).containsExactly(true);
        assertThat(workflows.getWorkflow(started.workflowId()).state()).isEqualTo(WorkflowState.COMPLETED);
    }

    private ActivityTask claim(String workerId) {
        return harness.activityCoordinator.claimTask(Set.of("sync-users"), workerId).orElseThrow();
    }
}
