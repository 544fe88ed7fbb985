package com.syncbridge.recovery;

import com.syncbridge.core.model.AcknowledgmentMessage;
import com.syncbridge.core.model.ActivityDefinition;
import com.syncbridge.core.model.ActivityResult;
import com.syncbridge.core.model.ActivityTask;
import com.syncbridge.core.model.RetryPolicy;
import com.syncbridge.core.model.TrackingStatus;
import com.syncbridge.core.model.WorkflowDefinition;
import com.syncbridge.core.model.WorkflowExecution;
import com.syncbridge.core.model.WorkflowState;
import com.syncbridge.engine.service.WorkflowService.StartWorkflowRequest;
import com.syncbridge.engine.test.SyncTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RecoveryEngineTest {

    private static final Set<String> ACTIVITIES = Set.of("allocate-credits", "notify-applications");

    private SyncTestHarness harness;
    private RecoverySettings settings;
    private RecoveryEngine recovery;

    @BeforeEach
    void setUp() {
        harness = new SyncTestHarness();
        harness.definitions.register(WorkflowDefinition.builder("credit.allocation")
            .step(ActivityDefinition.builder("allocate-credits")
                .retryPolicy(RetryPolicy.immediate(3))
                .timeout(Duration.ofSeconds(10))
                .build())
            .step(ActivityDefinition.builder("notify-applications")
                .retryPolicy(RetryPolicy.immediate(3))
                .timeout(Duration.ofSeconds(10))
                .build())
            .build());
        settings = new RecoverySettings(
            Duration.ofMillis(20), Duration.ofMillis(20), Duration.ofHours(24),
            Duration.ofMillis(20), Duration.ofMinutes(1), Duration.ofMillis(20), Duration.ofDays(7),
            Duration.ofMillis(20), List.of(SyncTestHarness.CRM), 100);
        recovery = newRecovery();
    }

    @Test
    @DisplayName("Tasks of a crashed worker are requeued once their lease expires")
    void reclaimsExpiredLeases() {
        WorkflowExecution workflow = start();
        ActivityTask abandoned = harness.activityCoordinator.claimTask(ACTIVITIES, "crashed-worker").orElseThrow();

        assertThat(recovery.reclaimExpiredLeases()).isZero();
        harness.clock.advanceSeconds(16);
        assertThat(recovery.reclaimExpiredLeases()).isEqualTo(1);

        ActivityTask retaken = harness.activityCoordinator.claimTask(ACTIVITIES, "worker-2").orElseThrow();
        assertThat(retaken.taskId()).isEqualTo(abandoned.taskId());
        assertThat(retaken.workflowId()).isEqualTo(workflow.workflowId());
        assertThat(retaken.attempt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Events left unacknowledged past the ack window expire")
    void expiresStaleEvents() {
        String eventId = harness.publisher.publish("credit.allocated", "T1", "Organization", "E1",
            harness.creditAllocated("a-1", 100), "billing");

        harness.clock.advance(Duration.ofHours(23));
        assertThat(recovery.expireStaleEvents()).isZero();
        harness.clock.advance(Duration.ofHours(2));
        assertThat(recovery.expireStaleEvents()).isEqualTo(1);

        assertThat(harness.trackingService.getEventStatus(eventId).orElseThrow().status())
            .isEqualTo(TrackingStatus.EXPIRED);
    }

    @Test
    @DisplayName("Terminal records are purged after retention, pending ones are kept")
    void purgesTerminalRecords() {
        String acked = harness.publisher.publish("credit.allocated", "T1", "Organization", "E1",
            harness.creditAllocated("a-1", 100), "billing");
        String pending = harness.publisher.publish("credit.allocated", "T1", "Organization", "E2",
            harness.creditAllocated("a-2", 100), "billing");
        harness.trackingService.applyAcknowledgment(
            AcknowledgmentMessage.ok(acked, "T1", SyncTestHarness.CRM, harness.clock.instant()));

        harness.clock.advance(Duration.ofDays(8));
        assertThat(recovery.purgeTerminalEvents()).isEqualTo(1);

        assertThat(harness.trackingService.getEventStatus(acked)).isEmpty();
        assertThat(harness.trackingService.getEventStatus(pending)).isPresent();
    }

    @Test
    @DisplayName("Finished activity tasks are purged after retention, outstanding ones are kept")
    void purgesFinishedTasks() {
        WorkflowExecution finished = start();
        ActivityTask allocate = harness.activityCoordinator.claimTask(ACTIVITIES, "worker-1").orElseThrow();
        harness.activityCoordinator.reportResult(allocate.taskId(), allocate.fenceToken(),
            ActivityResult.success(harness.json()));
        ActivityTask notify = harness.taskQueue.findOutstanding(finished.workflowId()).get(0);

        harness.clock.advance(Duration.ofDays(8));
        assertThat(recovery.purgeFinishedTasks()).isEqualTo(1);

        assertThat(harness.taskQueue.findById(allocate.taskId())).isEmpty();
        assertThat(harness.taskQueue.findById(notify.taskId())).isPresent();
        assertThat(harness.workflowCoordinator.getWorkflow(finished.workflowId()).history()).hasSize(1);
    }

    @Test
    @DisplayName("A stalled workflow is resumed without re-running its completed activity")
    void resumesAfterOrchestratorRestart() {
        Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();
        WorkflowExecution workflow = start();
        ActivityTask allocate = harness.activityCoordinator.claimTask(ACTIVITIES, "worker-1").orElseThrow();
        invocations.computeIfAbsent(allocate.activityName(), k -> new AtomicInteger()).incrementAndGet();
        harness.activityCoordinator.reportResult(allocate.taskId(), allocate.fenceToken(),
            ActivityResult.success(harness.json().put("granted", 100)));

        // the dispatched notify task is lost together with the orchestrator
        ActivityTask lost = harness.activityCoordinator.claimTask(ACTIVITIES, "worker-1").orElseThrow();
        harness.taskQueue.complete(lost.taskId(), lost.fenceToken());
        harness.restartCoordinators();
        recovery = newRecovery();

        harness.clock.advance(Duration.ofMinutes(2));
        assertThat(recovery.resumeRunningWorkflows(settings.stalledAfter())).isEqualTo(1);

        ActivityTask resumed = harness.activityCoordinator.claimTask(ACTIVITIES, "worker-2").orElseThrow();
        assertThat(resumed.activityName()).isEqualTo("notify-applications");
        invocations.computeIfAbsent(resumed.activityName(), k -> new AtomicInteger()).incrementAndGet();
        harness.activityCoordinator.reportResult(resumed.taskId(), resumed.fenceToken(),
            ActivityResult.success(harness.json()));

        assertThat(harness.workflowCoordinator.getWorkflow(workflow.workflowId()).state())
            .isEqualTo(WorkflowState.COMPLETED);
        assertThat(invocations.get("allocate-credits").get()).isEqualTo(1);
        assertThat(invocations.get("notify-applications").get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Workflows with an outstanding task are not dispatched twice")
    void resumeLeavesWaitingWorkflowsAlone() {
        WorkflowExecution workflow = start();
        harness.clock.advance(Duration.ofMinutes(5));

        recovery.resumeRunningWorkflows(settings.stalledAfter());

        assertThat(harness.taskQueue.findOutstanding(workflow.workflowId())).hasSize(1);
    }

    @Test
    @DisplayName("Workflows waiting on their task do not hide a stalled workflow from later sweeps")
    void resumeSweepsPastWaitingWorkflows() {
        settings = settingsWithBatchSize(1);
        recovery = newRecovery();
        WorkflowExecution waiting = start();
        harness.clock.advanceSeconds(1);
        WorkflowExecution stalled = start();
        ActivityTask held = loseTaskOf(stalled, waiting);
        harness.clock.advance(Duration.ofMinutes(2));

        for (int sweep = 0; sweep < 3; sweep++) {
            recovery.resumeRunningWorkflows(settings.stalledAfter());
        }

        assertThat(harness.taskQueue.findOutstanding(stalled.workflowId())).hasSize(1);
        assertThat(harness.taskQueue.findOutstanding(waiting.workflowId())).singleElement()
            .satisfies(task -> assertThat(task.taskId()).isEqualTo(held.taskId()));
    }

    @Test
    @DisplayName("The startup pass pages through every running workflow")
    void startupResumesBeyondOnePage() {
        settings = settingsWithBatchSize(1);
        recovery = newRecovery();
        WorkflowExecution waiting = start();
        WorkflowExecution stalled = start();
        loseTaskOf(stalled, waiting);

        assertThat(recovery.resumeAllRunningWorkflows()).isEqualTo(2);

        assertThat(harness.taskQueue.findOutstanding(stalled.workflowId())).hasSize(1);
        assertThat(harness.taskQueue.findOutstanding(waiting.workflowId())).hasSize(1);
    }

    @Test
    @DisplayName("Starting the engine resumes running workflows immediately")
    void startResumesWorkflows() {
        WorkflowExecution workflow = start();
        ActivityTask lost = harness.activityCoordinator.claimTask(ACTIVITIES, "worker-1").orElseThrow();
        harness.taskQueue.complete(lost.taskId(), lost.fenceToken());

        recovery.start();
        try {
            assertThat(harness.taskQueue.findOutstanding(workflow.workflowId())).hasSize(1);
        } finally {
            recovery.stop();
        }
    }

    private WorkflowExecution start() {
        return harness.workflowCoordinator.startWorkflow(new StartWorkflowRequest(
            "credit.allocation", "T1", harness.json().put("orgId", "T1").put("amount", 100), null));
    }

    /**
     * Claims the task of {@code waiting} and keeps it running, then drops the task of {@code stalled}
     * without recording a result.
     */
    private ActivityTask loseTaskOf(WorkflowExecution stalled, WorkflowExecution waiting) {
        ActivityTask held = harness.activityCoordinator.claimTask(ACTIVITIES, "worker-1").orElseThrow();
        ActivityTask lost = harness.activityCoordinator.claimTask(ACTIVITIES, "worker-1").orElseThrow();
        if (held.workflowId().equals(stalled.workflowId())) {
            ActivityTask swap = held;
            held = lost;
            lost = swap;
        }
        assertThat(held.workflowId()).isEqualTo(waiting.workflowId());
        harness.taskQueue.complete(lost.taskId(), lost.fenceToken());
        return held;
    }

    private RecoverySettings settingsWithBatchSize(int batchSize) {
        return new RecoverySettings(
            settings.leaseCheckInterval(), settings.expiryCheckInterval(), settings.ackWindow(),
            settings.resumeInterval(), settings.stalledAfter(), settings.purgeInterval(), settings.retention(),
            settings.reconcileInterval(), settings.reconcileApplications(), batchSize);
    }

    private RecoveryEngine newRecovery() {
        TrackingReconciler reconciler = new TrackingReconciler(harness.transport, harness.cursorRepository,
            harness.trackingRepository, harness.codec, harness.payloadRegistry, harness.keyResolver, harness.clock);
        return new RecoveryEngine(harness.activityCoordinator, harness.workflowCoordinator,
            harness.executionRepository, harness.trackingService, reconciler, settings, harness.clock);
    }
}
