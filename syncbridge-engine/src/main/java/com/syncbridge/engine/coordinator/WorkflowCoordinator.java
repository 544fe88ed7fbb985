package com.syncbridge.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.syncbridge.core.exception.InvalidStateTransitionException;
import com.syncbridge.core.exception.NotFoundException;
import com.syncbridge.core.exception.OptimisticLockException;
import com.syncbridge.core.model.ActivityDefinition;
import com.syncbridge.core.model.ActivityInvocation;
import com.syncbridge.core.model.ActivityOutcome;
import com.syncbridge.core.model.ActivityResult;
import com.syncbridge.core.model.ActivityTask;
import com.syncbridge.core.model.WorkflowDefinition;
import com.syncbridge.core.model.WorkflowExecution;
import com.syncbridge.core.model.WorkflowState;
import com.syncbridge.core.repository.ActivityTaskQueue;
import com.syncbridge.core.repository.WorkflowExecutionRepository;
import com.syncbridge.engine.logging.LoggingContext;
import com.syncbridge.engine.metrics.SyncMetrics;
import com.syncbridge.engine.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives workflow executions from their persisted history.
 *
 * The next step is a pure function of the definition, the workflow input and the history:
 * steps that already succeeded are passed over, a step whose condition is false is skipped
 * without a trace, and the first remaining step is dispatched as an activity task.
 * The coordinator owns no threads; it advances when a workflow starts, when a worker
 * reports a result and when recovery resumes a stalled execution.
 */
public class WorkflowCoordinator implements WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);

    public static final String WORKFLOW_EXHAUSTED = "WORKFLOW_EXHAUSTED";
    private static final int MAX_CAS_ATTEMPTS = 5;

    private final WorkflowDefinitionRegistry definitions;
    private final WorkflowExecutionRepository executionRepository;
    private final ActivityTaskQueue taskQueue;
    private final ObjectMapper objectMapper;
    private final SyncMetrics metrics;
    private final Clock clock;

    public WorkflowCoordinator(
            WorkflowDefinitionRegistry definitions,
            WorkflowExecutionRepository executionRepository,
            ActivityTaskQueue taskQueue,
            ObjectMapper objectMapper,
            SyncMetrics metrics,
            Clock clock) {
        this.definitions = definitions;
        this.executionRepository = executionRepository;
        this.taskQueue = taskQueue;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public WorkflowExecution startWorkflow(StartWorkflowRequest request) {
        if (request.requestId() != null) {
            var existing = executionRepository.findByRequestId(request.requestId());
            if (existing.isPresent()) {
                log.info("Found existing workflow for request {}: {}", request.requestId(), existing.get().workflowId());
                return existing.get();
            }
        }

        WorkflowDefinition definition = definitions.get(request.workflowType());
        WorkflowExecution execution = WorkflowExecution.start(
            definition.workflowType(),
            request.tenantId(),
            request.requestId(),
            request.input() != null ? request.input() : NullNode.getInstance(),
            clock.instant()
        );

        if (!executionRepository.save(execution)) {
            // lost a race with an identical submission
            return executionRepository.findByRequestId(request.requestId())
                .orElseThrow(() -> new NotFoundException("WorkflowExecution", request.requestId()));
        }

        try (LoggingContext ctx = LoggingContext.forWorkflow(execution.workflowId(), execution.tenantId())) {
            metrics.workflowStarted(definition.workflowType());
            log.info("Started workflow {} ({})", definition.workflowType(), execution.workflowId());
            return advance(execution, definition);
        }
    }

    @Override
    public WorkflowExecution getWorkflow(UUID workflowId) {
        return executionRepository.findById(workflowId)
            .orElseThrow(() -> new NotFoundException("WorkflowExecution", workflowId.toString()));
    }

    @Override
    public List<WorkflowExecution> findWorkflows(String tenantId, WorkflowState state, int limit) {
        return executionRepository.findByTenant(tenantId, state, limit);
    }

    @Override
    public WorkflowExecution cancelWorkflow(UUID workflowId, String reason) {
        for (int attempt = 1; ; attempt++) {
            WorkflowExecution execution = getWorkflow(workflowId);
            if (execution.state() != WorkflowState.RUNNING) {
                throw new InvalidStateTransitionException(
                    "WorkflowExecution", workflowId.toString(), execution.state(), WorkflowState.CANCELLED);
            }
            WorkflowExecution cancelled = execution.withCancelled(
                reason != null ? reason : "Cancelled", clock.instant());
            try {
                executionRepository.update(cancelled);
            } catch (OptimisticLockException e) {
                if (attempt >= MAX_CAS_ATTEMPTS) {
                    throw e;
                }
                continue;
            }

            int withdrawn = taskQueue.withdrawQueued(workflowId);
            metrics.workflowCancelled(execution.workflowType());
            try (LoggingContext ctx = LoggingContext.forWorkflow(workflowId, execution.tenantId())) {
                log.info("Cancelled workflow {} ({} queued tasks withdrawn): {}", workflowId, withdrawn, reason);
            }
            return cancelled;
        }
    }

    @Override
    public WorkflowExecution resumeWorkflow(UUID workflowId) {
        WorkflowExecution execution = getWorkflow(workflowId);
        if (execution.state() != WorkflowState.RUNNING) {
            return execution;
        }
        if (!taskQueue.findOutstanding(workflowId).isEmpty()) {
            return execution;
        }
        try (LoggingContext ctx = LoggingContext.forWorkflow(workflowId, execution.tenantId())) {
            log.info("Resuming workflow {} from {} recorded invocations", workflowId, execution.history().size());
            return advance(execution, definitions.get(execution.workflowType()));
        }
    }

    /**
     * Record the result of an activity attempt and decide what happens next.
     * A result already recorded for the same step and attempt is ignored.
     */
    public void onActivityResult(ActivityTask task, ActivityResult result) {
        recordResult(task, result).ifPresent(this::continueAfter);
    }

    /**
     * Append the result of an activity attempt to the workflow history without scheduling anything.
     *
     * @return The updated execution when it should advance; empty when the result was ignored
     *     or the workflow was cancelled
     */
    public Optional<WorkflowExecution> recordResult(ActivityTask task, ActivityResult result) {
        try (LoggingContext ctx = LoggingContext.forActivity(task.workflowId(), task.activityName(), task.attempt())) {
            for (int attempt = 1; ; attempt++) {
                WorkflowExecution execution = getWorkflow(task.workflowId());
                if (execution.state().isTerminal() && execution.state() != WorkflowState.CANCELLED) {
                    log.debug("Ignoring result for {} workflow {}", execution.state(), execution.workflowId());
                    return Optional.empty();
                }
                if (execution.hasRecorded(task.stepIndex(), task.attempt())) {
                    log.debug("Result for step {} attempt {} already recorded", task.stepIndex(), task.attempt());
                    return Optional.empty();
                }

                Instant now = clock.instant();
                ActivityInvocation invocation = ActivityInvocation.of(task, result, now);
                WorkflowExecution recorded = execution.withInvocation(invocation, now);
                try {
                    executionRepository.update(recorded);
                } catch (OptimisticLockException e) {
                    if (attempt >= MAX_CAS_ATTEMPTS) {
                        throw e;
                    }
                    continue;
                }

                metrics.activityFinished(task.activityName(), result.outcome().name(),
                    Duration.between(invocation.startedAt(), now));
                if (recorded.state() == WorkflowState.CANCELLED) {
                    log.info("Recorded {} for cancelled workflow; nothing further scheduled", result.outcome());
                    return Optional.empty();
                }
                return Optional.of(recorded);
            }
        }
    }

    /**
     * Decide and apply the next step of an execution whose latest result was just recorded.
     */
    public WorkflowExecution continueAfter(WorkflowExecution recorded) {
        try (LoggingContext ctx = LoggingContext.forWorkflow(recorded.workflowId(), recorded.tenantId())) {
            return advance(recorded, definitions.get(recorded.workflowType()));
        }
    }

    // ========== Decision ==========

    enum Action { DISPATCH, COMPLETE, FAIL }

    /**
     * Outcome of one decision: dispatch a step attempt, complete with a result, or fail.
     */
    record Decision(Action action, int stepIndex, int attempt, Duration delay,
                    JsonNode result, String errorCode, String detail) {

        static Decision dispatch(int stepIndex, int attempt, Duration delay) {
            return new Decision(Action.DISPATCH, stepIndex, attempt, delay, null, null, null);
        }

        static Decision complete(JsonNode result) {
            return new Decision(Action.COMPLETE, -1, 0, Duration.ZERO, result, null, null);
        }

        static Decision fail(String errorCode, String detail) {
            return new Decision(Action.FAIL, -1, 0, Duration.ZERO, null, errorCode, detail);
        }
    }

    /**
     * Decide the next action from definition, input and history alone.
     */
    static Decision decide(WorkflowDefinition definition, WorkflowExecution execution) {
        List<ActivityInvocation> history = execution.history();
        for (int i = 0; i < definition.stepCount(); i++) {
            if (execution.hasSucceeded(i)) {
                continue;
            }
            ActivityDefinition step = definition.step(i);
            List<ActivityInvocation> attempts = execution.attemptsOf(i);
            if (attempts.isEmpty()) {
                final int stepIndex = i;
                List<ActivityInvocation> earlier = history.stream()
                    .filter(inv -> inv.stepIndex() < stepIndex)
                    .toList();
                if (!step.condition().shouldRun(execution.input(), earlier)) {
                    continue;
                }
                return Decision.dispatch(i, 1, Duration.ZERO);
            }

            ActivityInvocation last = attempts.get(attempts.size() - 1);
            if (last.outcome() == ActivityOutcome.FATAL_FAILURE) {
                return Decision.fail(last.errorCode(), String.format(
                    "%s failed fatally on attempt %d: %s", step.name(), last.attempt(), last.errorDetail()));
            }
            if (attempts.size() >= step.retryPolicy().maxAttempts()) {
                return Decision.fail(WORKFLOW_EXHAUSTED, String.format(
                    "%s exhausted %d attempts, last error %s: %s",
                    step.name(), attempts.size(), last.errorCode(), last.errorDetail()));
            }
            return Decision.dispatch(i, attempts.size() + 1,
                step.retryPolicy().computeBackoff(attempts.size(), jitterSeed(execution.workflowId(), i, attempts.size())));
        }

        JsonNode result = null;
        for (ActivityInvocation inv : history) {
            if (inv.isSuccess()) {
                result = inv.output();
            }
        }
        return Decision.complete(result);
    }

    /**
     * Jitter seed of one retry, so replaying a history yields the same delay.
     */
    static long jitterSeed(UUID workflowId, int stepIndex, int failedAttempt) {
        long seed = workflowId.getMostSignificantBits() ^ workflowId.getLeastSignificantBits();
        return (seed * 31 + stepIndex) * 31 + failedAttempt;
    }

    // ========== Helper Methods ==========

    private WorkflowExecution advance(WorkflowExecution execution, WorkflowDefinition definition) {
        WorkflowExecution current = execution;
        for (int attempt = 1; ; attempt++) {
            Decision decision = decide(definition, current);
            try {
                return apply(decision, current, definition);
            } catch (OptimisticLockException e) {
                if (attempt >= MAX_CAS_ATTEMPTS) {
                    throw e;
                }
                current = getWorkflow(execution.workflowId());
                if (current.state() != WorkflowState.RUNNING) {
                    return current;
                }
            }
        }
    }

    private WorkflowExecution apply(Decision decision, WorkflowExecution execution, WorkflowDefinition definition) {
        Instant now = clock.instant();
        switch (decision.action()) {
            case DISPATCH -> {
                dispatch(execution, definition.step(decision.stepIndex()), decision, now);
                return execution;
            }
            case COMPLETE -> {
                WorkflowExecution completed = execution.withCompleted(decision.result(), now);
                executionRepository.update(completed);
                metrics.workflowCompleted(execution.workflowType(), Duration.between(execution.createdAt(), now));
                log.info("Workflow {} completed after {} invocations", execution.workflowId(), execution.history().size());
                return completed;
            }
            default -> {
                WorkflowExecution failed = execution.withFailed(decision.errorCode() + ": " + decision.detail(), now);
                executionRepository.update(failed);
                metrics.workflowFailed(execution.workflowType(), decision.errorCode());
                log.warn("Workflow {} failed: {}", execution.workflowId(), decision.detail());
                return failed;
            }
        }
    }

    private void dispatch(WorkflowExecution execution, ActivityDefinition step, Decision dispatch, Instant now) {
        boolean outstanding = taskQueue.findOutstanding(execution.workflowId()).stream()
            .anyMatch(t -> t.stepIndex() == dispatch.stepIndex() && t.attempt() == dispatch.attempt());
        if (outstanding) {
            log.debug("Step {} attempt {} already dispatched", step.name(), dispatch.attempt());
            return;
        }

        ActivityTask task = ActivityTask.create(
            execution.workflowId(),
            execution.tenantId(),
            step.name(),
            dispatch.stepIndex(),
            dispatch.attempt(),
            step.keyFor(execution.workflowId(), execution.tenantId(), execution.input()),
            activityInput(execution),
            step.timeout(),
            now,
            now.plus(dispatch.delay())
        );
        taskQueue.enqueue(task);

        if (dispatch.attempt() > 1) {
            metrics.activityRetried(step.name(), dispatch.attempt());
            log.info("Dispatched {} attempt {} after {}ms backoff",
                step.name(), dispatch.attempt(), dispatch.delay().toMillis());
        } else {
            log.info("Dispatched {} (step {})", step.name(), dispatch.stepIndex());
        }
    }

    /**
     * Activities receive the workflow input and the outputs of the steps that already succeeded.
     */
    private JsonNode activityInput(WorkflowExecution execution) {
        ObjectNode input = objectMapper.createObjectNode();
        input.set("input", execution.input());
        ObjectNode results = input.putObject("results");
        for (ActivityInvocation inv : execution.history()) {
            if (inv.isSuccess()) {
                results.set(inv.activityName(), inv.output() != null ? inv.output() : NullNode.getInstance());
            }
        }
        return input;
    }
}
