package com.syncbridge.engine.persistence;

import com.syncbridge.core.exception.OptimisticLockException;
import com.syncbridge.core.model.WorkflowExecution;
import com.syncbridge.core.model.WorkflowState;
import com.syncbridge.core.repository.WorkflowExecutionRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of WorkflowExecutionRepository.
 * For single-process deployments and testing.
 */
public class InMemoryWorkflowExecutionRepository implements WorkflowExecutionRepository {

    private static final Comparator<WorkflowExecution> PAGE_ORDER =
        Comparator.comparing(WorkflowExecution::updatedAt).thenComparing(WorkflowExecution::workflowId);

    private final Map<UUID, WorkflowExecution> executions = new ConcurrentHashMap<>();
    private final Map<String, UUID> byRequestId = new ConcurrentHashMap<>();

    @Override
    public synchronized boolean save(WorkflowExecution execution) {
        if (execution.requestId() != null) {
            if (byRequestId.putIfAbsent(execution.requestId(), execution.workflowId()) != null) {
                return false;
            }
        }
        executions.put(execution.workflowId(), execution);
        return true;
    }

    @Override
    public synchronized void update(WorkflowExecution execution) {
        WorkflowExecution existing = executions.get(execution.workflowId());
        long expected = execution.version() - 1;
        if (existing == null || existing.version() != expected) {
            throw new OptimisticLockException("WorkflowExecution", execution.workflowId().toString(), expected);
        }
        executions.put(execution.workflowId(), execution);
    }

    @Override
    public Optional<WorkflowExecution> findById(UUID workflowId) {
        return Optional.ofNullable(executions.get(workflowId));
    }

    @Override
    public Optional<WorkflowExecution> findByRequestId(String requestId) {
        UUID workflowId = byRequestId.get(requestId);
        return workflowId == null ? Optional.empty() : findById(workflowId);
    }

    @Override
    public List<WorkflowExecution> findByStateUpdatedBefore(
            WorkflowState state, Instant updatedBefore, WorkflowExecution after, int limit) {
        return executions.values().stream()
            .filter(e -> e.state() == state)
            .filter(e -> e.updatedAt().isBefore(updatedBefore))
            .filter(e -> after == null || PAGE_ORDER.compare(e, after) > 0)
            .sorted(PAGE_ORDER)
            .limit(limit)
            .toList();
    }

    @Override
    public List<WorkflowExecution> findByTenant(String tenantId, WorkflowState state, int limit) {
        return executions.values().stream()
            .filter(e -> e.tenantId().equals(tenantId))
            .filter(e -> state == null || e.state() == state)
            .sorted(Comparator.comparing(WorkflowExecution::createdAt).reversed())
            .limit(limit)
            .toList();
    }
}
