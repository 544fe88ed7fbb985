package com.syncbridge.core.repository;

import com.syncbridge.core.exception.OptimisticLockException;
import com.syncbridge.core.model.WorkflowExecution;
import com.syncbridge.core.model.WorkflowState;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for workflow executions and their activity history.
 */
public interface WorkflowExecutionRepository {

    /**
     * Save a new execution.
     *
     * @return false if an execution with the same requestId already exists
     */
    boolean save(WorkflowExecution execution);

    /**
     * Replace an execution, provided the stored version equals {@code execution.version() - 1}.
     *
     * @throws OptimisticLockException on a concurrent update
     */
    void update(WorkflowExecution execution);

    Optional<WorkflowExecution> findById(UUID workflowId);

    Optional<WorkflowExecution> findByRequestId(String requestId);

    /**
     * Executions in the given state not updated since the given instant, ordered by
     * {@code (updatedAt, workflowId)}. Paging resumes strictly after {@code after}; null starts from the oldest.
     */
    List<WorkflowExecution> findByStateUpdatedBefore(
        WorkflowState state, Instant updatedBefore, WorkflowExecution after, int limit);

    /**
     * Executions of a tenant, newest first; state may be null for all states.
     */
    List<WorkflowExecution> findByTenant(String tenantId, WorkflowState state, int limit);
}
