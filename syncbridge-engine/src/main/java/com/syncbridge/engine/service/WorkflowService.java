package com.syncbridge.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.syncbridge.core.model.WorkflowExecution;
import com.syncbridge.core.model.WorkflowState;

import java.util.List;
import java.util.UUID;

/**
 * Starts, inspects and cancels durable workflows.
 */
public interface WorkflowService {

    /**
     * Start a workflow and dispatch its first eligible activity.
     * A request carrying a requestId that was already submitted returns the existing execution.
     *
     * @param request The start request
     * @return The execution as persisted after the first dispatch decision
     */
    WorkflowExecution startWorkflow(StartWorkflowRequest request);

    /**
     * Get workflow execution by ID.
     *
     * @throws com.syncbridge.core.exception.NotFoundException if unknown
     */
    WorkflowExecution getWorkflow(UUID workflowId);

    /**
     * Executions of a tenant, newest first.
     *
     * @param state Optional state filter, null for all
     */
    List<WorkflowExecution> findWorkflows(String tenantId, WorkflowState state, int limit);

    /**
     * Cancel a RUNNING workflow. Queued activities are withdrawn; running ones may still
     * finish and are recorded, but nothing further is scheduled.
     *
     * @throws com.syncbridge.core.exception.InvalidStateTransitionException if not RUNNING
     */
    WorkflowExecution cancelWorkflow(UUID workflowId, String reason);

    /**
     * Re-derive the next step of a RUNNING workflow from its history and dispatch it
     * unless a task is already outstanding. No-op for other states.
     */
    WorkflowExecution resumeWorkflow(UUID workflowId);

    record StartWorkflowRequest(
        String workflowType,
        String tenantId,
        JsonNode input,
        String requestId
    ) {}
}
