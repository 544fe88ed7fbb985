package com.syncbridge.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.syncbridge.core.model.ActivityInvocation;
import com.syncbridge.core.model.WorkflowExecution;
import com.syncbridge.core.model.WorkflowState;
import com.syncbridge.engine.service.WorkflowService;
import com.syncbridge.engine.service.WorkflowService.StartWorkflowRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for workflow management.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private final WorkflowService workflowService;

    public WorkflowController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    /**
     * Start a workflow. Repeating a request with the same requestId returns the original execution.
     */
    @PostMapping
    public ResponseEntity<WorkflowExecutionResponse> startWorkflow(@RequestBody StartWorkflowRequestDto request) {
        WorkflowExecution execution = workflowService.startWorkflow(new StartWorkflowRequest(
            request.workflowType(),
            request.tenantId(),
            request.input(),
            request.requestId()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkflowExecutionResponse.from(execution));
    }

    @GetMapping("/{workflowId}")
    public ResponseEntity<WorkflowExecutionResponse> getWorkflow(@PathVariable UUID workflowId) {
        return ResponseEntity.ok(WorkflowExecutionResponse.from(workflowService.getWorkflow(workflowId)));
    }

    /**
     * Executions of a tenant, newest first.
     */
    @GetMapping
    public ResponseEntity<List<WorkflowExecutionResponse>> findWorkflows(
            @RequestParam String tenantId,
            @RequestParam(required = false) WorkflowState state,
            @RequestParam(defaultValue = "100") int limit) {
        List<WorkflowExecutionResponse> responses = workflowService.findWorkflows(tenantId, state, limit).stream()
            .map(WorkflowExecutionResponse::from)
            .toList();
        return ResponseEntity.ok(responses);
    }

    @PostMapping("/{workflowId}/cancel")
    public ResponseEntity<WorkflowExecutionResponse> cancelWorkflow(
            @PathVariable UUID workflowId,
            @RequestBody(required = false) CancelRequest request) {
        String reason = request != null && request.reason() != null ? request.reason() : "Manual cancellation";
        return ResponseEntity.ok(WorkflowExecutionResponse.from(workflowService.cancelWorkflow(workflowId, reason)));
    }

    // ========== DTOs ==========

    public record StartWorkflowRequestDto(
        String workflowType,
        String tenantId,
        JsonNode input,
        String requestId
    ) {}

    public record CancelRequest(String reason) {}

    public record InvocationResponse(
        String activityName,
        int attempt,
        String outcome,
        String errorCode,
        String errorDetail,
        Instant completedAt
    ) {
        static InvocationResponse from(ActivityInvocation invocation) {
            return new InvocationResponse(
                invocation.activityName(),
                invocation.attempt(),
                invocation.outcome().name(),
                invocation.errorCode(),
                invocation.errorDetail(),
                invocation.completedAt()
            );
        }
    }

    public record WorkflowExecutionResponse(
        UUID workflowId,
        String workflowType,
        String tenantId,
        String requestId,
        WorkflowState state,
        JsonNode input,
        JsonNode result,
        String lastError,
        List<InvocationResponse> history,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt
    ) {
        public static WorkflowExecutionResponse from(WorkflowExecution execution) {
            return new WorkflowExecutionResponse(
                execution.workflowId(),
                execution.workflowType(),
                execution.tenantId(),
                execution.requestId(),
                execution.state(),
                execution.input(),
                execution.result(),
                execution.lastError(),
                execution.history().stream().map(InvocationResponse::from).toList(),
                execution.createdAt(),
                execution.updatedAt(),
                execution.completedAt()
            );
        }
    }
}
