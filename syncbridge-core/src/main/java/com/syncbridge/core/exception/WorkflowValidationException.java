package com.syncbridge.core.exception;

import java.util.List;

/**
 * Thrown when a workflow definition or a workflow submission is invalid.
 */
public class WorkflowValidationException extends SyncBridgeException {

    public static final String ERROR_CODE = "WORKFLOW_VALIDATION_FAILED";

    private final List<String> errors;

    public WorkflowValidationException(String message) {
        this(List.of(message));
    }

    public WorkflowValidationException(List<String> errors) {
        super(ERROR_CODE, "Workflow validation failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
