package com.syncbridge.core.model;

/**
 * Lifecycle states for a workflow execution.
 * RUNNING is the only non-terminal state.
 */
public enum WorkflowState {
    /**
     * Activities are being dispatched and awaited.
     * Transitions: -> COMPLETED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Every eligible activity succeeded. Terminal state.
     */
    COMPLETED,

    /**
     * An activity failed fatally or exhausted its retry ceiling. Terminal state.
     * Prior successful activities are not rolled back.
     */
    FAILED,

    /**
     * Cancelled by an explicit request while RUNNING. Terminal state.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public boolean canTransitionTo(WorkflowState target) {
        return switch (this) {
            case RUNNING -> target == COMPLETED || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
