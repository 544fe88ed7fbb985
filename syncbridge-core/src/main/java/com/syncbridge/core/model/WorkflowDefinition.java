package com.syncbridge.core.model;

import com.syncbridge.core.exception.WorkflowValidationException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable declaration of a workflow type: an ordered sequence of activity steps.
 *
 * Invariants:
 * - at least one step
 * - step names are unique
 * - every step has a positive timeout
 */
public record WorkflowDefinition(
    String workflowType,
    String description,
    List<ActivityDefinition> steps
) {
    public WorkflowDefinition {
        steps = List.copyOf(steps);
    }

    public ActivityDefinition step(int stepIndex) {
        return steps.get(stepIndex);
    }

    public int stepCount() {
        return steps.size();
    }

    /**
     * Validate the definition.
     *
     * @throws WorkflowValidationException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (workflowType == null || workflowType.isBlank()) {
            errors.add("workflowType is required");
        }
        if (steps.isEmpty()) {
            errors.add("at least one step is required");
        }
        Set<String> names = new HashSet<>();
        for (ActivityDefinition step : steps) {
            if (step.name() == null || step.name().isBlank()) {
                errors.add("step name is required");
                continue;
            }
            if (!names.add(step.name())) {
                errors.add("duplicate step name: " + step.name());
            }
            if (step.timeout() == null || step.timeout().isZero() || step.timeout().isNegative()) {
                errors.add("step " + step.name() + " needs a positive timeout");
            }
        }
        if (!errors.isEmpty()) {
            throw new WorkflowValidationException(errors);
        }
    }

    public static Builder builder(String workflowType) {
        return new Builder(workflowType);
    }

    public static class Builder {
        private final String workflowType;
        private String description;
        private final List<ActivityDefinition> steps = new ArrayList<>();

        private Builder(String workflowType) {
            this.workflowType = workflowType;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder step(ActivityDefinition step) {
            this.steps.add(step);
            return this;
        }

        public Builder step(String activityName) {
            return step(ActivityDefinition.builder(activityName).build());
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(workflowType, description, steps);
        }
    }
}
