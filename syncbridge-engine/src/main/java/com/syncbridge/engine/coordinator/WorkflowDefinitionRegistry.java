package com.syncbridge.engine.coordinator;

import com.syncbridge.core.exception.NotFoundException;
import com.syncbridge.core.model.ActivityDefinition;
import com.syncbridge.core.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workflow definitions known to this process, by workflow type.
 */
public class WorkflowDefinitionRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkflowDefinitionRegistry.class);

    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();

    /**
     * Validate and register a definition, replacing any earlier one of the same type.
     */
    public void register(WorkflowDefinition definition) {
        definition.validate();
        WorkflowDefinition previous = definitions.put(definition.workflowType(), definition);
        if (previous != null) {
            log.warn("Replaced workflow definition {}", definition.workflowType());
        } else {
            log.info("Registered workflow {} with {} steps", definition.workflowType(), definition.stepCount());
        }
    }

    public WorkflowDefinition get(String workflowType) {
        return find(workflowType)
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", workflowType));
    }

    public Optional<WorkflowDefinition> find(String workflowType) {
        return Optional.ofNullable(definitions.get(workflowType));
    }

    public Collection<WorkflowDefinition> all() {
        return definitions.values();
    }

    /**
     * Names of every activity used by a registered workflow.
     */
    public Set<String> activityNames() {
        Set<String> names = new TreeSet<>();
        definitions.values().forEach(d -> d.steps().stream().map(ActivityDefinition::name).forEach(names::add));
        return names;
    }
}
