package com.automation.core.model;

import java.util.List;
import java.util.Objects;

/**
 * In-memory subscription of actions to a domain event.
 * Registered at process start-up and never persisted by the core.
 */
public record EventTriggerConfig(
    String id,
    TriggerEvent event,
    
    // Scope filters
    String workflowId,
    String stageId,
    String stepId,
    
    List<Condition> conditions,
    List<ActionConfig> actions,
    AutoAdvance autoAdvance
) {
    public EventTriggerConfig {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(event, "event");
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public boolean hasConditions() {
        return !conditions.isEmpty();
    }

    public boolean hasActions() {
        return !actions.isEmpty();
    }

    public boolean autoAdvanceEnabled() {
        return autoAdvance != null && autoAdvance.enabled();
    }

    /**
     * A config scoped to a workflow only matches payloads of that workflow.
     * Payloads that name no workflow are not filtered out.
     */
    public boolean matchesWorkflow(String payloadWorkflowId) {
        return workflowId == null || payloadWorkflowId == null || workflowId.equals(payloadWorkflowId);
    }
}
