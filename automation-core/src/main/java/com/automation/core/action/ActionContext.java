package com.automation.core.action;

import com.automation.core.model.AutomationTrigger;
import com.automation.core.model.HierarchyNode;
import com.automation.core.model.ScheduleType;
import com.automation.core.model.TriggerEvent;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * Context passed to the action executor for one scheduled run or one event dispatch.
 */
public record ActionContext(
    // Scheduled triggers only
    String triggerId,
    String triggerName,
    ScheduleType scheduleType,
    
    String organizationId,
    String workflowId,
    String stageId,
    String stepId,
    String userId,
    String clientId,
    String assignmentId,
    
    // Event triggers only
    TriggerEvent event,
    
    Instant executedAt,
    JsonNode data
) {
    /**
     * Context for a scheduled trigger run.
     */
    public static ActionContext forScheduledTrigger(AutomationTrigger trigger, Instant executedAt) {
        return new ActionContext(
            trigger.id(),
            trigger.name(),
            trigger.scheduleType(),
            trigger.organizationId(),
            trigger.workflowId(),
            null,
            null,
            null,
            null,
            null,
            null,
            executedAt,
            null
        );
    }

    /**
     * Context for the completion actions of a node completed by a cascade.
     * Stage and step nodes name themselves and their direct parent.
     */
    public static ActionContext forNodeCompletion(HierarchyNode node, String actorId, Instant executedAt) {
        String workflowId = null;
        String stageId = null;
        String stepId = null;
        switch (node.level()) {
            case WORKFLOW -> workflowId = node.id();
            case STAGE -> {
                workflowId = node.parentId();
                stageId = node.id();
            }
            case STEP -> {
                stageId = node.parentId();
                stepId = node.id();
            }
            case TASK -> stepId = node.parentId();
            default -> { }
        }
        return new ActionContext(
            null,
            null,
            null,
            null,
            workflowId,
            stageId,
            stepId,
            actorId,
            null,
            null,
            null,
            executedAt,
            null
        );
    }

    /**
     * Context for an event trigger, built from the enriched payload.
     * The user falls back to the payload's submittedBy when no userId is present.
     */
    public static ActionContext forEvent(TriggerEvent event, JsonNode payload, Instant executedAt) {
        String userId = text(payload, "userId");
        if (userId == null) {
            userId = text(payload, "submittedBy");
        }
        return new ActionContext(
            null,
            null,
            null,
            text(payload, "organizationId"),
            text(payload, "workflowId"),
            text(payload, "stageId"),
            text(payload, "stepId"),
            userId,
            text(payload, "clientId"),
            text(payload, "assignmentId"),
            event,
            executedAt,
            payload
        );
    }

    private static String text(JsonNode payload, String field) {
        if (payload == null) {
            return null;
        }
        JsonNode value = payload.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
