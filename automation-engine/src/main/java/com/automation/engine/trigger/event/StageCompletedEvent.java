package com.automation.engine.trigger.event;

public record StageCompletedEvent(
    String stageId,
    String workflowId,
    String organizationId,
    String userId,
    String assignmentId
) {}
