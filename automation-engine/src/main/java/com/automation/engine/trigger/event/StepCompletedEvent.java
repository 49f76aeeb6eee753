package com.automation.engine.trigger.event;

public record StepCompletedEvent(
    String stepId,
    String stageId,
    String organizationId,
    String userId,
    String assignmentId,
    String workflowId
) {}
