package com.automation.engine.trigger.event;

public record TaskCompletedEvent(
    String taskId,
    String stepId,
    String organizationId,
    String userId,
    String assignmentId,
    String workflowId
) {}
