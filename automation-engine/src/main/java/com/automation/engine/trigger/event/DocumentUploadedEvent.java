package com.automation.engine.trigger.event;

public record DocumentUploadedEvent(
    String documentId,
    String clientId,
    String organizationId,
    String documentType,
    String assignmentId,
    String workflowId
) {}
