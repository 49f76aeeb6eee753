package com.automation.engine.trigger.event;

public record ProposalAcceptedEvent(
    String proposalId,
    String clientId,
    String organizationId,
    String assignmentId,
    String workflowId
) {}
