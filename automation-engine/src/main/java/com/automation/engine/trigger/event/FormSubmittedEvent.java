package com.automation.engine.trigger.event;

/**
 * A form (or organizer, which is a kind of form) was submitted.
 * submittedBy stands in for the acting user when no other user is known.
 */
public record FormSubmittedEvent(
    String formSubmissionId,
    String clientId,
    String organizationId,
    String formTemplateId,
    String submittedBy,
    String assignmentId,
    String workflowId
) {}
