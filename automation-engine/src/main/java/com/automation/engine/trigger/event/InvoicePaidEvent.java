package com.automation.engine.trigger.event;

public record InvoicePaidEvent(
    String invoiceId,
    String clientId,
    String organizationId,
    String assignmentId,
    String workflowId
) {}
