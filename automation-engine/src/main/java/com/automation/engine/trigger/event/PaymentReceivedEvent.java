package com.automation.engine.trigger.event;

import java.math.BigDecimal;

/**
 * A payment was recorded against an invoice.
 */
public record PaymentReceivedEvent(
    String invoiceId,
    String clientId,
    String organizationId,
    BigDecimal amount,
    String assignmentId,
    String workflowId
) {}
