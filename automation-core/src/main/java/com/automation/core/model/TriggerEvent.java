package com.automation.core.model;

/**
 * Domain events that event triggers can subscribe to.
 */
public enum TriggerEvent {
    PAYMENT_RECEIVED("payment_received"),
    INVOICE_PAID("invoice_paid"),
    DOCUMENT_UPLOADED("document_uploaded"),
    ORGANIZER_SUBMITTED("organizer_submitted"),
    FORM_SUBMITTED("form_submitted"),
    PROPOSAL_ACCEPTED("proposal_accepted"),
    TASK_COMPLETED("task_completed"),
    STEP_COMPLETED("step_completed"),
    STAGE_COMPLETED("stage_completed");

    private final String wireName;

    TriggerEvent(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used in persisted configuration and in advance reasons.
     */
    public String wireName() {
        return wireName;
    }

    public static TriggerEvent fromWireName(String wireName) {
        for (TriggerEvent event : values()) {
            if (event.wireName.equals(wireName)) {
                return event;
            }
        }
        throw new IllegalArgumentException("Unknown trigger event: " + wireName);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
