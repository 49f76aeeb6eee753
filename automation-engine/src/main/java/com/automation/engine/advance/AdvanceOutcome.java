package com.automation.engine.advance;

/**
 * Result of an auto-advance attempt.
 */
public enum AdvanceOutcome {
    /** Moved to the next stage in workflow order. */
    ADVANCED,
    /** Moved directly to a targeted stage. */
    MOVED,
    /** Already at the last stage, nothing changed. */
    AT_FINAL_STAGE,
    STAGE_NOT_FOUND,
    ASSIGNMENT_NOT_FOUND,
    /** Persisting the move failed (e.g. concurrent modification). */
    FAILED;

    public String metricTag() {
        return name().toLowerCase();
    }
}
