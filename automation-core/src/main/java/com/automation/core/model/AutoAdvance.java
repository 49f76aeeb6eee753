package com.automation.core.model;

/**
 * Auto-advance settings of an event trigger. A null target stage means
 * "the next stage in workflow order".
 */
public record AutoAdvance(
    boolean enabled,
    String targetStageId,
    String targetStepId
) {
    public static AutoAdvance toNextStage() {
        return new AutoAdvance(true, null, null);
    }

    public static AutoAdvance toStage(String targetStageId) {
        return new AutoAdvance(true, targetStageId, null);
    }
}
