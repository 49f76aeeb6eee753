package com.automation.core.model;

import java.util.List;

/**
 * Levels of the work hierarchy, leaf-first:
 * SUBTASK / CHECKLIST_ITEM -> TASK -> STEP -> STAGE -> WORKFLOW.
 */
public enum NodeLevel {
    WORKFLOW,
    STAGE,
    STEP,
    TASK,
    SUBTASK,
    CHECKLIST_ITEM;

    /**
     * The level a node of this level rolls up into, or null for WORKFLOW.
     */
    public NodeLevel parent() {
        return switch (this) {
            case WORKFLOW -> null;
            case STAGE -> WORKFLOW;
            case STEP -> STAGE;
            case TASK -> STEP;
            case SUBTASK, CHECKLIST_ITEM -> TASK;
        };
    }

    /**
     * The levels whose nodes decide this level's cascade.
     */
    public List<NodeLevel> childLevels() {
        return switch (this) {
            case WORKFLOW -> List.of(STAGE);
            case STAGE -> List.of(STEP);
            case STEP -> List.of(TASK);
            case TASK -> List.of(SUBTASK, CHECKLIST_ITEM);
            case SUBTASK, CHECKLIST_ITEM -> List.of();
        };
    }

    public boolean isLeaf() {
        return childLevels().isEmpty();
    }
}
