package com.automation.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A unit of the work hierarchy (workflow, stage, step, task, subtask or checklist item).
 *
 * Primary Key: (level, id)
 *
 * Invariants:
 * - parentId references a node of level.parent() (null for WORKFLOW)
 * - status is COMPLETED only if completed explicitly or by a cascade from its children
 * - requireAllChildrenComplete is meaningful for STEP nodes only
 * - requireAllSubtasksComplete / requireAllChecklistsComplete are meaningful for TASK nodes only
 * - a node with autoProgress=false is never completed by a cascade
 *
 * @param onCompleteActions Actions run once when the node is completed by a cascade
 */
public record HierarchyNode(
    String id,
    NodeLevel level,
    String parentId,
    String name,
    int position,
    NodeStatus status,
    boolean requireAllChildrenComplete,
    boolean autoProgress,
    boolean requireAllSubtasksComplete,
    boolean requireAllChecklistsComplete,
    List<ActionConfig> onCompleteActions,
    Instant completedAt,
    String completedBy
) {
    public HierarchyNode {
        onCompleteActions = onCompleteActions != null ? List.copyOf(onCompleteActions) : List.of();
    }

    public static HierarchyNode pending(NodeLevel level, String id, String parentId, String name, int position) {
        return new HierarchyNode(id, level, parentId, name, position, NodeStatus.PENDING,
            true, true, true, true, List.of(), null, null);
    }

    public boolean isCompleted() {
        return status == NodeStatus.COMPLETED;
    }

    /**
     * True when the node opted out of automatic completion, either through
     * autoProgress=false or, for a STEP, requireAllChildrenComplete=false.
     */
    public boolean autoCompletionDisabled() {
        return !autoProgress || (level == NodeLevel.STEP && !requireAllChildrenComplete);
    }

    /**
     * Whether children of the given level count towards automatic completion.
     * A task can exclude its subtasks or its checklist; other levels count every child.
     */
    public boolean countsChildren(NodeLevel childLevel) {
        if (level != NodeLevel.TASK) {
            return true;
        }
        return switch (childLevel) {
            case SUBTASK -> requireAllSubtasksComplete;
            case CHECKLIST_ITEM -> requireAllChecklistsComplete;
            default -> true;
        };
    }

    public HierarchyNode withStatus(NodeStatus newStatus, Instant at, String actorId) {
        return new HierarchyNode(id, level, parentId, name, position, newStatus, requireAllChildrenComplete,
            autoProgress, requireAllSubtasksComplete, requireAllChecklistsComplete, onCompleteActions,
            newStatus == NodeStatus.COMPLETED ? at : null,
            newStatus == NodeStatus.COMPLETED ? actorId : null);
    }

    public HierarchyNode withRequireAllChildrenComplete(boolean required) {
        return new HierarchyNode(id, level, parentId, name, position, status, required,
            autoProgress, requireAllSubtasksComplete, requireAllChecklistsComplete, onCompleteActions,
            completedAt, completedBy);
    }

    public HierarchyNode withAutoProgress(boolean enabled) {
        return new HierarchyNode(id, level, parentId, name, position, status, requireAllChildrenComplete,
            enabled, requireAllSubtasksComplete, requireAllChecklistsComplete, onCompleteActions,
            completedAt, completedBy);
    }

    public HierarchyNode withTaskRequirements(boolean subtasksRequired, boolean checklistsRequired) {
        return new HierarchyNode(id, level, parentId, name, position, status, requireAllChildrenComplete,
            autoProgress, subtasksRequired, checklistsRequired, onCompleteActions,
            completedAt, completedBy);
    }

    public HierarchyNode withOnCompleteActions(List<ActionConfig> actions) {
        return new HierarchyNode(id, level, parentId, name, position, status, requireAllChildrenComplete,
            autoProgress, requireAllSubtasksComplete, requireAllChecklistsComplete, actions,
            completedAt, completedBy);
    }
}
