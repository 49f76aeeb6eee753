package com.automation.core.model;

import org.junit.jupiter.api.Test;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeLevelTest {

    @Test
    void parent_shouldRollLeavesUpToWorkflow() {
        assertEquals(NodeLevel.TASK, NodeLevel.SUBTASK.parent());
        assertEquals(NodeLevel.TASK, NodeLevel.CHECKLIST_ITEM.parent());
        assertEquals(NodeLevel.STEP, NodeLevel.TASK.parent());
        assertEquals(NodeLevel.STAGE, NodeLevel.STEP.parent());
        assertEquals(NodeLevel.WORKFLOW, NodeLevel.STAGE.parent());
        assertNull(NodeLevel.WORKFLOW.parent());
    }

    @Test
    void childLevels_shouldMirrorParent() {
        for (NodeLevel level : NodeLevel.values()) {
            for (NodeLevel child : level.childLevels()) {
                assertEquals(level, child.parent());
            }
        }
        assertEquals(List.of(NodeLevel.SUBTASK, NodeLevel.CHECKLIST_ITEM), NodeLevel.TASK.childLevels());
    }

    @Test
    void isLeaf_shouldIdentifySubtasksAndChecklistItems() {
        assertTrue(NodeLevel.SUBTASK.isLeaf());
        assertTrue(NodeLevel.CHECKLIST_ITEM.isLeaf());
        
        assertFalse(NodeLevel.TASK.isLeaf());
        assertFalse(NodeLevel.WORKFLOW.isLeaf());
    }

    @Test
    void requireAllChildrenComplete_shouldOnlyGateSteps() {
        HierarchyNode step = HierarchyNode.pending(NodeLevel.STEP, "step-1", "stage-1", "Review", 0)
            .withRequireAllChildrenComplete(false);
        HierarchyNode stage = HierarchyNode.pending(NodeLevel.STAGE, "stage-1", "wf-1", "Intake", 0)
            .withRequireAllChildrenComplete(false);
        
        assertTrue(step.autoCompletionDisabled());
        assertFalse(stage.autoCompletionDisabled());
        assertFalse(HierarchyNode.pending(NodeLevel.STEP, "step-2", "stage-1", "Sign", 1).autoCompletionDisabled());
    }

    @Test
    void autoProgressOptOut_shouldApplyToEveryLevel() {
        HierarchyNode stage = HierarchyNode.pending(NodeLevel.STAGE, "stage-1", "wf-1", "Intake", 0)
            .withAutoProgress(false);
        HierarchyNode task = HierarchyNode.pending(NodeLevel.TASK, "task-1", "step-1", "Collect", 0)
            .withAutoProgress(false);
        
        assertTrue(stage.autoCompletionDisabled());
        assertTrue(task.autoCompletionDisabled());
    }

    @Test
    void countsChildren_shouldHonourTaskRequirements() {
        HierarchyNode task = HierarchyNode.pending(NodeLevel.TASK, "task-1", "step-1", "Collect", 0)
            .withTaskRequirements(false, true);
        HierarchyNode step = HierarchyNode.pending(NodeLevel.STEP, "step-1", "stage-1", "Review", 0)
            .withTaskRequirements(false, false);
        
        assertFalse(task.countsChildren(NodeLevel.SUBTASK));
        assertTrue(task.countsChildren(NodeLevel.CHECKLIST_ITEM));
        assertTrue(step.countsChildren(NodeLevel.TASK));
    }

    @Test
    void onCompleteActions_shouldDefaultToEmpty() {
        HierarchyNode step = HierarchyNode.pending(NodeLevel.STEP, "step-1", "stage-1", "Review", 0);
        
        assertEquals(List.of(), step.onCompleteActions());
        assertEquals(List.of(ActionConfig.of("notify_client")),
            step.withOnCompleteActions(List.of(ActionConfig.of("notify_client"))).onCompleteActions());
    }

    @Test
    void withStatus_shouldStampAndClearCompletion() {
        Instant at = Instant.parse("2026-03-10T12:00:00Z");
        HierarchyNode item = HierarchyNode.pending(NodeLevel.CHECKLIST_ITEM, "c-1", "task-1", "W-2 received", 0);
        
        HierarchyNode checked = item.withStatus(NodeStatus.COMPLETED, at, "user-1");
        assertTrue(checked.isCompleted());
        assertEquals(at, checked.completedAt());
        assertEquals("user-1", checked.completedBy());
        
        HierarchyNode unchecked = checked.withStatus(NodeStatus.PENDING, at, "user-1");
        assertFalse(unchecked.isCompleted());
        assertNull(unchecked.completedAt());
        assertNull(unchecked.completedBy());
    }
}
