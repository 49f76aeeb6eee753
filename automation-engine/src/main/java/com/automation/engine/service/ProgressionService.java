package com.automation.engine.service;

import com.automation.core.model.HierarchyNode;
import java.util.Optional;

/**
 * Completion of work items and the upward cascade
 * subtask/checklist item -> task -> step -> stage -> workflow.
 */
public interface ProgressionService {

    /**
     * Complete a task directly and cascade to its step.
     * Calling it again on a completed task returns the task without re-running the cascade.
     * 
     * @param taskId The task ID
     * @param actorId Who completed it
     * @return The completed task, or empty if no such task exists
     */
    Optional<HierarchyNode> completeTask(String taskId, String actorId);

    /**
     * Complete a subtask and cascade to its task.
     * 
     * @param subtaskId The subtask ID
     * @param actorId Who completed it
     * @return The completed subtask, or empty if no such subtask exists
     */
    Optional<HierarchyNode> completeSubtask(String subtaskId, String actorId);

    /**
     * Flip a checklist item between checked and unchecked.
     * Only checking cascades; unchecking never reopens a completed task.
     * 
     * @param itemId The checklist item ID
     * @param actorId Who toggled it
     * @return The item in its new state, or empty if no such item exists
     */
    Optional<HierarchyNode> toggleChecklistItem(String itemId, String actorId);

    /**
     * Complete the task if all of its subtasks and checklist items are done, then cascade.
     * 
     * @return true if this call completed the task
     */
    boolean checkTaskCompletion(String taskId);

    /**
     * Complete the step if all of its tasks are done, then cascade.
     * Steps that do not require all children never complete here.
     * 
     * @return true if this call completed the step
     */
    boolean checkStepCompletion(String stepId);

    /**
     * Complete the stage if all of its steps are done, then cascade.
     * 
     * @return true if this call completed the stage
     */
    boolean checkStageCompletion(String stageId);

    /**
     * Complete the workflow if all of its stages are done.
     * 
     * @return true if this call completed the workflow
     */
    boolean checkWorkflowCompletion(String workflowId);
}
