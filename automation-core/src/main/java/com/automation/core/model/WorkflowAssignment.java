package com.automation.core.model;

/**
 * One assignee's run through a workflow.
 * 
 * Primary Key: id
 * 
 * Invariants:
 * - 0 <= completedStages <= totalStages (a targeted move may set it lower, see AssignmentAdvancer)
 * - progress = round(completedStages / totalStages * 100)
 * - version increases by one on every update (optimistic locking)
 */
public record WorkflowAssignment(
    String id,
    String workflowId,
    String assignedTo,
    
    // Position
    String currentStageId,
    String currentStepId,
    AssignmentStatus status,
    
    // Progress
    int completedStages,
    int totalStages,
    int progress,
    
    // Versioning (optimistic locking)
    long version
) {
    /**
     * Create a fresh assignment positioned at the first stage.
     */
    public static WorkflowAssignment create(
            String id,
            String workflowId,
            String assignedTo,
            String firstStageId,
            int totalStages) {
        return new WorkflowAssignment(id, workflowId, assignedTo, firstStageId, null,
            AssignmentStatus.ACTIVE, 0, totalStages, 0, 0L);
    }

    /**
     * Percentage of completed stages, rounded half up. Zero when there are no stages.
     */
    public static int progressOf(int completedStages, int totalStages) {
        if (totalStages <= 0) {
            return 0;
        }
        return (int) Math.round(completedStages * 100.0 / totalStages);
    }

    /**
     * Copy positioned at the given stage, with the step cleared, status ACTIVE
     * and progress recomputed from the new completed-stage count.
     */
    public WorkflowAssignment movedTo(String stageId, int newCompletedStages) {
        return new WorkflowAssignment(id, workflowId, assignedTo, stageId, null,
            AssignmentStatus.ACTIVE, newCompletedStages, totalStages,
            progressOf(newCompletedStages, totalStages), version + 1);
    }
}
