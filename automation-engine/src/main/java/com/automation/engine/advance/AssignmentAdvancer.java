package com.automation.engine.advance;

import com.automation.core.exception.OptimisticLockException;
import com.automation.core.model.HierarchyNode;
import com.automation.core.model.NodeLevel;
import com.automation.core.model.Notification;
import com.automation.core.model.WorkflowAssignment;
import com.automation.core.repository.AssignmentRepository;
import com.automation.core.repository.HierarchyRepository;
import com.automation.core.repository.NotificationService;
import com.automation.engine.metrics.AutomationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Moves workflow assignments between stages on behalf of event triggers.
 * 
 * Nothing thrown here reaches the event producer: missing records, optimistic
 * conflicts and notification failures are logged and reported as an outcome.
 */
public class AssignmentAdvancer {

    private static final Logger log = LoggerFactory.getLogger(AssignmentAdvancer.class);

    public static final String DEFAULT_REASON = "event_trigger";
    static final String NOTIFICATION_TITLE = "Workflow Advanced";

    private final AssignmentRepository assignmentRepository;
    private final HierarchyRepository hierarchyRepository;
    private final NotificationService notificationService;
    private final AutomationMetrics metrics;

    public AssignmentAdvancer(
            AssignmentRepository assignmentRepository,
            HierarchyRepository hierarchyRepository,
            NotificationService notificationService,
            AutomationMetrics metrics) {
        this.assignmentRepository = assignmentRepository;
        this.hierarchyRepository = hierarchyRepository;
        this.notificationService = notificationService;
        this.metrics = metrics;
    }

    /**
     * Advance the assignment to the stage after its current one.
     * 
     * @param assignmentId The assignment ID
     * @param reason Why the assignment advances (recorded in the notification)
     * @return What happened
     */
    public AdvanceOutcome autoAdvanceAssignment(String assignmentId, String reason) {
        AdvanceOutcome outcome;
        try {
            outcome = advanceToNext(assignmentId, reason != null ? reason : DEFAULT_REASON);
        } catch (RuntimeException e) {
            log.error("Failed to auto-advance assignment {}", assignmentId, e);
            outcome = AdvanceOutcome.FAILED;
        }
        metrics.assignmentAdvanced(outcome.metricTag());
        return outcome;
    }

    /**
     * Move the assignment directly to a stage. A null target falls back to
     * advancing to the next stage.
     * 
     * @param assignmentId The assignment ID
     * @param targetStageId The stage to move to, may be null
     * @return What happened
     */
    public AdvanceOutcome autoAdvanceToStage(String assignmentId, String targetStageId) {
        if (targetStageId == null) {
            return autoAdvanceAssignment(assignmentId, DEFAULT_REASON);
        }
        
        AdvanceOutcome outcome;
        try {
            outcome = moveTo(assignmentId, targetStageId);
        } catch (RuntimeException e) {
            log.error("Failed to move assignment {} to stage {}", assignmentId, targetStageId, e);
            outcome = AdvanceOutcome.FAILED;
        }
        metrics.assignmentAdvanced(outcome.metricTag());
        return outcome;
    }

    // ========== Internal Methods ==========

    private AdvanceOutcome advanceToNext(String assignmentId, String reason) {
        WorkflowAssignment assignment = assignmentRepository.findById(assignmentId).orElse(null);
        if (assignment == null) {
            log.warn("Assignment not found for auto-advance: {}", assignmentId);
            return AdvanceOutcome.ASSIGNMENT_NOT_FOUND;
        }
        
        List<HierarchyNode> stages = hierarchyRepository.findChildren(NodeLevel.STAGE, assignment.workflowId());
        int currentIndex = indexOf(stages, assignment.currentStageId());
        if (currentIndex < 0) {
            log.warn("Current stage {} of assignment {} not found in workflow {}",
                assignment.currentStageId(), assignmentId, assignment.workflowId());
            return AdvanceOutcome.STAGE_NOT_FOUND;
        }
        if (currentIndex >= stages.size() - 1) {
            log.info("Assignment {} is already at the final stage", assignmentId);
            return AdvanceOutcome.AT_FINAL_STAGE;
        }
        
        HierarchyNode nextStage = stages.get(currentIndex + 1);
        int completed = Math.min(assignment.completedStages() + 1, assignment.totalStages());
        if (!persist(assignment.movedTo(nextStage.id(), completed))) {
            return AdvanceOutcome.FAILED;
        }
        
        log.info("Assignment {} advanced to stage {} ({})", assignmentId, nextStage.id(), reason);
        notifyAssignee(assignment, nextStage,
            "Your workflow has automatically advanced to: " + nextStage.name(), reason);
        return AdvanceOutcome.ADVANCED;
    }

    private AdvanceOutcome moveTo(String assignmentId, String targetStageId) {
        WorkflowAssignment assignment = assignmentRepository.findById(assignmentId).orElse(null);
        if (assignment == null) {
            log.warn("Assignment not found for stage move: {}", assignmentId);
            return AdvanceOutcome.ASSIGNMENT_NOT_FOUND;
        }
        
        List<HierarchyNode> stages = hierarchyRepository.findChildren(NodeLevel.STAGE, assignment.workflowId());
        int targetIndex = indexOf(stages, targetStageId);
        if (targetIndex < 0) {
            log.warn("Target stage {} not found in workflow {}", targetStageId, assignment.workflowId());
            return AdvanceOutcome.STAGE_NOT_FOUND;
        }
        
        int currentIndex = indexOf(stages, assignment.currentStageId());
        if (currentIndex > targetIndex) {
            log.warn("Assignment {} moved back from stage {} to earlier stage {}",
                assignmentId, assignment.currentStageId(), targetStageId);
        }
        
        HierarchyNode target = stages.get(targetIndex);
        if (!persist(assignment.movedTo(target.id(), targetIndex))) {
            return AdvanceOutcome.FAILED;
        }
        
        log.info("Assignment {} moved to stage {}", assignmentId, target.id());
        notifyAssignee(assignment, target,
            "Your workflow has been moved to: " + target.name(), DEFAULT_REASON);
        return AdvanceOutcome.MOVED;
    }

    private boolean persist(WorkflowAssignment updated) {
        try {
            assignmentRepository.update(updated);
            return true;
        } catch (OptimisticLockException e) {
            log.warn("Assignment {} was modified concurrently, advance dropped", updated.id());
            return false;
        }
    }

    private void notifyAssignee(WorkflowAssignment assignment, HierarchyNode stage, String message, String reason) {
        if (assignment.assignedTo() == null) {
            log.debug("Assignment {} has no assignee, skipping notification", assignment.id());
            return;
        }
        try {
            notificationService.createNotification(Notification.info(
                assignment.assignedTo(),
                NOTIFICATION_TITLE,
                message,
                Map.of("assignmentId", assignment.id(), "stageId", stage.id(), "reason", reason)
            ));
        } catch (RuntimeException e) {
            log.warn("Failed to notify {} about assignment {}", assignment.assignedTo(), assignment.id(), e);
        }
    }

    private static int indexOf(List<HierarchyNode> stages, String stageId) {
        for (int i = 0; i < stages.size(); i++) {
            if (stages.get(i).id().equals(stageId)) {
                return i;
            }
        }
        return -1;
    }
}
