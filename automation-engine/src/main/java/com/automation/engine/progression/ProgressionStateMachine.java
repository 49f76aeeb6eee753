package com.automation.engine.progression;

import com.automation.core.action.ActionContext;
import com.automation.core.action.ActionExecutor;
import com.automation.core.model.HierarchyNode;
import com.automation.core.model.NodeLevel;
import com.automation.core.model.NodeStatus;
import com.automation.core.repository.HierarchyRepository;
import com.automation.engine.logging.LoggingContext;
import com.automation.engine.metrics.AutomationMetrics;
import com.automation.engine.service.ProgressionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Cascading completion over the work hierarchy.
 * 
 * A node completes automatically once every child it has is complete:
 * - TASK: subtasks and checklist items, each set either empty or fully done, at least one non-empty;
 *   a set the task does not require is ignored
 * - STEP, STAGE, WORKFLOW: a non-empty child set, fully done
 * - a node with autoProgress=false, or a STEP with requireAllChildrenComplete=false,
 *   never completes automatically
 * 
 * A node completed by the cascade then runs its onCompleteActions. A failing action
 * is logged and does not stop the cascade.
 * 
 * Propagation is strictly upward. Every level is guarded by "already completed" and
 * written with a compare-and-set, so two siblings finishing together complete the
 * parent once: the losing writer stops and the winner carries the cascade.
 */
public class ProgressionStateMachine implements ProgressionService {

    private static final Logger log = LoggerFactory.getLogger(ProgressionStateMachine.class);

    private final HierarchyRepository hierarchyRepository;
    private final ActionExecutor actionExecutor;
    private final AutomationMetrics metrics;
    private final Clock clock;

    public ProgressionStateMachine(
            HierarchyRepository hierarchyRepository,
            ActionExecutor actionExecutor,
            AutomationMetrics metrics,
            Clock clock) {
        this.hierarchyRepository = hierarchyRepository;
        this.actionExecutor = actionExecutor;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Optional<HierarchyNode> completeTask(String taskId, String actorId) {
        return completeDirectly(NodeLevel.TASK, taskId, actorId);
    }

    @Override
    public Optional<HierarchyNode> completeSubtask(String subtaskId, String actorId) {
        return completeDirectly(NodeLevel.SUBTASK, subtaskId, actorId);
    }

    @Override
    public Optional<HierarchyNode> toggleChecklistItem(String itemId, String actorId) {
        try (var ctx = LoggingContext.forNode(NodeLevel.CHECKLIST_ITEM, itemId)) {
            Optional<HierarchyNode> found = hierarchyRepository.findById(NodeLevel.CHECKLIST_ITEM, itemId);
            if (found.isEmpty()) {
                log.warn("Checklist item not found: {}", itemId);
                return Optional.empty();
            }
            
            HierarchyNode item = found.get();
            Instant now = clock.instant();
            
            if (item.isCompleted()) {
                if (!hierarchyRepository.compareAndSetStatus(NodeLevel.CHECKLIST_ITEM, itemId,
                        NodeStatus.COMPLETED, NodeStatus.PENDING, now, actorId)) {
                    log.debug("Checklist item {} changed concurrently", itemId);
                    return hierarchyRepository.findById(NodeLevel.CHECKLIST_ITEM, itemId);
                }
                // Unchecking does not reopen the task
                log.info("Checklist item {} unchecked by {}", itemId, actorId);
                return Optional.of(item.withStatus(NodeStatus.PENDING, now, actorId));
            }
            
            if (!hierarchyRepository.compareAndSetStatus(NodeLevel.CHECKLIST_ITEM, itemId,
                    NodeStatus.PENDING, NodeStatus.COMPLETED, now, actorId)) {
                log.debug("Checklist item {} changed concurrently", itemId);
                return hierarchyRepository.findById(NodeLevel.CHECKLIST_ITEM, itemId);
            }
            
            log.info("Checklist item {} checked by {}", itemId, actorId);
            metrics.nodeCompleted(NodeLevel.CHECKLIST_ITEM);
            cascade(NodeLevel.TASK, item.parentId(), actorId);
            return Optional.of(item.withStatus(NodeStatus.COMPLETED, now, actorId));
        }
    }

    @Override
    public boolean checkTaskCompletion(String taskId) {
        return cascade(NodeLevel.TASK, taskId, null);
    }

    @Override
    public boolean checkStepCompletion(String stepId) {
        return cascade(NodeLevel.STEP, stepId, null);
    }

    @Override
    public boolean checkStageCompletion(String stageId) {
        return cascade(NodeLevel.STAGE, stageId, null);
    }

    @Override
    public boolean checkWorkflowCompletion(String workflowId) {
        return cascade(NodeLevel.WORKFLOW, workflowId, null);
    }

    // ========== Internal Methods ==========

    private Optional<HierarchyNode> completeDirectly(NodeLevel level, String id, String actorId) {
        try (var ctx = LoggingContext.forNode(level, id)) {
            Optional<HierarchyNode> found = hierarchyRepository.findById(level, id);
            if (found.isEmpty()) {
                log.warn("{} not found: {}", level, id);
                return Optional.empty();
            }
            
            HierarchyNode node = found.get();
            if (node.isCompleted()) {
                log.debug("{} {} already completed", level, id);
                return found;
            }
            
            Instant now = clock.instant();
            if (!hierarchyRepository.compareAndSetStatus(level, id, NodeStatus.PENDING, NodeStatus.COMPLETED, now, actorId)) {
                log.debug("{} {} completed concurrently", level, id);
                return hierarchyRepository.findById(level, id);
            }
            
            log.info("{} {} completed by {}", level, id, actorId);
            metrics.nodeCompleted(level);
            
            cascade(level.parent(), node.parentId(), actorId);
            return Optional.of(node.withStatus(NodeStatus.COMPLETED, now, actorId));
        }
    }

    /**
     * Walk up from the given node, completing each level whose children are all done.
     * 
     * @return true if the starting node was completed by this call
     */
    private boolean cascade(NodeLevel startLevel, String startId, String actorId) {
        NodeLevel level = startLevel;
        String id = startId;
        boolean startCompleted = false;
        
        while (level != null && id != null) {
            Optional<HierarchyNode> completed = tryAutoComplete(level, id, actorId);
            if (completed.isEmpty()) {
                break;
            }
            if (level == startLevel) {
                startCompleted = true;
            }
            id = completed.get().parentId();
            level = level.parent();
        }
        
        return startCompleted;
    }

    private Optional<HierarchyNode> tryAutoComplete(NodeLevel level, String id, String actorId) {
        Optional<HierarchyNode> found = hierarchyRepository.findById(level, id);
        if (found.isEmpty()) {
            log.warn("Cascade reached missing {} {}", level, id);
            return Optional.empty();
        }
        
        HierarchyNode node = found.get();
        if (node.isCompleted()) {
            return Optional.empty();
        }
        if (node.autoCompletionDisabled()) {
            log.debug("{} {} requires explicit completion", level, id);
            return Optional.empty();
        }
        if (!childrenSatisfied(node)) {
            return Optional.empty();
        }
        
        Instant now = clock.instant();
        if (!hierarchyRepository.compareAndSetStatus(level, id, NodeStatus.PENDING, NodeStatus.COMPLETED, now, actorId)) {
            log.debug("{} {} auto-completed by a concurrent cascade", level, id);
            return Optional.empty();
        }
        
        log.info("{} {} auto-completed", level, id);
        metrics.nodeCompleted(level);
        HierarchyNode completed = node.withStatus(NodeStatus.COMPLETED, now, actorId);
        runCompletionActions(completed, actorId, now);
        return Optional.of(completed);
    }

    private void runCompletionActions(HierarchyNode node, String actorId, Instant now) {
        if (node.onCompleteActions().isEmpty()) {
            return;
        }
        try {
            actionExecutor.executeActions(node.onCompleteActions(), ActionContext.forNodeCompletion(node, actorId, now));
            log.info("Ran {} completion action(s) of {} {}", node.onCompleteActions().size(), node.level(), node.id());
        } catch (RuntimeException e) {
            log.error("Completion actions of {} {} failed", node.level(), node.id(), e);
        }
    }

    /**
     * An empty child set never satisfies a level on its own: a task needs at least one
     * subtask or checklist item, every other level needs at least one child.
     */
    private boolean childrenSatisfied(HierarchyNode node) {
        boolean anyChildren = false;
        
        for (NodeLevel childLevel : node.level().childLevels()) {
            if (!node.countsChildren(childLevel)) {
                continue;
            }
            List<HierarchyNode> children = hierarchyRepository.findChildren(childLevel, node.id());
            if (children.isEmpty()) {
                if (node.level() != NodeLevel.TASK) {
                    return false;
                }
                continue;
            }
            anyChildren = true;
            if (!children.stream().allMatch(HierarchyNode::isCompleted)) {
                return false;
            }
        }
        
        return anyChildren;
    }
}
