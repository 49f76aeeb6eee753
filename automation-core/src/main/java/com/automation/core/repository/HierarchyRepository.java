package com.automation.core.repository;

import com.automation.core.model.HierarchyNode;
import com.automation.core.model.NodeLevel;
import com.automation.core.model.NodeStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for workflow, stage, step, task, subtask and checklist nodes.
 */
public interface HierarchyRepository {

    /**
     * Insert or replace a node.
     */
    void save(HierarchyNode node);

    /**
     * Find a node by level and ID.
     */
    Optional<HierarchyNode> findById(NodeLevel level, String id);

    /**
     * Find the nodes of a level that belong to a parent, ordered by position.
     * 
     * @param level Level of the children
     * @param parentId ID of the parent node
     * @return Children, possibly empty
     */
    List<HierarchyNode> findChildren(NodeLevel level, String parentId);

    /**
     * Atomically move a node from one status to another.
     * Completion stamps completedAt/completedBy; moving back to PENDING clears them.
     * 
     * @param level Node level
     * @param id Node ID
     * @param expected Status the node must currently have
     * @param next Status to set
     * @param at Timestamp of the change
     * @param actorId Who made the change
     * @return true if this call changed the status, false if it was not in the expected status
     */
    boolean compareAndSetStatus(NodeLevel level, String id, NodeStatus expected, NodeStatus next,
                                Instant at, String actorId);
}
