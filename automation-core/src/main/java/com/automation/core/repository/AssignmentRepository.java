package com.automation.core.repository;

import com.automation.core.model.WorkflowAssignment;
import java.util.Optional;

/**
 * Repository for workflow assignments.
 */
public interface AssignmentRepository {

    void save(WorkflowAssignment assignment);

    Optional<WorkflowAssignment> findById(String assignmentId);

    /**
     * Update an assignment. The stored version must equal assignment.version() - 1.
     * 
     * @throws com.automation.core.exception.OptimisticLockException on a concurrent modification
     */
    void update(WorkflowAssignment assignment);
}
