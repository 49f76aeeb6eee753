package com.automation.engine.persistence;

import com.automation.core.exception.OptimisticLockException;
import com.automation.core.model.WorkflowAssignment;
import com.automation.core.repository.AssignmentRepository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of AssignmentRepository with version checks.
 */
public class InMemoryAssignmentRepository implements AssignmentRepository {

    private static final String ENTITY_TYPE = "WorkflowAssignment";

    private final Map<String, WorkflowAssignment> assignments = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowAssignment assignment) {
        assignments.put(assignment.id(), assignment);
    }

    @Override
    public Optional<WorkflowAssignment> findById(String assignmentId) {
        return Optional.ofNullable(assignments.get(assignmentId));
    }

    @Override
    public void update(WorkflowAssignment assignment) {
        long expectedVersion = assignment.version() - 1;
        synchronized (assignments) {
            WorkflowAssignment existing = assignments.get(assignment.id());
            if (existing == null || existing.version() != expectedVersion) {
                throw new OptimisticLockException(ENTITY_TYPE, assignment.id(), expectedVersion);
            }
            assignments.put(assignment.id(), assignment);
        }
    }
}
