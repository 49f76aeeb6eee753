package com.automation.engine.persistence.jdbc;

import com.automation.core.exception.OptimisticLockException;
import com.automation.core.model.AssignmentStatus;
import com.automation.core.model.WorkflowAssignment;
import com.automation.core.repository.AssignmentRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of AssignmentRepository.
 * Supports optimistic locking via the version column.
 */
@Repository("jdbcAssignmentRepository")
public class JdbcAssignmentRepository implements AssignmentRepository {

    private static final RowMapper<WorkflowAssignment> ROW_MAPPER = (rs, rowNum) -> new WorkflowAssignment(
        rs.getString("id"),
        rs.getString("workflow_id"),
        rs.getString("assigned_to"),
        rs.getString("current_stage_id"),
        rs.getString("current_step_id"),
        AssignmentStatus.valueOf(rs.getString("status")),
        rs.getInt("completed_stages"),
        rs.getInt("total_stages"),
        rs.getInt("progress"),
        rs.getLong("version")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcAssignmentRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public void save(WorkflowAssignment assignment) {
        String sql = """
            INSERT INTO workflow_assignments (
                id, workflow_id, assigned_to, current_stage_id, current_step_id,
                status, completed_stages, total_stages, progress, version
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        
        jdbcTemplate.update(sql,
            assignment.id(),
            assignment.workflowId(),
            assignment.assignedTo(),
            assignment.currentStageId(),
            assignment.currentStepId(),
            assignment.status().name(),
            assignment.completedStages(),
            assignment.totalStages(),
            assignment.progress(),
            assignment.version()
        );
    }

    @Override
    public Optional<WorkflowAssignment> findById(String assignmentId) {
        String sql = "SELECT * FROM workflow_assignments WHERE id = ?";
        List<WorkflowAssignment> results = jdbcTemplate.query(sql, ROW_MAPPER, assignmentId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    @Transactional
    public void update(WorkflowAssignment assignment) {
        String sql = """
            UPDATE workflow_assignments SET
                current_stage_id = ?,
                current_step_id = ?,
                status = ?,
                completed_stages = ?,
                total_stages = ?,
                progress = ?,
                version = ?
            WHERE id = ? AND version = ?
            """;
        
        long expectedVersion = assignment.version() - 1;
        int rows = jdbcTemplate.update(sql,
            assignment.currentStageId(),
            assignment.currentStepId(),
            assignment.status().name(),
            assignment.completedStages(),
            assignment.totalStages(),
            assignment.progress(),
            assignment.version(),
            assignment.id(),
            expectedVersion
        );
        
        if (rows == 0) {
            throw new OptimisticLockException("WorkflowAssignment", assignment.id(), expectedVersion);
        }
    }
}
