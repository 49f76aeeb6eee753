package com.automation.engine.persistence.jdbc;

import com.automation.core.model.ActionConfig;
import com.automation.core.model.HierarchyNode;
import com.automation.core.model.NodeLevel;
import com.automation.core.model.NodeStatus;
import com.automation.core.repository.HierarchyRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of HierarchyRepository.
 * All levels share one table keyed by (level, id).
 */
@Repository("jdbcHierarchyRepository")
public class JdbcHierarchyRepository implements HierarchyRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcHierarchyRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<HierarchyNode> rowMapper = new HierarchyNodeRowMapper();

    public JdbcHierarchyRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void save(HierarchyNode node) {
        String sql = """
            INSERT INTO hierarchy_nodes (
                level, id, parent_id, name, position, status,
                require_all_children_complete, auto_progress,
                require_all_subtasks_complete, require_all_checklists_complete,
                on_complete_actions_json, completed_at, completed_by
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?)
            ON CONFLICT (level, id) DO UPDATE SET
                parent_id = EXCLUDED.parent_id,
                name = EXCLUDED.name,
                position = EXCLUDED.position,
                status = EXCLUDED.status,
                require_all_children_complete = EXCLUDED.require_all_children_complete,
                auto_progress = EXCLUDED.auto_progress,
                require_all_subtasks_complete = EXCLUDED.require_all_subtasks_complete,
                require_all_checklists_complete = EXCLUDED.require_all_checklists_complete,
                on_complete_actions_json = EXCLUDED.on_complete_actions_json,
                completed_at = EXCLUDED.completed_at,
                completed_by = EXCLUDED.completed_by
            """;
        
        jdbcTemplate.update(sql,
            node.level().name(),
            node.id(),
            node.parentId(),
            node.name(),
            node.position(),
            node.status().name(),
            node.requireAllChildrenComplete(),
            node.autoProgress(),
            node.requireAllSubtasksComplete(),
            node.requireAllChecklistsComplete(),
            toJson(node.onCompleteActions()),
            node.completedAt() != null ? Timestamp.from(node.completedAt()) : null,
            node.completedBy()
        );
    }

    @Override
    public Optional<HierarchyNode> findById(NodeLevel level, String id) {
        String sql = "SELECT * FROM hierarchy_nodes WHERE level = ? AND id = ?";
        List<HierarchyNode> results = jdbcTemplate.query(sql, rowMapper, level.name(), id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<HierarchyNode> findChildren(NodeLevel level, String parentId) {
        String sql = """
            SELECT * FROM hierarchy_nodes
            WHERE level = ? AND parent_id = ?
            ORDER BY position, id
            """;
        return jdbcTemplate.query(sql, rowMapper, level.name(), parentId);
    }

    @Override
    @Transactional
    public boolean compareAndSetStatus(NodeLevel level, String id, NodeStatus expected, NodeStatus next,
                                       Instant at, String actorId) {
        boolean completing = next == NodeStatus.COMPLETED;
        String sql = """
            UPDATE hierarchy_nodes SET
                status = ?,
                completed_at = ?,
                completed_by = ?
            WHERE level = ? AND id = ? AND status = ?
            """;
        
        int rows = jdbcTemplate.update(sql,
            next.name(),
            completing ? Timestamp.from(at) : null,
            completing ? actorId : null,
            level.name(),
            id,
            expected.name()
        );
        
        if (rows == 0) {
            log.debug("{} {} was not {}; status left unchanged", level, id, expected);
        }
        return rows > 0;
    }

    private String toJson(List<ActionConfig> actions) {
        try {
            return objectMapper.writeValueAsString(actions);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize completion actions", e);
        }
    }

    private class HierarchyNodeRowMapper implements RowMapper<HierarchyNode> {
        @Override
        public HierarchyNode mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp completedAt = rs.getTimestamp("completed_at");
            try {
                return new HierarchyNode(
                    rs.getString("id"),
                    NodeLevel.valueOf(rs.getString("level")),
                    rs.getString("parent_id"),
                    rs.getString("name"),
                    rs.getInt("position"),
                    NodeStatus.valueOf(rs.getString("status")),
                    rs.getBoolean("require_all_children_complete"),
                    rs.getBoolean("auto_progress"),
                    rs.getBoolean("require_all_subtasks_complete"),
                    rs.getBoolean("require_all_checklists_complete"),
                    parseActions(rs.getString("on_complete_actions_json")),
                    completedAt != null ? completedAt.toInstant() : null,
                    rs.getString("completed_by")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map hierarchy node row", e);
            }
        }

        private List<ActionConfig> parseActions(String json) throws JsonProcessingException {
            if (json == null || json.isEmpty()) return List.of();
            return objectMapper.readValue(json,
                objectMapper.getTypeFactory().constructCollectionType(List.class, ActionConfig.class));
        }
    }
}
