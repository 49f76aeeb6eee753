package com.automation.engine.persistence.jdbc;

import com.automation.core.model.ActionConfig;
import com.automation.core.model.AutomationTrigger;
import com.automation.core.model.ScheduleType;
import com.automation.core.repository.TriggerRepository;
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
 * PostgreSQL-backed implementation of TriggerRepository.
 * 
 * The execution lock is a single conditional UPDATE on locked_at that also
 * re-checks the due condition, so exactly one of several concurrently polling
 * workers wins a due occurrence, and a worker with a stale due list loses once
 * the occurrence has been executed and rescheduled. A lock older than the
 * staleness window is treated as abandoned and can be taken over.
 */
@Repository("jdbcTriggerRepository")
public class JdbcTriggerRepository implements TriggerRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTriggerRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final TriggerRowMapper rowMapper = new TriggerRowMapper();

    public JdbcTriggerRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void save(AutomationTrigger trigger) {
        String sql = """
            INSERT INTO automation_triggers (
                id, organization_id, workflow_id, name, enabled,
                schedule_type, cron_expression, actions_json,
                next_execution, last_executed, locked_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?)
            ON CONFLICT (id) DO UPDATE SET
                organization_id = EXCLUDED.organization_id,
                workflow_id = EXCLUDED.workflow_id,
                name = EXCLUDED.name,
                enabled = EXCLUDED.enabled,
                schedule_type = EXCLUDED.schedule_type,
                cron_expression = EXCLUDED.cron_expression,
                actions_json = EXCLUDED.actions_json,
                next_execution = EXCLUDED.next_execution,
                last_executed = EXCLUDED.last_executed,
                locked_at = EXCLUDED.locked_at
            """;
        
        jdbcTemplate.update(sql,
            trigger.id(),
            trigger.organizationId(),
            trigger.workflowId(),
            trigger.name(),
            trigger.enabled(),
            trigger.scheduleType().wireName(),
            trigger.cronExpression(),
            toJson(trigger.actions()),
            toTimestamp(trigger.nextExecution()),
            toTimestamp(trigger.lastExecuted()),
            toTimestamp(trigger.lockedAt())
        );
    }

    @Override
    public Optional<AutomationTrigger> findById(String triggerId) {
        String sql = "SELECT * FROM automation_triggers WHERE id = ?";
        List<AutomationTrigger> results = jdbcTemplate.query(sql, rowMapper, triggerId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<AutomationTrigger> findDueForExecution(Instant now, int limit) {
        String sql = """
            SELECT * FROM automation_triggers
            WHERE enabled AND next_execution <= ?
            ORDER BY next_execution
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, Timestamp.from(now), limit);
    }

    @Override
    @Transactional
    public boolean tryAcquireLock(String triggerId, Instant now, Instant staleBefore) {
        String sql = """
            UPDATE automation_triggers SET locked_at = ?
            WHERE id = ?
              AND enabled
              AND next_execution <= ?
              AND (locked_at IS NULL OR locked_at < ?)
            """;
        
        int rows = jdbcTemplate.update(sql,
            Timestamp.from(now), triggerId, Timestamp.from(now), Timestamp.from(staleBefore));
        
        if (rows > 0) {
            log.debug("Acquired execution lock on trigger {}", triggerId);
            return true;
        }
        log.debug("Trigger {} is locked by another worker or no longer due", triggerId);
        return false;
    }

    @Override
    @Transactional
    public boolean tryAcquireManualLock(String triggerId, Instant now, Instant staleBefore) {
        String sql = """
            UPDATE automation_triggers SET locked_at = ?
            WHERE id = ? AND (locked_at IS NULL OR locked_at < ?)
            """;
        
        int rows = jdbcTemplate.update(sql, Timestamp.from(now), triggerId, Timestamp.from(staleBefore));
        
        if (rows > 0) {
            log.debug("Acquired manual execution lock on trigger {}", triggerId);
            return true;
        }
        log.debug("Execution lock on trigger {} held by another worker", triggerId);
        return false;
    }

    @Override
    @Transactional
    public void releaseLock(String triggerId, Instant executedAt, Instant nextExecution) {
        String sql = """
            UPDATE automation_triggers SET
                locked_at = NULL,
                last_executed = ?,
                next_execution = ?
            WHERE id = ?
            """;
        jdbcTemplate.update(sql, Timestamp.from(executedAt), toTimestamp(nextExecution), triggerId);
    }

    @Override
    @Transactional
    public void releaseLockPreservingSchedule(String triggerId, Instant executedAt) {
        String sql = """
            UPDATE automation_triggers SET
                locked_at = NULL,
                last_executed = ?
            WHERE id = ?
            """;
        jdbcTemplate.update(sql, Timestamp.from(executedAt), triggerId);
    }

    @Override
    @Transactional
    public boolean disable(String triggerId) {
        String sql = "UPDATE automation_triggers SET enabled = FALSE WHERE id = ? AND enabled";
        return jdbcTemplate.update(sql, triggerId) > 0;
    }

    // ========== Helper Methods ==========

    private String toJson(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize trigger actions", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private class TriggerRowMapper implements RowMapper<AutomationTrigger> {
        @Override
        public AutomationTrigger mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new AutomationTrigger(
                    rs.getString("id"),
                    rs.getString("organization_id"),
                    rs.getString("workflow_id"),
                    rs.getString("name"),
                    rs.getBoolean("enabled"),
                    ScheduleType.fromWireName(rs.getString("schedule_type")),
                    rs.getString("cron_expression"),
                    parseActions(rs.getString("actions_json")),
                    toInstant(rs.getTimestamp("next_execution")),
                    toInstant(rs.getTimestamp("last_executed")),
                    toInstant(rs.getTimestamp("locked_at"))
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map automation trigger row", e);
            }
        }

        private List<ActionConfig> parseActions(String json) throws JsonProcessingException {
            if (json == null || json.isEmpty()) return List.of();
            return objectMapper.readValue(json,
                objectMapper.getTypeFactory().constructCollectionType(List.class, ActionConfig.class));
        }
    }
}
