package com.automation.engine.persistence.jdbc;

import com.automation.core.exception.OptimisticLockException;
import com.automation.core.model.ActionConfig;
import com.automation.core.model.AssignmentStatus;
import com.automation.core.model.AutomationTrigger;
import com.automation.core.model.HierarchyNode;
import com.automation.core.model.NodeLevel;
import com.automation.core.model.NodeStatus;
import com.automation.core.model.WorkflowAssignment;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * PostgreSQL tests for the conditional updates behind trigger locking,
 * hierarchy status changes and assignment versioning.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class JdbcTriggerRepositoryTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("automation_test")
        .withUsername("test")
        .withPassword("test");

    private static final Duration STALENESS = Duration.ofMinutes(5);

    private JdbcTemplate jdbcTemplate;
    private JdbcTriggerRepository triggers;
    private JdbcHierarchyRepository hierarchy;
    private JdbcAssignmentRepository assignments;

    @BeforeAll
    void setUpSchema() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/automation-schema.sql")).execute(dataSource);

        jdbcTemplate = new JdbcTemplate(dataSource);
        ObjectMapper objectMapper = new ObjectMapper();
        triggers = new JdbcTriggerRepository(jdbcTemplate, objectMapper);
        hierarchy = new JdbcHierarchyRepository(jdbcTemplate, objectMapper);
        assignments = new JdbcAssignmentRepository(jdbcTemplate);
    }

    @BeforeEach
    void cleanTables() {
        jdbcTemplate.update("DELETE FROM automation_triggers");
        jdbcTemplate.update("DELETE FROM hierarchy_nodes");
        jdbcTemplate.update("DELETE FROM workflow_assignments");
    }

    // ========== Trigger Lock Tests ==========

    @Test
    @DisplayName("Concurrent workers: exactly one acquires the trigger lock")
    void concurrentLockAcquisition() throws Exception {
        Instant now = now();
        triggers.save(trigger("t-1", now.minusSeconds(1)));

        int workers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < workers; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return triggers.tryAcquireLock("t-1", now, now.minus(STALENESS));
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("A stale lock is reclaimed and released with the new schedule")
    void staleLockAndRelease() {
        Instant now = now();
        triggers.save(trigger("t-1", now).withLock(now.minus(Duration.ofMinutes(10))));

        assertThat(triggers.tryAcquireLock("t-1", now, now.minus(STALENESS))).isTrue();
        assertThat(triggers.tryAcquireLock("t-1", now, now.minus(STALENESS))).isFalse();

        Instant next = now.plus(Duration.ofDays(1));
        triggers.releaseLock("t-1", now, next);

        AutomationTrigger stored = triggers.findById("t-1").orElseThrow();
        assertThat(stored.lockedAt()).isNull();
        assertThat(stored.lastExecuted()).isEqualTo(now);
        assertThat(stored.nextExecution()).isEqualTo(next);
        assertThat(stored.actions()).extracting(ActionConfig::type).containsExactly("send_reminder");
    }

    @Test
    @DisplayName("Executed and rescheduled occurrence cannot be locked again from a stale due list")
    void lockRechecksDueCondition() {
        Instant now = now();
        triggers.save(trigger("t-1", now.minusSeconds(1)));
        assertThat(triggers.findDueForExecution(now, 10)).extracting(AutomationTrigger::id).containsExactly("t-1");

        assertThat(triggers.tryAcquireLock("t-1", now, now.minus(STALENESS))).isTrue();
        triggers.releaseLock("t-1", now, now.plus(Duration.ofDays(1)));

        assertThat(triggers.tryAcquireLock("t-1", now, now.minus(STALENESS))).isFalse();
        assertThat(triggers.tryAcquireManualLock("t-1", now, now.minus(STALENESS))).isTrue();
        assertThat(triggers.tryAcquireManualLock("t-1", now, now.minus(STALENESS))).isFalse();
    }

    @Test
    @DisplayName("Disabled trigger cannot be locked by the scheduler")
    void disabledTriggerNotLocked() {
        Instant now = now();
        triggers.save(trigger("t-1", now.minusSeconds(1)));
        triggers.disable("t-1");

        assertThat(triggers.tryAcquireLock("t-1", now, now.minus(STALENESS))).isFalse();
    }

    @Test
    @DisplayName("Due query honours enabled flag, schedule order and limit")
    void findDue() {
        Instant now = now();
        triggers.save(trigger("late", now.minusSeconds(10)));
        triggers.save(trigger("early", now.minusSeconds(60)));
        triggers.save(trigger("future", now.plusSeconds(60)));
        triggers.save(trigger("off", now.minusSeconds(30)));
        assertThat(triggers.disable("off")).isTrue();
        assertThat(triggers.disable("off")).isFalse();

        assertThat(triggers.findDueForExecution(now, 10))
            .extracting(AutomationTrigger::id)
            .containsExactly("early", "late");
    }

    // ========== Hierarchy and Assignment Tests ==========

    @Test
    @DisplayName("Status compare-and-set only succeeds from the expected status")
    void hierarchyCompareAndSet() {
        Instant now = now();
        hierarchy.save(HierarchyNode.pending(NodeLevel.TASK, "T1", "P1", "Task", 0));

        assertThat(hierarchy.compareAndSetStatus(NodeLevel.TASK, "T1", NodeStatus.PENDING, NodeStatus.COMPLETED, now, "u1")).isTrue();
        assertThat(hierarchy.compareAndSetStatus(NodeLevel.TASK, "T1", NodeStatus.PENDING, NodeStatus.COMPLETED, now, "u2")).isFalse();

        HierarchyNode stored = hierarchy.findById(NodeLevel.TASK, "T1").orElseThrow();
        assertThat(stored.completedBy()).isEqualTo("u1");
        assertThat(stored.completedAt()).isEqualTo(now);
        assertThat(hierarchy.findChildren(NodeLevel.TASK, "P1")).hasSize(1);
    }

    @Test
    @DisplayName("Progression settings and completion actions survive a round trip")
    void hierarchyNodeSettingsRoundTrip() {
        hierarchy.save(HierarchyNode.pending(NodeLevel.TASK, "T1", "P1", "Task", 0)
            .withAutoProgress(false)
            .withTaskRequirements(false, true));
        hierarchy.save(HierarchyNode.pending(NodeLevel.STEP, "P1", "S1", "Step", 0)
            .withOnCompleteActions(List.of(ActionConfig.of("send_email"))));

        HierarchyNode task = hierarchy.findById(NodeLevel.TASK, "T1").orElseThrow();
        HierarchyNode step = hierarchy.findById(NodeLevel.STEP, "P1").orElseThrow();
        assertThat(task.autoProgress()).isFalse();
        assertThat(task.requireAllSubtasksComplete()).isFalse();
        assertThat(task.requireAllChecklistsComplete()).isTrue();
        assertThat(task.onCompleteActions()).isEmpty();
        assertThat(step.onCompleteActions()).extracting(ActionConfig::type).containsExactly("send_email");
    }

    @Test
    @DisplayName("Stale assignment versions are rejected")
    void assignmentOptimisticLock() {
        WorkflowAssignment created = new WorkflowAssignment("a-1", "wf-1", "u1", "S1", null,
            AssignmentStatus.ACTIVE, 0, 4, 0, 0L);
        assignments.save(created);

        assignments.update(created.movedTo("S2", 1));

        assertThatThrownBy(() -> assignments.update(created.movedTo("S3", 2)))
            .isInstanceOf(OptimisticLockException.class);
        assertThat(assignments.findById("a-1").orElseThrow().progress()).isEqualTo(25);
    }

    private static Instant now() {
        // Postgres stores microseconds
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    private static AutomationTrigger trigger(String id, Instant nextExecution) {
        return AutomationTrigger.cron(id, "org-1", "wf-1", "Trigger " + id, "0 9 * * *",
            List.of(ActionConfig.of("send_reminder")), nextExecution);
    }
}
