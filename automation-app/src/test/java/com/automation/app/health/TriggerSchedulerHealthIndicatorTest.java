package com.automation.app.health;

import com.automation.app.config.AutomationProperties;
import com.automation.core.action.ActionExecutor;
import com.automation.core.action.ActionContext;
import com.automation.core.model.ActionConfig;
import com.automation.core.model.Condition;
import com.automation.engine.persistence.InMemoryTriggerRepository;
import com.automation.scheduler.SchedulerSettings;
import com.automation.scheduler.TriggerScheduler;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Trigger scheduler health")
class TriggerSchedulerHealthIndicatorTest {

    private static final Instant POLL_TIME = Instant.parse("2024-03-01T10:00:00Z");

    private AutomationProperties properties;
    private TriggerScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new AutomationProperties();
        scheduler = new TriggerScheduler(
            new InMemoryTriggerRepository(),
            new NoopActionExecutor(),
            Clock.fixed(POLL_TIME, ZoneOffset.UTC),
            new SchedulerSettings(Duration.ofMinutes(1), Duration.ofMinutes(5), 10, null));
    }

    @AfterEach
    void tearDown() {
        if (scheduler.isRunning()) {
            scheduler.stop();
        }
    }

    @Test
    void disabledSchedulerIsUp() {
        properties.getScheduler().setEnabled(false);

        Health health = indicatorAt(POLL_TIME).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("scheduler", "disabled");
    }

    @Test
    void stoppedSchedulerIsDown() {
        Health health = indicatorAt(POLL_TIME).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("scheduler", "stopped");
    }

    @Test
    void recentPollIsUp() throws InterruptedException {
        startAndAwaitFirstPoll();

        Health health = indicatorAt(POLL_TIME.plusSeconds(90)).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
            .containsEntry("scheduler", "running")
            .containsEntry("lastPollAt", POLL_TIME.toString())
            .containsEntry("pollInterval", "PT1M");
    }

    @Test
    void missedPollsReportStalled() throws InterruptedException {
        startAndAwaitFirstPoll();

        Health health = indicatorAt(POLL_TIME.plus(Duration.ofMinutes(10))).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("scheduler", "stalled");
    }

    private TriggerSchedulerHealthIndicator indicatorAt(Instant now) {
        return new TriggerSchedulerHealthIndicator(scheduler, properties, Clock.fixed(now, ZoneOffset.UTC));
    }

    private void startAndAwaitFirstPoll() throws InterruptedException {
        scheduler.start();
        long deadline = System.currentTimeMillis() + 5_000;
        while (scheduler.getLastPollAt() == null && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(scheduler.getLastPollAt()).isEqualTo(POLL_TIME);
    }

    private static class NoopActionExecutor implements ActionExecutor {
        @Override
        public boolean evaluateConditions(List<Condition> conditions, JsonNode payload) {
            return true;
        }

        @Override
        public void executeActions(List<ActionConfig> actions, ActionContext context) {
        }
    }
}
