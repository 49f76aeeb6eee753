package com.automation.scheduler;

import com.automation.core.exception.InvalidCronExpressionException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.*;

class CronSchedulesTest {

    @Test
    void fiveFieldMidnight_firesAtNextMidnightUtc() {
        Instant from = Instant.parse("2024-03-01T10:15:00Z");

        assertThat(CronSchedules.computeNextCronExecution("0 0 * * *", from))
            .contains(Instant.parse("2024-03-02T00:00:00Z"));
    }

    @Test
    void nextIsStrictlyAfterReference() {
        Instant exactlyMidnight = Instant.parse("2024-03-02T00:00:00Z");

        assertThat(CronSchedules.computeNextCronExecution("0 0 * * *", exactlyMidnight))
            .contains(Instant.parse("2024-03-03T00:00:00Z"));
    }

    @Test
    void sixFieldAndMacroExpressions() {
        Instant from = Instant.parse("2024-03-01T10:15:00Z");

        assertThat(CronSchedules.computeNextCronExecution("30 * * * * *", from))
            .contains(Instant.parse("2024-03-01T10:15:30Z"));
        assertThat(CronSchedules.computeNextCronExecution("@daily", from))
            .contains(Instant.parse("2024-03-02T00:00:00Z"));
    }

    @Test
    void zoneIsHonoured() {
        Instant from = Instant.parse("2024-03-01T10:15:00Z");

        // Midnight in New York (EST, UTC-5)
        assertThat(CronSchedules.computeNextCronExecution("0 0 * * *", from, ZoneId.of("America/New_York")))
            .contains(Instant.parse("2024-03-02T05:00:00Z"));
    }

    @Test
    void malformedExpressions_yieldEmpty() {
        Instant from = Instant.parse("2024-03-01T10:15:00Z");

        assertThat(CronSchedules.computeNextCronExecution("not a cron", from)).isEmpty();
        assertThat(CronSchedules.computeNextCronExecution("61 * * * *", from)).isEmpty();
        assertThat(CronSchedules.computeNextCronExecution("", from)).isEmpty();
        assertThat(CronSchedules.computeNextCronExecution(null, from)).isEmpty();
    }

    @Test
    void validate() {
        assertThat(CronSchedules.validateCronExpression("*/5 * * * *")).isTrue();
        assertThat(CronSchedules.validateCronExpression("0 9 * * MON-FRI")).isTrue();
        assertThat(CronSchedules.validateCronExpression("* * *")).isFalse();
        assertThat(CronSchedules.validateCronExpression(null)).isFalse();

        assertThatThrownBy(() -> CronSchedules.requireValid("bogus"))
            .isInstanceOf(InvalidCronExpressionException.class);
    }
}
