package com.automation.app.health;

import com.automation.app.config.AutomationProperties;
import com.automation.scheduler.TriggerScheduler;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Reports whether the trigger scheduler is polling.
 * DOWN when it is stopped or its last poll is older than three poll intervals.
 */
@Component
public class TriggerSchedulerHealthIndicator implements HealthIndicator {

    private static final int MAX_MISSED_POLLS = 3;

    private final TriggerScheduler triggerScheduler;
    private final AutomationProperties properties;
    private final Clock clock;

    public TriggerSchedulerHealthIndicator(
            TriggerScheduler triggerScheduler,
            AutomationProperties properties,
            Clock clock) {
        this.triggerScheduler = triggerScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Health health() {
        if (!properties.getScheduler().isEnabled()) {
            return Health.up().withDetail("scheduler", "disabled").build();
        }
        if (!triggerScheduler.isRunning()) {
            return Health.down().withDetail("scheduler", "stopped").build();
        }
        
        Duration pollInterval = triggerScheduler.getSettings().pollInterval();
        Instant lastPoll = triggerScheduler.getLastPollAt();
        if (lastPoll == null) {
            return Health.up()
                .withDetail("scheduler", "starting")
                .withDetail("pollInterval", pollInterval.toString())
                .build();
        }
        
        Duration sinceLastPoll = Duration.between(lastPoll, clock.instant());
        Health.Builder builder = sinceLastPoll.compareTo(pollInterval.multipliedBy(MAX_MISSED_POLLS)) > 0
            ? Health.down().withDetail("scheduler", "stalled")
            : Health.up().withDetail("scheduler", "running");
        
        return builder
            .withDetail("lastPollAt", lastPoll.toString())
            .withDetail("pollInterval", pollInterval.toString())
            .build();
    }
}
