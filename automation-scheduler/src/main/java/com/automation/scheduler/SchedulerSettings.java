package com.automation.scheduler;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Tuning of the trigger scheduler.
 * 
 * @param pollInterval Delay between two polls
 * @param lockStaleness Age after which a held lock is considered abandoned
 * @param batchSize Maximum number of due triggers processed per poll
 * @param zone Zone cron expressions are evaluated in
 */
public record SchedulerSettings(
    Duration pollInterval,
    Duration lockStaleness,
    int batchSize,
    ZoneId zone
) {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_LOCK_STALENESS = Duration.ofMinutes(5);
    public static final int DEFAULT_BATCH_SIZE = 100;

    public SchedulerSettings {
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(lockStaleness, "lockStaleness");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        zone = zone != null ? zone : CronSchedules.DEFAULT_ZONE;
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(DEFAULT_POLL_INTERVAL, DEFAULT_LOCK_STALENESS, DEFAULT_BATCH_SIZE, CronSchedules.DEFAULT_ZONE);
    }
}
