package com.automation.app.config;

import com.automation.scheduler.CronSchedules;
import com.automation.scheduler.SchedulerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Settings under the "automation" prefix.
 */
@ConfigurationProperties(prefix = "automation")
public class AutomationProperties {

    private final Scheduler scheduler = new Scheduler();
    private final Events events = new Events();

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Events getEvents() {
        return events;
    }

    public static class Scheduler {
        /** Whether this node polls for due triggers. */
        private boolean enabled = true;
        private Duration pollInterval = SchedulerSettings.DEFAULT_POLL_INTERVAL;
        /** Locks older than this are taken over by other workers. */
        private Duration lockStaleness = SchedulerSettings.DEFAULT_LOCK_STALENESS;
        private int batchSize = SchedulerSettings.DEFAULT_BATCH_SIZE;
        /** Zone cron expressions are evaluated in. */
        private ZoneId zone = CronSchedules.DEFAULT_ZONE;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getLockStaleness() {
            return lockStaleness;
        }

        public void setLockStaleness(Duration lockStaleness) {
            this.lockStaleness = lockStaleness;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public ZoneId getZone() {
            return zone;
        }

        public void setZone(ZoneId zone) {
            this.zone = zone;
        }

        public SchedulerSettings toSettings() {
            return new SchedulerSettings(pollInterval, lockStaleness, batchSize, zone);
        }
    }

    public static class Events {
        /** Threads running event handlers in the background. */
        private int asyncThreads = 4;

        public int getAsyncThreads() {
            return asyncThreads;
        }

        public void setAsyncThreads(int asyncThreads) {
            this.asyncThreads = asyncThreads;
        }
    }
}
