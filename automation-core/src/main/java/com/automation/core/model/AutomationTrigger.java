package com.automation.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Persisted time-based trigger: when (cron or one-time) and what (actions) to run.
 * 
 * Primary Key: id
 * 
 * Invariants:
 * - a disabled trigger is never selected for execution
 * - a ONE_TIME trigger is disabled exactly once, right after its execution
 * - a CRON trigger's nextExecution is strictly after the instant it was computed from
 * - lockedAt is set only while a worker owns the execution lock
 */
public record AutomationTrigger(
    String id,
    String organizationId,
    String workflowId,
    String name,
    boolean enabled,
    
    // Schedule
    ScheduleType scheduleType,
    String cronExpression,
    List<ActionConfig> actions,
    Instant nextExecution,
    Instant lastExecuted,
    
    // Execution lock
    Instant lockedAt
) {
    public AutomationTrigger {
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    /**
     * Create an enabled cron trigger.
     */
    public static AutomationTrigger cron(
            String id,
            String organizationId,
            String workflowId,
            String name,
            String cronExpression,
            List<ActionConfig> actions,
            Instant nextExecution) {
        return new AutomationTrigger(id, organizationId, workflowId, name, true,
            ScheduleType.CRON, cronExpression, actions, nextExecution, null, null);
    }

    /**
     * Create an enabled one-time trigger.
     */
    public static AutomationTrigger oneTime(
            String id,
            String organizationId,
            String workflowId,
            String name,
            List<ActionConfig> actions,
            Instant fireAt) {
        return new AutomationTrigger(id, organizationId, workflowId, name, true,
            ScheduleType.ONE_TIME, null, actions, fireAt, null, null);
    }

    /**
     * Check if the trigger should run at the given instant.
     */
    public boolean isDue(Instant now) {
        return enabled && nextExecution != null && !nextExecution.isAfter(now);
    }

    /**
     * Check if a non-stale lock is held at the given instant.
     */
    public boolean isLockedAt(Instant now, Duration stalenessWindow) {
        return lockedAt != null && lockedAt.isAfter(now.minus(stalenessWindow));
    }

    public AutomationTrigger withLock(Instant lockedAt) {
        return new AutomationTrigger(id, organizationId, workflowId, name, enabled,
            scheduleType, cronExpression, actions, nextExecution, lastExecuted, lockedAt);
    }

    public AutomationTrigger withLockReleased(Instant executedAt, Instant newNextExecution) {
        return new AutomationTrigger(id, organizationId, workflowId, name, enabled,
            scheduleType, cronExpression, actions, newNextExecution, executedAt, null);
    }

    public AutomationTrigger withEnabled(boolean newEnabled) {
        return new AutomationTrigger(id, organizationId, workflowId, name, newEnabled,
            scheduleType, cronExpression, actions, nextExecution, lastExecuted, lockedAt);
    }
}
