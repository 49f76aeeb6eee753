package com.automation.scheduler;

import com.automation.core.action.ActionContext;
import com.automation.core.action.ActionExecutor;
import com.automation.core.exception.LockAcquisitionException;
import com.automation.core.exception.NotFoundException;
import com.automation.core.model.AutomationTrigger;
import com.automation.core.model.ScheduleType;
import com.automation.core.repository.TriggerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls for due time-based triggers and runs their actions.
 * 
 * Safe to run on several nodes at once: each due trigger is executed by the
 * one worker that wins its lock, other workers skip it. After every attempt,
 * successful or not, the lock is released and the next execution recorded:
 * - CRON: next occurrence after the execution, or after now when the run failed
 * - ONE_TIME: disabled
 * - next run not computable: existing schedule kept, so the trigger is retried later
 */
public class TriggerScheduler {

    private static final Logger log = LoggerFactory.getLogger(TriggerScheduler.class);

    private static final String MDC_TRIGGER_ID = "triggerId";
    private static final String MDC_ORGANIZATION_ID = "organizationId";

    private final TriggerRepository triggerRepository;
    private final ActionExecutor actionExecutor;
    private final Clock clock;
    private final SchedulerSettings settings;
    private final SchedulerListener listener;
    
    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;
    private volatile Instant lastPollAt;

    public TriggerScheduler(
            TriggerRepository triggerRepository,
            ActionExecutor actionExecutor,
            Clock clock,
            SchedulerSettings settings) {
        this(triggerRepository, actionExecutor, clock, settings, SchedulerListener.NONE);
    }

    public TriggerScheduler(
            TriggerRepository triggerRepository,
            ActionExecutor actionExecutor,
            Clock clock,
            SchedulerSettings settings,
            SchedulerListener listener) {
        this.triggerRepository = triggerRepository;
        this.actionExecutor = actionExecutor;
        this.clock = clock;
        this.settings = settings;
        this.listener = listener != null ? listener : SchedulerListener.NONE;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "automation-trigger-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start polling with a fixed delay between polls.
     * 
     * @throws IllegalStateException if the scheduler was already stopped
     */
    public void start() {
        if (running) {
            log.warn("Trigger scheduler already running");
            return;
        }
        if (scheduler.isShutdown()) {
            throw new IllegalStateException("Trigger scheduler was stopped and cannot be restarted");
        }
        
        running = true;
        log.info("Starting trigger scheduler (poll interval {}, lock staleness {})",
            settings.pollInterval(), settings.lockStaleness());
        
        scheduler.scheduleWithFixedDelay(
            this::tick,
            0,
            settings.pollInterval().toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop polling. An in-flight poll is given 30 seconds to finish.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Trigger scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Start of the most recent poll, or null if none ran yet.
     */
    public Instant getLastPollAt() {
        return lastPollAt;
    }

    public SchedulerSettings getSettings() {
        return settings;
    }

    /**
     * Validate and store a trigger. A cron trigger without a next execution
     * gets the next occurrence after now.
     * 
     * @param trigger The trigger to store
     * @return The stored trigger
     * @throws com.automation.core.exception.InvalidCronExpressionException for a malformed cron expression
     */
    public AutomationTrigger scheduleTrigger(AutomationTrigger trigger) {
        AutomationTrigger toSave = trigger;
        
        if (trigger.scheduleType() == ScheduleType.CRON) {
            CronSchedules.requireValid(trigger.cronExpression());
            if (trigger.nextExecution() == null) {
                Instant next = CronSchedules.computeNextCronExecution(
                    trigger.cronExpression(), clock.instant(), settings.zone()).orElse(null);
                toSave = new AutomationTrigger(trigger.id(), trigger.organizationId(), trigger.workflowId(),
                    trigger.name(), trigger.enabled(), trigger.scheduleType(), trigger.cronExpression(),
                    trigger.actions(), next, trigger.lastExecuted(), trigger.lockedAt());
            }
        } else if (trigger.nextExecution() == null) {
            throw new IllegalArgumentException("One-time trigger " + trigger.id() + " needs a fire time");
        }
        
        triggerRepository.save(toSave);
        log.info("Scheduled trigger {} ({}), next execution {}", toSave.id(), toSave.scheduleType(), toSave.nextExecution());
        return toSave;
    }

    /**
     * Run one trigger immediately, outside its schedule.
     * 
     * @param triggerId The trigger ID
     * @return EXECUTED or FAILED
     * @throws NotFoundException if no such trigger exists
     * @throws LockAcquisitionException if another worker is running it
     */
    public TriggerOutcome executeNow(String triggerId) {
        AutomationTrigger trigger = triggerRepository.findById(triggerId)
            .orElseThrow(() -> new NotFoundException("AutomationTrigger", triggerId));
        
        Instant now = clock.instant();
        if (!triggerRepository.tryAcquireManualLock(triggerId, now, now.minus(settings.lockStaleness()))) {
            throw new LockAcquisitionException(triggerId);
        }
        
        log.info("Manual execution of trigger {}", triggerId);
        return runLocked(trigger);
    }

    /**
     * Process every trigger due at the current instant, up to the batch size.
     * Called by the polling thread; hosts and tests may call it directly.
     */
    public PollResult pollTriggers() {
        Instant now = clock.instant();
        lastPollAt = now;
        
        List<AutomationTrigger> due = triggerRepository.findDueForExecution(now, settings.batchSize());
        if (due.isEmpty()) {
            return PollResult.EMPTY;
        }
        log.debug("Found {} due trigger(s)", due.size());
        
        int executed = 0;
        int skipped = 0;
        int failed = 0;
        for (AutomationTrigger trigger : due) {
            TriggerOutcome outcome;
            try {
                outcome = processTrigger(trigger);
            } catch (RuntimeException e) {
                log.error("Failed to process trigger: {}", trigger.id(), e);
                outcome = TriggerOutcome.FAILED;
            }
            
            switch (outcome) {
                case EXECUTED -> executed++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }
        
        return new PollResult(due.size(), executed, skipped, failed);
    }

    // ========== Internal Methods ==========

    private void tick() {
        if (!running) return;
        
        try {
            PollResult result = pollTriggers();
            if (result.due() > 0) {
                log.info("Trigger poll: {}", result);
            }
        } catch (Exception e) {
            log.error("Error polling triggers", e);
        }
    }

    /**
     * Lock and run one trigger of the due list. The lock is stamped with the time of
     * acquisition, not of the poll, so slow earlier triggers in the batch do not
     * shorten the lock's staleness window.
     */
    private TriggerOutcome processTrigger(AutomationTrigger trigger) {
        try (var triggerCtx = MDC.putCloseable(MDC_TRIGGER_ID, trigger.id());
             var orgCtx = MDC.putCloseable(MDC_ORGANIZATION_ID, trigger.organizationId())) {
            
            Instant lockAt = clock.instant();
            if (!triggerRepository.tryAcquireLock(trigger.id(), lockAt, lockAt.minus(settings.lockStaleness()))) {
                log.debug("Trigger {} is locked by another worker or no longer due, skipping", trigger.id());
                listener.onLockSkipped(trigger);
                return TriggerOutcome.SKIPPED;
            }
            
            return runLocked(trigger);
        }
    }

    /**
     * Run the actions of a trigger whose lock is held, then release the lock.
     */
    private TriggerOutcome runLocked(AutomationTrigger trigger) {
        Instant executedAt = clock.instant();
        boolean succeeded = false;
        
        try {
            actionExecutor.executeActions(trigger.actions(), ActionContext.forScheduledTrigger(trigger, executedAt));
            succeeded = true;
            log.info("Executed trigger {} ({})", trigger.id(), trigger.name());
        } catch (RuntimeException e) {
            log.error("Trigger {} failed", trigger.id(), e);
        } finally {
            NextRun next;
            try {
                next = succeeded ? nextRunAfterSuccess(trigger, executedAt) : nextRunAfterFailure(trigger);
            } catch (RuntimeException e) {
                log.warn("Could not reschedule trigger {}, keeping its schedule", trigger.id(), e);
                next = NextRun.PRESERVE;
            }
            releaseLock(trigger, executedAt, next);
        }
        
        TriggerOutcome outcome = succeeded ? TriggerOutcome.EXECUTED : TriggerOutcome.FAILED;
        listener.onTriggerExecuted(trigger, outcome);
        return outcome;
    }

    private NextRun nextRunAfterSuccess(AutomationTrigger trigger, Instant executedAt) {
        if (trigger.scheduleType() == ScheduleType.ONE_TIME) {
            triggerRepository.disable(trigger.id());
            log.info("One-time trigger {} disabled", trigger.id());
            return NextRun.of(null);
        }
        return nextCronRun(trigger, executedAt);
    }

    private NextRun nextRunAfterFailure(AutomationTrigger trigger) {
        if (trigger.scheduleType() == ScheduleType.ONE_TIME) {
            triggerRepository.disable(trigger.id());
            log.info("One-time trigger {} disabled after failure", trigger.id());
            return NextRun.PRESERVE;
        }
        return nextCronRun(trigger, clock.instant());
    }

    private NextRun nextCronRun(AutomationTrigger trigger, Instant after) {
        Optional<Instant> next = CronSchedules.computeNextCronExecution(trigger.cronExpression(), after, settings.zone());
        if (next.isEmpty()) {
            log.warn("Cannot compute next run of trigger {} from '{}', keeping its schedule",
                trigger.id(), trigger.cronExpression());
            return NextRun.PRESERVE;
        }
        return NextRun.of(next.get());
    }

    private void releaseLock(AutomationTrigger trigger, Instant executedAt, NextRun next) {
        try {
            if (next.preserve()) {
                triggerRepository.releaseLockPreservingSchedule(trigger.id(), executedAt);
            } else {
                triggerRepository.releaseLock(trigger.id(), executedAt, next.at());
            }
        } catch (RuntimeException e) {
            log.error("Failed to release lock on trigger {}; it becomes available again after {}",
                trigger.id(), settings.lockStaleness(), e);
        }
    }

    private record NextRun(Instant at, boolean preserve) {
        static final NextRun PRESERVE = new NextRun(null, true);

        static NextRun of(Instant at) {
            return new NextRun(at, false);
        }
    }

    /**
     * Result of one trigger attempt.
     */
    public enum TriggerOutcome {
        EXECUTED,
        FAILED,
        /** Another worker holds the lock. */
        SKIPPED
    }

    /**
     * Counts of one poll.
     */
    public record PollResult(int due, int executed, int skipped, int failed) {
        public static final PollResult EMPTY = new PollResult(0, 0, 0, 0);
    }

    /**
     * Callback for scheduler activity, used for metrics.
     */
    public interface SchedulerListener {
        SchedulerListener NONE = new SchedulerListener() {
        };

        default void onTriggerExecuted(AutomationTrigger trigger, TriggerOutcome outcome) {
        }

        default void onLockSkipped(AutomationTrigger trigger) {
        }
    }
}
