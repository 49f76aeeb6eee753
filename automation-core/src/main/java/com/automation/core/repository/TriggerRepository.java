package com.automation.core.repository;

import com.automation.core.model.AutomationTrigger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for time-based trigger persistence.
 * Owns the per-trigger execution lock used to elect a single executor
 * among concurrently polling workers.
 */
public interface TriggerRepository {

    /**
     * Insert or replace a trigger.
     */
    void save(AutomationTrigger trigger);

    /**
     * Find a trigger by ID.
     */
    Optional<AutomationTrigger> findById(String triggerId);

    /**
     * Find enabled triggers whose next execution is at or before now,
     * ordered by next execution.
     * 
     * @param now Current time
     * @param limit Maximum number of results
     * @return Due triggers
     */
    List<AutomationTrigger> findDueForExecution(Instant now, int limit);

    /**
     * Atomically take the execution lock of a due trigger.
     * Succeeds only if the trigger is still due at now (enabled, nextExecution at or
     * before now) and is unlocked or its lock was taken before staleBefore. A worker
     * holding a stale due list therefore cannot re-run an occurrence another worker
     * has already executed and rescheduled or disabled.
     * 
     * @param triggerId The trigger ID
     * @param now Lock timestamp to record, also the due reference time
     * @param staleBefore Locks older than this are considered abandoned
     * @return true if the lock was acquired, false if another worker holds it or the trigger is no longer due
     */
    boolean tryAcquireLock(String triggerId, Instant now, Instant staleBefore);

    /**
     * Atomically take the execution lock for a manual run, regardless of schedule.
     * 
     * @param triggerId The trigger ID
     * @param now Lock timestamp to record
     * @param staleBefore Locks older than this are considered abandoned
     * @return true if the lock was acquired, false if another worker holds it
     */
    boolean tryAcquireManualLock(String triggerId, Instant now, Instant staleBefore);

    /**
     * Release the lock, recording the execution and the next execution time.
     * 
     * @param triggerId The trigger ID
     * @param executedAt When the execution ran
     * @param nextExecution The new next execution, may be null (one-time triggers)
     */
    void releaseLock(String triggerId, Instant executedAt, Instant nextExecution);

    /**
     * Release the lock leaving the stored next execution untouched,
     * so the trigger stays eligible on a later tick.
     * 
     * @param triggerId The trigger ID
     * @param executedAt When the execution was attempted
     */
    void releaseLockPreservingSchedule(String triggerId, Instant executedAt);

    /**
     * Disable a trigger.
     * 
     * @return true if the trigger was enabled before this call
     */
    boolean disable(String triggerId);
}
