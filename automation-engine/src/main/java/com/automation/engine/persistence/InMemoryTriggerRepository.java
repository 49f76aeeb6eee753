package com.automation.engine.persistence;

import com.automation.core.model.AutomationTrigger;
import com.automation.core.repository.TriggerRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TriggerRepository.
 * Lock transitions are serialized on the trigger map, which makes
 * tryAcquireLock an atomic compare-and-set within one process.
 */
public class InMemoryTriggerRepository implements TriggerRepository {

    private final Map<String, AutomationTrigger> triggers = new ConcurrentHashMap<>();

    @Override
    public void save(AutomationTrigger trigger) {
        triggers.put(trigger.id(), trigger);
    }

    @Override
    public Optional<AutomationTrigger> findById(String triggerId) {
        return Optional.ofNullable(triggers.get(triggerId));
    }

    @Override
    public List<AutomationTrigger> findDueForExecution(Instant now, int limit) {
        return triggers.values().stream()
            .filter(t -> t.isDue(now))
            .sorted(Comparator.comparing(AutomationTrigger::nextExecution))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public boolean tryAcquireLock(String triggerId, Instant now, Instant staleBefore) {
        return acquire(triggerId, now, staleBefore, true);
    }

    @Override
    public boolean tryAcquireManualLock(String triggerId, Instant now, Instant staleBefore) {
        return acquire(triggerId, now, staleBefore, false);
    }

    private boolean acquire(String triggerId, Instant now, Instant staleBefore, boolean requireDue) {
        synchronized (triggers) {
            AutomationTrigger existing = triggers.get(triggerId);
            if (existing == null) {
                return false;
            }
            if (requireDue && !existing.isDue(now)) {
                return false;
            }
            if (existing.lockedAt() != null && !existing.lockedAt().isBefore(staleBefore)) {
                // Held by another worker
                return false;
            }
            triggers.put(triggerId, existing.withLock(now));
            return true;
        }
    }

    @Override
    public void releaseLock(String triggerId, Instant executedAt, Instant nextExecution) {
        synchronized (triggers) {
            triggers.computeIfPresent(triggerId, (id, t) -> t.withLockReleased(executedAt, nextExecution));
        }
    }

    @Override
    public void releaseLockPreservingSchedule(String triggerId, Instant executedAt) {
        synchronized (triggers) {
            triggers.computeIfPresent(triggerId, (id, t) -> t.withLockReleased(executedAt, t.nextExecution()));
        }
    }

    @Override
    public boolean disable(String triggerId) {
        synchronized (triggers) {
            AutomationTrigger existing = triggers.get(triggerId);
            if (existing == null || !existing.enabled()) {
                return false;
            }
            triggers.put(triggerId, existing.withEnabled(false));
            return true;
        }
    }
}
