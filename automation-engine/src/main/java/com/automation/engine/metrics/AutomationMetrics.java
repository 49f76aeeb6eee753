package com.automation.engine.metrics;

import com.automation.core.model.NodeLevel;
import com.automation.core.model.TriggerEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

/**
 * Micrometer metrics for the automation core.
 * 
 * Metrics exposed:
 * - Scheduled trigger executions by outcome, and lock contention skips
 * - Event dispatches and per-config failures by event
 * - Assignment advances by outcome
 * - Cascade completions by hierarchy level
 * 
 * Recording is a no-op until the binder is bound to a registry.
 */
public class AutomationMetrics implements MeterBinder {

    // Metric names
    public static final String TRIGGER_EXECUTIONS = "automation.trigger.executions";
    public static final String TRIGGER_LOCK_SKIPPED = "automation.trigger.lock.skipped";
    public static final String EVENT_DISPATCHES = "automation.event.dispatches";
    public static final String EVENT_FAILURES = "automation.event.failures";
    public static final String ASSIGNMENT_ADVANCES = "automation.assignment.advances";
    public static final String PROGRESSION_COMPLETIONS = "automation.progression.completions";

    private volatile MeterRegistry registry;

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
    }

    // ========== Scheduler Metrics ==========

    public void triggerExecuted(String outcome) {
        increment(Counter.builder(TRIGGER_EXECUTIONS)
            .tag("outcome", outcome)
            .description("Scheduled trigger executions"));
    }

    public void triggerLockSkipped() {
        increment(Counter.builder(TRIGGER_LOCK_SKIPPED)
            .description("Due triggers skipped because another worker holds the lock"));
    }

    // ========== Event Metrics ==========

    public void eventDispatched(TriggerEvent event) {
        increment(Counter.builder(EVENT_DISPATCHES)
            .tag("event", event.wireName())
            .description("Domain events dispatched to event triggers"));
    }

    public void eventTriggerFailed(TriggerEvent event) {
        increment(Counter.builder(EVENT_FAILURES)
            .tag("event", event.wireName())
            .description("Event trigger configs that failed during evaluation or execution"));
    }

    // ========== Progression Metrics ==========

    public void assignmentAdvanced(String outcome) {
        increment(Counter.builder(ASSIGNMENT_ADVANCES)
            .tag("outcome", outcome)
            .description("Assignment auto-advance attempts"));
    }

    public void nodeCompleted(NodeLevel level) {
        increment(Counter.builder(PROGRESSION_COMPLETIONS)
            .tag("level", level.name().toLowerCase())
            .description("Hierarchy nodes completed directly or by cascade"));
    }

    private void increment(Counter.Builder builder) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        builder.register(current).increment();
    }
}
