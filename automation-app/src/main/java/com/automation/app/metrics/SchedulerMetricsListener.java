package com.automation.app.metrics;

import com.automation.core.model.AutomationTrigger;
import com.automation.engine.metrics.AutomationMetrics;
import com.automation.scheduler.TriggerScheduler.SchedulerListener;
import com.automation.scheduler.TriggerScheduler.TriggerOutcome;

/**
 * Feeds scheduler activity into the automation metrics.
 */
public class SchedulerMetricsListener implements SchedulerListener {

    private final AutomationMetrics metrics;

    public SchedulerMetricsListener(AutomationMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onTriggerExecuted(AutomationTrigger trigger, TriggerOutcome outcome) {
        metrics.triggerExecuted(outcome.name().toLowerCase());
    }

    @Override
    public void onLockSkipped(AutomationTrigger trigger) {
        metrics.triggerLockSkipped();
    }
}
