package com.automation.app.lifecycle;

import com.automation.app.config.AutomationProperties;
import com.automation.engine.dispatch.AsyncEventDispatcher;
import com.automation.engine.trigger.EventTriggerRegistry;
import com.automation.scheduler.TriggerScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts the trigger scheduler once the application is ready and shuts the
 * automation core down in order when the context closes:
 * 1. Stop polling (an in-flight poll finishes and releases its locks)
 * 2. Drain background event handlers
 * 3. Dispose the event trigger registry
 */
@Component
public class AutomationLifecycle {

    private static final Logger log = LoggerFactory.getLogger(AutomationLifecycle.class);

    private final TriggerScheduler triggerScheduler;
    private final AsyncEventDispatcher eventDispatcher;
    private final EventTriggerRegistry triggerRegistry;
    private final AutomationProperties properties;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public AutomationLifecycle(
            TriggerScheduler triggerScheduler,
            AsyncEventDispatcher eventDispatcher,
            EventTriggerRegistry triggerRegistry,
            AutomationProperties properties) {
        this.triggerScheduler = triggerScheduler;
        this.eventDispatcher = eventDispatcher;
        this.triggerRegistry = triggerRegistry;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.getScheduler().isEnabled()) {
            log.info("Trigger scheduler disabled on this node");
            return;
        }
        triggerScheduler.start();
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down workflow automation");
        
        triggerScheduler.stop();
        eventDispatcher.close();
        triggerRegistry.close();
        
        log.info("Workflow automation shut down");
    }
}
