package com.automation.engine.trigger;

import com.automation.core.model.EventTriggerConfig;
import com.automation.core.model.TriggerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Event trigger configurations held in process memory, keyed by event.
 * Thread-safe. Once closed, no further configurations are accepted.
 */
public class EventTriggerRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventTriggerRegistry.class);

    private final Map<TriggerEvent, List<EventTriggerConfig>> triggersByEvent = new ConcurrentHashMap<>();
    private volatile boolean closed = false;

    public void register(EventTriggerConfig config) {
        if (closed) {
            throw new IllegalStateException("Event trigger registry is closed");
        }
        triggersByEvent.computeIfAbsent(config.event(), e -> new CopyOnWriteArrayList<>()).add(config);
        log.info("Registered event trigger {} for {}", config.id(), config.event());
    }

    /**
     * Remove a configuration from every event it is registered for.
     * 
     * @return true if anything was removed
     */
    public boolean unregister(String triggerId) {
        boolean removed = false;
        for (List<EventTriggerConfig> configs : triggersByEvent.values()) {
            removed |= configs.removeIf(config -> config.id().equals(triggerId));
        }
        if (removed) {
            log.info("Unregistered event trigger {}", triggerId);
        }
        return removed;
    }

    public void clear() {
        triggersByEvent.clear();
        log.info("Cleared all event triggers");
    }

    /**
     * Snapshot of the configurations for an event, in registration order.
     */
    public List<EventTriggerConfig> triggersFor(TriggerEvent event) {
        List<EventTriggerConfig> configs = triggersByEvent.get(event);
        return configs == null ? List.of() : List.copyOf(configs);
    }

    public int size() {
        return triggersByEvent.values().stream().mapToInt(List::size).sum();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        triggersByEvent.clear();
    }
}
