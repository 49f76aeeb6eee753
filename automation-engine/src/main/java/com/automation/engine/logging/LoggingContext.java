package com.automation.engine.logging;

import com.automation.core.model.NodeLevel;
import com.automation.core.model.TriggerEvent;
import org.slf4j.MDC;
import java.util.UUID;

/**
 * Scoped MDC entries for one event dispatch or one completion cascade.
 *
 * <pre>
 * try (var ctx = LoggingContext.forEvent(TriggerEvent.INVOICE_PAID, organizationId, assignmentId)) {
 *     log.info("Dispatching"); // carries event, organizationId, assignmentId, traceId
 * }
 * </pre>
 *
 * A trace id already present on the thread is reused and left in place on close.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String ORGANIZATION_ID = "organizationId";
    public static final String EVENT = "event";
    public static final String ASSIGNMENT_ID = "assignmentId";
    public static final String NODE_LEVEL = "nodeLevel";
    public static final String NODE_ID = "nodeId";
    public static final String TRACE_ID = "traceId";

    private final boolean ownsTraceId;

    private LoggingContext() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
            ownsTraceId = true;
        } else {
            ownsTraceId = false;
        }
    }

    public static LoggingContext forEvent(TriggerEvent event, String organizationId, String assignmentId) {
        LoggingContext ctx = new LoggingContext();
        if (event != null) {
            MDC.put(EVENT, event.wireName());
        }
        put(ORGANIZATION_ID, organizationId);
        put(ASSIGNMENT_ID, assignmentId);
        return ctx;
    }

    public static LoggingContext forNode(NodeLevel level, String nodeId) {
        LoggingContext ctx = new LoggingContext();
        if (level != null) {
            MDC.put(NODE_LEVEL, level.name());
        }
        put(NODE_ID, nodeId);
        return ctx;
    }

    private static void put(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    @Override
    public void close() {
        MDC.remove(ORGANIZATION_ID);
        MDC.remove(EVENT);
        MDC.remove(ASSIGNMENT_ID);
        MDC.remove(NODE_LEVEL);
        MDC.remove(NODE_ID);
        if (ownsTraceId) {
            MDC.remove(TRACE_ID);
        }
    }
}
