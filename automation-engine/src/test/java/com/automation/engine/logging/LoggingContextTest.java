package com.automation.engine.logging;

import com.automation.core.model.NodeLevel;
import com.automation.core.model.TriggerEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.*;

class LoggingContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void eventContextIsRemovedOnClose() {
        try (var ctx = LoggingContext.forEvent(TriggerEvent.INVOICE_PAID, "org-1", null)) {
            assertThat(MDC.get(LoggingContext.EVENT)).isEqualTo("invoice_paid");
            assertThat(MDC.get(LoggingContext.ORGANIZATION_ID)).isEqualTo("org-1");
            assertThat(MDC.get(LoggingContext.ASSIGNMENT_ID)).isNull();
            assertThat(MDC.get(LoggingContext.TRACE_ID)).hasSize(8);
        }

        assertThat(MDC.getCopyOfContextMap()).isNullOrEmpty();
    }

    @Test
    void existingTraceIdIsReusedAndKept() {
        MDC.put(LoggingContext.TRACE_ID, "request-7");

        try (var ctx = LoggingContext.forNode(NodeLevel.STEP, "step-1")) {
            assertThat(MDC.get(LoggingContext.TRACE_ID)).isEqualTo("request-7");
            assertThat(MDC.get(LoggingContext.NODE_LEVEL)).isEqualTo("STEP");
        }

        assertThat(MDC.get(LoggingContext.TRACE_ID)).isEqualTo("request-7");
        assertThat(MDC.get(LoggingContext.NODE_ID)).isNull();
    }
}
