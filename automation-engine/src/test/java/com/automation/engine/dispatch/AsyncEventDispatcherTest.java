package com.automation.engine.dispatch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class AsyncEventDispatcherTest {

    private final AsyncEventDispatcher dispatcher = new AsyncEventDispatcher(2);

    @AfterEach
    void tearDown() {
        dispatcher.close();
        MDC.clear();
    }

    @Test
    void submit_carriesCallerMdc() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        MDC.put("traceId", "trace-42");

        Future<?> future = dispatcher.submit("mdc check", () -> seen.set(MDC.get("traceId")));
        future.get(5, TimeUnit.SECONDS);

        assertThat(seen.get()).isEqualTo("trace-42");
    }

    @Test
    void submit_swallowsHandlerFailure() throws Exception {
        Future<?> future = dispatcher.submit("failing handler", () -> {
            throw new IllegalStateException("boom");
        });

        assertThatCode(() -> future.get(5, TimeUnit.SECONDS)).doesNotThrowAnyException();
    }

    @Test
    void submit_afterClose_returnsNull() {
        dispatcher.close();

        assertThat(dispatcher.submit("late", () -> { })).isNull();
    }
}
