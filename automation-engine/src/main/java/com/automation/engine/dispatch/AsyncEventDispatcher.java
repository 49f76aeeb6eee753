package com.automation.engine.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs event handlers off the caller's thread.
 * 
 * The caller's MDC is carried into the worker. Failures are logged with the
 * submitted description and never reach the caller.
 */
public class AsyncEventDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncEventDispatcher.class);

    private final ExecutorService executor;

    public AsyncEventDispatcher(int threads) {
        this(Executors.newFixedThreadPool(threads, new DispatcherThreadFactory()));
    }

    public AsyncEventDispatcher(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Submit a handler for background execution.
     * 
     * @param description What the handler does, used in log messages
     * @param handler The handler
     * @return Future completing when the handler has run, or null if the dispatcher is shut down
     */
    public Future<?> submit(String description, Runnable handler) {
        Map<String, String> callerMdc = MDC.getCopyOfContextMap();
        
        try {
            return executor.submit(() -> {
                if (callerMdc != null) {
                    MDC.setContextMap(callerMdc);
                }
                try {
                    handler.run();
                } catch (RuntimeException e) {
                    log.error("Background handler failed: {}", description, e);
                } finally {
                    MDC.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Dispatcher is shut down, dropping: {}", description);
            return null;
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Async event dispatcher stopped");
    }

    private static final class DispatcherThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "automation-events-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
