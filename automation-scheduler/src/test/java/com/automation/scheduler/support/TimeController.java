package com.automation.scheduler.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock whose time only moves when a test moves it.
 * 
 * <pre>{@code
 * TimeController time = TimeController.at(Instant.parse("2024-01-01T00:00:00Z"));
 * time.advance(Duration.ofMinutes(5));
 * }</pre>
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> currentTime;

    private TimeController(AtomicReference<Instant> currentTime) {
        this.currentTime = currentTime;
    }

    public static TimeController at(Instant startTime) {
        return new TimeController(new AtomicReference<>(startTime));
    }

    public void advance(Duration duration) {
        currentTime.updateAndGet(t -> t.plus(duration));
    }

    public void setTime(Instant time) {
        currentTime.set(time);
    }

    @Override
    public Instant instant() {
        return currentTime.get();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        // Shares the same timeline
        return new TimeController(currentTime);
    }
}
