package com.automation.scheduler;

import com.automation.core.exception.InvalidCronExpressionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Cron utilities on top of Spring's CronExpression.
 * 
 * Accepts standard 5-field expressions (minute hour day-of-month month day-of-week),
 * 6-field expressions with a leading seconds field, and macros such as "@daily".
 * Expressions are evaluated in UTC unless a zone is given.
 */
public final class CronSchedules {

    private static final Logger log = LoggerFactory.getLogger(CronSchedules.class);

    public static final ZoneId DEFAULT_ZONE = ZoneOffset.UTC;

    private CronSchedules() {
    }

    /**
     * Next occurrence strictly after the reference time, in UTC.
     * 
     * @param expression Cron expression
     * @param referenceTime Time to compute from
     * @return Next occurrence, or empty if the expression is malformed or never fires again
     */
    public static Optional<Instant> computeNextCronExecution(String expression, Instant referenceTime) {
        return computeNextCronExecution(expression, referenceTime, DEFAULT_ZONE);
    }

    /**
     * Next occurrence strictly after the reference time, evaluated in the given zone.
     */
    public static Optional<Instant> computeNextCronExecution(String expression, Instant referenceTime, ZoneId zone) {
        if (expression == null || expression.isBlank()) {
            return Optional.empty();
        }
        try {
            ZonedDateTime next = parse(expression).next(referenceTime.atZone(zone));
            return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
        } catch (IllegalArgumentException e) {
            log.debug("Invalid cron expression '{}': {}", expression, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Next occurrence after the current instant, in UTC.
     */
    public static Optional<Instant> computeNextCronExecution(String expression) {
        return computeNextCronExecution(expression, Instant.now());
    }

    public static boolean validateCronExpression(String expression) {
        if (expression == null || expression.isBlank()) {
            return false;
        }
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * @throws InvalidCronExpressionException if the expression cannot be parsed
     */
    public static void requireValid(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(String.valueOf(expression), null);
        }
        try {
            parse(expression);
        } catch (IllegalArgumentException e) {
            throw new InvalidCronExpressionException(expression, e);
        }
    }

    private static CronExpression parse(String expression) {
        String trimmed = expression.trim();
        if (!trimmed.startsWith("@") && trimmed.split("\\s+").length == 5) {
            // Standard cron has minute precision; Spring expects a seconds field
            return CronExpression.parse("0 " + trimmed);
        }
        return CronExpression.parse(trimmed);
    }
}
