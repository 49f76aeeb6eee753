package com.automation.core.exception;

/**
 * Thrown when a cron expression cannot be parsed.
 */
public class InvalidCronExpressionException extends AutomationException {
    
    public static final String ERROR_CODE = "INVALID_CRON_EXPRESSION";
    
    public InvalidCronExpressionException(String expression, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Invalid cron expression '%s'",
            expression
        ), cause);
    }
}
