package com.automation.core.exception;

/**
 * Raised by action executors when a configured action fails.
 */
public class ActionExecutionException extends AutomationException {
    
    public static final String ERROR_CODE = "ACTION_EXECUTION_FAILED";
    
    public ActionExecutionException(String actionType, String message) {
        super(ERROR_CODE, String.format(
            "Action '%s' failed: %s",
            actionType, message
        ));
    }

    public ActionExecutionException(String actionType, String message, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Action '%s' failed: %s",
            actionType, message
        ), cause);
    }
}
