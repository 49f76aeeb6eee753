package com.automation.core.exception;

/**
 * Thrown when a referenced trigger, assignment or hierarchy node does not exist.
 */
public class NotFoundException extends AutomationException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
