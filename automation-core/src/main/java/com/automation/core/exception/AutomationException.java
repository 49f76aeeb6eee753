package com.automation.core.exception;

/**
 * Base exception for all automation errors.
 */
public class AutomationException extends RuntimeException {
    
    private final String errorCode;
    
    public AutomationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public AutomationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
