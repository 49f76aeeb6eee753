package com.automation.core.exception;

/**
 * Thrown when a caller requires a trigger lock that is held by another worker.
 * The scheduler itself treats contention as a silent skip and never throws this.
 */
public class LockAcquisitionException extends AutomationException {
    
    public static final String ERROR_CODE = "LOCK_ACQUISITION_FAILED";
    
    public LockAcquisitionException(String triggerId) {
        super(ERROR_CODE, String.format(
            "Failed to acquire execution lock for trigger '%s'",
            triggerId
        ));
    }
}
