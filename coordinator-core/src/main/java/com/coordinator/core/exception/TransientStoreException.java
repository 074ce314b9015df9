package com.coordinator.core.exception;

/**
 * Thrown by a coordination store when an operation failed for a reason that may
 * succeed on retry (lost connection, lock timeout, failover).
 */
public class TransientStoreException extends CoordinatorException {
    
    public static final String ERROR_CODE = "TRANSIENT_STORE_ERROR";
    
    public TransientStoreException(String operation, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Coordination store operation '%s' failed: %s",
            operation, cause.getMessage()
        ), cause);
    }

    public TransientStoreException(String message) {
        super(ERROR_CODE, message);
    }
}
