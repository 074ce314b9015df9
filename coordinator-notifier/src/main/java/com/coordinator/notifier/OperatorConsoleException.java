package com.coordinator.notifier;

import com.coordinator.core.exception.CoordinatorException;

/**
 * Thrown when text cannot be handed to the operator console.
 * Undelivered notifications stay on the pending list for the next pass.
 */
public class OperatorConsoleException extends CoordinatorException {

    public static final String ERROR_CODE = "CONSOLE_UNAVAILABLE";

    public OperatorConsoleException(String message) {
        super(ERROR_CODE, message);
    }

    public OperatorConsoleException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
