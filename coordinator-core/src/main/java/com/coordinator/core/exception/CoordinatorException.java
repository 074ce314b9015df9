package com.coordinator.core.exception;

/**
 * Root of the coordinator's unchecked exceptions. The error code is part of the
 * contract: it is what HTTP clients and the commit gate report, so subclasses keep
 * theirs in an {@code ERROR_CODE} constant and never change it.
 */
public class CoordinatorException extends RuntimeException {

    private final String errorCode;

    protected CoordinatorException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    protected CoordinatorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode is required");
        }
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode + "]: " + getMessage();
    }
}
