package com.coordinator.worker;

/**
 * Thrown by stage handlers when a task fails a stage.
 * The reason is reported to the pipeline, which decides whether to retry based on it.
 */
public class StageFailedException extends Exception {

    private final String reason;

    public StageFailedException(String reason) {
        super(reason);
        this.reason = reason;
    }

    public StageFailedException(String reason, Throwable cause) {
        super(reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
