package com.coordinator.core.model;

/**
 * Outcome of reporting a claimed task as failed.
 */
public enum FailureResult {
    /** Back at the tail of the same stage. */
    REQUEUED,
    /** Retries exhausted or failure not retryable; parked in the dead-letter list. */
    DEAD_LETTERED,
    /** The task was not inflight for that stage; nothing changed. */
    NOT_CLAIMED
}
