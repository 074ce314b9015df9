package com.coordinator.core.model;

/**
 * Outcome of reporting a claimed task as done with a stage.
 */
public enum CompletionResult {
    /** Moved to the head of the next stage. */
    ADVANCED,
    /** Completed the last stage and left the pipeline. */
    FINISHED,
    /** The task was not inflight for that stage; nothing changed. */
    NOT_CLAIMED
}
