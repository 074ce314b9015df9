package com.coordinator.core.model;

/**
 * Point-in-time depth of one stage.
 */
public record QueueStats(Stage stage, long pending, long inflight) {

    public long total() {
        return pending + inflight;
    }
}
