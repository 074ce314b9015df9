package com.coordinator.core.model;

public enum EnqueueResult {
    ENQUEUED,
    /** The id was already somewhere in the pipeline; nothing changed. */
    ALREADY_QUEUED
}
