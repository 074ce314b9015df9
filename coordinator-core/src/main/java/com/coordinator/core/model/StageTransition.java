package com.coordinator.core.model;

import java.time.Instant;

/**
 * Append-only audit entry for a task moving between pipeline lists.
 * A null fromStage means the task entered the pipeline; a null toStage means it left.
 */
public record StageTransition(
    String taskId,
    Stage fromStage,
    Stage toStage,
    Instant timestamp,
    String reason
) {
    public static final String REASON_ENQUEUED = "enqueued";
    public static final String REASON_COMPLETED = "completed";
    public static final String REASON_FINISHED = "finished";
    public static final String REASON_RETRY = "retry";
    public static final String REASON_DEAD_LETTER = "dead_letter";
    public static final String REASON_RECOVERED = "recovered";
    public static final String REASON_HANDOFF_RESUMED = "handoff_resumed";
    public static final String REASON_REPLAYED = "replayed";
}
