package com.coordinator.core.model;

import java.time.Instant;

/**
 * A task that exhausted its retries (or failed non-retryably) and now waits for an operator.
 */
public record DeadLetterEntry(
    String taskId,
    Stage stage,
    String reason,
    int retries,
    Instant deadLetteredAt
) {
}
