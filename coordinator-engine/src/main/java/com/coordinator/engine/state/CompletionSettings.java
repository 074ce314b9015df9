package com.coordinator.engine.state;

import com.coordinator.core.model.TaskStatus;

import java.time.Duration;
import java.util.Set;

/**
 * What a task must satisfy before it may become complete.
 *
 * @param completionSource the only status from which {@code complete} is accepted
 * @param requiredChecks CI checks that must all have concluded successfully
 * @param mainlineBranch branch the commit must be reachable from
 * @param freshness maximum age of the commit
 */
public record CompletionSettings(
    TaskStatus completionSource,
    Set<String> requiredChecks,
    String mainlineBranch,
    Duration freshness
) {
    public CompletionSettings {
        if (completionSource == null || completionSource.isTerminal()
                || !completionSource.canTransitionTo(TaskStatus.COMPLETE)) {
            throw new IllegalArgumentException("completionSource must be a status with an edge to complete: " + completionSource);
        }
        requiredChecks = requiredChecks != null ? Set.copyOf(requiredChecks) : Set.of();
    }

    public static CompletionSettings defaults() {
        return new CompletionSettings(TaskStatus.IN_PROGRESS, Set.of(), "main", Duration.ofHours(24));
    }
}
