package com.coordinator.gate;

import com.coordinator.core.model.TaskStatus;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Commit gate configuration.
 *
 * @param failOpen Allow the commit when the gate itself fails
 * @param artifactPath Path of the persisted task artifact, relative to the repository root
 * @param sentinel Marker that identifies system-generated status commits
 * @param activeStatuses Statuses a task must be in for commits to reference it
 * @param completionPattern Messages matching this claim the task is complete
 */
public record GateSettings(
    boolean failOpen,
    String artifactPath,
    String sentinel,
    Set<TaskStatus> activeStatuses,
    Pattern completionPattern
) {
    public static final String DEFAULT_COMPLETION_PATTERN = "(?i)\\b(complete[sd]?|done|finish(es|ed)?)\\b";

    public GateSettings {
        if (activeStatuses == null || activeStatuses.isEmpty()) {
            throw new IllegalArgumentException("at least one active status is required");
        }
        activeStatuses = Set.copyOf(activeStatuses);
    }

    public static GateSettings defaults() {
        return new GateSettings(
            true,
            "prp_status.json",
            "[prp-system]",
            Set.of(TaskStatus.IN_PROGRESS),
            Pattern.compile(DEFAULT_COMPLETION_PATTERN)
        );
    }

    public GateSettings withFailOpen(boolean value) {
        return new GateSettings(value, artifactPath, sentinel, activeStatuses, completionPattern);
    }

    public static GateSettings of(boolean failOpen, String artifactPath, String sentinel,
                                  List<TaskStatus> activeStatuses, String completionPattern) {
        return new GateSettings(failOpen, artifactPath, sentinel, Set.copyOf(activeStatuses),
            Pattern.compile(completionPattern));
    }
}
