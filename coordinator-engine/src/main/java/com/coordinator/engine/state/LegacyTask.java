package com.coordinator.engine.state;

import com.coordinator.core.model.TaskStatus;

/**
 * A task entry from before stable ids existed, as found in the old status artifact.
 * stableId is 0 when the entry never had one.
 */
public record LegacyTask(String id, String title, TaskStatus status, int priority, long stableId) {
}
