package com.coordinator.core.model;

import java.util.Arrays;

/**
 * Lifecycle states for a task record.
 * Transitions follow a strict state machine: no edge may be skipped.
 */
public enum TaskStatus {
    /**
     * Ingested, not yet owned by anyone.
     * Transitions: -> ASSIGNED, DEPRECATED
     */
    NEW("new"),

    /**
     * Owned by a named agent, work not started.
     * Transitions: -> IN_PROGRESS, DEPRECATED
     */
    ASSIGNED("assigned"),

    /**
     * Under development.
     * Transitions: -> VALIDATION, COMPLETE (shallow pipelines), DEPRECATED
     */
    IN_PROGRESS("in_progress"),

    /**
     * Development finished, under review.
     * Transitions: -> INTEGRATION, COMPLETE (when configured as completion source), DEPRECATED
     */
    VALIDATION("validation"),

    /**
     * Validated, being merged and deployed.
     * Transitions: -> COMPLETE, DEPRECATED
     */
    INTEGRATION("integration"),

    /**
     * Done. Terminal state.
     */
    COMPLETE("complete"),

    /**
     * Superseded by another task. Terminal state.
     */
    DEPRECATED("deprecated");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used in the persisted task artifact and on the wire.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Check if this state is terminal (no further transitions).
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == DEPRECATED;
    }

    /**
     * Check if this state can transition to the target state.
     * Which non-terminal state actually feeds COMPLETE is narrowed further by configuration.
     */
    public boolean canTransitionTo(TaskStatus target) {
        if (target == DEPRECATED) {
            return !isTerminal();
        }
        return switch (this) {
            case NEW -> target == ASSIGNED;
            case ASSIGNED -> target == IN_PROGRESS;
            case IN_PROGRESS -> target == VALIDATION || target == COMPLETE;
            case VALIDATION -> target == INTEGRATION || target == COMPLETE;
            case INTEGRATION -> target == COMPLETE;
            case COMPLETE, DEPRECATED -> false;
        };
    }

    public static TaskStatus fromWireName(String name) {
        return Arrays.stream(values())
            .filter(s -> s.wireName.equalsIgnoreCase(name) || s.name().equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown task status: " + name));
    }
}
