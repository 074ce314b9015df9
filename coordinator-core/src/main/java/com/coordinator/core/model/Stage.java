package com.coordinator.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Ordered processing stages of the pipeline. Each stage owns one queue and one
 * inflight shadow queue in the coordination store.
 */
public enum Stage {
    NEW("new"),
    DEVELOPMENT("dev"),
    VALIDATION("validation"),
    INTEGRATION("integration");

    private final String wireName;

    Stage(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * The stage a task moves to when it completes this one, empty for the last stage.
     */
    public Optional<Stage> next() {
        int nextOrdinal = ordinal() + 1;
        Stage[] stages = values();
        return nextOrdinal < stages.length ? Optional.of(stages[nextOrdinal]) : Optional.empty();
    }

    public boolean isLast() {
        return next().isEmpty();
    }

    /**
     * Resolve a stage from its wire name or enum name, case-insensitively.
     */
    public static Stage fromWireName(String name) {
        return Arrays.stream(values())
            .filter(s -> s.wireName.equalsIgnoreCase(name) || s.name().equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown stage: " + name));
    }
}
