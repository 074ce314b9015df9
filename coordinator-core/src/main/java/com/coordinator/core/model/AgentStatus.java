package com.coordinator.core.model;

import java.util.Arrays;

/**
 * Self-reported agent status, written with each heartbeat.
 */
public enum AgentStatus {
    ACTIVE,
    BUSY,
    IDLE,
    ERROR,
    UNKNOWN;

    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * Lenient parse: anything unrecognised is {@link #UNKNOWN}.
     */
    public static AgentStatus fromWireName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        return Arrays.stream(values())
            .filter(s -> s.name().equalsIgnoreCase(name))
            .findFirst()
            .orElse(UNKNOWN);
    }
}
