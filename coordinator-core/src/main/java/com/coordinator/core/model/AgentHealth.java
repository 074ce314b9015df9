package com.coordinator.core.model;

/**
 * Health derived from the age of an agent's last heartbeat.
 * Ordered from healthiest to least healthy; for a fixed heartbeat, health
 * only moves forward through this order as time passes.
 */
public enum AgentHealth {
    ACTIVE,
    IDLE,
    STALE,
    UNKNOWN;

    public boolean isDown() {
        return this == STALE;
    }
}
