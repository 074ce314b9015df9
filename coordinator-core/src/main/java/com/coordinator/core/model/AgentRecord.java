package com.coordinator.core.model;

import java.time.Instant;

/**
 * Last known state of a worker agent.
 * lastActivity is null until the first heartbeat.
 */
public record AgentRecord(
    String id,
    AgentStatus status,
    String currentTask,
    Instant lastActivity
) {
    public static AgentRecord heartbeat(String id, AgentStatus status, String currentTask, Instant at) {
        return new AgentRecord(id, status, currentTask, at);
    }

    public boolean hasHeartbeat() {
        return lastActivity != null;
    }
}
