package com.coordinator.api.rest;

import com.coordinator.core.model.AgentRecord;
import com.coordinator.core.model.AgentStatus;
import com.coordinator.engine.agent.AgentRegistry;
import com.coordinator.recovery.AgentLivenessMonitor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * REST API for agent heartbeats and derived health.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private final AgentRegistry agents;
    private final AgentLivenessMonitor livenessMonitor;

    public AgentController(AgentRegistry agents, AgentLivenessMonitor livenessMonitor) {
        this.agents = agents;
        this.livenessMonitor = livenessMonitor;
    }

    @PostMapping("/{agentId}/heartbeat")
    public ResponseEntity<AgentResponse> heartbeat(
            @PathVariable String agentId,
            @RequestBody(required = false) HeartbeatRequest request) {
        AgentStatus status = request != null && request.status() != null
            ? AgentStatus.fromWireName(request.status())
            : AgentStatus.ACTIVE;
        String currentTask = request != null ? request.currentTask() : null;
        return ResponseEntity.ok(toResponse(agents.heartbeat(agentId, status, currentTask)));
    }

    @GetMapping("/{agentId}")
    public ResponseEntity<AgentResponse> get(@PathVariable String agentId) {
        return ResponseEntity.ok(toResponse(agents.get(agentId)));
    }

    @GetMapping
    public ResponseEntity<List<AgentResponse>> list() {
        return ResponseEntity.ok(agents.list().stream()
            .map(this::toResponse)
            .toList());
    }

    private AgentResponse toResponse(AgentRecord agent) {
        return new AgentResponse(
            agent.id(),
            agent.status().wireName(),
            agent.currentTask(),
            agent.lastActivity(),
            livenessMonitor.health(agent).name().toLowerCase());
    }

    // ========== DTOs ==========

    public record HeartbeatRequest(String status, String currentTask) {}

    public record AgentResponse(String id, String status, String currentTask, Instant lastActivity, String health) {}
}
