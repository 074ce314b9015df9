package com.coordinator.engine.agent;

import com.coordinator.core.exception.NotFoundException;
import com.coordinator.core.model.AgentRecord;
import com.coordinator.core.model.AgentStatus;
import com.coordinator.core.repository.AgentRepository;
import com.coordinator.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Records agent heartbeats. Heartbeats are the only writes to agent records.
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final AgentRepository repository;
    private final Clock clock;

    public AgentRegistry(AgentRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public AgentRecord heartbeat(String agentId, AgentStatus status, String currentTask) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        try (var ctx = LoggingContext.forAgent(agentId)) {
            AgentRecord record = AgentRecord.heartbeat(
                agentId, status != null ? status : AgentStatus.ACTIVE, currentTask, clock.instant());
            repository.save(record);
            log.debug("Heartbeat from {} ({}, task={})", agentId, record.status().wireName(), currentTask);
            return record;
        }
    }

    public AgentRecord get(String agentId) {
        return repository.findById(agentId)
            .orElseThrow(() -> new NotFoundException("Agent", agentId));
    }

    public List<AgentRecord> list() {
        return repository.findAll().stream()
            .sorted(Comparator.comparing(AgentRecord::id))
            .collect(Collectors.toList());
    }
}
