package com.coordinator.core.repository;

import com.coordinator.core.model.AgentRecord;

import java.util.List;
import java.util.Optional;

/**
 * Repository for agent heartbeat records.
 */
public interface AgentRepository {

    /**
     * Insert or replace the record for an agent.
     */
    void save(AgentRecord agent);

    /**
     * @param agentId The agent id
     * @return The record if the agent ever sent a heartbeat
     */
    Optional<AgentRecord> findById(String agentId);

    /**
     * @return All known agents
     */
    List<AgentRecord> findAll();
}
