package com.coordinator.engine.persistence;

import com.coordinator.core.model.AgentRecord;
import com.coordinator.core.model.AgentStatus;
import com.coordinator.core.repository.AgentRepository;
import com.coordinator.core.store.CoordinationStore;
import com.coordinator.engine.store.PipelineKeys;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * AgentRepository keeping each agent as a hash {@code agent:{id}}.
 */
public class StoreAgentRepository implements AgentRepository {

    private static final String STATUS = "status";
    private static final String CURRENT_TASK = "current_prp";
    private static final String LAST_ACTIVITY = "last_activity";

    private final CoordinationStore store;
    private final PipelineKeys keys;

    public StoreAgentRepository(CoordinationStore store, PipelineKeys keys) {
        this.store = store;
        this.keys = keys;
    }

    @Override
    public void save(AgentRecord agent) {
        String key = keys.agent(agent.id());
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(STATUS, agent.status().wireName());
        if (agent.lastActivity() != null) {
            fields.put(LAST_ACTIVITY, agent.lastActivity().toString());
        }
        if (agent.currentTask() != null) {
            fields.put(CURRENT_TASK, agent.currentTask());
        } else {
            store.hdel(key, CURRENT_TASK);
        }
        store.hsetAll(key, fields);
        store.sadd(keys.agentIndex(), agent.id());
    }

    @Override
    public Optional<AgentRecord> findById(String agentId) {
        Map<String, String> fields = store.hgetAll(keys.agent(agentId));
        if (fields.isEmpty()) {
            return Optional.empty();
        }
        String lastActivity = fields.get(LAST_ACTIVITY);
        return Optional.of(new AgentRecord(
            agentId,
            AgentStatus.fromWireName(fields.get(STATUS)),
            fields.get(CURRENT_TASK),
            lastActivity == null || lastActivity.isEmpty() ? null : Instant.parse(lastActivity)
        ));
    }

    @Override
    public List<AgentRecord> findAll() {
        List<AgentRecord> agents = new ArrayList<>();
        for (String id : store.smembers(keys.agentIndex())) {
            findById(id).ifPresent(agents::add);
        }
        return agents;
    }
}
