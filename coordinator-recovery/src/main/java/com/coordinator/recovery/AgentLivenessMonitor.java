package com.coordinator.recovery;

import com.coordinator.core.model.AgentHealth;
import com.coordinator.core.model.AgentRecord;
import com.coordinator.core.notification.NotificationPublisher;
import com.coordinator.core.notification.NotificationType;
import com.coordinator.core.repository.AgentRepository;
import com.coordinator.core.store.CoordinationStore;
import com.coordinator.engine.logging.LoggingContext;
import com.coordinator.engine.metrics.PipelineMetrics;
import com.coordinator.engine.store.PipelineKeys;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Derives agent health from heartbeat age and tells the operator when an agent goes silent.
 *
 * Each stale episode is reported once. The heartbeat an episode was reported for is kept in the
 * store, so a restarted monitor does not report it again; a newer heartbeat opens a new episode.
 * Reads agent records only and never touches the queues.
 */
public class AgentLivenessMonitor {

    private static final Logger log = LoggerFactory.getLogger(AgentLivenessMonitor.class);

    private final AgentRepository agents;
    private final CoordinationStore store;
    private final PipelineKeys keys;
    private final NotificationPublisher publisher;
    private final PipelineMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Duration activeThreshold;
    private final Duration idleThreshold;
    private final Clock clock;

    public AgentLivenessMonitor(
            AgentRepository agents,
            CoordinationStore store,
            PipelineKeys keys,
            NotificationPublisher publisher,
            PipelineMetrics metrics,
            ObjectMapper objectMapper,
            Duration activeThreshold,
            Duration idleThreshold,
            Clock clock) {
        if (idleThreshold.compareTo(activeThreshold) < 0) {
            throw new IllegalArgumentException("idle threshold must not be shorter than active threshold");
        }
        this.agents = agents;
        this.store = store;
        this.keys = keys;
        this.publisher = publisher;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.activeThreshold = activeThreshold;
        this.idleThreshold = idleThreshold;
        this.clock = clock;
    }

    public AgentHealth health(AgentRecord agent) {
        if (agent == null || !agent.hasHeartbeat()) {
            return AgentHealth.UNKNOWN;
        }
        Duration age = Duration.between(agent.lastActivity(), clock.instant());
        if (age.compareTo(activeThreshold) < 0) {
            return AgentHealth.ACTIVE;
        }
        if (age.compareTo(idleThreshold) < 0) {
            return AgentHealth.IDLE;
        }
        return AgentHealth.STALE;
    }

    public Optional<AgentHealth> health(String agentId) {
        return agents.findById(agentId).map(this::health);
    }

    /**
     * Check every known agent and publish {@code agent_down} for each new stale episode.
     *
     * @return Agents reported down by this poll
     */
    public List<String> poll() {
        List<String> reported = new ArrayList<>();
        for (AgentRecord agent : agents.findAll()) {
            try (var ctx = LoggingContext.forAgent(agent.id())) {
                if (health(agent).isDown()) {
                    if (claimEpisode(agent)) {
                        reportDownOrRelease(agent);
                        reported.add(agent.id());
                    }
                } else if (store.hdel(keys.agentDownReported(), agent.id())) {
                    log.info("Agent {} is back ({})", agent.id(), health(agent));
                }
            } catch (Exception e) {
                log.error("Failed to check liveness of agent {}", agent.id(), e);
            }
        }
        return reported;
    }

    private boolean claimEpisode(AgentRecord agent) {
        String heartbeat = String.valueOf(agent.lastActivity().toEpochMilli());
        String hash = keys.agentDownReported();
        Optional<String> previous = store.hget(hash, agent.id());
        if (previous.isPresent()) {
            if (previous.get().equals(heartbeat)) {
                return false;
            }
            // Left over from an episode whose recovery was never observed
            store.hdel(hash, agent.id());
        }
        return store.hsetIfAbsent(hash, agent.id(), heartbeat);
    }

    private void reportDownOrRelease(AgentRecord agent) {
        try {
            reportDown(agent);
        } catch (RuntimeException e) {
            // Unreported episodes stay claimable by the next poll
            store.hdel(keys.agentDownReported(), agent.id());
            throw e;
        }
    }

    private void reportDown(AgentRecord agent) {
        Instant now = clock.instant();
        long silentFor = Duration.between(agent.lastActivity(), now).getSeconds();

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("agent_id", agent.id());
        payload.put("last_activity", agent.lastActivity().toString());
        payload.put("current_prp", agent.currentTask());
        payload.put("seconds_since", silentFor);
        publisher.publish(NotificationType.AGENT_DOWN, payload);
        metrics.agentDown(agent.id());

        log.warn("Agent {} has been silent for {}s (task={})", agent.id(), silentFor, agent.currentTask());
    }
}
