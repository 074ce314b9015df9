package com.coordinator.engine.agent;

import com.coordinator.core.exception.NotFoundException;
import com.coordinator.core.model.AgentRecord;
import com.coordinator.core.model.AgentStatus;
import com.coordinator.engine.test.PipelineFixture;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class AgentRegistryTest {

    private final PipelineFixture fx = new PipelineFixture();

    @Test
    void heartbeatRecordsActivityAtClockTime() {
        fx.time.advanceSeconds(42);

        AgentRecord agent = fx.agents.heartbeat("dev-1", null, "PRP-1");

        assertThat(agent.status()).isEqualTo(AgentStatus.ACTIVE);
        assertThat(fx.agents.get("dev-1").lastActivity()).isEqualTo(fx.time.now());
    }

    @Test
    void listIsSortedById() {
        fx.agents.heartbeat("qa-1", AgentStatus.IDLE, null);
        fx.agents.heartbeat("dev-1", AgentStatus.BUSY, "PRP-1");

        assertThat(fx.agents.list()).extracting(AgentRecord::id).containsExactly("dev-1", "qa-1");
    }

    @Test
    void unknownAgent() {
        assertThatThrownBy(() -> fx.agents.get("nobody")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> fx.agents.heartbeat(" ", null, null)).isInstanceOf(IllegalArgumentException.class);
    }
}
