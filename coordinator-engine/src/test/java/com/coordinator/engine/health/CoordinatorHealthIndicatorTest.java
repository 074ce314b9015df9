package com.coordinator.engine.health;

import com.coordinator.core.model.Stage;
import com.coordinator.engine.store.InMemoryCoordinationStore;
import com.coordinator.engine.test.PipelineFixture;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CoordinatorHealthIndicatorTest {

    private final PipelineFixture fx = new PipelineFixture();

    @Test
    @SuppressWarnings("unchecked")
    void upWithQueueDepths() {
        fx.pipeline.enqueue("T1", Stage.DEVELOPMENT);
        fx.pipeline.enqueue("T2", Stage.DEVELOPMENT);
        fx.pipeline.claim(Stage.DEVELOPMENT, Duration.ZERO);

        Health health = new CoordinatorHealthIndicator(fx.store, fx.pipeline).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        Map<String, Object> queues = (Map<String, Object>) health.getDetails().get("queues");
        assertThat(queues.get("dev")).isEqualTo(Map.of("pending", 1L, "inflight", 1L));
        assertThat(health.getDetails()).containsEntry("deadLetters", 0L);
    }

    @Test
    void downWhenStoreUnreachable() {
        InMemoryCoordinationStore unreachable = new InMemoryCoordinationStore() {
            @Override
            public boolean ping() {
                return false;
            }
        };

        Health health = new CoordinatorHealthIndicator(unreachable, fx.pipeline).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("store", "unreachable");
    }

    @Test
    void warnsWhenDeadLettersPileUp() {
        for (int i = 0; i < 11; i++) {
            fx.store.pushTail(fx.keys.deadLetters(), "{}");
        }

        Health health = new CoordinatorHealthIndicator(fx.store, fx.pipeline).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsKey("deadLetterWarning");
    }
}
