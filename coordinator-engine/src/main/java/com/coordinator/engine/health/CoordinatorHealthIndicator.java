package com.coordinator.engine.health;

import com.coordinator.core.model.QueueStats;
import com.coordinator.core.model.Stage;
import com.coordinator.core.store.CoordinationStore;
import com.coordinator.engine.service.PipelineService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the coordinator.
 * Reports health status based on:
 * - Coordination store reachability
 * - Per-stage queue depths
 * - Dead letters awaiting an operator
 */
public class CoordinatorHealthIndicator implements HealthIndicator {

    private static final long DEAD_LETTER_WARNING_THRESHOLD = 10;

    private final CoordinationStore store;
    private final PipelineService pipeline;

    public CoordinatorHealthIndicator(CoordinationStore store, PipelineService pipeline) {
        this.store = store;
        this.pipeline = pipeline;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();

        try {
            if (!store.ping()) {
                details.put("store", "unreachable");
                return Health.down().withDetails(details).build();
            }
            details.put("store", "reachable");

            Map<String, Object> queues = new LinkedHashMap<>();
            for (Stage stage : Stage.values()) {
                QueueStats stats = pipeline.stats(stage);
                queues.put(stage.wireName(), Map.of("pending", stats.pending(), "inflight", stats.inflight()));
            }
            details.put("queues", queues);

            long deadLetters = pipeline.deadLetterCount();
            details.put("deadLetters", deadLetters);
            if (deadLetters > DEAD_LETTER_WARNING_THRESHOLD) {
                details.put("deadLetterWarning", "Dead letters are piling up - operator attention needed");
            }

            return Health.up().withDetails(details).build();

        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
