package com.coordinator.recovery;

import com.coordinator.core.model.QueueStats;
import com.coordinator.core.model.Stage;
import com.coordinator.core.notification.NotificationPublisher;
import com.coordinator.core.notification.NotificationType;
import com.coordinator.engine.service.PipelineService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the operator for more workers when a stage's backlog grows past a threshold.
 * One {@code scaling_needed} per breach; the breach ends once the depth is back at or below the threshold.
 */
public class QueueDepthMonitor {

    private static final Logger log = LoggerFactory.getLogger(QueueDepthMonitor.class);

    private final PipelineService pipeline;
    private final NotificationPublisher publisher;
    private final ObjectMapper objectMapper;
    private final Stage stage;
    private final int threshold;

    private boolean breached;

    public QueueDepthMonitor(
            PipelineService pipeline,
            NotificationPublisher publisher,
            ObjectMapper objectMapper,
            Stage stage,
            int threshold) {
        this.pipeline = pipeline;
        this.publisher = publisher;
        this.objectMapper = objectMapper;
        this.stage = stage;
        this.threshold = threshold;
    }

    /**
     * @return true if this check published a scaling request
     */
    public synchronized boolean check() {
        QueueStats stats = pipeline.stats(stage);
        if (stats.pending() <= threshold) {
            if (breached) {
                log.info("{} queue back to {} pending", stage.wireName(), stats.pending());
            }
            breached = false;
            return false;
        }
        if (breached) {
            return false;
        }
        breached = true;

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("queue", stage.wireName());
        payload.put("depth", stats.pending());
        payload.put("threshold", threshold);
        publisher.publish(NotificationType.SCALING_NEEDED, payload);

        log.warn("{} queue depth {} exceeds {}", stage.wireName(), stats.pending(), threshold);
        return true;
    }
}
