package com.coordinator.recovery;

import com.coordinator.core.model.QueueStats;
import com.coordinator.core.model.Stage;
import com.coordinator.core.model.TaskRecord;
import com.coordinator.core.notification.Notification;
import com.coordinator.core.notification.NotificationPublisher;
import com.coordinator.core.notification.NotificationType;
import com.coordinator.core.repository.TaskRecordRepository;
import com.coordinator.engine.service.PipelineService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Periodic summary for the operator: queue depths per stage and the tasks still in flight.
 */
public class ProgressReporter {

    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    static final int TITLE_LIMIT = 50;

    private final PipelineService pipeline;
    private final TaskRecordRepository tasks;
    private final NotificationPublisher publisher;
    private final ObjectMapper objectMapper;

    public ProgressReporter(
            PipelineService pipeline,
            TaskRecordRepository tasks,
            NotificationPublisher publisher,
            ObjectMapper objectMapper) {
        this.pipeline = pipeline;
        this.tasks = tasks;
        this.publisher = publisher;
        this.objectMapper = objectMapper;
    }

    public Notification report() {
        ObjectNode payload = objectMapper.createObjectNode();

        ObjectNode queues = payload.putObject("queues");
        for (Stage stage : Stage.values()) {
            QueueStats stats = pipeline.stats(stage);
            ObjectNode depth = queues.putObject(stage.wireName());
            depth.put("pending", stats.pending());
            depth.put("inflight", stats.inflight());
        }

        List<TaskRecord> active = tasks.findAll().stream()
            .filter(t -> !t.isTerminal())
            .sorted(Comparator.comparingLong(TaskRecord::stableId))
            .collect(Collectors.toList());

        ArrayNode activeTasks = payload.putArray("active_prps");
        for (TaskRecord task : active) {
            ObjectNode entry = activeTasks.addObject();
            entry.put("id", task.id());
            entry.put("status", task.status().wireName());
            entry.put("title", truncate(task.title()));
        }
        payload.put("total_active", active.size());

        log.info("Progress report: {} active task(s)", active.size());
        return publisher.publish(NotificationType.PROGRESS_REPORT, payload);
    }

    private static String truncate(String title) {
        if (title == null || title.length() <= TITLE_LIMIT) {
            return title;
        }
        return title.substring(0, TITLE_LIMIT);
    }
}
