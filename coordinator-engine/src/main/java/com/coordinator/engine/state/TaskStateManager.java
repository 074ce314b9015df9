package com.coordinator.engine.state;

import com.coordinator.core.exception.DuplicateTaskException;
import com.coordinator.core.exception.InvalidTransitionException;
import com.coordinator.core.exception.NotFoundException;
import com.coordinator.core.model.GateCheckFailure;
import com.coordinator.core.model.TaskRecord;
import com.coordinator.core.model.TaskStatus;
import com.coordinator.core.notification.NotificationPublisher;
import com.coordinator.core.notification.NotificationType;
import com.coordinator.core.repository.TaskRecordRepository;
import com.coordinator.engine.logging.LoggingContext;
import com.coordinator.engine.service.TaskStateService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * State machine for task records.
 * 
 * Status moves one edge at a time: new, assigned, in_progress, validation, integration,
 * complete; any non-terminal status may move to deprecated. Completion is additionally
 * restricted to the configured source status and guarded by the {@link CompletionGate}.
 * 
 * Writes are read-modify-write on the record; each task is expected to have one writer
 * at a time (its owning agent or the operator).
 */
public class TaskStateManager implements TaskStateService {

    private static final Logger log = LoggerFactory.getLogger(TaskStateManager.class);

    private final TaskRecordRepository repository;
    private final StableIdService stableIdService;
    private final CompletionGate completionGate;
    private final CompletionSettings completionSettings;
    private final NotificationPublisher notificationPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TaskStateManager(
            TaskRecordRepository repository,
            StableIdService stableIdService,
            CompletionGate completionGate,
            CompletionSettings completionSettings,
            NotificationPublisher notificationPublisher,
            ObjectMapper objectMapper,
            Clock clock) {
        this.repository = repository;
        this.stableIdService = stableIdService;
        this.completionGate = completionGate;
        this.completionSettings = completionSettings;
        this.notificationPublisher = notificationPublisher;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public TaskRecord create(String taskId, String title, int priority, Set<String> dependencies) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        try (var ctx = LoggingContext.forTask(taskId)) {
            if (repository.exists(taskId)) {
                throw new DuplicateTaskException(taskId);
            }
            long stableId = stableIdService.assign(taskId);
            TaskRecord record = TaskRecord.create(taskId, stableId, title, priority, dependencies, clock.instant());
            repository.save(record);
            log.info("Created task {} with stable id {}", taskId, stableId);

            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("prp_id", taskId);
            payload.put("title", title);
            payload.put("priority", priority);
            payload.put("stable_id", stableId);
            try {
                notificationPublisher.publish(NotificationType.NEW_TASK, payload);
            } catch (RuntimeException e) {
                log.warn("Failed to publish new_task notification for {}: {}", taskId, e.getMessage());
            }
            return record;
        }
    }

    @Override
    public TaskRecord assign(String taskId, String owner) {
        if (owner == null || owner.isBlank()) {
            throw new InvalidTransitionException(taskId, "an owner must be named");
        }
        TaskRecord record = get(taskId);
        if (record.isAssigned()) {
            throw new InvalidTransitionException(taskId, "already assigned to " + record.owner());
        }
        return transition(record, TaskStatus.ASSIGNED, b -> b.owner(owner).assignedAt(clock.instant()));
    }

    @Override
    public TaskRecord start(String taskId) {
        TaskRecord record = get(taskId);
        return transition(record, TaskStatus.IN_PROGRESS,
            b -> record.devStartedAt() == null ? b.devStartedAt(clock.instant()) : b);
    }

    @Override
    public TaskRecord submitForValidation(String taskId) {
        TaskRecord record = get(taskId);
        return transition(record, TaskStatus.VALIDATION,
            b -> record.validationStartedAt() == null ? b.validationStartedAt(clock.instant()) : b);
    }

    @Override
    public TaskRecord submitForIntegration(String taskId) {
        TaskRecord record = get(taskId);
        return transition(record, TaskStatus.INTEGRATION,
            b -> record.integrationStartedAt() == null ? b.integrationStartedAt(clock.instant()) : b);
    }

    @Override
    public TaskRecord complete(String taskId, String commitHash) {
        try (var ctx = LoggingContext.forTask(taskId)) {
            TaskRecord record = get(taskId);
            requireCompletionSource(record);
            completionGate.requirePassed(taskId, commitHash);
            return transition(record, TaskStatus.COMPLETE,
                b -> b.commitHash(commitHash).completedAt(clock.instant()));
        }
    }

    @Override
    public List<GateCheckFailure> verifyCompletion(String taskId, String commitHash) {
        get(taskId);
        return completionGate.evaluate(taskId, commitHash);
    }

    @Override
    public TaskRecord deprecate(String taskId, String supersededBy) {
        if (supersededBy == null || supersededBy.isBlank()) {
            throw new InvalidTransitionException(taskId, "deprecation requires the superseding task id");
        }
        if (supersededBy.equals(taskId)) {
            throw new InvalidTransitionException(taskId, "a task cannot supersede itself");
        }
        TaskRecord record = get(taskId);
        return transition(record, TaskStatus.DEPRECATED, b -> b.deprecated(supersededBy));
    }

    @Override
    public TaskRecord get(String taskId) {
        return repository.findById(taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    @Override
    public List<TaskRecord> list(TaskStatus status) {
        List<TaskRecord> records = status == null ? repository.findAll() : repository.findByStatus(status);
        List<TaskRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparingLong(TaskRecord::stableId).thenComparing(TaskRecord::id));
        return sorted;
    }

    @Override
    public MigrationReport migrateLegacy(Collection<LegacyTask> legacyTasks) {
        List<LegacyTask> ordered = new ArrayList<>(legacyTasks);
        ordered.sort(Comparator.comparing(LegacyTask::id));
        List<String> migrated = new ArrayList<>();
        List<String> alreadyMapped = new ArrayList<>();
        Instant now = clock.instant();

        for (LegacyTask legacy : ordered) {
            try (var ctx = LoggingContext.forTask(legacy.id())) {
                if (legacy.stableId() > 0) {
                    stableIdService.bind(legacy.id(), legacy.stableId());
                }
                boolean mapped = stableIdService.stableIdFor(legacy.id()).isPresent();
                long stableId = stableIdService.assign(legacy.id());

                TaskRecord existing = repository.findById(legacy.id()).orElse(null);
                if (mapped && existing != null && existing.stableId() == stableId) {
                    alreadyMapped.add(legacy.id());
                    continue;
                }
                TaskRecord base = existing != null
                    ? existing
                    : TaskRecord.create(legacy.id(), stableId, legacy.title(), legacy.priority(), Set.of(), now)
                        .toBuilder()
                        .status(legacy.status() != null ? legacy.status() : TaskStatus.NEW)
                        .build();
                TaskRecord record = base.withMigration(stableId, now);
                repository.save(record);
                migrated.add(legacy.id());
                log.info("Migrated legacy task {} to stable id {}", legacy.id(), stableId);
            }
        }
        log.info("Legacy migration: {} migrated, {} already mapped", migrated.size(), alreadyMapped.size());
        return new MigrationReport(migrated, alreadyMapped);
    }

    private void requireCompletionSource(TaskRecord record) {
        if (record.status() != completionSettings.completionSource()) {
            throw new InvalidTransitionException(
                record.id(), record.status(), List.of(completionSettings.completionSource()));
        }
    }

    private TaskRecord transition(TaskRecord record, TaskStatus target, UnaryOperator<TaskRecord.Builder> changes) {
        try (var ctx = LoggingContext.forTask(record.id())) {
            if (!record.status().canTransitionTo(target)) {
                throw new InvalidTransitionException(record.id(), record.status(), target);
            }
            TaskRecord updated = changes.apply(record.toBuilder().status(target)).build();
            repository.save(updated);
            log.info("Task {} transitioned {} -> {}", record.id(), record.status().wireName(), target.wireName());
            return updated;
        }
    }
}
