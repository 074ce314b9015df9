package com.coordinator.api.rest;

import com.coordinator.core.model.GateCheckFailure;
import com.coordinator.core.model.StageTransition;
import com.coordinator.core.model.TaskRecord;
import com.coordinator.core.model.TaskStatus;
import com.coordinator.core.repository.TransitionLog;
import com.coordinator.engine.service.TaskStateService;
import com.coordinator.engine.state.LegacyTask;
import com.coordinator.engine.state.MigrationReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * REST API for the task state machine.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final int DEFAULT_TRANSITION_LIMIT = 100;

    private final TaskStateService tasks;
    private final TransitionLog transitionLog;

    public TaskController(TaskStateService tasks, TransitionLog transitionLog) {
        this.tasks = tasks;
        this.transitionLog = transitionLog;
    }

    /**
     * Register a new task. A stable id is issued once and never changes.
     */
    @PostMapping
    public ResponseEntity<TaskResponse> create(@RequestBody CreateTaskRequest request) {
        int priority = request.priority() != null ? request.priority() : TaskRecord.DEFAULT_PRIORITY;
        Set<String> dependencies = request.dependencies() != null ? Set.copyOf(request.dependencies()) : Set.of();
        TaskRecord record = tasks.create(request.id(), request.title(), priority, dependencies);
        return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.from(record));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> get(@PathVariable String taskId) {
        return ResponseEntity.ok(TaskResponse.from(tasks.get(taskId)));
    }

    /**
     * List tasks, optionally only those in one status.
     */
    @GetMapping
    public ResponseEntity<List<TaskResponse>> list(@RequestParam(required = false) String status) {
        TaskStatus filter = status != null ? TaskStatus.fromWireName(status) : null;
        return ResponseEntity.ok(tasks.list(filter).stream()
            .map(TaskResponse::from)
            .toList());
    }

    @PostMapping("/{taskId}/assign")
    public ResponseEntity<TaskResponse> assign(@PathVariable String taskId, @RequestBody AssignRequest request) {
        return ResponseEntity.ok(TaskResponse.from(tasks.assign(taskId, request.owner())));
    }

    @PostMapping("/{taskId}/start")
    public ResponseEntity<TaskResponse> start(@PathVariable String taskId) {
        return ResponseEntity.ok(TaskResponse.from(tasks.start(taskId)));
    }

    /**
     * Hand a task on to validation (the default) or integration.
     */
    @PostMapping("/{taskId}/submit")
    public ResponseEntity<TaskResponse> submit(
            @PathVariable String taskId,
            @RequestParam(defaultValue = "validation") String to) {
        TaskRecord record = switch (TaskStatus.fromWireName(to)) {
            case VALIDATION -> tasks.submitForValidation(taskId);
            case INTEGRATION -> tasks.submitForIntegration(taskId);
            default -> throw new IllegalArgumentException("Tasks can only be submitted to validation or integration: " + to);
        };
        return ResponseEntity.ok(TaskResponse.from(record));
    }

    /**
     * Mark a task complete. Rejected with 422 unless every completion check passes.
     */
    @PostMapping("/{taskId}/complete")
    public ResponseEntity<TaskResponse> complete(@PathVariable String taskId, @RequestBody CompleteRequest request) {
        return ResponseEntity.ok(TaskResponse.from(tasks.complete(taskId, request.commitHash())));
    }

    /**
     * Dry-run of the completion checks; never changes the task.
     */
    @GetMapping("/{taskId}/verify")
    public ResponseEntity<List<String>> verify(@PathVariable String taskId, @RequestParam String commitHash) {
        return ResponseEntity.ok(tasks.verifyCompletion(taskId, commitHash).stream()
            .map(GateCheckFailure::describe)
            .toList());
    }

    @PostMapping("/{taskId}/deprecate")
    public ResponseEntity<TaskResponse> deprecate(@PathVariable String taskId, @RequestBody DeprecateRequest request) {
        return ResponseEntity.ok(TaskResponse.from(tasks.deprecate(taskId, request.supersededBy())));
    }

    /**
     * Issue stable ids to legacy entries. Running it again changes nothing.
     */
    @PostMapping("/migrate")
    public ResponseEntity<MigrationReport> migrate(@RequestBody List<LegacyTaskRequest> legacyTasks) {
        return ResponseEntity.ok(tasks.migrateLegacy(legacyTasks.stream()
            .map(LegacyTaskRequest::toLegacyTask)
            .toList()));
    }

    @GetMapping("/{taskId}/transitions")
    public ResponseEntity<List<TransitionResponse>> transitions(@PathVariable String taskId) {
        tasks.get(taskId);
        return ResponseEntity.ok(transitionLog.findByTaskId(taskId).stream()
            .map(TransitionResponse::from)
            .toList());
    }

    @GetMapping("/transitions")
    public ResponseEntity<List<TransitionResponse>> recentTransitions(
            @RequestParam(defaultValue = "" + DEFAULT_TRANSITION_LIMIT) int limit) {
        return ResponseEntity.ok(transitionLog.recent(limit).stream()
            .map(TransitionResponse::from)
            .toList());
    }

    // ========== DTOs ==========

    public record CreateTaskRequest(String id, String title, Integer priority, List<String> dependencies) {}

    public record AssignRequest(String owner) {}

    public record CompleteRequest(String commitHash) {}

    public record DeprecateRequest(String supersededBy) {}

    public record LegacyTaskRequest(String id, String title, String status, Integer priority, Long stableId) {
        LegacyTask toLegacyTask() {
            return new LegacyTask(
                id,
                title,
                status != null ? TaskStatus.fromWireName(status) : TaskStatus.NEW,
                priority != null ? priority : TaskRecord.DEFAULT_PRIORITY,
                stableId != null ? stableId : 0L);
        }
    }

    public record TaskResponse(
        String id,
        long stableId,
        String title,
        String status,
        int priority,
        String owner,
        Set<String> dependencies,
        int retries,
        boolean needsAttention,
        String commitHash,
        boolean deprecated,
        String supersededBy,
        Instant createdAt,
        Instant completedAt
    ) {
        public static TaskResponse from(TaskRecord record) {
            return new TaskResponse(
                record.id(),
                record.stableId(),
                record.title(),
                record.status().wireName(),
                record.priority(),
                record.owner(),
                record.dependencies(),
                record.retries(),
                record.needsAttention(),
                record.commitHash(),
                record.deprecated(),
                record.supersededBy(),
                record.createdAt(),
                record.completedAt()
            );
        }
    }

    public record TransitionResponse(String taskId, String from, String to, Instant timestamp, String reason) {
        public static TransitionResponse from(StageTransition transition) {
            return new TransitionResponse(
                transition.taskId(),
                transition.fromStage() != null ? transition.fromStage().wireName() : null,
                transition.toStage() != null ? transition.toStage().wireName() : null,
                transition.timestamp(),
                transition.reason()
            );
        }
    }
}
