package com.coordinator.api.rest;

import com.coordinator.api.lifecycle.CoordinatorLifecycle;
import com.coordinator.core.model.CompletionResult;
import com.coordinator.core.model.DeadLetterEntry;
import com.coordinator.core.model.EnqueueResult;
import com.coordinator.core.model.FailureResult;
import com.coordinator.core.model.QueueStats;
import com.coordinator.core.model.Stage;
import com.coordinator.engine.config.CoordinatorProperties;
import com.coordinator.engine.service.PipelineService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST API for the stage queues. Used by workers (claim, complete, fail) and operators.
 */
@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private final PipelineService pipeline;
    private final CoordinatorLifecycle lifecycle;
    private final CoordinatorProperties properties;

    public PipelineController(PipelineService pipeline, CoordinatorLifecycle lifecycle, CoordinatorProperties properties) {
        this.pipeline = pipeline;
        this.lifecycle = lifecycle;
        this.properties = properties;
    }

    /**
     * Enqueue one task at the tail of a stage.
     */
    @PostMapping("/{stage}/tasks/{taskId}")
    public ResponseEntity<Map<String, Object>> enqueue(@PathVariable String stage, @PathVariable String taskId) {
        EnqueueResult result = pipeline.enqueue(taskId, Stage.fromWireName(stage));
        HttpStatus status = result == EnqueueResult.ENQUEUED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(Map.of("taskId", taskId, "result", result.name()));
    }

    /**
     * Enqueue several tasks; ids already in the pipeline are skipped.
     */
    @PostMapping("/{stage}/bulk")
    public ResponseEntity<Map<String, Object>> enqueueAll(@PathVariable String stage, @RequestBody BulkEnqueueRequest request) {
        if (request.taskIds() == null) {
            throw new IllegalArgumentException("taskIds is required");
        }
        int enqueued = pipeline.enqueueAll(request.taskIds(), Stage.fromWireName(stage));
        return ResponseEntity.ok(Map.of("requested", request.taskIds().size(), "enqueued", enqueued));
    }

    /**
     * Claim the head of a stage, waiting up to the requested timeout.
     * Answers 204 when nothing arrived and 503 while the coordinator shuts down.
     */
    @PostMapping("/{stage}/claim")
    public ResponseEntity<Map<String, Object>> claim(
            @PathVariable String stage,
            @RequestParam(required = false) Long timeoutSeconds) {
        if (!lifecycle.canAcceptClaims()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("errorCode", "SHUTTING_DOWN", "message", "Coordinator is shutting down"));
        }
        Duration maxTimeout = properties.getPipeline().getClaimTimeout();
        Duration timeout = timeoutSeconds == null
            ? maxTimeout
            : Duration.ofSeconds(Math.max(0, Math.min(timeoutSeconds, maxTimeout.toSeconds())));
        Optional<String> claimed = pipeline.claim(Stage.fromWireName(stage), timeout);
        return claimed
            .<ResponseEntity<Map<String, Object>>>map(id -> ResponseEntity.ok(Map.of("taskId", id)))
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/{stage}/tasks/{taskId}/complete")
    public ResponseEntity<Map<String, Object>> complete(@PathVariable String stage, @PathVariable String taskId) {
        CompletionResult result = pipeline.complete(taskId, Stage.fromWireName(stage));
        return ResponseEntity.ok(Map.of("taskId", taskId, "result", result.name()));
    }

    @PostMapping("/{stage}/tasks/{taskId}/fail")
    public ResponseEntity<Map<String, Object>> fail(
            @PathVariable String stage,
            @PathVariable String taskId,
            @RequestBody(required = false) FailRequest request) {
        String reason = request != null && request.reason() != null ? request.reason() : "unspecified";
        FailureResult result = pipeline.fail(taskId, Stage.fromWireName(stage), reason);
        return ResponseEntity.ok(Map.of("taskId", taskId, "result", result.name()));
    }

    /**
     * Requeue tasks claimed longer ago than maxAgeSeconds (default: the configured stuck age).
     */
    @PostMapping("/{stage}/recover")
    public ResponseEntity<Map<String, Object>> recover(
            @PathVariable String stage,
            @RequestParam(required = false) Long maxAgeSeconds) {
        Duration maxAge = maxAgeSeconds != null
            ? Duration.ofSeconds(maxAgeSeconds)
            : properties.getPipeline().getStuckMaxAge();
        List<String> recovered = pipeline.recoverStuck(Stage.fromWireName(stage), maxAge);
        return ResponseEntity.ok(Map.of("recovered", recovered));
    }

    @GetMapping("/{stage}/stats")
    public ResponseEntity<StageStatsResponse> stats(@PathVariable String stage) {
        return ResponseEntity.ok(StageStatsResponse.from(pipeline.stats(Stage.fromWireName(stage))));
    }

    @GetMapping("/stats")
    public ResponseEntity<List<StageStatsResponse>> allStats() {
        List<StageStatsResponse> stats = Arrays.stream(Stage.values())
            .map(pipeline::stats)
            .map(StageStatsResponse::from)
            .toList();
        return ResponseEntity.ok(stats);
    }

    @GetMapping("/dead-letters")
    public ResponseEntity<List<DeadLetterResponse>> deadLetters() {
        return ResponseEntity.ok(pipeline.deadLetters().stream()
            .map(DeadLetterResponse::from)
            .toList());
    }

    /**
     * Put a dead-lettered task back at the tail of its stage, or of another stage if given.
     */
    @PostMapping("/dead-letters/{taskId}/replay")
    public ResponseEntity<Map<String, Object>> replay(
            @PathVariable String taskId,
            @RequestBody(required = false) ReplayRequest request) {
        Stage stage = request != null && request.stage() != null ? Stage.fromWireName(request.stage()) : null;
        EnqueueResult result = pipeline.replayDeadLetter(taskId, stage);
        return ResponseEntity.ok(Map.of("taskId", taskId, "result", result.name()));
    }

    // ========== DTOs ==========

    public record BulkEnqueueRequest(List<String> taskIds) {}

    public record FailRequest(String reason) {}

    public record ReplayRequest(String stage) {}

    public record StageStatsResponse(String stage, long pending, long inflight) {
        public static StageStatsResponse from(QueueStats stats) {
            return new StageStatsResponse(stats.stage().wireName(), stats.pending(), stats.inflight());
        }
    }

    public record DeadLetterResponse(String taskId, String stage, String reason, int retries, Instant deadLetteredAt) {
        public static DeadLetterResponse from(DeadLetterEntry entry) {
            return new DeadLetterResponse(
                entry.taskId(),
                entry.stage().wireName(),
                entry.reason(),
                entry.retries(),
                entry.deadLetteredAt());
        }
    }
}
