package com.coordinator.engine.pipeline;

import com.coordinator.core.exception.NotFoundException;
import com.coordinator.core.model.CompletionResult;
import com.coordinator.core.model.DeadLetterEntry;
import com.coordinator.core.model.EnqueueResult;
import com.coordinator.core.model.FailureResult;
import com.coordinator.core.model.QueueStats;
import com.coordinator.core.model.Stage;
import com.coordinator.core.model.StageTransition;
import com.coordinator.core.notification.NotificationPublisher;
import com.coordinator.core.notification.NotificationType;
import com.coordinator.core.repository.TaskRecordRepository;
import com.coordinator.core.repository.TransitionLog;
import com.coordinator.core.store.CoordinationStore;
import com.coordinator.engine.logging.LoggingContext;
import com.coordinator.engine.metrics.PipelineMetrics;
import com.coordinator.engine.service.PipelineService;
import com.coordinator.engine.store.PipelineKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Queue pipeline over the coordination store.
 * 
 * Each stage is a pending list plus an inflight shadow list. Claiming is one atomic
 * blocking move between them. Completing and failing are several store calls (remove
 * from inflight, then push onto the next stage, back onto this one or onto the dead
 * letters), bracketed by a handoff ledger entry so an interrupted move can be finished
 * by {@link #resumeHandoffs}. Only the caller that removed the inflight entry pushes.
 * 
 * Invariants:
 * - a task id is in at most one stage list (pending or inflight) at a time
 * - FIFO within a stage; completed and recovered tasks jump to the head
 * - the membership set holds exactly the ids somewhere in the stage lists
 */
public class QueuePipelineEngine implements PipelineService {

    private static final Logger log = LoggerFactory.getLogger(QueuePipelineEngine.class);

    private final CoordinationStore store;
    private final PipelineKeys keys;
    private final TaskRecordRepository taskRepository;
    private final TransitionLog transitionLog;
    private final NotificationPublisher notificationPublisher;
    private final PipelineMetrics metrics;
    private final PipelineSettings settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public QueuePipelineEngine(
            CoordinationStore store,
            PipelineKeys keys,
            TaskRecordRepository taskRepository,
            TransitionLog transitionLog,
            NotificationPublisher notificationPublisher,
            PipelineMetrics metrics,
            PipelineSettings settings,
            ObjectMapper objectMapper,
            Clock clock) {
        this.store = store;
        this.keys = keys;
        this.taskRepository = taskRepository;
        this.transitionLog = transitionLog;
        this.notificationPublisher = notificationPublisher;
        this.metrics = metrics;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.clock = clock;

        for (Stage stage : Stage.values()) {
            metrics.bindQueueDepth(stage, "pending", () -> store.length(keys.queue(stage)));
            metrics.bindQueueDepth(stage, "inflight", () -> store.length(keys.inflight(stage)));
        }
    }

    // ========== Enqueue ==========

    @Override
    public EnqueueResult enqueue(String taskId, Stage stage) {
        Objects.requireNonNull(taskId, "taskId");
        try (var ctx = LoggingContext.forTask(taskId, stage)) {
            if (!store.sadd(keys.members(), taskId)) {
                log.debug("Task {} already in pipeline, enqueue ignored", taskId);
                metrics.duplicateEnqueue(stage);
                return EnqueueResult.ALREADY_QUEUED;
            }
            try {
                store.pushTail(keys.queue(stage), taskId);
            } catch (RuntimeException e) {
                // Membership without a list entry would refuse every later enqueue
                store.srem(keys.members(), taskId);
                throw e;
            }
            transitionLog.append(new StageTransition(taskId, null, stage, clock.instant(), StageTransition.REASON_ENQUEUED));
            metrics.enqueued(stage);
            log.info("Enqueued task {} for stage {}", taskId, stage.wireName());
            return EnqueueResult.ENQUEUED;
        }
    }

    @Override
    public int enqueueAll(Collection<String> taskIds, Stage stage) {
        List<String> queued = new ArrayList<>();
        for (String taskId : taskIds) {
            if (enqueue(taskId, stage) == EnqueueResult.ENQUEUED) {
                queued.add(taskId);
            }
        }
        if (!queued.isEmpty()) {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("stage", stage.wireName());
            payload.put("count", queued.size());
            ArrayNode ids = payload.putArray("prp_ids");
            queued.forEach(ids::add);
            publishSafely(NotificationType.BULK_ENQUEUE, payload);
        }
        log.info("Bulk enqueue for stage {}: {} of {} queued", stage.wireName(), queued.size(), taskIds.size());
        return queued.size();
    }

    // ========== Claim ==========

    @Override
    public Optional<String> claim(Stage stage, Duration timeout) {
        Optional<String> claimed = store.moveBlocking(keys.queue(stage), keys.inflight(stage), timeout);
        claimed.ifPresent(taskId -> {
            try (var ctx = LoggingContext.forTask(taskId, stage)) {
                Instant now = clock.instant();
                store.hset(keys.claims(stage), taskId, Long.toString(now.toEpochMilli()));
                taskRepository.stampStageStarted(taskId, stage, now);
                metrics.claimed(stage);
                log.info("Claimed task {} from stage {}", taskId, stage.wireName());
            }
        });
        return claimed;
    }

    // ========== Complete ==========

    @Override
    public CompletionResult complete(String taskId, Stage stage) {
        try (var ctx = LoggingContext.forTask(taskId, stage)) {
            String ledgerEntry = HandoffEntry.advance(stage, clock.instant()).encode();
            boolean freshHandoff = store.hsetIfAbsent(keys.handoffs(), taskId, ledgerEntry);

            long removed = store.remove(keys.inflight(stage), taskId, 0);
            store.hdel(keys.claims(stage), taskId);

            if (removed == 0) {
                // Either never claimed here or an earlier handoff owns it; resumeHandoffs finishes those
                if (freshHandoff) {
                    store.hdel(keys.handoffs(), taskId);
                }
                log.debug("Task {} not inflight in stage {}, complete ignored", taskId, stage.wireName());
                return CompletionResult.NOT_CLAIMED;
            }
            return finishHandoff(taskId, stage, !freshHandoff, StageTransition.REASON_COMPLETED);
        }
    }

    /**
     * Second half of a handoff: enter the next stage (or leave the pipeline), then clear the ledger.
     * When the handoff may have partly happened before, a task already listed in any stage is
     * taken as moved on and is not pushed again. The same holds for the other two moves below.
     */
    private CompletionResult finishHandoff(String taskId, Stage stage, boolean mayHavePushed, String reason) {
        boolean alreadyMoved = mayHavePushed && isListedAnywhere(taskId);
        Optional<Stage> next = stage.next();
        CompletionResult result;
        if (next.isPresent()) {
            Stage nextStage = next.get();
            if (!alreadyMoved) {
                store.pushHead(keys.queue(nextStage), taskId);
            }
            transitionLog.append(new StageTransition(taskId, stage, nextStage, clock.instant(), reason));
            log.info("Task {} moved from {} to head of {}", taskId, stage.wireName(), nextStage.wireName());
            result = CompletionResult.ADVANCED;
        } else {
            if (!alreadyMoved) {
                store.srem(keys.members(), taskId);
            }
            transitionLog.append(new StageTransition(taskId, stage, null, clock.instant(), StageTransition.REASON_FINISHED));
            log.info("Task {} finished the pipeline at {}", taskId, stage.wireName());
            result = CompletionResult.FINISHED;
        }
        store.hdel(keys.handoffs(), taskId);
        metrics.completed(stage);
        return result;
    }

    private boolean isListedAnywhere(String taskId) {
        for (Stage candidate : Stage.values()) {
            if (store.range(keys.queue(candidate)).contains(taskId)
                    || store.range(keys.inflight(candidate)).contains(taskId)) {
                return true;
            }
        }
        return false;
    }

    // ========== Fail ==========

    @Override
    public FailureResult fail(String taskId, Stage stage, String reason) {
        try (var ctx = LoggingContext.forTask(taskId, stage)) {
            HandoffEntry requeue = HandoffEntry.requeue(stage, clock.instant());
            if (!store.hsetIfAbsent(keys.handoffs(), taskId, requeue.encode())) {
                log.debug("Task {} has an unfinished handoff, fail left to resumption", taskId);
                return FailureResult.NOT_CLAIMED;
            }
            long removed = store.remove(keys.inflight(stage), taskId, 0);
            store.hdel(keys.claims(stage), taskId);
            if (removed == 0) {
                store.hdel(keys.handoffs(), taskId);
                log.debug("Task {} not inflight in stage {}, fail ignored", taskId, stage.wireName());
                return FailureResult.NOT_CLAIMED;
            }

            int retries = taskRepository.incrementRetries(taskId);
            boolean retryable = settings.isRetryable(reason);
            if (!retryable || retries > settings.maxRetries()) {
                HandoffEntry dead = HandoffEntry.deadLetter(stage, clock.instant(), retries, reason);
                store.hset(keys.handoffs(), taskId, dead.encode());
                finishDeadLetter(taskId, dead, false);
                metrics.failed(stage, false);
                return FailureResult.DEAD_LETTERED;
            }

            finishRequeue(taskId, stage, false, StageTransition.REASON_RETRY);
            metrics.failed(stage, true);
            log.info("Task {} failed in {} ({}), requeued, retries {}/{}",
                taskId, stage.wireName(), reason, retries, settings.maxRetries());
            return FailureResult.REQUEUED;
        }
    }

    private void finishRequeue(String taskId, Stage stage, boolean mayHavePushed, String transitionReason) {
        if (!(mayHavePushed && isListedAnywhere(taskId))) {
            store.pushTail(keys.queue(stage), taskId);
        }
        transitionLog.append(new StageTransition(taskId, stage, stage, clock.instant(), transitionReason));
        store.hdel(keys.handoffs(), taskId);
    }

    private void finishDeadLetter(String taskId, HandoffEntry move, boolean mayHavePushed) {
        Stage stage = move.stage();
        String reason = move.reason();
        int retries = move.retries();
        boolean parked = mayHavePushed && deadLetters().stream().anyMatch(e -> e.taskId().equals(taskId));
        if (!parked) {
            DeadLetterEntry entry = new DeadLetterEntry(taskId, stage, reason, retries, clock.instant());
            store.pushTail(keys.deadLetters(), toJson(entry));
        }
        store.srem(keys.members(), taskId);
        if (taskRepository.exists(taskId)) {
            taskRepository.markNeedsAttention(taskId, true);
        }
        transitionLog.append(new StageTransition(taskId, stage, null, clock.instant(), StageTransition.REASON_DEAD_LETTER));
        store.hdel(keys.handoffs(), taskId);
        metrics.deadLettered(stage);
        log.warn("Task {} dead-lettered from {} after {} retries: {}", taskId, stage.wireName(), retries, reason);

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("event", "dead_letter");
        payload.put("prp_id", taskId);
        payload.put("stage", stage.wireName());
        payload.put("reason", reason);
        payload.put("retries", retries);
        payload.put("message", String.format("Task %s needs attention: failed %d time(s) in %s (%s)",
            taskId, retries, stage.wireName(), reason));
        publishSafely(NotificationType.SYSTEM, payload);
    }

    // ========== Recovery ==========

    @Override
    public List<String> recoverStuck(Stage stage, Duration maxAge) {
        Instant now = clock.instant();
        Map<String, String> claimTimes = store.hgetAll(keys.claims(stage));
        Set<String> handoffsInProgress = store.hgetAll(keys.handoffs()).keySet();
        List<String> inflight = new ArrayList<>(store.range(keys.inflight(stage)));
        List<String> recovered = new ArrayList<>();

        // Newest claim first, so after head pushes the oldest stuck entry is served first
        for (int i = inflight.size() - 1; i >= 0; i--) {
            String taskId = inflight.get(i);
            if (handoffsInProgress.contains(taskId)) {
                continue;
            }
            try (var ctx = LoggingContext.forTask(taskId, stage)) {
                String claimedAt = claimTimes.get(taskId);
                if (claimedAt == null) {
                    // Claimed by a process that died before recording the time; start the clock now
                    store.hsetIfAbsent(keys.claims(stage), taskId, Long.toString(now.toEpochMilli()));
                    log.debug("Inflight task {} had no claim time, recorded {}", taskId, now);
                    continue;
                }
                Duration age = Duration.ofMillis(now.toEpochMilli() - Long.parseLong(claimedAt));
                if (age.compareTo(maxAge) <= 0) {
                    continue;
                }
                if (store.remove(keys.inflight(stage), taskId, 1) == 0) {
                    continue;
                }
                store.hdel(keys.claims(stage), taskId);
                store.pushHead(keys.queue(stage), taskId);
                transitionLog.append(new StageTransition(taskId, stage, stage, now, StageTransition.REASON_RECOVERED));
                log.warn("Recovered stuck task {} in {} after {}s inflight", taskId, stage.wireName(), age.toSeconds());
                recovered.add(taskId);
            } catch (NumberFormatException e) {
                log.warn("Unreadable claim time for {} in {}, resetting", taskId, stage.wireName());
                store.hset(keys.claims(stage), taskId, Long.toString(now.toEpochMilli()));
            }
        }
        if (!recovered.isEmpty()) {
            metrics.recovered(stage, recovered.size());
        }
        return recovered;
    }

    @Override
    public List<String> resumeHandoffs(Duration grace) {
        Instant now = clock.instant();
        List<String> resumed = new ArrayList<>();
        for (Map.Entry<String, String> row : store.hgetAll(keys.handoffs()).entrySet()) {
            String taskId = row.getKey();
            Optional<HandoffEntry> parsed = HandoffEntry.parse(row.getValue());
            if (parsed.isEmpty()) {
                log.warn("Dropping unreadable handoff entry for {}: {}", taskId, row.getValue());
                store.hdel(keys.handoffs(), taskId);
                continue;
            }
            HandoffEntry entry = parsed.get();
            if (Duration.between(entry.startedAt(), now).compareTo(grace) < 0) {
                continue;
            }
            Stage stage = entry.stage();
            try (var ctx = LoggingContext.forTask(taskId, stage)) {
                store.remove(keys.inflight(stage), taskId, 0);
                store.hdel(keys.claims(stage), taskId);
                switch (entry.move()) {
                    case REQUEUE:
                        finishRequeue(taskId, stage, true, StageTransition.REASON_HANDOFF_RESUMED);
                        break;
                    case DEAD_LETTER:
                        finishDeadLetter(taskId, entry, true);
                        break;
                    default:
                        finishHandoff(taskId, stage, true, StageTransition.REASON_HANDOFF_RESUMED);
                }
                metrics.handoffResumed(stage);
                log.warn("Resumed interrupted {} of task {} out of {}",
                    entry.move().name().toLowerCase(), taskId, stage.wireName());
                resumed.add(taskId);
            }
        }
        return resumed;
    }

    // ========== Dead letters & stats ==========

    @Override
    public List<DeadLetterEntry> deadLetters() {
        return store.range(keys.deadLetters()).stream()
            .map(this::parseDeadLetter)
            .flatMap(Optional::stream)
            .collect(Collectors.toList());
    }

    @Override
    public EnqueueResult replayDeadLetter(String taskId, Stage stage) {
        try (var ctx = LoggingContext.forTask(taskId, stage)) {
            DeadLetterEntry replayed = null;
            for (String raw : store.range(keys.deadLetters())) {
                Optional<DeadLetterEntry> entry = parseDeadLetter(raw);
                if (entry.isPresent() && entry.get().taskId().equals(taskId)
                        && store.remove(keys.deadLetters(), raw, 1) > 0) {
                    replayed = entry.get();
                }
            }
            if (replayed == null) {
                throw new NotFoundException("Dead letter", taskId);
            }
            if (taskRepository.exists(taskId)) {
                taskRepository.resetRetries(taskId);
                taskRepository.markNeedsAttention(taskId, false);
            }
            Stage target = stage != null ? stage : replayed.stage();
            metrics.deadLetterReplayed(target);
            log.info("Replaying dead-lettered task {} into {}", taskId, target.wireName());
            return enqueue(taskId, target);
        }
    }

    @Override
    public QueueStats stats(Stage stage) {
        return new QueueStats(stage, store.length(keys.queue(stage)), store.length(keys.inflight(stage)));
    }

    @Override
    public long deadLetterCount() {
        return store.length(keys.deadLetters());
    }

    private Optional<DeadLetterEntry> parseDeadLetter(String raw) {
        try {
            return Optional.of(objectMapper.readValue(raw, DeadLetterEntry.class));
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable dead-letter entry: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value, e);
        }
    }

    private void publishSafely(NotificationType type, ObjectNode payload) {
        try {
            notificationPublisher.publish(type, payload);
        } catch (RuntimeException e) {
            // Queue state is already committed; a lost notification must not undo it
            log.warn("Failed to publish {} notification: {}", type.wireName(), e.getMessage());
        }
    }
}
