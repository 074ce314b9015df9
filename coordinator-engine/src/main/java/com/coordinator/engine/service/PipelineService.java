package com.coordinator.engine.service;

import com.coordinator.core.model.CompletionResult;
import com.coordinator.core.model.DeadLetterEntry;
import com.coordinator.core.model.EnqueueResult;
import com.coordinator.core.model.FailureResult;
import com.coordinator.core.model.QueueStats;
import com.coordinator.core.model.Stage;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Service for moving task ids through the stage queues.
 * Ids only; task records are the state manager's concern.
 */
public interface PipelineService {

    /**
     * Append a task to the tail of a stage queue.
     * 
     * @param taskId The task id
     * @param stage The stage to queue for
     * @return ALREADY_QUEUED if the id is anywhere in the pipeline already
     */
    EnqueueResult enqueue(String taskId, Stage stage);

    /**
     * Enqueue several tasks and announce the batch with one notification.
     * 
     * @return Number of ids actually queued
     */
    int enqueueAll(Collection<String> taskIds, Stage stage);

    /**
     * Claim the task at the head of a stage queue (called by workers).
     * Blocks up to the timeout.
     * 
     * @param stage The stage to claim from
     * @param timeout Maximum time to wait for work
     * @return The claimed id, or empty on timeout
     */
    Optional<String> claim(Stage stage, Duration timeout);

    /**
     * Report that a claimed task finished a stage.
     * The task moves to the head of the next stage, or leaves the pipeline after the last one.
     * 
     * @param taskId The task id
     * @param stage The stage it was claimed from
     * @return Outcome of the handoff
     */
    CompletionResult complete(String taskId, Stage stage);

    /**
     * Report that a claimed task failed a stage.
     * 
     * @param taskId The task id
     * @param stage The stage it was claimed from
     * @param reason Failure reason; configured reasons are never retried
     * @return REQUEUED while retries remain, otherwise DEAD_LETTERED
     */
    FailureResult fail(String taskId, Stage stage, String reason);

    /**
     * Requeue, at the head, every inflight entry of a stage claimed longer ago than maxAge.
     * 
     * @return Ids requeued
     */
    List<String> recoverStuck(Stage stage, Duration maxAge);

    /**
     * Finish handoffs interrupted between leaving one stage and entering the next.
     * 
     * @param grace Minimum age of a handoff before it is considered interrupted
     * @return Ids whose handoff was finished
     */
    List<String> resumeHandoffs(Duration grace);

    List<DeadLetterEntry> deadLetters();

    /**
     * Put a dead-lettered task back into a stage with its retry count reset.
     * 
     * @param taskId The task id
     * @param stage Stage to requeue into, or null for the stage it failed in
     * @return Result of the re-enqueue
     */
    EnqueueResult replayDeadLetter(String taskId, Stage stage);

    QueueStats stats(Stage stage);

    long deadLetterCount();
}
