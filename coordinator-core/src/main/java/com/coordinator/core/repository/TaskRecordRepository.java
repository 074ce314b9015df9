package com.coordinator.core.repository;

import com.coordinator.core.model.Stage;
import com.coordinator.core.model.TaskRecord;
import com.coordinator.core.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for task records.
 * Records are never deleted; terminal records stay for audit.
 */
public interface TaskRecordRepository {

    /**
     * Insert or replace a task record.
     * 
     * @param record The record to write
     */
    void save(TaskRecord record);

    /**
     * Find a task by its legacy/display id.
     * 
     * @param id The task id
     * @return The record if found
     */
    Optional<TaskRecord> findById(String id);

    boolean exists(String id);

    /**
     * @return Every known record, in no particular order
     */
    List<TaskRecord> findAll();

    /**
     * Find records in a given status.
     * 
     * @param status The status to match
     * @return Matching records
     */
    List<TaskRecord> findByStatus(TaskStatus status);

    /**
     * Atomically increment the retry counter of a record.
     * 
     * @param id The task id
     * @return The new retry count
     */
    int incrementRetries(String id);

    /**
     * Reset the retry counter, used when an operator replays a dead letter.
     */
    void resetRetries(String id);

    /**
     * Flag a record for operator attention.
     */
    void markNeedsAttention(String id, boolean needsAttention);

    /**
     * Record when a task was first claimed from a stage. Later claims of the same
     * stage (after a retry or recovery) keep the original timestamp.
     * 
     * @param id The task id
     * @param stage The stage that was claimed
     * @param at Claim time
     * @return true if the timestamp was written
     */
    boolean stampStageStarted(String id, Stage stage, Instant at);
}
