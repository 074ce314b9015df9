package com.coordinator.engine.service;

import com.coordinator.core.model.GateCheckFailure;
import com.coordinator.core.model.TaskRecord;
import com.coordinator.core.model.TaskStatus;
import com.coordinator.engine.state.LegacyTask;
import com.coordinator.engine.state.MigrationReport;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Service for the task lifecycle state machine.
 * The only writer of task status.
 */
public interface TaskStateService {

    /**
     * Create a task in {@code new} with the next stable id.
     * 
     * @throws com.coordinator.core.exception.DuplicateTaskException if the id is taken
     */
    TaskRecord create(String taskId, String title, int priority, Set<String> dependencies);

    /**
     * Give an unassigned {@code new} task to a named owner.
     */
    TaskRecord assign(String taskId, String owner);

    TaskRecord start(String taskId);

    TaskRecord submitForValidation(String taskId);

    TaskRecord submitForIntegration(String taskId);

    /**
     * Mark a task complete after the completion gate passes.
     * 
     * @param taskId The task id
     * @param commitHash The commit implementing the task
     * @throws com.coordinator.core.exception.InvalidTransitionException if not in the completion source status
     * @throws com.coordinator.core.exception.ValidationGateException listing every failed evidence check
     */
    TaskRecord complete(String taskId, String commitHash);

    /**
     * Evaluate the completion gate without changing anything.
     * 
     * @return Failed checks, empty if completion would be accepted
     */
    List<GateCheckFailure> verifyCompletion(String taskId, String commitHash);

    /**
     * Retire a non-terminal task in favour of another.
     */
    TaskRecord deprecate(String taskId, String supersededBy);

    /**
     * @throws com.coordinator.core.exception.NotFoundException if unknown
     */
    TaskRecord get(String taskId);

    List<TaskRecord> list(TaskStatus status);

    /**
     * One-time migration of legacy entries to stable ids, in ascending legacy id order.
     * Re-running it changes nothing for entries already migrated.
     */
    MigrationReport migrateLegacy(Collection<LegacyTask> legacyTasks);
}
