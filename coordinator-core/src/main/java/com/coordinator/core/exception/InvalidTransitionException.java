package com.coordinator.core.exception;

import com.coordinator.core.model.TaskStatus;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Thrown when a task status change does not follow an edge of the state machine,
 * or when an operation requires the task to be in a status it is not in.
 */
public class InvalidTransitionException extends CoordinatorException {
    
    public static final String ERROR_CODE = "INVALID_TRANSITION";

    private final TaskStatus currentStatus;
    
    public InvalidTransitionException(String taskId, TaskStatus currentStatus, TaskStatus requestedStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition task %s from %s to %s",
            taskId, currentStatus.wireName(), requestedStatus.wireName()
        ));
        this.currentStatus = currentStatus;
    }
    
    public InvalidTransitionException(String taskId, TaskStatus currentStatus, Collection<TaskStatus> requiredStatuses) {
        super(ERROR_CODE, String.format(
            "Task %s is in status %s, required: %s",
            taskId, currentStatus.wireName(),
            requiredStatuses.stream().map(TaskStatus::wireName).collect(Collectors.joining(" or "))
        ));
        this.currentStatus = currentStatus;
    }

    public InvalidTransitionException(String taskId, String reason) {
        super(ERROR_CODE, String.format("Cannot transition task %s: %s", taskId, reason));
        this.currentStatus = null;
    }

    public TaskStatus getCurrentStatus() {
        return currentStatus;
    }
}
