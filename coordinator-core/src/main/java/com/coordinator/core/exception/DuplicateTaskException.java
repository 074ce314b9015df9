package com.coordinator.core.exception;

/**
 * Thrown when creating a task whose id is already taken.
 */
public class DuplicateTaskException extends CoordinatorException {
    
    public static final String ERROR_CODE = "DUPLICATE_TASK";
    
    public DuplicateTaskException(String taskId) {
        super(ERROR_CODE, String.format("Task already exists: %s", taskId));
    }
}
