package com.coordinator.core.exception;

import com.coordinator.core.model.GateCheckFailure;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when the completion gate blocks a task from reaching {@code complete}.
 * The message enumerates every failed check.
 */
public class ValidationGateException extends CoordinatorException {
    
    public static final String ERROR_CODE = "VALIDATION_GATE_FAILED";

    private final List<GateCheckFailure> failures;
    
    public ValidationGateException(String taskId, List<GateCheckFailure> failures) {
        super(ERROR_CODE, String.format(
            "Completion gate failed for task %s: %s",
            taskId,
            failures.stream().map(GateCheckFailure::describe).collect(Collectors.joining("; "))
        ));
        this.failures = List.copyOf(failures);
    }

    public List<GateCheckFailure> getFailures() {
        return failures;
    }
}
