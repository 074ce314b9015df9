package com.coordinator.gate;

/**
 * Outcome of evaluating a commit.
 *
 * @param errorCode Error code of the violated rule, null when allowed for a normal reason
 * @param taskId Task the commit was correlated with, null if none
 */
public record GateDecision(boolean allowed, Code code, String errorCode, String message, String taskId) {

    public enum Code {
        /** Correlated task is in an active status and any completion claim verified. */
        ALLOWED,
        /** No task id in the message. */
        NO_TASK,
        /** System-generated update of the task artifact. */
        SYSTEM_UPDATE,
        /** Task artifact edited without the system sentinel. */
        PROTECTED_ARTIFACT,
        NOT_FOUND,
        /** Task is not in an active status. */
        INVALID_STATE,
        /** Completion claimed but the completion gate failed. */
        VALIDATION_FAILED,
        /** The gate itself failed; allowed or not depending on configuration. */
        HOOK_FAILURE;

        public String wireName() {
            return name().toLowerCase();
        }
    }

    public static GateDecision allow(Code code, String message, String taskId) {
        return new GateDecision(true, code, null, message, taskId);
    }

    public static GateDecision reject(Code code, String errorCode, String message, String taskId) {
        return new GateDecision(false, code, errorCode, message, taskId);
    }
}
