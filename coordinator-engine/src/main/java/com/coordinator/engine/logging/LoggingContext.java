package com.coordinator.engine.logging;

import com.coordinator.core.model.Stage;
import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures pipeline logs carry the task, stage and agent they concern.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(taskId, Stage.DEVELOPMENT)) {
 *     log.info("Claimed task"); // includes taskId, stage
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [worker-1] INFO  c.c.e.p.QueuePipelineEngine - Claimed task
 *   taskId=PRP-042 stage=dev agentId=dev-agent-1 traceId=3f2a9c1b
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK_ID = "taskId";
    public static final String STAGE = "stage";
    public static final String AGENT_ID = "agentId";
    public static final String NOTIFICATION_ID = "notificationId";
    public static final String TRACE_ID = "traceId";

    // Values the keys held before this context set them; restored on close so contexts can nest
    private final Map<String, String> previous = new HashMap<>();

    private LoggingContext() {
    }

    private LoggingContext put(String key, String value) {
        if (value != null) {
            previous.put(key, MDC.get(key));
            MDC.put(key, value);
        }
        return this;
    }

    /**
     * Create a logging context for an operation on one task within a stage.
     */
    public static LoggingContext forTask(String taskId, Stage stage) {
        LoggingContext ctx = new LoggingContext()
            .put(TASK_ID, taskId)
            .put(STAGE, stage != null ? stage.wireName() : null);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a task outside any stage (state machine operations).
     */
    public static LoggingContext forTask(String taskId) {
        return forTask(taskId, null);
    }

    /**
     * Create a logging context for agent-level operations.
     */
    public static LoggingContext forAgent(String agentId) {
        LoggingContext ctx = new LoggingContext().put(AGENT_ID, agentId);
        ensureTraceId();
        return ctx;
    }

    public static LoggingContext forNotification(String notificationId) {
        LoggingContext ctx = new LoggingContext().put(NOTIFICATION_ID, notificationId);
        ensureTraceId();
        return ctx;
    }

    public static String getTaskId() {
        return MDC.get(TASK_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        // TRACE_ID stays for the rest of the request or loop iteration
    }

    /**
     * Clear all MDC context. Call at the end of a request or loop iteration.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
