package com.coordinator.worker;

import com.coordinator.core.model.Stage;
import com.coordinator.core.model.TaskRecord;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Context provided to stage handlers while they hold a task.
 */
public class StageContext {

    private final String taskId;
    private final Stage stage;
    private final String agentId;
    private final Supplier<Optional<TaskRecord>> recordLookup;
    private final Runnable heartbeat;

    public StageContext(
            String taskId,
            Stage stage,
            String agentId,
            Supplier<Optional<TaskRecord>> recordLookup,
            Runnable heartbeat) {
        this.taskId = taskId;
        this.stage = stage;
        this.agentId = agentId;
        this.recordLookup = recordLookup;
        this.heartbeat = heartbeat;
    }

    public String getTaskId() {
        return taskId;
    }

    public Stage getStage() {
        return stage;
    }

    public String getAgentId() {
        return agentId;
    }

    /**
     * Current task record, read when called. Empty if the pipeline holds an id without a record.
     */
    public Optional<TaskRecord> getRecord() {
        return recordLookup.get();
    }

    /**
     * Send a heartbeat now. Heartbeats are also sent periodically while the handler runs;
     * call this from long steps that block the periodic ones.
     */
    public void heartbeat() {
        heartbeat.run();
    }
}
