package com.coordinator.worker;

/**
 * Does the work of one stage for one task.
 * Workers implement this interface for the stage they serve.
 */
@FunctionalInterface
public interface StageHandler {

    /**
     * Process a claimed task. Returning normally completes the stage.
     *
     * @param context The claimed task and utilities
     * @throws StageFailedException if the task failed this stage
     */
    void handle(StageContext context) throws StageFailedException;
}
