package com.coordinator.core.repository;

import com.coordinator.core.model.StageTransition;

import java.util.List;

/**
 * Append-only log of pipeline transitions.
 */
public interface TransitionLog {

    void append(StageTransition transition);

    /**
     * @param taskId The task id
     * @return Transitions of one task, oldest first
     */
    List<StageTransition> findByTaskId(String taskId);

    /**
     * @param limit Maximum number of results
     * @return The most recent transitions, newest first
     */
    List<StageTransition> recent(int limit);
}
