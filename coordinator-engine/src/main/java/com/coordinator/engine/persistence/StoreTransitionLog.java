package com.coordinator.engine.persistence;

import com.coordinator.core.model.StageTransition;
import com.coordinator.core.repository.TransitionLog;
import com.coordinator.core.store.CoordinationStore;
import com.coordinator.engine.store.PipelineKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * TransitionLog stored as a JSON list, oldest first.
 */
public class StoreTransitionLog implements TransitionLog {

    private static final Logger log = LoggerFactory.getLogger(StoreTransitionLog.class);

    private final CoordinationStore store;
    private final PipelineKeys keys;
    private final ObjectMapper objectMapper;

    public StoreTransitionLog(CoordinationStore store, PipelineKeys keys, ObjectMapper objectMapper) {
        this.store = store;
        this.keys = keys;
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(StageTransition transition) {
        try {
            store.pushTail(keys.transitions(), objectMapper.writeValueAsString(transition));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize transition for " + transition.taskId(), e);
        }
    }

    @Override
    public List<StageTransition> findByTaskId(String taskId) {
        return readAll().stream()
            .filter(t -> taskId.equals(t.taskId()))
            .collect(Collectors.toList());
    }

    @Override
    public List<StageTransition> recent(int limit) {
        List<StageTransition> all = new ArrayList<>(readAll());
        Collections.reverse(all);
        return all.stream().limit(limit).collect(Collectors.toList());
    }

    private List<StageTransition> readAll() {
        return store.range(keys.transitions()).stream()
            .map(this::parse)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
    }

    private StageTransition parse(String json) {
        try {
            return objectMapper.readValue(json, StageTransition.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable transition entry: {}", e.getOriginalMessage());
            return null;
        }
    }
}
