package com.coordinator.engine.store;

import com.coordinator.core.model.Stage;

/**
 * Names of every key the coordinator uses in the coordination store.
 * An optional prefix lets several pipelines share one store.
 */
public final class PipelineKeys {

    private final String prefix;

    public PipelineKeys(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    public static PipelineKeys unprefixed() {
        return new PipelineKeys("");
    }

    /** Pending entries of a stage, claimed from the head. */
    public String queue(Stage stage) {
        return prefix + "queue:" + stage.wireName();
    }

    /** Entries claimed from a stage and not yet completed or failed. */
    public String inflight(Stage stage) {
        return queue(stage) + ":inflight";
    }

    /** Hash of task id to claim time (epoch millis) for a stage's inflight entries. */
    public String claims(Stage stage) {
        return queue(stage) + ":claims";
    }

    /** Set of every task id currently anywhere in the pipeline lists. */
    public String members() {
        return prefix + "pipeline:members";
    }

    public String deadLetters() {
        return prefix + "pipeline:dead_letter";
    }

    /** Hash of task id to in-progress handoff ({@code stage|millis}). */
    public String handoffs() {
        return prefix + "pipeline:handoffs";
    }

    public String transitions() {
        return prefix + "pipeline:transitions";
    }

    public String task(String taskId) {
        return prefix + "prp:" + taskId;
    }

    public String taskIndex() {
        return prefix + "prp:index";
    }

    public String agent(String agentId) {
        return prefix + "agent:" + agentId;
    }

    public String agentIndex() {
        return prefix + "agent:index";
    }

    /** Hash holding the stable id sequence and the legacy id mapping. */
    public String stableIds() {
        return prefix + "ids:stable";
    }

    public String legacyIdMap() {
        return prefix + "ids:legacy";
    }

    /** Hash of stable id to the legacy id it was given to. */
    public String stableIdOwners() {
        return prefix + "ids:owners";
    }

    /** Hash of agent id to the lastActivity already reported as down. */
    public String agentDownReported() {
        return prefix + "liveness:agent_down";
    }

    public String notifications(String pendingKey) {
        return prefix + pendingKey;
    }
}
