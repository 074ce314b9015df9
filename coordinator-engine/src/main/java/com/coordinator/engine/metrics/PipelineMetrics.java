package com.coordinator.engine.metrics;

import com.coordinator.core.model.Stage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

/**
 * Micrometer metrics for the pipeline coordinator.
 * 
 * Metrics exposed:
 * - Queue traffic per stage (enqueued, claimed, completed, failed, dead-lettered)
 * - Recovery activity (stuck entries requeued, handoffs resumed)
 * - Notification delivery (delivered, deduplicated, fallback-formatted)
 * - Gate decisions by result code
 * - Queue depth gauges
 */
public class PipelineMetrics {

    public static final String ENQUEUED = "coordinator.queue.enqueued";
    public static final String DUPLICATE_ENQUEUES = "coordinator.queue.duplicates";
    public static final String CLAIMED = "coordinator.queue.claimed";
    public static final String COMPLETED = "coordinator.queue.completed";
    public static final String FAILED = "coordinator.queue.failed";
    public static final String DEAD_LETTERED = "coordinator.dead_letter.total";
    public static final String DEAD_LETTER_REPLAYED = "coordinator.dead_letter.replayed";
    public static final String RECOVERED = "coordinator.recovery.requeued";
    public static final String HANDOFFS_RESUMED = "coordinator.recovery.handoffs_resumed";
    public static final String QUEUE_DEPTH = "coordinator.queue.depth";
    public static final String AGENTS_DOWN = "coordinator.agents.down";
    public static final String NOTIFICATIONS_DELIVERED = "coordinator.notifications.delivered";
    public static final String NOTIFICATIONS_DEDUPLICATED = "coordinator.notifications.deduplicated";
    public static final String NOTIFICATIONS_FALLBACK = "coordinator.notifications.fallback";
    public static final String GATE_DECISIONS = "coordinator.gate.decisions";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Metrics kept in a private registry, for components running without Spring.
     */
    public static PipelineMetrics standalone() {
        return new PipelineMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return registry;
    }

    // ========== Queue ==========

    public void enqueued(Stage stage) {
        stageCounter(ENQUEUED, stage, "Tasks pushed onto a stage queue").increment();
    }

    public void duplicateEnqueue(Stage stage) {
        stageCounter(DUPLICATE_ENQUEUES, stage, "Enqueue calls ignored because the task was already queued").increment();
    }

    public void claimed(Stage stage) {
        stageCounter(CLAIMED, stage, "Tasks claimed by workers").increment();
    }

    public void completed(Stage stage) {
        stageCounter(COMPLETED, stage, "Tasks that finished a stage").increment();
    }

    public void failed(Stage stage, boolean willRetry) {
        Counter.builder(FAILED)
            .tag("stage", stage.wireName())
            .tag("will_retry", String.valueOf(willRetry))
            .description("Task failures reported by workers")
            .register(registry)
            .increment();
    }

    public void deadLettered(Stage stage) {
        stageCounter(DEAD_LETTERED, stage, "Tasks moved to the dead-letter list").increment();
    }

    public void deadLetterReplayed(Stage stage) {
        stageCounter(DEAD_LETTER_REPLAYED, stage, "Dead letters replayed by an operator").increment();
    }

    /**
     * Register a gauge reporting a queue length on scrape.
     */
    public void bindQueueDepth(Stage stage, String kind, Supplier<Number> depth) {
        Gauge.builder(QUEUE_DEPTH, depth)
            .tag("stage", stage.wireName())
            .tag("kind", kind)
            .description("Entries currently in a stage list")
            .register(registry);
    }

    // ========== Recovery ==========

    public void recovered(Stage stage, int count) {
        stageCounter(RECOVERED, stage, "Stuck inflight entries requeued").increment(count);
    }

    public void handoffResumed(Stage stage) {
        stageCounter(HANDOFFS_RESUMED, stage, "Interrupted handoffs finished by recovery").increment();
    }

    public void agentDown(String agentId) {
        Counter.builder(AGENTS_DOWN)
            .description("Agent-down notifications emitted")
            .register(registry)
            .increment();
    }

    // ========== Notifications ==========

    public void notificationDelivered(String type) {
        Counter.builder(NOTIFICATIONS_DELIVERED)
            .tag("type", type)
            .description("Notifications written to the operator console")
            .register(registry)
            .increment();
    }

    public void notificationDeduplicated() {
        Counter.builder(NOTIFICATIONS_DEDUPLICATED)
            .description("Notifications skipped because their id was already delivered")
            .register(registry)
            .increment();
    }

    public void notificationFallback(String type) {
        Counter.builder(NOTIFICATIONS_FALLBACK)
            .tag("type", type)
            .description("Notifications rendered with the generic formatter")
            .register(registry)
            .increment();
    }

    // ========== Gate ==========

    public void gateDecision(String code) {
        Counter.builder(GATE_DECISIONS)
            .tag("code", code)
            .description("Commit gate decisions")
            .register(registry)
            .increment();
    }

    private Counter stageCounter(String name, Stage stage, String description) {
        return Counter.builder(name)
            .tag("stage", stage.wireName())
            .description(description)
            .register(registry);
    }
}
