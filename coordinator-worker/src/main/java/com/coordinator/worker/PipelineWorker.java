package com.coordinator.worker;

import com.coordinator.core.model.AgentStatus;
import com.coordinator.core.model.CompletionResult;
import com.coordinator.core.model.FailureResult;
import com.coordinator.core.model.Stage;
import com.coordinator.core.repository.TaskRecordRepository;
import com.coordinator.engine.agent.AgentRegistry;
import com.coordinator.engine.logging.LoggingContext;
import com.coordinator.engine.service.PipelineService;
import com.coordinator.scheduler.CancellationToken;
import com.coordinator.scheduler.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Worker that serves one stage: claims tasks, runs the stage handler, and reports the result.
 *
 * Usage:
 * <pre>
 * PipelineWorker worker = new PipelineWorker("dev-1", Stage.DEVELOPMENT, pipeline, agents, tasks,
 *     context -> build(context.getTaskId()), ticker, WorkerSettings.defaults());
 * worker.start();
 * </pre>
 *
 * A worker that dies while holding a task leaves it inflight; stuck-task recovery requeues it.
 */
public class PipelineWorker {

    private static final Logger log = LoggerFactory.getLogger(PipelineWorker.class);

    /**
     * Timing of the worker loop.
     *
     * @param claimTimeout How long one claim waits for work
     * @param heartbeatInterval How often heartbeats are sent while a task is held
     * @param errorBackoff Pause after an unexpected error in the loop
     */
    public record WorkerSettings(Duration claimTimeout, Duration heartbeatInterval, Duration errorBackoff) {
        public static WorkerSettings defaults() {
            return new WorkerSettings(Duration.ofSeconds(30), Duration.ofSeconds(30), Duration.ofSeconds(5));
        }
    }

    /**
     * What happened to one claimed task.
     */
    public record WorkOutcome(String taskId, boolean succeeded, String detail) {
    }

    private final String agentId;
    private final Stage stage;
    private final PipelineService pipeline;
    private final AgentRegistry agents;
    private final TaskRecordRepository tasks;
    private final StageHandler handler;
    private final Ticker ticker;
    private final WorkerSettings settings;

    private final CancellationToken cancellation = new CancellationToken();
    private ExecutorService executor;

    public PipelineWorker(
            String agentId,
            Stage stage,
            PipelineService pipeline,
            AgentRegistry agents,
            TaskRecordRepository tasks,
            StageHandler handler,
            Ticker ticker,
            WorkerSettings settings) {
        this.agentId = agentId;
        this.stage = stage;
        this.pipeline = pipeline;
        this.agents = agents;
        this.tasks = tasks;
        this.handler = handler;
        this.ticker = ticker;
        this.settings = settings;
    }

    /**
     * Start the worker loop on a thread of its own.
     */
    public synchronized void start() {
        if (executor != null) {
            log.warn("Worker {} already started", agentId);
            return;
        }
        log.info("Starting worker {} for stage {}", agentId, stage.wireName());
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "worker-" + agentId);
            thread.setDaemon(true);
            return thread;
        });
        executor.submit(() -> run(cancellation));
    }

    /**
     * Stop the worker. A task being handled is finished and reported first.
     */
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        log.info("Stopping worker {}", agentId);
        cancellation.cancel();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
    }

    /**
     * Run until the token is cancelled.
     */
    public void run(CancellationToken token) {
        try (var ctx = LoggingContext.forAgent(agentId)) {
            while (!token.isCancelled()) {
                try {
                    runOnce();
                } catch (Exception e) {
                    log.error("Error in worker loop of {}", agentId, e);
                    if (token.await(settings.errorBackoff())) {
                        break;
                    }
                }
            }
        }
        log.info("Worker {} stopped", agentId);
    }

    /**
     * Claim at most one task and process it.
     *
     * @return The outcome, or empty if no task arrived within the claim timeout
     */
    public Optional<WorkOutcome> runOnce() {
        agents.heartbeat(agentId, AgentStatus.IDLE, null);
        Optional<String> claimed = pipeline.claim(stage, settings.claimTimeout());
        if (claimed.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(process(claimed.get()));
    }

    private WorkOutcome process(String taskId) {
        try (var ctx = LoggingContext.forTask(taskId, stage)) {
            Runnable beat = () -> agents.heartbeat(agentId, AgentStatus.BUSY, taskId);
            beat.run();
            Ticker.ScheduledJob heartbeats = ticker.every("heartbeat-" + agentId, settings.heartbeatInterval(), beat);

            StageContext context = new StageContext(taskId, stage, agentId, () -> tasks.findById(taskId), beat);
            try {
                handler.handle(context);
            } catch (StageFailedException e) {
                return reportFailure(taskId, e.getReason());
            } catch (Exception e) {
                log.error("Handler for {} threw unexpectedly", stage.wireName(), e);
                return reportFailure(taskId, "error: " + e.getClass().getSimpleName() + ": " + e.getMessage());
            } finally {
                heartbeats.cancel();
            }

            CompletionResult result = pipeline.complete(taskId, stage);
            if (result == CompletionResult.NOT_CLAIMED) {
                log.warn("Task {} was no longer held by {} when it completed {}", taskId, agentId, stage.wireName());
                return new WorkOutcome(taskId, false, result.name());
            }
            log.info("Worker {} finished {} for {} ({})", agentId, stage.wireName(), taskId, result);
            return new WorkOutcome(taskId, true, result.name());
        }
    }

    private WorkOutcome reportFailure(String taskId, String reason) {
        FailureResult result = pipeline.fail(taskId, stage, reason);
        log.warn("Worker {} failed {} for {}: {} ({})", agentId, stage.wireName(), taskId, reason, result);
        return new WorkOutcome(taskId, false, result.name());
    }

    public String agentId() {
        return agentId;
    }
}
