package com.coordinator.worker;

import com.coordinator.core.model.AgentRecord;
import com.coordinator.core.model.AgentStatus;
import com.coordinator.core.model.Stage;
import com.coordinator.core.model.TaskRecord;
import com.coordinator.engine.pipeline.PipelineSettings;
import com.coordinator.engine.test.PipelineFixture;
import com.coordinator.scheduler.CancellationToken;
import com.coordinator.scheduler.ManualTicker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class PipelineWorkerTest {

    private static final PipelineWorker.WorkerSettings SETTINGS =
        new PipelineWorker.WorkerSettings(Duration.ZERO, Duration.ofSeconds(30), Duration.ofMillis(10));

    private final PipelineFixture fx = new PipelineFixture();
    private final ManualTicker ticker = new ManualTicker();

    private PipelineWorker worker(StageHandler handler) {
        return new PipelineWorker("dev-1", Stage.DEVELOPMENT, fx.pipeline, fx.agents, fx.taskRepository,
            handler, ticker, SETTINGS);
    }

    @Test
    @DisplayName("A handled task moves to the head of the next stage")
    void successAdvances() {
        fx.createAndEnqueue("PRP-1", Stage.DEVELOPMENT);

        Optional<PipelineWorker.WorkOutcome> outcome = worker(ctx -> { }).runOnce();

        assertThat(outcome).contains(new PipelineWorker.WorkOutcome("PRP-1", true, "ADVANCED"));
        assertThat(fx.pending(Stage.VALIDATION)).containsExactly("PRP-1");
        assertThat(fx.inflight(Stage.DEVELOPMENT)).isEmpty();
    }

    @Test
    @DisplayName("A stage failure is reported with the handler's reason")
    void failureRequeues() {
        fx.createAndEnqueue("PRP-1", Stage.DEVELOPMENT);

        Optional<PipelineWorker.WorkOutcome> outcome = worker(ctx -> {
            throw new StageFailedException("tests failed");
        }).runOnce();

        assertThat(outcome).contains(new PipelineWorker.WorkOutcome("PRP-1", false, "REQUEUED"));
        assertThat(fx.pending(Stage.DEVELOPMENT)).containsExactly("PRP-1");
        assertThat(fx.taskRepository.findById("PRP-1")).map(TaskRecord::retries).contains(1);
    }

    @Test
    @DisplayName("An unexpected exception counts as a failure instead of killing the worker")
    void unexpectedExceptionIsAFailure() {
        PipelineFixture strict = new PipelineFixture(new PipelineSettings(0, Set.of()));
        strict.createAndEnqueue("PRP-1", Stage.DEVELOPMENT);
        PipelineWorker failing = new PipelineWorker("dev-1", Stage.DEVELOPMENT, strict.pipeline, strict.agents,
            strict.taskRepository, ctx -> {
                throw new IllegalStateException("boom");
            }, ticker, SETTINGS);

        Optional<PipelineWorker.WorkOutcome> outcome = failing.runOnce();

        assertThat(outcome).map(PipelineWorker.WorkOutcome::detail).contains("DEAD_LETTERED");
        assertThat(strict.pipeline.deadLetters())
            .singleElement()
            .satisfies(entry -> assertThat(entry.reason()).isEqualTo("error: IllegalStateException: boom"));
        assertThat(ticker.jobCount()).isZero();
    }

    @Test
    void emptyQueueReportsIdle() {
        Optional<PipelineWorker.WorkOutcome> outcome = worker(ctx -> fail("no task expected")).runOnce();

        assertThat(outcome).isEmpty();
        AgentRecord agent = fx.agents.get("dev-1");
        assertThat(agent.status()).isEqualTo(AgentStatus.IDLE);
        assertThat(agent.currentTask()).isNull();
    }

    @Test
    @DisplayName("Heartbeats keep flowing while a long task is handled, and stop afterwards")
    void heartbeatsWhileHolding() {
        fx.createAndEnqueue("PRP-1", Stage.DEVELOPMENT);
        List<Instant> seen = new ArrayList<>();

        worker(ctx -> {
            for (int i = 0; i < 3; i++) {
                fx.time.advanceSeconds(30);
                ticker.advance(Duration.ofSeconds(30));
                seen.add(fx.agents.get("dev-1").lastActivity());
            }
            assertThat(fx.agents.get("dev-1").currentTask()).isEqualTo("PRP-1");
            assertThat(fx.agents.get("dev-1").status()).isEqualTo(AgentStatus.BUSY);
        }).runOnce();

        assertThat(seen).containsExactly(
            PipelineFixture.START.plusSeconds(30),
            PipelineFixture.START.plusSeconds(60),
            PipelineFixture.START.plusSeconds(90));
        assertThat(ticker.jobCount()).isZero();
    }

    @Test
    void contextExposesTaskRecord() {
        fx.createAndEnqueue("PRP-1", Stage.DEVELOPMENT);
        AtomicReference<String> title = new AtomicReference<>();

        worker(ctx -> title.set(ctx.getRecord().map(TaskRecord::title).orElse(null))).runOnce();

        assertThat(title.get()).isEqualTo("Task PRP-1");
    }

    @Test
    @DisplayName("If recovery took the task back meanwhile, completing changes nothing")
    void recoveredWhileHandling() {
        fx.createAndEnqueue("PRP-1", Stage.DEVELOPMENT);

        Optional<PipelineWorker.WorkOutcome> outcome = worker(ctx -> {
            fx.time.advanceSeconds(1);
            fx.pipeline.recoverStuck(Stage.DEVELOPMENT, Duration.ZERO);
        }).runOnce();

        assertThat(outcome).contains(new PipelineWorker.WorkOutcome("PRP-1", false, "NOT_CLAIMED"));
        assertThat(fx.pending(Stage.DEVELOPMENT)).containsExactly("PRP-1");
        assertThat(fx.pending(Stage.VALIDATION)).isEmpty();
    }

    @Test
    void runLoopsUntilCancelled() {
        fx.createAndEnqueue("PRP-1", Stage.DEVELOPMENT);
        fx.createAndEnqueue("PRP-2", Stage.DEVELOPMENT);
        CancellationToken token = new CancellationToken();
        List<String> handled = new ArrayList<>();

        worker(ctx -> {
            handled.add(ctx.getTaskId());
            if (handled.size() == 2) {
                token.cancel();
            }
        }).run(token);

        assertThat(handled).containsExactly("PRP-1", "PRP-2");
        assertThat(fx.pending(Stage.VALIDATION)).containsExactly("PRP-2", "PRP-1");
    }

    @Test
    void startedWorkerProcessesInBackground() throws InterruptedException {
        PipelineWorker background = new PipelineWorker("dev-2", Stage.DEVELOPMENT, fx.pipeline, fx.agents,
            fx.taskRepository, ctx -> { }, ticker,
            new PipelineWorker.WorkerSettings(Duration.ofMillis(50), Duration.ofSeconds(30), Duration.ofMillis(10)));
        background.start();
        try {
            fx.createAndEnqueue("PRP-1", Stage.DEVELOPMENT);

            long deadline = System.currentTimeMillis() + 5000;
            while (fx.pending(Stage.VALIDATION).isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
        } finally {
            background.stop();
        }

        assertThat(fx.pending(Stage.VALIDATION)).containsExactly("PRP-1");
    }
}
