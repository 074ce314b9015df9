package com.coordinator.recovery;

import com.coordinator.core.model.AgentStatus;
import com.coordinator.core.model.Stage;
import com.coordinator.core.notification.Notification;
import com.coordinator.core.notification.NotificationType;
import com.coordinator.engine.test.PipelineFixture;
import com.coordinator.scheduler.ManualTicker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RecoveryEngineTest {

    private final PipelineFixture fx = new PipelineFixture();
    private final ManualTicker ticker = new ManualTicker();
    private final RecoveryEngine engine = new RecoveryEngine(
        ticker,
        new StuckTaskRecovery(fx.pipeline, Duration.ofMinutes(30), Duration.ofMinutes(1)),
        new AgentLivenessMonitor(fx.agentRepository, fx.store, fx.keys, fx.publisher, fx.metrics,
            fx.objectMapper, Duration.ofSeconds(60), Duration.ofSeconds(300), fx.time),
        new QueueDepthMonitor(fx.pipeline, fx.publisher, fx.objectMapper, Stage.DEVELOPMENT, 20),
        new ProgressReporter(fx.pipeline, fx.taskRepository, fx.publisher, fx.objectMapper),
        RecoveryEngine.Schedule.defaults());

    /**
     * Move the clock and the ticker together, one minute at a time.
     */
    private void runFor(Duration duration) {
        for (long m = 0; m < duration.toMinutes(); m++) {
            fx.time.advanceMinutes(1);
            ticker.advance(Duration.ofMinutes(1));
        }
    }

    @Test
    void registersEveryLoopOnce() {
        engine.start();
        engine.start();

        assertThat(ticker.jobCount()).isEqualTo(4);
        assertThat(engine.isRunning()).isTrue();
    }

    @Test
    @DisplayName("A claim abandoned for longer than the stuck threshold is requeued by the schedule")
    void stuckTaskRecoveredOnSchedule() {
        fx.pipeline.enqueue("T1", Stage.DEVELOPMENT);
        fx.pipeline.claim(Stage.DEVELOPMENT, Duration.ZERO);
        engine.start();

        runFor(Duration.ofMinutes(30));
        assertThat(fx.inflight(Stage.DEVELOPMENT)).containsExactly("T1");

        runFor(Duration.ofMinutes(1));
        assertThat(fx.pending(Stage.DEVELOPMENT)).containsExactly("T1");
        assertThat(fx.inflight(Stage.DEVELOPMENT)).isEmpty();
    }

    @Test
    @DisplayName("Silent agents and the progress report reach the pending list")
    void livenessAndReport() {
        fx.agents.heartbeat("dev-1", AgentStatus.BUSY, null);
        engine.start();

        runFor(Duration.ofMinutes(30));

        assertThat(fx.pendingNotifications())
            .extracting(Notification::type)
            .containsOnlyOnce(NotificationType.AGENT_DOWN, NotificationType.PROGRESS_REPORT);
    }

    @Test
    void stopCancelsLoops() {
        engine.start();
        engine.stop();
        fx.agents.heartbeat("dev-1", AgentStatus.BUSY, null);

        runFor(Duration.ofMinutes(60));

        assertThat(fx.pendingNotifications()).isEmpty();
        assertThat(engine.isRunning()).isFalse();
    }
}
