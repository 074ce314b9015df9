package com.coordinator.recovery;

import com.coordinator.core.model.Stage;
import com.coordinator.core.notification.Notification;
import com.coordinator.core.notification.NotificationType;
import com.coordinator.engine.test.PipelineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class QueueDepthMonitorTest {

    private final PipelineFixture fx = new PipelineFixture();
    private final QueueDepthMonitor monitor =
        new QueueDepthMonitor(fx.pipeline, fx.publisher, fx.objectMapper, Stage.DEVELOPMENT, 20);

    private void fill(int count) {
        fx.pipeline.enqueueAll(
            IntStream.range(0, count).mapToObj(i -> "PRP-" + i).collect(Collectors.toList()),
            Stage.DEVELOPMENT);
    }

    private List<Notification> scalingRequests() {
        return fx.pendingNotifications().stream()
            .filter(n -> n.type() == NotificationType.SCALING_NEEDED)
            .collect(Collectors.toList());
    }

    @Test
    @DisplayName("A depth at the threshold is not a breach")
    void atThresholdIsQuiet() {
        fill(20);

        assertThat(monitor.check()).isFalse();
        assertThat(scalingRequests()).isEmpty();
    }

    @Test
    @DisplayName("One scaling request per breach")
    void oncePerBreach() {
        fill(21);

        assertThat(monitor.check()).isTrue();
        assertThat(monitor.check()).isFalse();

        List<Notification> requests = scalingRequests();
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).payloadText("queue")).isEqualTo("dev");
        assertThat(requests.get(0).payload().get("depth").asLong()).isEqualTo(21);
        assertThat(requests.get(0).payload().get("threshold").asInt()).isEqualTo(20);
    }

    @Test
    @DisplayName("Draining below the threshold ends the breach so the next one is reported")
    void reportsAgainAfterDrain() {
        fill(21);
        monitor.check();

        for (int i = 0; i < 5; i++) {
            fx.pipeline.claim(Stage.DEVELOPMENT, Duration.ZERO);
        }
        assertThat(monitor.check()).isFalse();

        fx.pipeline.enqueueAll(List.of("X1", "X2", "X3", "X4", "X5"), Stage.DEVELOPMENT);
        assertThat(monitor.check()).isTrue();
        assertThat(scalingRequests()).hasSize(2);
    }

    @Test
    @DisplayName("Claimed tasks do not count towards the backlog")
    void inflightNotCounted() {
        fill(22);
        fx.pipeline.claim(Stage.DEVELOPMENT, Duration.ZERO);
        fx.pipeline.claim(Stage.DEVELOPMENT, Duration.ZERO);

        assertThat(monitor.check()).isFalse();
    }
}
