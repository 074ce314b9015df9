package com.coordinator.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ManualTickerTest {

    private final ManualTicker ticker = new ManualTicker();

    @Test
    @DisplayName("Jobs run once per elapsed interval, in due order")
    void runsDueJobsInOrder() {
        List<String> runs = new ArrayList<>();
        ticker.every("fast", Duration.ofSeconds(10), () -> runs.add("fast"));
        ticker.every("slow", Duration.ofSeconds(25), () -> runs.add("slow"));

        int count = ticker.advance(Duration.ofSeconds(30));

        assertThat(count).isEqualTo(4);
        assertThat(runs).containsExactly("fast", "fast", "slow", "fast");
    }

    @Test
    @DisplayName("Nothing runs before the first interval has passed")
    void firstRunAfterOneInterval() {
        List<String> runs = new ArrayList<>();
        ticker.every("job", Duration.ofMinutes(1), () -> runs.add("job"));

        ticker.advance(Duration.ofSeconds(59));
        assertThat(runs).isEmpty();
        ticker.advance(Duration.ofSeconds(1));
        assertThat(runs).hasSize(1);
    }

    @Test
    @DisplayName("A failing job does not stop the others or its own later runs")
    void failuresAreContained() {
        List<String> runs = new ArrayList<>();
        ticker.every("broken", Duration.ofSeconds(1), () -> {
            runs.add("broken");
            throw new IllegalStateException("boom");
        });
        ticker.every("healthy", Duration.ofSeconds(1), () -> runs.add("healthy"));

        ticker.advance(Duration.ofSeconds(2));

        assertThat(runs).containsExactly("broken", "healthy", "broken", "healthy");
    }

    @Test
    @DisplayName("Cancelled jobs and a stopped ticker run nothing")
    void cancelAndStop() {
        List<String> runs = new ArrayList<>();
        Ticker.ScheduledJob job = ticker.every("job", Duration.ofSeconds(1), () -> runs.add("job"));
        ticker.every("other", Duration.ofSeconds(1), () -> runs.add("other"));

        job.cancel();
        ticker.advance(Duration.ofSeconds(1));
        assertThat(runs).containsExactly("other");
        assertThat(ticker.jobCount()).isEqualTo(1);

        ticker.stop();
        ticker.advance(Duration.ofSeconds(5));
        ticker.runAll();
        assertThat(runs).containsExactly("other");
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> ticker.every("bad", Duration.ZERO, () -> { }))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
