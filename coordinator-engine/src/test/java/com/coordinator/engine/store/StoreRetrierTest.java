package com.coordinator.engine.store;

import com.coordinator.core.exception.TransientStoreException;
import com.coordinator.core.model.RetryPolicy;
import com.coordinator.core.test.FailureInjector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class StoreRetrierTest {

    private final List<Duration> sleeps = new ArrayList<>();

    private final RetryPolicy policy = RetryPolicy.builder()
        .maxAttempts(4)
        .initialBackoff(Duration.ofMillis(100))
        .maxBackoff(Duration.ofSeconds(1))
        .multiplier(2.0)
        .withoutJitter()
        .build();

    private final StoreRetrier retrier = new StoreRetrier(policy, sleeps::add);

    @Test
    @DisplayName("Transient failures are retried with exponential backoff")
    void retriesTransientFailures() {
        FailureInjector injector = FailureInjector.failFirst(2);

        String result = retrier.call("hget", () -> {
            injector.maybeThrow(() -> new TransientStoreException("connection reset"));
            return "value";
        });

        assertThat(result).isEqualTo("value");
        assertThat(injector.getFailureCount()).isEqualTo(2);
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    @DisplayName("The last failure propagates once attempts run out")
    void givesUp() {
        FailureInjector injector = FailureInjector.alwaysFail();

        assertThatThrownBy(() -> retrier.run("hset", () ->
                injector.maybeThrow(() -> new TransientStoreException("down"))))
            .isInstanceOf(TransientStoreException.class)
            .hasMessage("down");
        assertThat(injector.getFailureCount()).isEqualTo(4);
        assertThat(sleeps).hasSize(3);
    }

    @Test
    @DisplayName("Other exceptions are not retried")
    void nonTransientNotRetried() {
        FailureInjector injector = FailureInjector.alwaysFail();

        assertThatThrownBy(() -> retrier.call("range", () -> {
            injector.maybeThrow(() -> new IllegalStateException("bug"));
            return null;
        })).isInstanceOf(IllegalStateException.class);
        assertThat(injector.getFailureCount()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("An interrupted backoff gives up at once and keeps the interrupt flag")
    void interruptedWhileWaiting() {
        StoreRetrier impatient = new StoreRetrier(policy, d -> {
            throw new InterruptedException();
        });
        FailureInjector injector = FailureInjector.alwaysFail();

        try {
            assertThatThrownBy(() -> impatient.run("hset", () ->
                    injector.maybeThrow(() -> new TransientStoreException("down"))))
                .isInstanceOf(TransientStoreException.class);
            assertThat(injector.getFailureCount()).isEqualTo(1);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
