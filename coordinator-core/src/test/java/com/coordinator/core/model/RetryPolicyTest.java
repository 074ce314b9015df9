package com.coordinator.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delaysGrowByTheMultiplier() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialBackoff(Duration.ofMillis(40))
            .maxBackoff(Duration.ofSeconds(5))
            .multiplier(3.0)
            .withoutJitter()
            .build();

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMillis(40));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofMillis(120));
        assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofMillis(360));
    }

    @Test
    void delaysStopAtTheCap() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialBackoff(Duration.ofMillis(500))
            .maxBackoff(Duration.ofMillis(1500))
            .withoutJitter()
            .build();

        assertThat(policy.delayAfter(8)).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    void jitterKeepsDelaysNearTheBase() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialBackoff(Duration.ofMillis(200))
            .jitter(0.25)
            .build();

        for (int i = 0; i < 40; i++) {
            assertThat(policy.delayAfter(1).toMillis()).isBetween(150L, 250L);
        }
    }

    @Test
    void defaultsAllowThreeAttempts() {
        RetryPolicy policy = RetryPolicy.storeDefaults();

        assertThat(policy.allowsAnotherAttempt(2)).isTrue();
        assertThat(policy.allowsAnotherAttempt(3)).isFalse();
        assertThat(RetryPolicy.once().allowsAnotherAttempt(1)).isFalse();
    }

    @Test
    void rejectsNonsense() {
        assertThatThrownBy(() -> RetryPolicy.builder().maxAttempts(0).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().jitter(2.0).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder()
                .initialBackoff(Duration.ofSeconds(5)).maxBackoff(Duration.ofSeconds(1)).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.storeDefaults().delayAfter(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
