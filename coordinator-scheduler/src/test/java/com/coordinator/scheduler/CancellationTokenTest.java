package com.coordinator.scheduler;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void awaitTimesOutWhileNotCancelled() {
        CancellationToken token = new CancellationToken();

        assertThat(token.await(Duration.ofMillis(20))).isFalse();
        assertThat(token.isCancelled()).isFalse();
    }

    @Test
    void cancelWakesWaiter() throws Exception {
        CancellationToken token = new CancellationToken();
        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> token.await(Duration.ofMinutes(5)));

        token.cancel();

        assertThat(waiter.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(token.isCancelled()).isTrue();
    }
}
