package com.coordinator.engine.store;

import com.coordinator.core.exception.TransientStoreException;
import com.coordinator.core.model.RetryPolicy;
import com.coordinator.core.test.FailureInjector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RetryingCoordinationStoreTest {

    /**
     * In-memory store whose every call first consults the injector.
     */
    static class FlakyStore extends InMemoryCoordinationStore {
        final FailureInjector injector;

        FlakyStore(FailureInjector injector) {
            this.injector = injector;
        }

        private void maybeFail(String op) {
            injector.maybeThrow(() -> new TransientStoreException(op + ": injected"));
        }

        @Override
        public Map<String, String> hgetAll(String key) {
            maybeFail("hgetAll");
            return super.hgetAll(key);
        }

        @Override
        public void hset(String key, String field, String value) {
            maybeFail("hset");
            super.hset(key, field, value);
        }

        @Override
        public boolean sadd(String key, String member) {
            maybeFail("sadd");
            return super.sadd(key, member);
        }

        @Override
        public void pushTail(String key, String value) {
            maybeFail("pushTail");
            super.pushTail(key, value);
        }
    }

    private final RetryPolicy policy = RetryPolicy.builder()
        .maxAttempts(3)
        .initialBackoff(Duration.ofMillis(1))
        .withoutJitter()
        .build();

    @Test
    @DisplayName("Reads and overwrites survive transient failures")
    void retriesIdempotentCalls() {
        FlakyStore flaky = new FlakyStore(FailureInjector.failFirst(2));
        RetryingCoordinationStore store = new RetryingCoordinationStore(flaky, new StoreRetrier(policy, d -> { }));

        store.hset("h", "f", "v");

        assertThat(flaky.injector.getFailureCount()).isEqualTo(2);
        assertThat(store.hgetAll("h")).containsEntry("f", "v");
    }

    @Test
    @DisplayName("Calls whose answer depends on prior state are not retried")
    void nonIdempotentCallsPassThrough() {
        FlakyStore flaky = new FlakyStore(FailureInjector.failFirst(1));
        RetryingCoordinationStore store = new RetryingCoordinationStore(flaky, new StoreRetrier(policy, d -> { }));

        assertThatThrownBy(() -> store.sadd("s", "a"))
            .isInstanceOf(TransientStoreException.class);
        assertThat(store.sadd("s", "a")).isTrue();
    }

    @Test
    @DisplayName("Pushes are never repeated by the decorator")
    void pushesNotRepeated() {
        FlakyStore flaky = new FlakyStore(FailureInjector.failFirst(1));
        RetryingCoordinationStore store = new RetryingCoordinationStore(flaky, new StoreRetrier(policy, d -> { }));

        assertThatThrownBy(() -> store.pushTail("q", "T1"))
            .isInstanceOf(TransientStoreException.class);
        assertThat(store.range("q")).isEmpty();
    }

    @Test
    @DisplayName("Persistent failures of retried calls surface after the last attempt")
    void persistentFailure() {
        FlakyStore flaky = new FlakyStore(FailureInjector.alwaysFail());
        RetryingCoordinationStore store = new RetryingCoordinationStore(flaky, new StoreRetrier(policy, d -> { }));

        assertThatThrownBy(() -> store.hgetAll("h"))
            .isInstanceOf(TransientStoreException.class);
        assertThat(flaky.injector.getFailureCount()).isEqualTo(3);
    }
}
