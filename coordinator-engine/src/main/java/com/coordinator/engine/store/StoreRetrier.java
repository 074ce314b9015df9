package com.coordinator.engine.store;

import com.coordinator.core.exception.TransientStoreException;
import com.coordinator.core.model.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retries store calls that fail with {@link TransientStoreException}, backing off
 * between attempts according to a {@link RetryPolicy}. Once attempts run out the
 * last exception propagates to the caller.
 */
public class StoreRetrier {

    private static final Logger log = LoggerFactory.getLogger(StoreRetrier.class);

    /**
     * Waits between attempts. Replaced in tests to avoid real sleeping.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public StoreRetrier(RetryPolicy policy) {
        this(policy, duration -> Thread.sleep(duration.toMillis()));
    }

    public StoreRetrier(RetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public <T> T call(String operation, Supplier<T> action) {
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (TransientStoreException e) {
                if (!policy.allowsAnotherAttempt(attempt)) {
                    log.error("Store operation {} failed after {} attempt(s)", operation, attempt, e);
                    throw e;
                }
                Duration backoff = policy.delayAfter(attempt);
                log.warn("Store operation {} failed (attempt {}/{}), retrying in {}ms: {}",
                    operation, attempt, policy.maxAttempts(), backoff.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                attempt++;
            }
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
