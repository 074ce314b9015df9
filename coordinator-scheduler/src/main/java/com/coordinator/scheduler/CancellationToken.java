package com.coordinator.scheduler;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative stop signal for long-running loops.
 * A loop waits on the token instead of sleeping, so cancelling wakes it at once.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Wait up to {@code timeout} for cancellation.
     *
     * @return true if cancelled (or the waiting thread was interrupted)
     */
    public boolean await(Duration timeout) {
        try {
            return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
