package com.coordinator.core.test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Makes a fake store call fail on demand. Wrap the call site:
 *
 * <pre>{@code
 * FailureInjector injector = FailureInjector.failFirst(2);
 * injector.maybeThrow(() -> new TransientStoreException("connection reset"));
 * }</pre>
 */
public final class FailureInjector {

    private static final int UNLIMITED = -1;

    private final AtomicInteger budget;
    private final AtomicInteger injected = new AtomicInteger();

    private FailureInjector(int failures) {
        this.budget = new AtomicInteger(failures);
    }

    /** The first {@code n} calls fail, later ones pass. */
    public static FailureInjector failFirst(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative");
        }
        return new FailureInjector(n);
    }

    public static FailureInjector alwaysFail() {
        return new FailureInjector(UNLIMITED);
    }

    public <T extends RuntimeException> void maybeThrow(Supplier<T> failure) {
        if (consume()) {
            injected.incrementAndGet();
            throw failure.get();
        }
    }

    private boolean consume() {
        int left = budget.getAndUpdate(b -> b > 0 ? b - 1 : b);
        return left != 0;
    }

    public int getFailureCount() {
        return injected.get();
    }
}
