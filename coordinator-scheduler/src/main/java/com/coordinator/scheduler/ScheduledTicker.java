package com.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ticker on a {@link ScheduledExecutorService} with fixed delay between runs.
 * Jobs registered before {@link #start()} are scheduled when it is called.
 */
public class ScheduledTicker implements Ticker {

    private static final Logger log = LoggerFactory.getLogger(ScheduledTicker.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final ScheduledExecutorService scheduler;
    private final List<Job> jobs = new CopyOnWriteArrayList<>();
    private volatile boolean running = false;

    public ScheduledTicker(int threads) {
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(threads, r -> {
            Thread thread = new Thread(r, "coordinator-ticker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public synchronized ScheduledJob every(String name, Duration interval, Runnable job) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        Job registered = new Job(name, interval, job);
        jobs.add(registered);
        if (running) {
            registered.schedule();
        }
        return registered;
    }

    @Override
    public synchronized void start() {
        if (running) {
            log.warn("Ticker already running");
            return;
        }
        running = true;
        jobs.forEach(Job::schedule);
        log.info("Ticker started with {} job(s)", jobs.size());
    }

    @Override
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Ticker stopped");
    }

    private final class Job implements ScheduledJob {
        private final String name;
        private final Duration interval;
        private final Runnable task;
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        Job(String name, Duration interval, Runnable task) {
            this.name = name;
            this.interval = interval;
            this.task = task;
        }

        void schedule() {
            if (cancelled) {
                return;
            }
            future = scheduler.scheduleWithFixedDelay(
                this::runOnce, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Scheduled {} every {}", name, interval);
        }

        private void runOnce() {
            if (!running || cancelled) {
                return;
            }
            try {
                task.run();
            } catch (Exception e) {
                log.error("Ticker job {} failed", name, e);
            }
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void cancel() {
            cancelled = true;
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
            jobs.remove(this);
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
