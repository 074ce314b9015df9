package com.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ticker driven by explicit calls instead of wall-clock time.
 * {@link #advance(Duration)} runs every job that falls due in the advanced span,
 * in due-time order, on the calling thread.
 */
public class ManualTicker implements Ticker {

    private static final Logger log = LoggerFactory.getLogger(ManualTicker.class);

    private final List<Job> jobs = new ArrayList<>();
    private Duration elapsed = Duration.ZERO;
    private boolean running = true;

    @Override
    public synchronized ScheduledJob every(String name, Duration interval, Runnable job) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        Job registered = new Job(name, interval, job, elapsed.plus(interval));
        jobs.add(registered);
        return registered;
    }

    @Override
    public synchronized void start() {
        running = true;
    }

    @Override
    public synchronized void stop() {
        running = false;
    }

    /**
     * Move virtual time forward, running jobs as they fall due.
     *
     * @return Number of job runs performed
     */
    public synchronized int advance(Duration duration) {
        Duration target = elapsed.plus(duration);
        int runs = 0;
        while (running) {
            Job next = jobs.stream()
                .filter(j -> !j.cancelled && j.nextDue.compareTo(target) <= 0)
                .min(Comparator.comparing((Job j) -> j.nextDue))
                .orElse(null);
            if (next == null) {
                break;
            }
            elapsed = next.nextDue;
            next.nextDue = next.nextDue.plus(next.interval);
            next.runOnce();
            runs++;
        }
        elapsed = target;
        return runs;
    }

    /**
     * Run every live job once, now, without moving time.
     */
    public synchronized void runAll() {
        if (!running) {
            return;
        }
        new ArrayList<>(jobs).stream().filter(j -> !j.cancelled).forEach(Job::runOnce);
    }

    public synchronized int jobCount() {
        return (int) jobs.stream().filter(j -> !j.cancelled).count();
    }

    private static final class Job implements ScheduledJob {
        private final String name;
        private final Duration interval;
        private final Runnable task;
        private Duration nextDue;
        private volatile boolean cancelled;

        Job(String name, Duration interval, Runnable task, Duration firstDue) {
            this.name = name;
            this.interval = interval;
            this.task = task;
            this.nextDue = firstDue;
        }

        void runOnce() {
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
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
