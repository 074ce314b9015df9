package com.coordinator.scheduler;

import java.time.Duration;

/**
 * Runs periodic jobs. Coordinator loops register here instead of sleeping in threads
 * of their own, so shutdown and tests control when they run.
 */
public interface Ticker {

    /**
     * Run a job repeatedly, {@code interval} apart, starting one interval from now.
     * A job that throws is logged and runs again at its next tick.
     *
     * @param name Job name for logging
     * @return Handle to cancel just this job
     */
    ScheduledJob every(String name, Duration interval, Runnable job);

    void start();

    /**
     * Stop running jobs. Jobs already running are allowed to finish.
     */
    void stop();

    /**
     * A registered periodic job.
     */
    interface ScheduledJob {
        String name();

        void cancel();

        boolean isCancelled();
    }
}
