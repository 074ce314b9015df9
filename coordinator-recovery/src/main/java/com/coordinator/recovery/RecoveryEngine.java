package com.coordinator.recovery;

import com.coordinator.scheduler.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Schedules the background loops of the coordinator on a ticker.
 *
 * Responsibilities:
 * - Recover stuck inflight entries and interrupted handoffs
 * - Detect agents that stopped sending heartbeats
 * - Request scaling when the development backlog grows
 * - Send the periodic progress report
 */
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    /**
     * How often each loop runs.
     */
    public record Schedule(
        Duration recoveryInterval,
        Duration livenessInterval,
        Duration depthCheckInterval,
        Duration progressInterval
    ) {
        public static Schedule defaults() {
            return new Schedule(
                Duration.ofMinutes(1),
                Duration.ofSeconds(30),
                Duration.ofMinutes(1),
                Duration.ofMinutes(30)
            );
        }
    }

    private final Ticker ticker;
    private final StuckTaskRecovery stuckTaskRecovery;
    private final AgentLivenessMonitor livenessMonitor;
    private final QueueDepthMonitor depthMonitor;
    private final ProgressReporter progressReporter;
    private final Schedule schedule;

    private final List<Ticker.ScheduledJob> jobs = new ArrayList<>();
    private volatile boolean running = false;

    public RecoveryEngine(
            Ticker ticker,
            StuckTaskRecovery stuckTaskRecovery,
            AgentLivenessMonitor livenessMonitor,
            QueueDepthMonitor depthMonitor,
            ProgressReporter progressReporter,
            Schedule schedule) {
        this.ticker = ticker;
        this.stuckTaskRecovery = stuckTaskRecovery;
        this.livenessMonitor = livenessMonitor;
        this.depthMonitor = depthMonitor;
        this.progressReporter = progressReporter;
        this.schedule = schedule;
    }

    /**
     * Register every loop with the ticker. The ticker itself is started by its owner.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Recovery engine already running");
            return;
        }
        running = true;
        log.info("Starting recovery engine");

        jobs.add(ticker.every("stuck-task-recovery", schedule.recoveryInterval(), stuckTaskRecovery::sweep));
        jobs.add(ticker.every("agent-liveness", schedule.livenessInterval(), livenessMonitor::poll));
        jobs.add(ticker.every("queue-depth", schedule.depthCheckInterval(), depthMonitor::check));
        jobs.add(ticker.every("progress-report", schedule.progressInterval(), progressReporter::report));

        log.info("Recovery engine started (recovery every {}, stuck after {})",
            schedule.recoveryInterval(), stuckTaskRecovery.stuckMaxAge());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        jobs.forEach(Ticker.ScheduledJob::cancel);
        jobs.clear();
        log.info("Recovery engine stopped");
    }

    public boolean isRunning() {
        return running;
    }
}
