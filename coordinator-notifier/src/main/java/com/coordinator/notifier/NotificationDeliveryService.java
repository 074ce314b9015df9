package com.coordinator.notifier;

import com.coordinator.core.exception.NotificationFormatException;
import com.coordinator.core.notification.Notification;
import com.coordinator.core.notification.NotificationCodec;
import com.coordinator.core.store.CoordinationStore;
import com.coordinator.engine.logging.LoggingContext;
import com.coordinator.engine.metrics.PipelineMetrics;
import com.coordinator.scheduler.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Moves notifications from the pending list to the operator console.
 *
 * Each pass reads the whole list, delivers entries whose id has not been delivered yet, and then
 * removes the entries it went through. Entries published during a pass are left for the next one.
 * If the console fails, the pass stops and the failed entry and everything after it stay pending.
 */
public class NotificationDeliveryService {

    private static final Logger log = LoggerFactory.getLogger(NotificationDeliveryService.class);

    private final CoordinationStore store;
    private final String pendingKey;
    private final NotificationCodec codec;
    private final NotificationFormatter formatter;
    private final OperatorConsole console;
    private final PipelineMetrics metrics;
    private final DeliveredSet delivered;
    private final Clock clock;

    private final List<Ticker.ScheduledJob> jobs = new ArrayList<>();

    public NotificationDeliveryService(
            CoordinationStore store,
            String pendingKey,
            NotificationCodec codec,
            NotificationFormatter formatter,
            OperatorConsole console,
            PipelineMetrics metrics,
            int dedupCapacity,
            Clock clock) {
        this.store = store;
        this.pendingKey = pendingKey;
        this.codec = codec;
        this.formatter = formatter;
        this.console = console;
        this.metrics = metrics;
        this.delivered = new DeliveredSet(dedupCapacity);
        this.clock = clock;
    }

    /**
     * Deliver everything currently pending.
     *
     * @return Number of notifications written to the console
     */
    public synchronized int deliverPending() {
        List<String> entries = store.range(pendingKey);
        if (entries.isEmpty()) {
            return 0;
        }

        List<String> processed = new ArrayList<>();
        int written = 0;
        for (String raw : entries) {
            Notification notification = codec.decode(raw);
            try (var ctx = LoggingContext.forNotification(notification.id())) {
                if (delivered.contains(notification.id())) {
                    log.debug("Skipping already delivered notification {}", notification.id());
                    metrics.notificationDeduplicated();
                } else {
                    try {
                        write(render(notification));
                    } catch (OperatorConsoleException e) {
                        log.error("Operator console unavailable, {} notification(s) left pending",
                            entries.size() - processed.size(), e);
                        break;
                    }
                    delivered.add(notification.id());
                    metrics.notificationDelivered(notification.type().wireName());
                    written++;
                }
                processed.add(raw);
            }
        }

        for (String raw : processed) {
            store.remove(pendingKey, raw, 1);
        }
        if (written > 0) {
            log.info("Delivered {} notification(s)", written);
        }
        return written;
    }

    /**
     * Tell the operator the coordinator is alive, even when nothing else happens.
     */
    public void keepAlive() {
        long pending = store.length(pendingKey);
        try {
            write(String.format("[KEEPALIVE] coordinator running at %s, %d notification(s) pending",
                clock.instant(), pending));
        } catch (OperatorConsoleException e) {
            log.warn("Keep-alive not delivered: {}", e.getMessage());
        }
    }

    public synchronized void start(Ticker ticker, Duration pollInterval, Duration keepAliveInterval) {
        if (!jobs.isEmpty()) {
            log.warn("Notification delivery already running");
            return;
        }
        jobs.add(ticker.every("notification-delivery", pollInterval, this::deliverPending));
        jobs.add(ticker.every("notification-keepalive", keepAliveInterval, this::keepAlive));
        log.info("Notification delivery started (poll every {}, keep-alive every {})", pollInterval, keepAliveInterval);
    }

    public synchronized void stop() {
        jobs.forEach(Ticker.ScheduledJob::cancel);
        jobs.clear();
        log.info("Notification delivery stopped");
    }

    public int deliveredCount() {
        return delivered.size();
    }

    private String render(Notification notification) {
        try {
            return formatter.format(notification);
        } catch (NotificationFormatException e) {
            log.warn("{}; using generic format", e.getMessage());
            metrics.notificationFallback(notification.rawType());
            return formatter.formatGeneric(notification);
        }
    }

    private void write(String line) {
        console.writeLine(line);
        console.submit();
    }
}
