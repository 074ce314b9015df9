package com.coordinator.api.lifecycle;

import com.coordinator.engine.config.CoordinatorProperties;
import com.coordinator.notifier.NotificationDeliveryService;
import com.coordinator.recovery.RecoveryEngine;
import com.coordinator.scheduler.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts the background loops once the application is ready and stops them on shutdown.
 *
 * On shutdown:
 * 1. Stops handing out new claims
 * 2. Cancels the recovery and delivery jobs
 * 3. Stops the ticker, letting running jobs finish
 *
 * Tasks claimed but not completed stay inflight and are recovered by the next instance.
 */
@Component
public class CoordinatorLifecycle {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorLifecycle.class);

    private final Ticker ticker;
    private final RecoveryEngine recoveryEngine;
    private final NotificationDeliveryService deliveryService;
    private final CoordinatorProperties properties;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public CoordinatorLifecycle(
            Ticker ticker,
            RecoveryEngine recoveryEngine,
            NotificationDeliveryService deliveryService,
            CoordinatorProperties properties) {
        this.ticker = ticker;
        this.recoveryEngine = recoveryEngine;
        this.deliveryService = deliveryService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        recoveryEngine.start();
        deliveryService.start(ticker,
            properties.getNotification().getPollInterval(),
            properties.getNotification().getKeepAliveInterval());
        ticker.start();
        log.info("Coordinator loops started (store: {})", properties.getStore().getType());
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Initiating graceful shutdown");
        deliveryService.stop();
        recoveryEngine.stop();
        ticker.stop();
        log.info("Graceful shutdown complete, {} notification(s) delivered", deliveryService.deliveredCount());
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Workers should check this before claiming.
     */
    public boolean canAcceptClaims() {
        return !shuttingDown.get();
    }
}
