package com.coordinator.engine.notification;

import com.coordinator.core.notification.Notification;
import com.coordinator.core.notification.NotificationCodec;
import com.coordinator.core.notification.NotificationPublisher;
import com.coordinator.core.notification.NotificationType;
import com.coordinator.core.store.CoordinationStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Publishes notifications by appending them to the pending list in the coordination store,
 * where the delivery service picks them up.
 */
public class StoreNotificationPublisher implements NotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(StoreNotificationPublisher.class);

    private final CoordinationStore store;
    private final String pendingKey;
    private final NotificationCodec codec;
    private final Clock clock;

    public StoreNotificationPublisher(CoordinationStore store, String pendingKey, NotificationCodec codec, Clock clock) {
        this.store = store;
        this.pendingKey = pendingKey;
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public Notification publish(NotificationType type, JsonNode payload) {
        Notification notification = Notification.create(type, payload, clock.instant());
        store.pushTail(pendingKey, codec.encode(notification));
        log.debug("Published {} notification {}", type.wireName(), notification.id());
        return notification;
    }
}
