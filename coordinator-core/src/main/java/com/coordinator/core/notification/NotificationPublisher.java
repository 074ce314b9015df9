package com.coordinator.core.notification;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Producer side of the operator notification path.
 * Publishing never waits for delivery.
 */
public interface NotificationPublisher {

    /**
     * Append a notification to the pending list.
     *
     * @return The published notification with its assigned id
     */
    Notification publish(NotificationType type, JsonNode payload);
}
