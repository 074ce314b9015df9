package com.coordinator.core.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.UUID;

/**
 * A message destined for the human operator.
 *
 * @param rawType the type string exactly as produced, kept so generic delivery can show it
 */
public record Notification(
    String id,
    NotificationType type,
    JsonNode payload,
    Instant timestamp,
    String rawType
) {
    public Notification {
        if (payload == null) {
            payload = JsonNodeFactory.instance.objectNode();
        }
        if (rawType == null) {
            rawType = type.wireName();
        }
    }

    /**
     * Create a notification with the conventional {@code notif-<millis>} id prefix.
     * The random suffix keeps ids from separate publishing processes apart.
     */
    public static Notification create(NotificationType type, JsonNode payload, Instant now) {
        return new Notification(
            "notif-" + now.toEpochMilli() + "-" + UUID.randomUUID(),
            type,
            payload,
            now,
            type.wireName()
        );
    }

    public String payloadText(String field) {
        JsonNode node = payload.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
