package com.coordinator.core.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HexFormat;

/**
 * JSON form of a notification on the pending list:
 * {@code {"id": "...", "type": "...", "timestamp": "...", "data": {...}}}.
 *
 * Decoding is lenient: an entry that is not valid JSON, or has no id, still decodes
 * into a {@link NotificationType#GENERIC} notification carrying the raw text.
 */
public class NotificationCodec {

    private final ObjectMapper objectMapper;

    public NotificationCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(Notification notification) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", notification.id());
        node.put("type", notification.rawType());
        node.put("timestamp", notification.timestamp().toString());
        node.set("data", notification.payload());
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode notification " + notification.id(), e);
        }
    }

    public Notification decode(String raw) {
        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return rawGeneric(raw);
        }
        if (node == null || !node.isObject() || !node.hasNonNull("id")) {
            return rawGeneric(raw);
        }
        String rawType = node.hasNonNull("type") ? node.get("type").asText() : NotificationType.GENERIC.wireName();
        JsonNode data = node.has("data") ? node.get("data") : objectMapper.createObjectNode();
        return new Notification(
            node.get("id").asText(),
            NotificationType.fromWireName(rawType),
            data,
            parseTimestamp(node.get("timestamp")),
            rawType
        );
    }

    private Notification rawGeneric(String raw) {
        // Content-derived id so a redelivered garbage entry is still deduplicated
        return new Notification(
            "raw-" + sha256Hex(raw),
            NotificationType.GENERIC,
            TextNode.valueOf(raw),
            null,
            "unparseable"
        );
    }

    private static String sha256Hex(String raw) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(raw.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static Instant parseTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
