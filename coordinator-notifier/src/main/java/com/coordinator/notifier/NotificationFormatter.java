package com.coordinator.notifier;

import com.coordinator.core.exception.NotificationFormatException;
import com.coordinator.core.notification.Notification;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Renders notifications as a single console line.
 *
 * Every {@link com.coordinator.core.notification.NotificationType} has a format. A payload that
 * does not fit its type's format raises {@link NotificationFormatException}; callers then use
 * {@link #formatGeneric(Notification)}, which accepts anything.
 */
public class NotificationFormatter {

    static final int GENERIC_PAYLOAD_LIMIT = 500;

    public String format(Notification n) {
        return switch (n.type()) {
            case SYSTEM -> "[SYSTEM] " + require(n, "message");
            case NEW_TASK -> formatNewTask(n);
            case AGENT_DOWN -> formatAgentDown(n);
            case BULK_ENQUEUE -> formatBulkEnqueue(n);
            case DEPLOYMENT_FAILED -> String.format("[DEPLOYMENT FAILED] %s: %s",
                require(n, "prp_id"), optional(n, "error", "no error given"));
            case SCALING_NEEDED -> String.format("[SCALING] %s queue depth %s exceeds %s, consider adding agents",
                require(n, "queue"), require(n, "depth"), optional(n, "threshold", "?"));
            case PROGRESS_REPORT -> formatProgress(n);
            case QA_HANDLED -> String.format("[Q&A] %s asked: %s | Answer: %s",
                optional(n, "agent", "unknown agent"), require(n, "question"), optional(n, "answer", "(none)"));
            case GENERIC -> formatGeneric(n);
        };
    }

    /**
     * Shows the type and the raw payload, for unknown types and unformattable payloads.
     */
    public String formatGeneric(Notification n) {
        String payload = n.payload().isTextual() ? n.payload().asText() : n.payload().toString();
        if (payload.length() > GENERIC_PAYLOAD_LIMIT) {
            payload = payload.substring(0, GENERIC_PAYLOAD_LIMIT) + "...";
        }
        return singleLine(String.format("[%s] %s", n.rawType().toUpperCase(), payload));
    }

    private String formatNewTask(Notification n) {
        String id = require(n, "prp_id");
        String title = optional(n, "title", "untitled");
        String priority = optional(n, "priority", null);
        return priority == null
            ? String.format("[NEW PRP] %s: %s", id, title)
            : String.format("[NEW PRP] %s: %s (priority %s)", id, title, priority);
    }

    private String formatAgentDown(Notification n) {
        String agent = require(n, "agent_id");
        String task = optional(n, "current_prp", "no task");
        return String.format("[AGENT DOWN] %s silent for %ss (last activity %s, working on %s)",
            agent, optional(n, "seconds_since", "?"), optional(n, "last_activity", "never"), task);
    }

    private String formatBulkEnqueue(Notification n) {
        JsonNode ids = n.payload().get("prp_ids");
        if (ids == null || !ids.isArray()) {
            throw new NotificationFormatException(n.id(), "prp_ids must be a list");
        }
        List<String> names = new ArrayList<>();
        ids.forEach(id -> names.add(id.asText()));
        return String.format("[BULK] %d PRP(s) queued for %s: %s",
            names.size(), optional(n, "stage", "dev"), String.join(", ", names));
    }

    private String formatProgress(Notification n) {
        JsonNode queues = n.payload().get("queues");
        if (queues == null || !queues.isObject()) {
            throw new NotificationFormatException(n.id(), "queues must be an object");
        }
        List<String> depths = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = queues.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> queue = fields.next();
            depths.add(String.format("%s %d pending/%d inflight",
                queue.getKey(),
                queue.getValue().path("pending").asLong(),
                queue.getValue().path("inflight").asLong()));
        }
        return String.format("[PROGRESS] %s | %s active PRP(s)",
            String.join(", ", depths), optional(n, "total_active", "0"));
    }

    private static String require(Notification n, String field) {
        String value = n.payload().isObject() ? n.payloadText(field) : null;
        if (value == null) {
            throw new NotificationFormatException(n.id(), "missing field '" + field + "'");
        }
        return singleLine(value);
    }

    private static String optional(Notification n, String field, String fallback) {
        String value = n.payload().isObject() ? n.payloadText(field) : null;
        return value == null ? fallback : singleLine(value);
    }

    private static String singleLine(String text) {
        return text.replace("\r", " ").replace("\n", " ");
    }
}
