package com.coordinator.api.rest;

import com.coordinator.core.notification.Notification;
import com.coordinator.core.notification.NotificationPublisher;
import com.coordinator.core.notification.NotificationType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Lets external producers (deploy scripts, the Q&A agent, operators) publish to the operator.
 * Publishing only appends to the pending list; delivery happens in the background.
 */
@RestController
@RequestMapping("/api/v1/notifications")
public class NotificationController {

    private final NotificationPublisher publisher;
    private final ObjectMapper objectMapper;

    public NotificationController(NotificationPublisher publisher, ObjectMapper objectMapper) {
        this.publisher = publisher;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/deployment-failed")
    public ResponseEntity<Map<String, Object>> deploymentFailed(@RequestBody DeploymentFailedRequest request) {
        ObjectNode payload = objectMapper.createObjectNode()
            .put("prp_id", required(request.prpId(), "prpId"))
            .put("error", request.error());
        return published(publisher.publish(NotificationType.DEPLOYMENT_FAILED, payload));
    }

    @PostMapping("/qa-handled")
    public ResponseEntity<Map<String, Object>> qaHandled(@RequestBody QaHandledRequest request) {
        ObjectNode payload = objectMapper.createObjectNode()
            .put("agent", request.agent())
            .put("question", required(request.question(), "question"))
            .put("answer", request.answer());
        return published(publisher.publish(NotificationType.QA_HANDLED, payload));
    }

    @PostMapping("/system")
    public ResponseEntity<Map<String, Object>> system(@RequestBody SystemRequest request) {
        ObjectNode payload = objectMapper.createObjectNode()
            .put("message", required(request.message(), "message"));
        return published(publisher.publish(NotificationType.SYSTEM, payload));
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    private static ResponseEntity<Map<String, Object>> published(Notification notification) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(Map.of("id", notification.id(), "type", notification.type().wireName()));
    }

    // ========== DTOs ==========

    public record DeploymentFailedRequest(String prpId, String error) {}

    public record QaHandledRequest(String agent, String question, String answer) {}

    public record SystemRequest(String message) {}
}
