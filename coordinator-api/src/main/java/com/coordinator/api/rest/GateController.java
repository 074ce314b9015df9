package com.coordinator.api.rest;

import com.coordinator.gate.CommitGate;
import com.coordinator.gate.CommitProposal;
import com.coordinator.gate.GateDecision;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Endpoint called by the repository's commit hook.
 * Always answers 200; the hook reads {@code allowed} and prints {@code message} on rejection.
 */
@RestController
@RequestMapping("/api/v1/gate")
public class GateController {

    private final CommitGate commitGate;

    public GateController(CommitGate commitGate) {
        this.commitGate = commitGate;
    }

    @PostMapping("/evaluate")
    public ResponseEntity<DecisionResponse> evaluate(@RequestBody EvaluateRequest request) {
        GateDecision decision = commitGate.evaluate(
            new CommitProposal(request.message(), request.files(), request.commitHash()));
        return ResponseEntity.ok(DecisionResponse.from(decision));
    }

    // ========== DTOs ==========

    public record EvaluateRequest(String message, List<String> files, String commitHash) {}

    public record DecisionResponse(boolean allowed, String code, String errorCode, String message, String taskId) {
        public static DecisionResponse from(GateDecision decision) {
            return new DecisionResponse(
                decision.allowed(),
                decision.code().wireName(),
                decision.errorCode(),
                decision.message(),
                decision.taskId());
        }
    }
}
