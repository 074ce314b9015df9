package com.coordinator.gate;

import com.coordinator.core.exception.InvalidTransitionException;
import com.coordinator.core.exception.NotFoundException;
import com.coordinator.core.exception.ValidationGateException;
import com.coordinator.core.model.GateCheckFailure;
import com.coordinator.core.model.TaskRecord;
import com.coordinator.core.model.TaskStatus;
import com.coordinator.core.repository.TaskRecordRepository;
import com.coordinator.engine.logging.LoggingContext;
import com.coordinator.engine.metrics.PipelineMetrics;
import com.coordinator.engine.service.TaskStateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Enforces the task state machine where work is committed.
 *
 * Rules, in order:
 * <ol>
 *   <li>The task artifact may only change in system-generated commits (message carries the sentinel).</li>
 *   <li>A message without a task id is allowed.</li>
 *   <li>The referenced task must exist and be in an active status.</li>
 *   <li>A message claiming completion must pass the completion gate.</li>
 * </ol>
 * An internal error allows or blocks the commit depending on {@link GateSettings#failOpen()}.
 * The gate never changes task state.
 */
public class CommitGate {

    private static final Logger log = LoggerFactory.getLogger(CommitGate.class);

    public static final String HOOK_FAILURE_CODE = "HOOK_FAILURE";
    public static final String PROTECTED_ARTIFACT_CODE = "PROTECTED_ARTIFACT";

    private final TaskRecordRepository tasks;
    private final TaskStateService taskStateService;
    private final TaskIdExtractor extractor;
    private final GateSettings settings;
    private final PipelineMetrics metrics;

    public CommitGate(
            TaskRecordRepository tasks,
            TaskStateService taskStateService,
            TaskIdExtractor extractor,
            GateSettings settings,
            PipelineMetrics metrics) {
        this.tasks = tasks;
        this.taskStateService = taskStateService;
        this.extractor = extractor;
        this.settings = settings;
        this.metrics = metrics;
    }

    public GateDecision evaluate(CommitProposal proposal) {
        GateDecision decision;
        try {
            decision = decide(proposal);
        } catch (Exception e) {
            log.error("Commit gate failed internally, commit {} (fail-open={})",
                settings.failOpen() ? "allowed" : "blocked", settings.failOpen(), e);
            String message = "Commit gate error: " + e.getMessage();
            decision = settings.failOpen()
                ? new GateDecision(true, GateDecision.Code.HOOK_FAILURE, HOOK_FAILURE_CODE, message, null)
                : GateDecision.reject(GateDecision.Code.HOOK_FAILURE, HOOK_FAILURE_CODE, message, null);
        }
        metrics.gateDecision(decision.code().wireName());
        if (decision.allowed()) {
            log.debug("Commit allowed ({}): {}", decision.code().wireName(), decision.message());
        } else {
            log.info("Commit rejected ({}): {}", decision.code().wireName(), decision.message());
        }
        return decision;
    }

    private GateDecision decide(CommitProposal proposal) {
        if (touchesArtifact(proposal)) {
            if (proposal.message().contains(settings.sentinel())) {
                return GateDecision.allow(GateDecision.Code.SYSTEM_UPDATE, "System status update", null);
            }
            return GateDecision.reject(GateDecision.Code.PROTECTED_ARTIFACT, PROTECTED_ARTIFACT_CODE,
                settings.artifactPath() + " is maintained by the coordinator and cannot be edited by hand", null);
        }

        Optional<TaskIdExtractor.Match> match = extractor.extract(proposal.message());
        if (match.isEmpty()) {
            return GateDecision.allow(GateDecision.Code.NO_TASK, "No task referenced", null);
        }
        String taskId = match.get().taskId();

        try (var ctx = LoggingContext.forTask(taskId)) {
            Optional<TaskRecord> record = tasks.findById(taskId);
            if (record.isEmpty()) {
                if (!match.get().tagged()) {
                    // An untagged token that only looks like an id
                    return GateDecision.allow(GateDecision.Code.NO_TASK, "No known task referenced", null);
                }
                return GateDecision.reject(GateDecision.Code.NOT_FOUND, NotFoundException.ERROR_CODE,
                    new NotFoundException("Task", taskId).getMessage(), taskId);
            }

            TaskStatus status = record.get().status();
            if (!settings.activeStatuses().contains(status)) {
                List<TaskStatus> required = settings.activeStatuses().stream()
                    .sorted(Comparator.naturalOrder())
                    .collect(Collectors.toList());
                return GateDecision.reject(GateDecision.Code.INVALID_STATE, InvalidTransitionException.ERROR_CODE,
                    new InvalidTransitionException(taskId, status, required).getMessage(), taskId);
            }

            if (settings.completionPattern().matcher(proposal.message()).find()) {
                List<GateCheckFailure> failures = taskStateService.verifyCompletion(taskId, proposal.commitHash());
                if (!failures.isEmpty()) {
                    return GateDecision.reject(GateDecision.Code.VALIDATION_FAILED, ValidationGateException.ERROR_CODE,
                        new ValidationGateException(taskId, failures).getMessage(), taskId);
                }
                return GateDecision.allow(GateDecision.Code.ALLOWED, "Completion verified for " + taskId, taskId);
            }

            return GateDecision.allow(GateDecision.Code.ALLOWED, "Task " + taskId + " is " + status.wireName(), taskId);
        }
    }

    private boolean touchesArtifact(CommitProposal proposal) {
        String artifact = settings.artifactPath();
        return proposal.files().stream()
            .map(f -> f.replace('\\', '/'))
            .anyMatch(f -> f.equals(artifact) || f.endsWith("/" + artifact));
    }
}
