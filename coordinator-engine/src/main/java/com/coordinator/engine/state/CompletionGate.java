package com.coordinator.engine.state;

import com.coordinator.core.ci.CiCollaborator;
import com.coordinator.core.exception.ValidationGateException;
import com.coordinator.core.model.CiReport;
import com.coordinator.core.model.GateCheck;
import com.coordinator.core.model.GateCheckFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Evidence checks a task's commit must pass before the task may be marked complete.
 * Anything the CI collaborator cannot establish counts as failed.
 */
public class CompletionGate {

    private static final Logger log = LoggerFactory.getLogger(CompletionGate.class);

    private final CiCollaborator ciCollaborator;
    private final CompletionSettings settings;
    private final Clock clock;

    public CompletionGate(CiCollaborator ciCollaborator, CompletionSettings settings, Clock clock) {
        this.ciCollaborator = ciCollaborator;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Evaluate every check.
     * 
     * @param taskId The task being completed, for logging
     * @param commitHash The commit claimed to implement it
     * @return Failed checks, empty if the commit may complete the task
     */
    public List<GateCheckFailure> evaluate(String taskId, String commitHash) {
        List<GateCheckFailure> failures = new ArrayList<>();
        if (commitHash == null || commitHash.isBlank()) {
            failures.add(new GateCheckFailure(GateCheck.COMMIT_HASH, "no commit hash supplied"));
            return failures;
        }

        CiReport report = inspect(commitHash);
        if (!report.verifiable()) {
            String detail = "cannot verify: " + report.reason();
            failures.add(new GateCheckFailure(GateCheck.CI_CHECKS, detail));
            failures.add(new GateCheckFailure(GateCheck.MAINLINE, detail));
            failures.add(new GateCheckFailure(GateCheck.FRESHNESS, detail));
            log.warn("Completion of {} blocked, CI state of {} unverifiable: {}", taskId, commitHash, report.reason());
            return failures;
        }

        List<String> unsuccessful = settings.requiredChecks().stream()
            .filter(check -> !report.checkSucceeded(check))
            .sorted()
            .map(check -> check + "=" + report.checkConclusions().getOrDefault(check, "missing"))
            .collect(Collectors.toList());
        if (!unsuccessful.isEmpty()) {
            failures.add(new GateCheckFailure(GateCheck.CI_CHECKS, String.join(", ", unsuccessful)));
        }

        if (!report.onMainline()) {
            failures.add(new GateCheckFailure(GateCheck.MAINLINE,
                String.format("commit %s is not on %s", commitHash, settings.mainlineBranch())));
        }

        if (report.commitTimestamp() == null) {
            failures.add(new GateCheckFailure(GateCheck.FRESHNESS, "commit time unknown"));
        } else {
            Duration age = Duration.between(report.commitTimestamp(), clock.instant());
            if (age.compareTo(settings.freshness()) > 0) {
                failures.add(new GateCheckFailure(GateCheck.FRESHNESS,
                    String.format("commit is %dh old, limit %dh", age.toHours(), settings.freshness().toHours())));
            }
        }

        if (!failures.isEmpty()) {
            log.info("Completion gate for {} failed {} check(s)", taskId, failures.size());
        }
        return failures;
    }

    /**
     * @throws ValidationGateException listing every failed check
     */
    public void requirePassed(String taskId, String commitHash) {
        List<GateCheckFailure> failures = evaluate(taskId, commitHash);
        if (!failures.isEmpty()) {
            throw new ValidationGateException(taskId, failures);
        }
    }

    private CiReport inspect(String commitHash) {
        try {
            return ciCollaborator.inspect(commitHash, settings.requiredChecks(), settings.mainlineBranch());
        } catch (RuntimeException e) {
            log.warn("CI collaborator failed for {}: {}", commitHash, e.getMessage());
            return CiReport.unverifiable(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
