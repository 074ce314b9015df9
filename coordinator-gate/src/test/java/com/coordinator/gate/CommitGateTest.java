package com.coordinator.gate;

import com.coordinator.core.exception.InvalidTransitionException;
import com.coordinator.core.exception.NotFoundException;
import com.coordinator.core.exception.TransientStoreException;
import com.coordinator.core.exception.ValidationGateException;
import com.coordinator.core.model.CiReport;
import com.coordinator.core.model.TaskRecord;
import com.coordinator.core.model.TaskStatus;
import com.coordinator.engine.metrics.PipelineMetrics;
import com.coordinator.engine.persistence.StoreTaskRecordRepository;
import com.coordinator.engine.test.PipelineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class CommitGateTest {

    private static final String SHA = "abc123";

    private final PipelineFixture fx = new PipelineFixture();
    private final CommitGate gate = gate(GateSettings.defaults());

    private CommitGate gate(GateSettings settings) {
        return new CommitGate(fx.taskRepository, fx.tasks, new TaskIdExtractor(), settings, fx.metrics);
    }

    private void inProgress(String taskId) {
        fx.tasks.create(taskId, "Task " + taskId, 50, Set.of());
        fx.tasks.assign(taskId, "dev-1");
        fx.tasks.start(taskId);
    }

    private void ciReports(String testConclusion) {
        fx.ci.report(SHA, CiReport.verified(
            Map.of("build", "success", "test", testConclusion),
            fx.time.now().minusSeconds(3600),
            true));
    }

    private static CommitProposal commit(String message, String... files) {
        return new CommitProposal(message, List.of(files), SHA);
    }

    @Nested
    class ScenarioB {

        @Test
        @DisplayName("Completion claim on a task in validation is an invalid transition")
        void rejectedWhenNotInProgress() {
            inProgress("TASK-7");
            fx.tasks.submitForValidation("TASK-7");
            ciReports("success");

            GateDecision decision = gate.evaluate(commit("fix(TASK-7): complete", "src/App.java"));

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.code()).isEqualTo(GateDecision.Code.INVALID_STATE);
            assertThat(decision.errorCode()).isEqualTo(InvalidTransitionException.ERROR_CODE);
            assertThat(decision.message()).contains("validation").contains("required: in_progress");
        }

        @Test
        @DisplayName("The same message is accepted for a task in progress with green CI")
        void acceptedWithPassingChecks() {
            inProgress("TASK-7");
            ciReports("success");

            GateDecision decision = gate.evaluate(commit("fix(TASK-7): complete", "src/App.java"));

            assertThat(decision.allowed()).isTrue();
            assertThat(decision.code()).isEqualTo(GateDecision.Code.ALLOWED);
            assertThat(decision.taskId()).isEqualTo("TASK-7");
        }

        @Test
        @DisplayName("One failing required check blocks completion and is named")
        void rejectedWithFailingCheck() {
            inProgress("TASK-7");
            ciReports("failure");

            GateDecision decision = gate.evaluate(commit("fix(TASK-7): complete", "src/App.java"));

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.code()).isEqualTo(GateDecision.Code.VALIDATION_FAILED);
            assertThat(decision.errorCode()).isEqualTo(ValidationGateException.ERROR_CODE);
            assertThat(decision.message()).contains("test=failure").doesNotContain("build=");
        }
    }

    @Nested
    class Artifact {

        @Test
        void handEditRejected() {
            GateDecision decision = gate.evaluate(commit("tweak statuses", "prp_status.json"));

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.code()).isEqualTo(GateDecision.Code.PROTECTED_ARTIFACT);
        }

        @Test
        void nestedPathRecognised() {
            GateDecision decision = gate.evaluate(commit("tweak", "config/prp_status.json"));

            assertThat(decision.code()).isEqualTo(GateDecision.Code.PROTECTED_ARTIFACT);
        }

        @Test
        @DisplayName("System status commits may touch the artifact whatever task they mention")
        void sentinelAllowed() {
            GateDecision decision = gate.evaluate(
                commit("[prp-system] PRP-9 -> complete", "prp_status.json"));

            assertThat(decision.allowed()).isTrue();
            assertThat(decision.code()).isEqualTo(GateDecision.Code.SYSTEM_UPDATE);
        }
    }

    @Nested
    class Correlation {

        @Test
        void noTaskIdAllowed() {
            GateDecision decision = gate.evaluate(commit("chore: bump dependencies", "pom.xml"));

            assertThat(decision.allowed()).isTrue();
            assertThat(decision.code()).isEqualTo(GateDecision.Code.NO_TASK);
            assertThat(fx.ci.inspections()).isZero();
        }

        @Test
        void taggedUnknownTaskRejected() {
            GateDecision decision = gate.evaluate(commit("feat(PRP-404): add endpoint", "src/Api.java"));

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.code()).isEqualTo(GateDecision.Code.NOT_FOUND);
            assertThat(decision.errorCode()).isEqualTo(NotFoundException.ERROR_CODE);
        }

        @Test
        @DisplayName("An untagged token that is not a known task does not block the commit")
        void bareUnknownTokenAllowed() {
            GateDecision decision = gate.evaluate(commit("Handle UTF-8 names", "src/Names.java"));

            assertThat(decision.allowed()).isTrue();
            assertThat(decision.code()).isEqualTo(GateDecision.Code.NO_TASK);
        }

        @Test
        @DisplayName("Work commits on an active task do not consult CI")
        void progressCommitAllowedWithoutCi() {
            inProgress("PRP-3");

            GateDecision decision = gate.evaluate(commit("PRP-3: wire the repository", "src/Repo.java"));

            assertThat(decision.allowed()).isTrue();
            assertThat(fx.ci.inspections()).isZero();
        }

        @Test
        void inactiveTaskRejected() {
            fx.tasks.create("PRP-3", "New", 50, Set.of());

            GateDecision decision = gate.evaluate(commit("[PRP-3] start work", "src/A.java"));

            assertThat(decision.code()).isEqualTo(GateDecision.Code.INVALID_STATE);
            assertThat(decision.message()).contains("new");
        }

        @Test
        void configuredActiveStatusesRespected() {
            inProgress("PRP-3");
            fx.tasks.submitForValidation("PRP-3");
            CommitGate lenient = gate(new GateSettings(true, "prp_status.json", "[prp-system]",
                Set.of(TaskStatus.IN_PROGRESS, TaskStatus.VALIDATION), GateSettings.defaults().completionPattern()));

            assertThat(lenient.evaluate(commit("fix(PRP-3): review feedback", "src/A.java")).allowed()).isTrue();
        }

        @Test
        @DisplayName("Evaluating a commit never changes the task")
        void gateIsReadOnly() {
            inProgress("TASK-7");
            ciReports("success");
            TaskRecord before = fx.tasks.get("TASK-7");

            gate.evaluate(commit("fix(TASK-7): complete", "src/App.java"));

            assertThat(fx.tasks.get("TASK-7")).isEqualTo(before);
        }
    }

    @Nested
    class InternalFailure {

        private final StoreTaskRecordRepository broken = new StoreTaskRecordRepository(fx.store, fx.keys) {
            @Override
            public Optional<TaskRecord> findById(String id) {
                throw new TransientStoreException("store down");
            }
        };

        @Test
        @DisplayName("Fails open by default")
        void failOpen() {
            CommitGate failing = new CommitGate(broken, fx.tasks, new TaskIdExtractor(), GateSettings.defaults(), fx.metrics);

            GateDecision decision = failing.evaluate(commit("fix(TASK-7): complete", "src/App.java"));

            assertThat(decision.allowed()).isTrue();
            assertThat(decision.code()).isEqualTo(GateDecision.Code.HOOK_FAILURE);
            assertThat(decision.errorCode()).isEqualTo(CommitGate.HOOK_FAILURE_CODE);
        }

        @Test
        void failClosedWhenConfigured() {
            CommitGate failing = new CommitGate(broken, fx.tasks, new TaskIdExtractor(),
                GateSettings.defaults().withFailOpen(false), fx.metrics);

            GateDecision decision = failing.evaluate(commit("fix(TASK-7): complete", "src/App.java"));

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.code()).isEqualTo(GateDecision.Code.HOOK_FAILURE);
        }
    }

    @Test
    void decisionsAreCounted() {
        gate.evaluate(commit("chore: tidy"));
        gate.evaluate(commit("tweak", "prp_status.json"));

        assertThat(fx.metrics.registry().counter(PipelineMetrics.GATE_DECISIONS, "code", "no_task").count()).isEqualTo(1.0);
        assertThat(fx.metrics.registry().counter(PipelineMetrics.GATE_DECISIONS, "code", "protected_artifact").count())
            .isEqualTo(1.0);
    }
}
