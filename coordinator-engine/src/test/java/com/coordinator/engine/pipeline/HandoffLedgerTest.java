package com.coordinator.engine.pipeline;

import com.coordinator.core.model.CompletionResult;
import com.coordinator.core.model.Stage;
import com.coordinator.core.model.StageTransition;
import com.coordinator.engine.test.PipelineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Handoffs interrupted between leaving one stage and entering the next.
 * Each test reproduces the store state a crash would leave behind.
 */
class HandoffLedgerTest {

    private static final Duration GRACE = Duration.ofMinutes(1);

    private PipelineFixture fx;

    @BeforeEach
    void setUp() {
        fx = new PipelineFixture();
    }

    private void ledger(String taskId, Stage stage) {
        fx.store.hset(fx.keys.handoffs(), taskId, stage.wireName() + "|" + fx.time.millis());
    }

    @Test
    @DisplayName("Crash after leaving inflight: resumption pushes the task to the next stage")
    void crashBetweenRemoveAndPush() {
        fx.pipeline.enqueue("T1", Stage.DEVELOPMENT);
        fx.pipeline.claim(Stage.DEVELOPMENT, Duration.ZERO);
        ledger("T1", Stage.DEVELOPMENT);
        fx.store.remove(fx.keys.inflight(Stage.DEVELOPMENT), "T1", 0);

        assertThat(fx.pipeline.resumeHandoffs(GRACE)).isEmpty();
        fx.time.advance(GRACE);

        assertThat(fx.pipeline.resumeHandoffs(GRACE)).containsExactly("T1");
        assertThat(fx.pending(Stage.VALIDATION)).containsExactly("T1");
        assertThat(fx.store.hgetAll(fx.keys.handoffs())).isEmpty();
        assertThat(fx.transitionLog.findByTaskId("T1")).extracting(StageTransition::reason)
            .endsWith(StageTransition.REASON_HANDOFF_RESUMED);
    }

    @Test
    @DisplayName("Crash before leaving inflight: resumption removes the inflight entry too")
    void crashBeforeRemove() {
        fx.pipeline.enqueue("T1", Stage.VALIDATION);
        fx.pipeline.claim(Stage.VALIDATION, Duration.ZERO);
        ledger("T1", Stage.VALIDATION);
        fx.time.advanceMinutes(2);

        fx.pipeline.resumeHandoffs(GRACE);

        assertThat(fx.inflight(Stage.VALIDATION)).isEmpty();
        assertThat(fx.pending(Stage.INTEGRATION)).containsExactly("T1");
    }

    @Test
    @DisplayName("Crash after the push: resumption does not enqueue the task twice")
    void crashAfterPush() {
        fx.pipeline.enqueue("T1", Stage.DEVELOPMENT);
        fx.pipeline.claim(Stage.DEVELOPMENT, Duration.ZERO);
        ledger("T1", Stage.DEVELOPMENT);
        fx.store.remove(fx.keys.inflight(Stage.DEVELOPMENT), "T1", 0);
        fx.store.pushHead(fx.keys.queue(Stage.VALIDATION), "T1");
        fx.time.advanceMinutes(2);

        fx.pipeline.resumeHandoffs(GRACE);

        assertThat(fx.pending(Stage.VALIDATION)).containsExactly("T1");
        assertThat(fx.store.hgetAll(fx.keys.handoffs())).isEmpty();
    }

    @Test
    @DisplayName("A complete retried after a crash leaves the handoff to resumption")
    void retriedCompleteDefersToResumption() {
        fx.pipeline.enqueue("T1", Stage.DEVELOPMENT);
        fx.pipeline.claim(Stage.DEVELOPMENT, Duration.ZERO);
        ledger("T1", Stage.DEVELOPMENT);
        fx.store.remove(fx.keys.inflight(Stage.DEVELOPMENT), "T1", 0);

        assertThat(fx.pipeline.complete("T1", Stage.DEVELOPMENT)).isEqualTo(CompletionResult.NOT_CLAIMED);
        assertThat(fx.store.hget(fx.keys.handoffs(), "T1")).isPresent();

        fx.time.advanceMinutes(2);
        fx.pipeline.resumeHandoffs(GRACE);
        assertThat(fx.pending(Stage.VALIDATION)).containsExactly("T1");
    }

    @Test
    @DisplayName("A worker still holding the claim completes over a leftover ledger entry")
    void completeOverLeftoverLedger() {
        fx.pipeline.enqueue("T1", Stage.DEVELOPMENT);
        fx.pipeline.claim(Stage.DEVELOPMENT, Duration.ZERO);
        ledger("T1", Stage.DEVELOPMENT);

        assertThat(fx.pipeline.complete("T1", Stage.DEVELOPMENT)).isEqualTo(CompletionResult.ADVANCED);

        assertThat(fx.pending(Stage.VALIDATION)).containsExactly("T1");
        assertThat(fx.store.hgetAll(fx.keys.handoffs())).isEmpty();
    }

    @Test
    @DisplayName("A stale ledger entry does not pull a task back once it has moved on")
    void staleLedgerAfterTaskMovedOn() {
        ledger("T1", Stage.DEVELOPMENT);
        fx.pipeline.enqueue("T1", Stage.INTEGRATION);
        fx.time.advanceMinutes(2);

        fx.pipeline.resumeHandoffs(GRACE);

        assertThat(fx.pending(Stage.VALIDATION)).isEmpty();
        assertThat(fx.pending(Stage.INTEGRATION)).containsExactly("T1");
        assertThat(fx.store.hgetAll(fx.keys.handoffs())).isEmpty();
    }

    @Test
    @DisplayName("A ledger entry for a different stage does not let complete skip its claim check")
    void ledgerForOtherStageDoesNotCount() {
        fx.pipeline.enqueue("T1", Stage.VALIDATION);
        ledger("T1", Stage.DEVELOPMENT);

        assertThat(fx.pipeline.complete("T1", Stage.VALIDATION)).isEqualTo(CompletionResult.NOT_CLAIMED);
        assertThat(fx.store.hget(fx.keys.handoffs(), "T1")).isPresent();
    }

    @Test
    @DisplayName("Stuck recovery leaves entries with a handoff in progress to the ledger")
    void recoverySkipsHandoffsInProgress() {
        fx.pipeline.enqueue("T1", Stage.DEVELOPMENT);
        fx.pipeline.claim(Stage.DEVELOPMENT, Duration.ZERO);
        ledger("T1", Stage.DEVELOPMENT);
        fx.time.advanceMinutes(45);

        assertThat(fx.pipeline.recoverStuck(Stage.DEVELOPMENT, Duration.ofMinutes(30))).isEmpty();
        assertThat(fx.pending(Stage.DEVELOPMENT)).isEmpty();

        fx.pipeline.resumeHandoffs(GRACE);
        assertThat(fx.pending(Stage.VALIDATION)).containsExactly("T1");
        assertThat(fx.inflight(Stage.DEVELOPMENT)).isEmpty();
    }

    @Test
    @DisplayName("Unreadable ledger entries are dropped")
    void unreadableEntryDropped() {
        fx.store.hset(fx.keys.handoffs(), "T1", "garbage");

        assertThat(fx.pipeline.resumeHandoffs(GRACE)).isEmpty();
        assertThat(fx.store.hgetAll(fx.keys.handoffs())).isEmpty();
    }

    @Test
    @DisplayName("An interrupted final-stage handoff removes the task from the pipeline")
    void lastStageHandoffFinishes() {
        fx.pipeline.enqueue("T1", Stage.INTEGRATION);
        fx.pipeline.claim(Stage.INTEGRATION, Duration.ZERO);
        ledger("T1", Stage.INTEGRATION);
        fx.store.remove(fx.keys.inflight(Stage.INTEGRATION), "T1", 0);
        fx.time.advanceMinutes(2);

        fx.pipeline.resumeHandoffs(GRACE);

        assertThat(fx.store.sismember(fx.keys.members(), "T1")).isFalse();
    }
}
