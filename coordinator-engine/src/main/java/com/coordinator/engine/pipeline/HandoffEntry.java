package com.coordinator.engine.pipeline;

import com.coordinator.core.model.Stage;

import java.time.Instant;
import java.util.Optional;

/**
 * One row of the handoff ledger: a task leaving a stage's inflight list, and where it goes.
 *
 * Stored as {@code stage|millis} for a move to the next stage, {@code stage|millis|requeue}
 * for a retry in the same stage and {@code stage|millis|dead|retries|reason} for a dead letter.
 * The reason is last so it may itself contain the separator.
 */
record HandoffEntry(Stage stage, Instant startedAt, Move move, int retries, String reason) {

    enum Move {
        ADVANCE,
        REQUEUE,
        DEAD_LETTER
    }

    private static final String SEPARATOR = "|";
    private static final String REQUEUE_TAG = "requeue";
    private static final String DEAD_LETTER_TAG = "dead";

    static HandoffEntry advance(Stage stage, Instant startedAt) {
        return new HandoffEntry(stage, startedAt, Move.ADVANCE, 0, null);
    }

    static HandoffEntry requeue(Stage stage, Instant startedAt) {
        return new HandoffEntry(stage, startedAt, Move.REQUEUE, 0, null);
    }

    static HandoffEntry deadLetter(Stage stage, Instant startedAt, int retries, String reason) {
        return new HandoffEntry(stage, startedAt, Move.DEAD_LETTER, retries, reason);
    }

    String encode() {
        String head = stage.wireName() + SEPARATOR + startedAt.toEpochMilli();
        switch (move) {
            case REQUEUE:
                return head + SEPARATOR + REQUEUE_TAG;
            case DEAD_LETTER:
                return head + SEPARATOR + DEAD_LETTER_TAG + SEPARATOR + retries
                    + SEPARATOR + (reason == null ? "" : reason);
            default:
                return head;
        }
    }

    static Optional<HandoffEntry> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String[] parts = raw.split("\\|", 5);
        if (parts.length < 2) {
            return Optional.empty();
        }
        try {
            Stage stage = Stage.fromWireName(parts[0]);
            Instant startedAt = Instant.ofEpochMilli(Long.parseLong(parts[1]));
            if (parts.length == 2) {
                return Optional.of(advance(stage, startedAt));
            }
            if (parts.length == 3 && REQUEUE_TAG.equals(parts[2])) {
                return Optional.of(requeue(stage, startedAt));
            }
            if (parts.length == 5 && DEAD_LETTER_TAG.equals(parts[2])) {
                return Optional.of(deadLetter(stage, startedAt, Integer.parseInt(parts[3]), parts[4]));
            }
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            return Optional.empty();
        }
    }
}
