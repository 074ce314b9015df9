package com.coordinator.core.model;

/**
 * Checks evaluated by the completion gate before a task may become {@code complete}.
 */
public enum GateCheck {
    /** A commit hash was supplied. */
    COMMIT_HASH,
    /** Every required CI check concluded successfully. */
    CI_CHECKS,
    /** The commit is reachable from the mainline branch. */
    MAINLINE,
    /** The commit is no older than the freshness window. */
    FRESHNESS;

    public String wireName() {
        return name().toLowerCase();
    }
}
