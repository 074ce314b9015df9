package com.coordinator.core.model;

/**
 * One failed completion gate check and what was observed.
 */
public record GateCheckFailure(GateCheck check, String detail) {

    public String describe() {
        return check.wireName() + ": " + detail;
    }
}
