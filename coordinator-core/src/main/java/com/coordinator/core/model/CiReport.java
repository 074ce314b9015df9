package com.coordinator.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * What the CI collaborator could establish about a commit.
 * When {@code verifiable} is false nothing else in the report can be trusted and
 * the completion gate fails closed.
 *
 * @param checkConclusions check name to conclusion ("success", "failure", "pending", ...)
 */
public record CiReport(
    boolean verifiable,
    String reason,
    Map<String, String> checkConclusions,
    Instant commitTimestamp,
    boolean onMainline
) {
    public static final String SUCCESS = "success";

    public static CiReport unverifiable(String reason) {
        return new CiReport(false, reason, Map.of(), null, false);
    }

    public static CiReport verified(Map<String, String> checkConclusions, Instant commitTimestamp, boolean onMainline) {
        return new CiReport(true, null, Map.copyOf(checkConclusions), commitTimestamp, onMainline);
    }

    public boolean checkSucceeded(String checkName) {
        return SUCCESS.equalsIgnoreCase(checkConclusions.get(checkName));
    }
}
