package com.coordinator.core.ci;

import com.coordinator.core.model.CiReport;

import java.util.Set;

/**
 * Opaque oracle for CI state of a commit.
 * Implementations never throw for connectivity or credential problems; they
 * return {@link CiReport#unverifiable(String)} instead.
 */
public interface CiCollaborator {

    /**
     * @param commitHash The commit to inspect
     * @param requiredChecks Names of checks whose conclusions are needed
     * @param mainlineBranch Branch the commit must be reachable from
     * @return What could be established about the commit
     */
    CiReport inspect(String commitHash, Set<String> requiredChecks, String mainlineBranch);
}
