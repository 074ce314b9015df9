package com.coordinator.core.exception;

/**
 * Thrown when code attempts to change a stable id that has already been written,
 * or to give one stable id to two legacy ids.
 */
public class StableIdConflictException extends CoordinatorException {
    
    public static final String ERROR_CODE = "STABLE_ID_CONFLICT";
    
    public StableIdConflictException(String legacyId, long existingStableId, long requestedStableId) {
        this(String.format(
            "Legacy id '%s' is already mapped to stable id %d, refusing %d",
            legacyId, existingStableId, requestedStableId
        ));
    }

    private StableIdConflictException(String message) {
        super(ERROR_CODE, message);
    }

    public static StableIdConflictException alreadyIssued(long stableId, String owner, String requestedLegacyId) {
        return new StableIdConflictException(String.format(
            "Stable id %d already belongs to '%s', refusing it for '%s'",
            stableId, owner, requestedLegacyId
        ));
    }
}
