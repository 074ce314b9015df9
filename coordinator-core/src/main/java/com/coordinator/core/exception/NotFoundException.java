package com.coordinator.core.exception;

/**
 * A task, agent or dead letter the caller named does not exist.
 */
public class NotFoundException extends CoordinatorException {

    public static final String ERROR_CODE = "NOT_FOUND";

    private final String kind;
    private final String id;

    public NotFoundException(String kind, String id) {
        super(ERROR_CODE, kind + " '" + id + "' does not exist");
        this.kind = kind;
        this.id = id;
    }

    public String getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }
}
