package com.e2eq.lexikon.graph.exceptions;

/**
 * Base type of all failures surfaced by the relation graph. Each subtype carries an
 * {@link ErrorCode} so boundary layers can map it without inspecting the class.
 */
public abstract class RelationGraphException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum ErrorCode {
        INVALID_TYPE,
        NOT_FOUND,
        ALREADY_RESOLVED,
        UNKNOWN_TERM,
        STORE_UNAVAILABLE,
        CANCELLED
    }

    private final ErrorCode code;

    protected RelationGraphException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected RelationGraphException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
