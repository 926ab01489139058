package com.e2eq.lexikon.graph.exceptions;

/**
 * Backend I/O failure. Never retried by the graph core; callers own retry and backoff.
 */
public class StoreUnavailableException extends RelationGraphException {
    private static final long serialVersionUID = 1L;

    public StoreUnavailableException(String message) {
        super(ErrorCode.STORE_UNAVAILABLE, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, cause);
    }
}
