package com.e2eq.lexikon.graph.exceptions;

public class UnknownTermException extends RelationGraphException {
    private static final long serialVersionUID = 1L;

    private final String termId;

    public UnknownTermException(String termId) {
        super(ErrorCode.UNKNOWN_TERM, "Unknown term: " + termId);
        this.termId = termId;
    }

    public String getTermId() {
        return termId;
    }
}
