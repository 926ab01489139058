package com.e2eq.lexikon.graph.exceptions;

public class InferenceCancelledException extends RelationGraphException {
    private static final long serialVersionUID = 1L;

    private final int completedHops;

    public InferenceCancelledException(String sourceTermId, int completedHops) {
        super(ErrorCode.CANCELLED, "Inference from '" + sourceTermId + "' cancelled after " + completedHops + " hop(s)");
        this.completedHops = completedHops;
    }

    public int getCompletedHops() {
        return completedHops;
    }
}
