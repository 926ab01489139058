package com.e2eq.lexikon.graph.exceptions;

/**
 * Thrown when a review decision targets a relation that is no longer provisional.
 */
public class AlreadyResolvedException extends RelationGraphException {
    private static final long serialVersionUID = 1L;

    private final String relationId;

    public AlreadyResolvedException(String relationId) {
        super(ErrorCode.ALREADY_RESOLVED, "Relation " + relationId + " is already confirmed");
        this.relationId = relationId;
    }

    public String getRelationId() {
        return relationId;
    }
}
