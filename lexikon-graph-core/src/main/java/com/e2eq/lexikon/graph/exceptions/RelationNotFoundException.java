package com.e2eq.lexikon.graph.exceptions;

public class RelationNotFoundException extends RelationGraphException {
    private static final long serialVersionUID = 1L;

    private final String relationId;

    public RelationNotFoundException(String relationId) {
        super(ErrorCode.NOT_FOUND, "Relation not found: " + relationId);
        this.relationId = relationId;
    }

    public String getRelationId() {
        return relationId;
    }
}
