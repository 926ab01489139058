package com.e2eq.lexikon.graph.exceptions;

/**
 * Thrown when a relation names an unknown type, carries a confidence outside [0,1], or loops
 * back onto its own source for a type that is not reflexive.
 */
public class InvalidRelationTypeException extends RelationGraphException {
    private static final long serialVersionUID = 1L;

    private final String relationType;

    public InvalidRelationTypeException(String relationType, String message) {
        super(ErrorCode.INVALID_TYPE, message);
        this.relationType = relationType;
    }

    public static InvalidRelationTypeException unknown(String relationType) {
        return new InvalidRelationTypeException(relationType, "Unknown relation type '" + relationType + "'");
    }

    public String getRelationType() {
        return relationType;
    }
}
