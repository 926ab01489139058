package com.e2eq.lexikon.graph.core;

import com.e2eq.lexikon.graph.core.RelationTypeRegistry.RelationTypeDef;
import com.e2eq.lexikon.graph.exceptions.InvalidRelationTypeException;

/**
 * Structural checks every {@link RelationStore} applies before accepting a write.
 */
public final class RelationValidator {
    private RelationValidator() {}

    public static RelationTypeDef validate(Relation relation, RelationTypeRegistry registry) {
        if (relation == null) {
            throw new IllegalArgumentException("relation must not be null");
        }
        if (relation.getSourceId() == null || relation.getSourceId().isBlank()
                || relation.getTargetId() == null || relation.getTargetId().isBlank()) {
            throw new IllegalArgumentException("relation source and target must be non-empty");
        }
        RelationTypeDef type = registry.typeOf(relation.getRelationType())
                .orElseThrow(() -> InvalidRelationTypeException.unknown(relation.getRelationType()));
        double c = relation.getConfidence();
        if (Double.isNaN(c) || c < 0.0d || c > 1.0d) {
            throw new InvalidRelationTypeException(type.name(), "Confidence must be within [0,1], was " + c);
        }
        if (!type.reflexive() && relation.getSourceId().equals(relation.getTargetId())) {
            throw new InvalidRelationTypeException(type.name(),
                    "Relation type '" + type.name() + "' is not reflexive; self-loop on " + relation.getSourceId());
        }
        return type;
    }
}
