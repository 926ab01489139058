package com.e2eq.lexikon.graph.core;

/**
 * Uniqueness key of a relation. For symmetric types the key is independent of direction, so
 * {@code A related_to B} and {@code B related_to A} share one key.
 */
public record RelationKey(String first, String relationType, String second) {

    public static RelationKey of(String sourceId, String relationType, String targetId, boolean symmetric) {
        if (symmetric && sourceId.compareTo(targetId) > 0) {
            return new RelationKey(targetId, relationType, sourceId);
        }
        return new RelationKey(sourceId, relationType, targetId);
    }

    public static RelationKey of(Relation relation, RelationTypeRegistry registry) {
        boolean symmetric = registry.typeOf(relation.getRelationType())
                .map(RelationTypeRegistry.RelationTypeDef::symmetric)
                .orElse(false);
        return of(relation.getSourceId(), relation.getRelationType(), relation.getTargetId(), symmetric);
    }

    /**
     * Flat form used as the unique index value by persistent stores.
     */
    public String asString() {
        return first + "|" + relationType + "|" + second;
    }
}
