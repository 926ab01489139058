package com.e2eq.lexikon.graph.core;

import java.util.*;

public interface RelationTypeRegistry {
    Optional<RelationTypeDef> typeOf(String name);
    Map<String, RelationTypeDef> types();

    default boolean isSymmetric(String name) {
        return typeOf(name).map(RelationTypeDef::symmetric).orElse(false);
    }

    default boolean isTransitive(String name) {
        return typeOf(name).map(RelationTypeDef::transitive).orElse(false);
    }

    default Optional<String> inverseOf(String name) {
        Optional<String> declared = typeOf(name).flatMap(RelationTypeDef::inverseOf);
        if (declared.isPresent()) {
            return declared;
        }
        // fall back to a type that declares this one as its inverse
        for (RelationTypeDef t : types().values()) {
            if (t.inverseOf().isPresent() && t.inverseOf().get().equals(name)) {
                return Optional.of(t.name());
            }
        }
        return Optional.empty();
    }

    static RelationTypeRegistry inMemory(Collection<RelationTypeDef> types) {
        return new InMemoryRelationTypeRegistry(types);
    }

    /**
     * Algebraic properties of a relation type.
     *
     * @param equivalence marks the type used by equivalence propagation ({@code equivalent_to})
     */
    record RelationTypeDef(String name,
                           boolean symmetric,
                           boolean transitive,
                           boolean reflexive,
                           boolean equivalence,
                           Optional<String> inverseOf) {

        public static RelationTypeDef plain(String name) {
            return new RelationTypeDef(name, false, false, false, false, Optional.empty());
        }
    }
}
