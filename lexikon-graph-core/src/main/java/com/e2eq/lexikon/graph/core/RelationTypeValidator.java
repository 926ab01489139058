package com.e2eq.lexikon.graph.core;

import com.e2eq.lexikon.graph.core.RelationTypeRegistry.RelationTypeDef;

import java.util.*;

/**
 * Validator for relation type declarations: unique names, inverse reference integrity, and
 * illegal combinations of algebraic properties.
 */
public final class RelationTypeValidator {
    private RelationTypeValidator() {}

    public static void validate(Collection<RelationTypeDef> defs) {
        Map<String, RelationTypeDef> byName = new HashMap<>();
        for (RelationTypeDef d : defs) {
            require(d.name() != null && !d.name().isBlank(), "Relation type id must be non-empty");
            require(byName.put(d.name(), d) == null, "Duplicate relation type '" + d.name() + "'");
        }

        int equivalenceTypes = 0;
        for (RelationTypeDef d : defs) {
            d.inverseOf().ifPresent(inv -> {
                require(byName.containsKey(inv), "Unknown relation type '" + inv + "' in inverseOf of " + d.name());
                require(!d.symmetric(), "Symmetric relation type '" + d.name() + "' cannot declare an inverse");
                RelationTypeDef other = byName.get(inv);
                other.inverseOf().ifPresent(back -> require(back.equals(d.name()),
                        "Inverse of '" + d.name() + "' is '" + inv + "' but '" + inv + "' declares inverse '" + back + "'"));
            });
            if (d.equivalence()) {
                equivalenceTypes++;
                require(d.symmetric() && d.transitive(),
                        "Equivalence relation type '" + d.name() + "' must be symmetric and transitive");
            }
        }
        require(equivalenceTypes <= 1, "At most one relation type may be marked as equivalence");
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
