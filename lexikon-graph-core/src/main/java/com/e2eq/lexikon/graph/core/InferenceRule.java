package com.e2eq.lexikon.graph.core;

import com.e2eq.lexikon.graph.core.DerivationArena.Node;

import java.util.Locale;

/**
 * Closed set of derivation rules. Each constant carries its own evaluation:
 * <ul>
 *   <li>{@code addViews} exposes extra base facts when the snapshot is loaded,</li>
 *   <li>{@code extend} joins a fact with a base edge leaving the fact's target,</li>
 *   <li>{@code transform} derives a new fact from a single fact.</li>
 * </ul>
 */
public enum InferenceRule {

    /** {@code A→B (T)}, {@code B→C (T)}, T transitive gives {@code A→C (T)}. */
    TRANSITIVE {
        @Override
        void extend(int fact, RuleEngine.Step step) {
            Node f = step.arena().node(fact);
            if (!step.registry().isTransitive(f.relationType())) return;
            for (int edge : step.arena().baseFrom(f.targetId())) {
                Node e = step.arena().node(edge);
                if (e.relationType().equals(f.relationType())) {
                    step.combine(fact, edge, f.relationType(), this);
                }
            }
        }
    },

    /** Symmetric edges are traversable in both directions; nothing new is proposed. */
    SYMMETRIC {
        @Override
        void addViews(Relation relation, DerivationArena arena, RelationTypeRegistry registry) {
            if (registry.isSymmetric(relation.getRelationType())) {
                arena.addBase(relation, true, this);
            }
        }
    },

    /** {@code A ≡ B}, {@code B→C (T)}, T transitive gives {@code A→C (T)}. */
    EQUIVALENCE {
        @Override
        void addViews(Relation relation, DerivationArena arena, RelationTypeRegistry registry) {
            if (isEquivalence(relation.getRelationType(), registry)) {
                arena.addBase(relation, true, this);
            }
        }

        @Override
        void extend(int fact, RuleEngine.Step step) {
            Node f = step.arena().node(fact);
            if (!isEquivalence(f.relationType(), step.registry())) return;
            for (int edge : step.arena().baseFrom(f.targetId())) {
                Node e = step.arena().node(edge);
                if (!e.relationType().equals(f.relationType()) && step.registry().isTransitive(e.relationType())) {
                    step.combine(fact, edge, e.relationType(), this);
                }
            }
        }
    },

    /** {@code A→B (T)} with {@code inverseOf(T) = T'} gives {@code B→A (T')}. */
    INVERSE {
        @Override
        void transform(int fact, RuleEngine.Step step) {
            Node f = step.arena().node(fact);
            step.registry().inverseOf(f.relationType())
                    .ifPresent(inverse -> step.invert(fact, inverse, this));
        }
    };

    void addViews(Relation relation, DerivationArena arena, RelationTypeRegistry registry) {
        // no extra views by default
    }

    void extend(int fact, RuleEngine.Step step) {
        // binary rules override
    }

    void transform(int fact, RuleEngine.Step step) {
        // unary rules override
    }

    private static boolean isEquivalence(String relationType, RelationTypeRegistry registry) {
        return registry.typeOf(relationType).map(RelationTypeRegistry.RelationTypeDef::equivalence).orElse(false);
    }

    /**
     * Case-insensitive lookup that also accepts lower-case wire names such as {@code transitive}.
     */
    public static InferenceRule parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("rule name must be non-empty");
        }
        try {
            return InferenceRule.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown inference rule '" + name + "'", e);
        }
    }
}
