package com.e2eq.lexikon.graph.core;

/**
 * Decides how an incoming relation is folded into an existing row with the same key.
 */
public final class MergePolicy {
    private MergePolicy() {}

    public enum Action {
        /** Confirmed row re-asserted: keep the higher confidence. */
        RAISE_CONFIDENCE,
        /** Provisional row asserted by a user: becomes confirmed and asserted. */
        PROMOTE,
        /** Provisional row re-derived with a better derivation. */
        REPLACE_DERIVATION,
        /** Provisional row re-derived with an equal or worse derivation. */
        KEEP,
        /** Inferred candidate for an already confirmed row. */
        SKIP
    }

    public static Action decide(Relation existing, Relation incoming) {
        if (existing.isConfirmed()) {
            return incoming.isInferred() ? Action.SKIP : Action.RAISE_CONFIDENCE;
        }
        if (!incoming.isInferred()) {
            return Action.PROMOTE;
        }
        return incoming.getConfidence() > existing.getConfidence() ? Action.REPLACE_DERIVATION : Action.KEEP;
    }

    /**
     * Applies {@code action} to {@code existing} in place.
     */
    public static PutResult apply(Action action, Relation existing, Relation incoming) {
        switch (action) {
            case SKIP:
                return PutResult.skipped(existing.getId());
            case RAISE_CONFIDENCE:
                existing.setConfidence(Math.max(existing.getConfidence(), incoming.getConfidence()));
                break;
            case PROMOTE:
                existing.setConfidence(Math.max(existing.getConfidence(), incoming.getConfidence()));
                existing.setStatus(Relation.Status.CONFIRMED);
                existing.setProvenance(Relation.Provenance.ASSERTED);
                existing.setDerivationPath(null);
                existing.setRulePath(null);
                if (incoming.getCreatedBy() != null) existing.setCreatedBy(incoming.getCreatedBy());
                break;
            case REPLACE_DERIVATION:
                existing.setConfidence(incoming.getConfidence());
                existing.setDerivationPath(incoming.getDerivationPath());
                existing.setRulePath(incoming.getRulePath());
                break;
            case KEEP:
            default:
                break;
        }
        if (!incoming.getMetadata().isEmpty()) {
            existing.getMetadata().putAll(incoming.getMetadata());
        }
        return PutResult.merged(existing.getId());
    }
}
