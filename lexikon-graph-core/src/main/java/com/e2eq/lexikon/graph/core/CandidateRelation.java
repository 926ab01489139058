package com.e2eq.lexikon.graph.core;

import java.util.List;

/**
 * A derived relation proposed by the {@link RuleEngine}. Not persisted until the orchestrator hands it to
 * the store, after which {@code relationId} names the stored row.
 */
public record CandidateRelation(String sourceId,
                                String targetId,
                                String relationType,
                                double confidence,
                                List<String> derivationPath,
                                List<String> rulePath,
                                String relationId) {

    public CandidateRelation {
        derivationPath = List.copyOf(derivationPath);
        rulePath = List.copyOf(rulePath);
    }

    public CandidateRelation withRelationId(String id) {
        return new CandidateRelation(sourceId, targetId, relationType, confidence, derivationPath, rulePath, id);
    }

    public Relation toRelation(String createdBy) {
        return Relation.inferred(sourceId, relationType, targetId, confidence, derivationPath, rulePath, createdBy);
    }
}
