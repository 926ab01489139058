package com.e2eq.lexikon.graph.core;

import java.util.List;

/**
 * Result of deleting a relation.
 *
 * @param rederived inferred relations that found an alternative derivation and were updated in place
 * @param retracted ids of inferred relations removed because no derivation remained
 */
public record InvalidationReport(String deletedId, List<CandidateRelation> rederived, List<String> retracted) {

    public InvalidationReport {
        rederived = List.copyOf(rederived);
        retracted = List.copyOf(retracted);
    }
}
