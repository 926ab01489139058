package com.e2eq.lexikon.graph.core;

import java.util.Date;
import java.util.List;

/**
 * Progress of a bulk re-inference job, saved after every processed term.
 *
 * @param lastTermId last term fully processed; the job resumes strictly after it
 * @param skippedTerms terms that failed with a structural error and were passed over
 */
public record ReinferenceCheckpoint(String jobId,
                                    Status status,
                                    List<InferenceRule> rules,
                                    int maxDepth,
                                    String lastTermId,
                                    long processedTerms,
                                    long skippedTerms,
                                    long inferredRelations,
                                    String error,
                                    Date startedAt,
                                    Date updatedAt) {

    public enum Status { RUNNING, COMPLETED, FAILED }

    public ReinferenceCheckpoint {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static ReinferenceCheckpoint started(String jobId, List<InferenceRule> rules, int maxDepth) {
        Date now = new Date();
        return new ReinferenceCheckpoint(jobId, Status.RUNNING, rules, maxDepth, null, 0, 0, 0, null, now, now);
    }

    public ReinferenceCheckpoint advance(String termId, long inferred, boolean skipped) {
        return new ReinferenceCheckpoint(jobId, status, rules, maxDepth, termId, processedTerms + 1,
                skippedTerms + (skipped ? 1 : 0), inferredRelations + inferred, error, startedAt, new Date());
    }

    public ReinferenceCheckpoint withStatus(Status newStatus, String newError) {
        return new ReinferenceCheckpoint(jobId, newStatus, rules, maxDepth, lastTermId, processedTerms,
                skippedTerms, inferredRelations, newError, startedAt, new Date());
    }
}
