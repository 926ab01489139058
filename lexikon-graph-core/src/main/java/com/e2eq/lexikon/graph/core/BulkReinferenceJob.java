package com.e2eq.lexikon.graph.core;

import com.e2eq.lexikon.graph.exceptions.InvalidRelationTypeException;
import com.e2eq.lexikon.graph.exceptions.RelationNotFoundException;
import com.e2eq.lexikon.graph.exceptions.RelationGraphException;
import com.e2eq.lexikon.graph.exceptions.UnknownTermException;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Re-runs inference for every term in the store, one page of terms at a time.
 * <p>
 * The checkpoint is saved after each term, so a job that stops with {@code FAILED} is picked up by
 * {@link #resume(String)} right after the last completed term instead of from the beginning.
 * </p>
 */
public class BulkReinferenceJob {
    private static final Logger LOG = Logger.getLogger(BulkReinferenceJob.class);

    private final RelationStore store;
    private final InferenceOrchestrator orchestrator;
    private final CheckpointStore checkpoints;
    private final int chunkSize;

    public BulkReinferenceJob(RelationStore store, InferenceOrchestrator orchestrator, CheckpointStore checkpoints,
                              int chunkSize) {
        this.store = Objects.requireNonNull(store, "store");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints");
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be positive");
        this.chunkSize = chunkSize;
    }

    /**
     * Registers a new job without processing any term.
     */
    public ReinferenceCheckpoint start(Collection<InferenceRule> rules, int maxDepth) {
        List<InferenceRule> ruleList = new ArrayList<>(RuleEngine.normalize(rules));
        ReinferenceCheckpoint cp = ReinferenceCheckpoint.started(UUID.randomUUID().toString(), ruleList, maxDepth);
        checkpoints.save(cp);
        LOG.infof("bulk re-inference %s registered (rules=%s, maxDepth=%d)", cp.jobId(), ruleList, maxDepth);
        return cp;
    }

    /** Registers and runs a job to completion or failure. */
    public ReinferenceCheckpoint run(Collection<InferenceRule> rules, int maxDepth) {
        return execute(start(rules, maxDepth).jobId());
    }

    /**
     * Continues a job after its last completed term. A completed job is returned unchanged.
     */
    public ReinferenceCheckpoint resume(String jobId) {
        ReinferenceCheckpoint cp = require(jobId);
        if (cp.status() == ReinferenceCheckpoint.Status.COMPLETED) {
            return cp;
        }
        checkpoints.save(cp.withStatus(ReinferenceCheckpoint.Status.RUNNING, null));
        LOG.infof("bulk re-inference %s resuming after term %s", jobId, cp.lastTermId());
        return execute(jobId);
    }

    public Optional<ReinferenceCheckpoint> status(String jobId) {
        return checkpoints.find(jobId);
    }

    /**
     * Processes terms from the job's cursor until the store has no more terms or a term fails with a
     * non-structural error.
     */
    public ReinferenceCheckpoint execute(String jobId) {
        ReinferenceCheckpoint cp = require(jobId);
        Set<InferenceRule> rules = RuleEngine.normalize(cp.rules());
        while (true) {
            List<String> page = store.termIds(cp.lastTermId(), chunkSize);
            if (page.isEmpty()) break;
            for (String term : page) {
                try {
                    List<CandidateRelation> inferred = orchestrator.infer(term, rules, cp.maxDepth());
                    cp = cp.advance(term, inferred.size(), false);
                } catch (InvalidRelationTypeException | RelationNotFoundException | UnknownTermException e) {
                    LOG.warnf("bulk re-inference %s: skipping term %s: %s", jobId, term, e.getMessage());
                    cp = cp.advance(term, 0, true);
                } catch (RuntimeException e) {
                    ReinferenceCheckpoint failed = cp.withStatus(ReinferenceCheckpoint.Status.FAILED, describe(e));
                    checkpoints.save(failed);
                    LOG.errorf(e, "bulk re-inference %s failed at term %s after %d term(s)", jobId, term,
                            cp.processedTerms());
                    return failed;
                }
                checkpoints.save(cp);
            }
        }
        ReinferenceCheckpoint done = cp.withStatus(ReinferenceCheckpoint.Status.COMPLETED, null);
        checkpoints.save(done);
        LOG.infof("bulk re-inference %s completed: %d term(s), %d skipped, %d relation(s) inferred",
                jobId, done.processedTerms(), done.skippedTerms(), done.inferredRelations());
        return done;
    }

    private ReinferenceCheckpoint require(String jobId) {
        return checkpoints.find(jobId)
                .orElseThrow(() -> new NoSuchElementException("Unknown re-inference job " + jobId));
    }

    private static String describe(RuntimeException e) {
        String code = e instanceof RelationGraphException ? ((RelationGraphException) e).getCode() + ": " : "";
        return code + e.getMessage();
    }
}
