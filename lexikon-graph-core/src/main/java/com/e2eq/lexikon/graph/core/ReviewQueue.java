package com.e2eq.lexikon.graph.core;

import com.e2eq.lexikon.graph.exceptions.AlreadyResolvedException;
import com.e2eq.lexikon.graph.exceptions.InvalidRelationTypeException;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Boundary to the human review workflow: lists provisional relations and applies approve/reject decisions.
 * Rejected relations are deleted outright, so a later inference run with new support may propose them again.
 */
public class ReviewQueue {
    private static final Logger LOG = Logger.getLogger(ReviewQueue.class);

    private final RelationStore store;

    public ReviewQueue(RelationStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public List<Relation> getPending(int limit) {
        if (limit <= 0) return List.of();
        return store.findByStatus(Relation.Status.PROVISIONAL, limit);
    }

    /**
     * @param reviewerConfidence optional override applied on approval
     * @return the approved relation, or empty on rejection
     * @throws com.e2eq.lexikon.graph.exceptions.RelationNotFoundException if no relation has this id
     * @throws AlreadyResolvedException if the relation is already confirmed
     */
    public Optional<Relation> resolve(String relationId, ReviewDecision decision, Double reviewerConfidence) {
        Relation r = store.require(relationId);
        if (r.isConfirmed()) {
            throw new AlreadyResolvedException(relationId);
        }
        if (decision == ReviewDecision.REJECT) {
            store.delete(relationId);
            LOG.infof("review rejected %s", r);
            return Optional.empty();
        }
        if (reviewerConfidence != null) {
            if (reviewerConfidence < 0.0d || reviewerConfidence > 1.0d) {
                throw new InvalidRelationTypeException(r.getRelationType(),
                        "Reviewer confidence must be within [0,1], was " + reviewerConfidence);
            }
            r.setConfidence(reviewerConfidence);
        }
        r.setStatus(Relation.Status.CONFIRMED);
        store.update(r);
        LOG.infof("review approved %s", r);
        return Optional.of(r);
    }
}
