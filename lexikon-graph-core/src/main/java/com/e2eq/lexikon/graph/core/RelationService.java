package com.e2eq.lexikon.graph.core;

import com.e2eq.lexikon.graph.exceptions.UnknownTermException;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Entry point for asserted relations, the confirmed-only query surface, and deletion with cascading
 * invalidation of dependent inferred relations.
 */
public class RelationService {
    private static final Logger LOG = Logger.getLogger(RelationService.class);

    private final RelationStore store;
    private final InferenceOrchestrator orchestrator;
    private final TermDirectory terms;
    private final InferenceSettings settings;

    public RelationService(RelationStore store, InferenceOrchestrator orchestrator, TermDirectory terms,
                           InferenceSettings settings) {
        this.store = Objects.requireNonNull(store, "store");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.terms = terms != null ? terms : TermDirectory.permissive();
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Asserts a confirmed relation. Re-asserting an existing key keeps one row and raises its confidence to the
     * larger value ({@link PutResult.Outcome#MERGED}).
     *
     * @param confidence null defaults to 1.0
     */
    public PutResult createRelation(String sourceId, String targetId, String relationType, Double confidence,
                                    String createdBy, Map<String, Object> metadata) {
        if (settings.verifyTerms()) {
            if (!terms.termExists(sourceId)) throw new UnknownTermException(sourceId);
            if (!terms.termExists(targetId)) throw new UnknownTermException(targetId);
        }
        Relation r = Relation.asserted(sourceId, relationType, targetId,
                confidence != null ? confidence : 1.0d, createdBy);
        r.setMetadata(metadata);
        PutResult result = store.put(r);
        LOG.infof("createRelation %s -[%s]-> %s by %s: %s %s", sourceId, relationType, targetId, createdBy,
                result.outcome(), result.id());
        return result;
    }

    public Relation getRelation(String id) {
        return store.require(id);
    }

    /**
     * Confirmed relations touching {@code termId}. Symmetric relations are reported for both of their ends
     * regardless of the stored direction.
     *
     * @param relationType null means any type
     */
    public List<Relation> getRelations(String termId, Direction direction, String relationType) {
        Direction d = direction != null ? direction : Direction.BOTH;
        Map<String, Relation> out = new LinkedHashMap<>();
        if (d != Direction.INCOMING) {
            collect(out, store.getOutgoing(termId, relationType), false);
            collect(out, store.getIncoming(termId, relationType), true);
        }
        if (d != Direction.OUTGOING) {
            collect(out, store.getIncoming(termId, relationType), false);
            collect(out, store.getOutgoing(termId, relationType), true);
        }
        return new ArrayList<>(out.values());
    }

    private void collect(Map<String, Relation> out, List<Relation> relations, boolean symmetricOnly) {
        for (Relation r : relations) {
            if (!r.isConfirmed()) continue;
            if (symmetricOnly && !store.registry().isSymmetric(r.getRelationType())) continue;
            out.putIfAbsent(r.getId(), r);
        }
    }

    /**
     * Confirmed relations within {@code depth} hops of the term.
     */
    public List<Relation> neighborhood(String termId, int depth) {
        return store.neighborhood(List.of(termId), settings.clampDepth(depth));
    }

    /**
     * Deletes a relation and re-evaluates every inferred relation whose derivation referenced it. Each affected
     * relation is updated with its best remaining derivation or retracted. A retraction, or a re-derivation at
     * lower confidence, re-evaluates the relations derived from that one in turn.
     *
     * @throws com.e2eq.lexikon.graph.exceptions.RelationNotFoundException if no relation has this id
     */
    public InvalidationReport deleteRelation(String id) {
        List<Relation> affected = store.delete(id);
        Set<String> invalid = new HashSet<>();
        invalid.add(id);

        Deque<Relation> worklist = new ArrayDeque<>(affected);
        Map<String, CandidateRelation> rederived = new LinkedHashMap<>();
        List<String> retracted = new ArrayList<>();

        while (!worklist.isEmpty()) {
            Relation next = worklist.removeFirst();
            Optional<Relation> current = store.get(next.getId());
            if (current.isEmpty() || invalid.contains(next.getId())) continue;
            Relation rel = current.get();

            Set<String> excluded = new HashSet<>(invalid);
            excluded.addAll(dependentsOf(rel.getId()));
            Optional<CandidateRelation> alternative = orchestrator.rederive(rel, excluded);
            if (alternative.isPresent()) {
                CandidateRelation alt = alternative.get();
                double previous = rel.getConfidence();
                rel.setConfidence(alt.confidence());
                rel.setDerivationPath(alt.derivationPath());
                rel.setRulePath(alt.rulePath());
                store.update(rel);
                rederived.put(rel.getId(), alt);
                LOG.debugf("re-derived %s via %s", rel, alt.derivationPath());
                if (alt.confidence() < previous) {
                    // relations built on this one may now exceed its confidence
                    worklist.addAll(store.findDerivedFrom(rel.getId()));
                }
            } else {
                invalid.add(rel.getId());
                rederived.remove(rel.getId());
                retracted.add(rel.getId());
                worklist.addAll(store.delete(rel.getId()));
                LOG.debugf("retracted %s; no remaining derivation", rel);
            }
        }
        LOG.infof("deleted relation %s: %d re-derived, %d retracted", id, rederived.size(), retracted.size());
        return new InvalidationReport(id, new ArrayList<>(rederived.values()), retracted);
    }

    /** Ids of relations whose derivation depends on {@code relationId}, directly or through other derivations. */
    private Set<String> dependentsOf(String relationId) {
        Set<String> seen = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(List.of(relationId));
        while (!pending.isEmpty()) {
            for (Relation r : store.findDerivedFrom(pending.removeFirst())) {
                if (seen.add(r.getId())) pending.add(r.getId());
            }
        }
        seen.add(relationId);
        return seen;
    }
}
