package com.e2eq.lexikon.graph.core;

import org.jboss.logging.Logger;

import java.util.*;

/**
 * Drives bounded-depth inference from one term.
 * <p>
 * A run reads a single neighborhood snapshot from the store, expands it breadth-first in memory one hop at a
 * time, and persists the surviving candidates in one {@link RelationStore#putAll} call as provisional inferred
 * relations. Nothing is written if the run is cancelled or the store fails. Runs for different terms share no
 * state and may proceed concurrently.
 * </p>
 */
public class InferenceOrchestrator {
    private static final Logger LOG = Logger.getLogger(InferenceOrchestrator.class);

    public static final String INFERENCE_ACTOR = "inference";

    private final RelationStore store;
    private final RuleEngine engine;
    private final InferenceSettings settings;

    public InferenceOrchestrator(RelationStore store, RuleEngine engine, InferenceSettings settings) {
        this.store = Objects.requireNonNull(store, "store");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public List<CandidateRelation> infer(String sourceTermId, Collection<InferenceRule> rules, int maxDepth) {
        return infer(sourceTermId, rules, maxDepth, CancellationToken.none());
    }

    /**
     * @param rules rules to apply; null or empty means all rules
     * @param maxDepth maximum number of relations in a derivation; clamped to the configured limit
     * @return persisted candidates, highest confidence first; candidates matching a confirmed relation are
     *         omitted
     * @throws com.e2eq.lexikon.graph.exceptions.InferenceCancelledException if {@code token} was cancelled
     *         before the run finished
     * @throws com.e2eq.lexikon.graph.exceptions.StoreUnavailableException on backend failure
     */
    public List<CandidateRelation> infer(String sourceTermId, Collection<InferenceRule> rules, int maxDepth,
                                         CancellationToken token) {
        if (maxDepth <= 0) return List.of();
        int depth = settings.clampDepth(maxDepth);
        if (depth < maxDepth) {
            LOG.debugf("maxDepth %d clamped to %d", maxDepth, depth);
        }
        Set<InferenceRule> ruleSet = RuleEngine.normalize(rules);

        List<Relation> snapshot = store.neighborhood(List.of(sourceTermId), depth);
        if (!hasOutgoing(sourceTermId, snapshot)) {
            LOG.debugf("no outgoing relations from %s; nothing to infer", sourceTermId);
            return List.of();
        }
        List<Relation> incoming = ruleSet.contains(InferenceRule.INVERSE)
                ? confirmedOnly(store.getIncoming(sourceTermId, null))
                : List.of();

        DerivationArena arena = expand(sourceTermId, snapshot, incoming, ruleSet, depth, token);

        List<CandidateRelation> candidates = new ArrayList<>();
        for (int idx : arena.bestNodes()) {
            if (arena.node(idx).sourceId().equals(sourceTermId)) {
                candidates.add(arena.toCandidate(idx));
            }
        }
        candidates.sort(RuleEngine.BY_CONFIDENCE_DESC);
        if (candidates.isEmpty()) return List.of();

        List<Relation> rows = new ArrayList<>(candidates.size());
        for (CandidateRelation c : candidates) rows.add(c.toRelation(INFERENCE_ACTOR));
        List<PutResult> results = store.putAll(rows);

        List<CandidateRelation> out = new ArrayList<>(candidates.size());
        int created = 0;
        for (int i = 0; i < candidates.size(); i++) {
            PutResult result = results.get(i);
            if (result.isSkipped()) continue;
            if (result.isCreated()) created++;
            out.add(candidates.get(i).withRelationId(result.id()));
        }
        LOG.infof("inferred %d candidate(s) from %s at depth %d (%d new, %d already confirmed)",
                out.size(), sourceTermId, depth, created, candidates.size() - out.size());
        return out;
    }

    /**
     * Looks for the best remaining derivation of an existing inferred relation, ignoring the relations in
     * {@code excludedIds} and anything derived from them.
     */
    public Optional<CandidateRelation> rederive(Relation relation, Set<String> excludedIds) {
        int depth = settings.clampDepth(Math.max(settings.defaultMaxDepth(), relation.getDerivationPath().size()));
        Set<InferenceRule> ruleSet = EnumSet.allOf(InferenceRule.class);
        List<Relation> snapshot = usable(store.neighborhood(List.of(relation.getSourceId()), depth), excludedIds);
        List<Relation> incoming = usable(confirmedOnly(store.getIncoming(relation.getSourceId(), null)), excludedIds);

        DerivationArena arena = expand(relation.getSourceId(), snapshot, incoming, ruleSet, depth, CancellationToken.none());
        RelationKey wanted = RelationKey.of(relation, store.registry());
        for (int idx : arena.bestNodes()) {
            DerivationArena.Node n = arena.node(idx);
            if (arena.keyOf(n).equals(wanted)) {
                return Optional.of(arena.toCandidate(idx).withRelationId(relation.getId()));
            }
        }
        return Optional.empty();
    }

    private DerivationArena expand(String anchor, List<Relation> snapshot, List<Relation> incoming,
                                   Set<InferenceRule> ruleSet, int depth, CancellationToken token) {
        DerivationArena arena = engine.load(snapshot, ruleSet);
        List<Integer> frontier = engine.seed(arena, anchor, incoming, ruleSet);
        int hop = 1;
        while (hop < depth && !frontier.isEmpty()) {
            token.throwIfCancelled(anchor, hop);
            frontier = engine.step(arena, frontier, ruleSet);
            hop++;
        }
        token.throwIfCancelled(anchor, hop);
        LOG.debugf("expansion from %s finished after %d hop(s), arena size %d", anchor, hop, arena.size());
        return arena;
    }

    private boolean hasOutgoing(String termId, List<Relation> snapshot) {
        for (Relation r : snapshot) {
            if (r.getSourceId().equals(termId)) return true;
            if (r.getTargetId().equals(termId) && store.registry().isSymmetric(r.getRelationType())) return true;
        }
        return false;
    }

    private static List<Relation> confirmedOnly(List<Relation> relations) {
        List<Relation> out = new ArrayList<>(relations.size());
        for (Relation r : relations) {
            if (r.isConfirmed()) out.add(r);
        }
        return out;
    }

    private static List<Relation> usable(List<Relation> relations, Set<String> excludedIds) {
        List<Relation> out = new ArrayList<>(relations.size());
        for (Relation r : relations) {
            if (excludedIds.contains(r.getId())) continue;
            if (!Collections.disjoint(r.getDerivationPath(), excludedIds)) continue;
            out.add(r);
        }
        return out;
    }

    public InferenceSettings settings() {
        return settings;
    }
}
