package com.e2eq.lexikon.graph.core;

import com.e2eq.lexikon.graph.core.DerivationArena.Node;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Storage-agnostic derivation of candidate relations.
 * <p>
 * {@link #applyRules} is the one-shot form: one round of every requested rule over a frontier and an edge
 * set. The orchestrator drives the same machinery hop by hop through {@link #load}, {@link #seed} and
 * {@link #step} so derivations share one {@link DerivationArena}.
 * </p>
 */
public final class RuleEngine {
    private static final Logger LOG = Logger.getLogger(RuleEngine.class);

    public static final Comparator<CandidateRelation> BY_CONFIDENCE_DESC =
            Comparator.comparingDouble(CandidateRelation::confidence).reversed()
                    .thenComparing(CandidateRelation::sourceId)
                    .thenComparing(CandidateRelation::relationType)
                    .thenComparing(CandidateRelation::targetId);

    private final RelationTypeRegistry registry;
    private final double decay;
    private final double minConfidence;

    public RuleEngine(RelationTypeRegistry registry, InferenceSettings settings) {
        this(registry, settings.decay(), settings.minConfidence());
    }

    public RuleEngine(RelationTypeRegistry registry, double decay, double minConfidence) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.decay = decay;
        this.minConfidence = minConfidence;
    }

    public RelationTypeRegistry registry() {
        return registry;
    }

    public double decay() {
        return decay;
    }

    /**
     * Applies every rule once to each frontier relation against {@code edges}.
     *
     * @return the best candidate per key, highest confidence first
     */
    public List<CandidateRelation> applyRules(Collection<Relation> frontier,
                                              Collection<Relation> edges,
                                              Collection<InferenceRule> rules) {
        Set<InferenceRule> ruleSet = normalize(rules);
        DerivationArena arena = load(edges, ruleSet);
        List<Integer> facts = new ArrayList<>(frontier.size());
        for (Relation r : frontier) {
            facts.add(arena.addBase(r, false, null));
        }
        Step step = new Step(arena);
        for (int fact : facts) {
            for (InferenceRule rule : ruleSet) {
                rule.transform(fact, step);
                rule.extend(fact, step);
            }
        }
        List<CandidateRelation> out = new ArrayList<>();
        for (int idx : arena.bestNodes()) {
            out.add(arena.toCandidate(idx));
        }
        out.sort(BY_CONFIDENCE_DESC);
        return out;
    }

    /**
     * Builds an arena holding {@code edges} plus the extra views the rules ask for.
     */
    public DerivationArena load(Collection<Relation> edges, Set<InferenceRule> rules) {
        DerivationArena arena = new DerivationArena(registry);
        for (Relation r : edges) {
            arena.addBase(r, false, null);
            for (InferenceRule rule : rules) {
                rule.addViews(r, arena, registry);
            }
        }
        return arena;
    }

    /**
     * First hop: base facts leaving {@code anchor}, plus facts obtained from {@code incoming} relations by the
     * unary rules.
     *
     * @return the frontier for the next hop
     */
    public List<Integer> seed(DerivationArena arena, String anchor, Collection<Relation> incoming, Set<InferenceRule> rules) {
        List<Integer> frontier = new ArrayList<>(arena.baseFrom(anchor));
        Step step = new Step(arena);
        for (Relation r : incoming) {
            int fact = arena.addBase(r, false, null);
            for (InferenceRule rule : rules) {
                rule.transform(fact, step);
            }
        }
        frontier.addAll(step.accepted());
        return frontier;
    }

    /**
     * Extends every frontier fact by one base edge.
     *
     * @return nodes that became the best derivation of their key during this step
     */
    public List<Integer> step(DerivationArena arena, List<Integer> frontier, Set<InferenceRule> rules) {
        Step step = new Step(arena);
        for (int fact : frontier) {
            for (InferenceRule rule : rules) {
                rule.extend(fact, step);
            }
        }
        return step.accepted();
    }

    static Set<InferenceRule> normalize(Collection<InferenceRule> rules) {
        return rules == null || rules.isEmpty() ? EnumSet.allOf(InferenceRule.class) : EnumSet.copyOf(rules);
    }

    /**
     * Scratch state of one evaluation round; rules report derivations through it.
     */
    final class Step {
        private final DerivationArena arena;
        private final List<Integer> accepted = new ArrayList<>();

        Step(DerivationArena arena) {
            this.arena = arena;
        }

        DerivationArena arena() {
            return arena;
        }

        RelationTypeRegistry registry() {
            return registry;
        }

        List<Integer> accepted() {
            return accepted;
        }

        void combine(int left, int right, String relationType, InferenceRule rule) {
            Node l = arena.node(left);
            Node r = arena.node(right);
            if (l.sourceId().equals(r.targetId())) {
                LOG.debugf("cycle: %s -[%s]-> %s would loop back to its source", l.sourceId(), relationType, r.targetId());
                return;
            }
            List<String> visited = arena.terms(left);
            List<String> tail = arena.terms(right);
            for (int i = 1; i < tail.size(); i++) {
                if (visited.contains(tail.get(i))) {
                    LOG.debugf("cycle: derivation of %s -[%s]-> %s revisits %s",
                            l.sourceId(), relationType, r.targetId(), tail.get(i));
                    return;
                }
            }
            double confidence = l.confidence() * r.confidence() * decay;
            if (!admissible(l.sourceId(), relationType, r.targetId(), confidence)) return;
            accept(arena.deriveBinary(left, right, relationType, confidence, rule));
        }

        void invert(int fact, String relationType, InferenceRule rule) {
            Node f = arena.node(fact);
            double confidence = f.confidence() * decay;
            if (!admissible(f.targetId(), relationType, f.sourceId(), confidence)) return;
            accept(arena.deriveReversed(fact, relationType, confidence, rule));
        }

        private boolean admissible(String source, String relationType, String target, double confidence) {
            if (confidence < minConfidence) {
                LOG.debugf("pruned %s -[%s]-> %s at %.4f", source, relationType, target, confidence);
                return false;
            }
            RelationKey key = RelationKey.of(source, relationType, target, registry.isSymmetric(relationType));
            int current = arena.bestFor(key);
            // a strictly more confident derivation already holds the key
            return current == DerivationArena.NONE || arena.node(current).confidence() <= confidence;
        }

        private void accept(int node) {
            if (arena.offer(node)) {
                accepted.add(node);
            }
        }
    }
}
