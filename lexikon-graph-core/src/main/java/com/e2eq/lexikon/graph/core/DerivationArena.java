package com.e2eq.lexikon.graph.core;

import java.util.*;

/**
 * Append-only storage of derivation nodes for a single inference run.
 * <p>
 * Base nodes wrap stored relations (or a reversed view of a symmetric one). Derived nodes reference their
 * parents by index, so extending a derivation by one edge costs one node instead of a copied path list.
 * Paths, rule sequences and visited terms are reconstructed from the indexes on demand. The arena also keeps
 * the best derived node per {@link RelationKey}.
 * </p>
 * Not thread-safe; each inference run owns its arena.
 */
public final class DerivationArena {

    public static final int NONE = -1;

    /**
     * @param left first parent, or {@link #NONE} for base nodes
     * @param right second parent, or {@link #NONE} for base and unary nodes
     * @param baseRelationId stored relation wrapped by a base node
     * @param rule rule that produced the node; null for a base node in stored direction
     * @param earliestCreated smallest creation time over the constituent relations, epoch millis
     * @param length number of constituent relations
     */
    public record Node(String sourceId,
                       String targetId,
                       String relationType,
                       double confidence,
                       int left,
                       int right,
                       String baseRelationId,
                       InferenceRule rule,
                       long earliestCreated,
                       int length) {

        public boolean isBase() {
            return left == NONE;
        }
    }

    private final RelationTypeRegistry registry;
    private final List<Node> nodes = new ArrayList<>();
    private final Map<String, List<Integer>> baseBySource = new HashMap<>();
    private final Map<String, Integer> baseViews = new HashMap<>();
    private final Map<RelationKey, Integer> best = new LinkedHashMap<>();

    public DerivationArena(RelationTypeRegistry registry) {
        this.registry = registry;
    }

    public int size() {
        return nodes.size();
    }

    public Node node(int index) {
        return nodes.get(index);
    }

    /**
     * Adds a stored relation as a base fact, optionally reversed. Adding the same view twice returns the
     * existing index.
     */
    public int addBase(Relation relation, boolean reversed, InferenceRule viaRule) {
        String identity = relation.getId() != null
                ? relation.getId()
                : RelationKey.of(relation.getSourceId(), relation.getRelationType(), relation.getTargetId(), false).asString();
        String viewKey = identity + (reversed ? "|r" : "|f");
        Integer existing = baseViews.get(viewKey);
        if (existing != null) return existing;

        String src = reversed ? relation.getTargetId() : relation.getSourceId();
        String dst = reversed ? relation.getSourceId() : relation.getTargetId();
        long created = relation.getCreatedAt() != null ? relation.getCreatedAt().getTime() : Long.MAX_VALUE;
        int idx = append(new Node(src, dst, relation.getRelationType(), relation.getConfidence(),
                NONE, NONE, identity, viaRule, created, 1));
        baseViews.put(viewKey, idx);
        baseBySource.computeIfAbsent(src, k -> new ArrayList<>()).add(idx);
        return idx;
    }

    /** Base nodes (stored direction and reversed views) starting at {@code termId}. */
    public List<Integer> baseFrom(String termId) {
        return baseBySource.getOrDefault(termId, List.of());
    }

    int deriveBinary(int left, int right, String relationType, double confidence, InferenceRule rule) {
        Node l = nodes.get(left);
        Node r = nodes.get(right);
        return append(new Node(l.sourceId(), r.targetId(), relationType, confidence, left, right, null, rule,
                Math.min(l.earliestCreated(), r.earliestCreated()), l.length() + r.length()));
    }

    int deriveReversed(int parent, String relationType, double confidence, InferenceRule rule) {
        Node p = nodes.get(parent);
        return append(new Node(p.targetId(), p.sourceId(), relationType, confidence, parent, NONE, null, rule,
                p.earliestCreated(), p.length()));
    }

    private int append(Node n) {
        nodes.add(n);
        return nodes.size() - 1;
    }

    // --- reconstruction -------------------------------------------------------------------------

    /** Constituent stored relation ids in derivation order. */
    public List<String> derivationPath(int index) {
        List<String> out = new ArrayList<>();
        collectPath(index, out);
        return out;
    }

    private void collectPath(int index, List<String> out) {
        Node n = nodes.get(index);
        if (n.isBase()) {
            out.add(n.baseRelationId());
            return;
        }
        collectPath(n.left(), out);
        if (n.right() != NONE) collectPath(n.right(), out);
    }

    /** Rules applied while building the node, in the order they were applied. */
    public List<String> rulePath(int index) {
        List<String> out = new ArrayList<>();
        collectRules(index, out);
        return out;
    }

    private void collectRules(int index, List<String> out) {
        Node n = nodes.get(index);
        if (!n.isBase()) {
            collectRules(n.left(), out);
            if (n.right() != NONE) collectRules(n.right(), out);
        }
        if (n.rule() != null) out.add(n.rule().name());
    }

    /** Terms visited from the node's source to its target. */
    public List<String> terms(int index) {
        Node n = nodes.get(index);
        if (n.isBase()) {
            return new ArrayList<>(List.of(n.sourceId(), n.targetId()));
        }
        if (n.right() == NONE) {
            List<String> t = terms(n.left());
            Collections.reverse(t);
            return t;
        }
        List<String> t = terms(n.left());
        List<String> tail = terms(n.right());
        t.addAll(tail.subList(1, tail.size()));
        return t;
    }

    // --- best-per-key table ---------------------------------------------------------------------

    RelationKey keyOf(Node n) {
        return RelationKey.of(n.sourceId(), n.relationType(), n.targetId(), registry.isSymmetric(n.relationType()));
    }

    /** Best derived node currently held for the key, or {@link #NONE}. */
    int bestFor(RelationKey key) {
        return best.getOrDefault(key, NONE);
    }

    /**
     * Records {@code index} as the derivation of its key if it beats the current holder.
     *
     * @return true if the node became the best derivation of its key
     */
    boolean offer(int index) {
        RelationKey key = keyOf(nodes.get(index));
        Integer current = best.get(key);
        if (current == null || isBetter(index, current)) {
            best.put(key, index);
            return true;
        }
        return false;
    }

    /**
     * Highest confidence wins, then the shorter path, then the earliest created constituent; the
     * lexicographically smaller path breaks remaining ties so repeated runs pick the same derivation.
     */
    boolean isBetter(int a, int b) {
        Node x = nodes.get(a);
        Node y = nodes.get(b);
        int c = Double.compare(x.confidence(), y.confidence());
        if (c != 0) return c > 0;
        if (x.length() != y.length()) return x.length() < y.length();
        if (x.earliestCreated() != y.earliestCreated()) return x.earliestCreated() < y.earliestCreated();
        return String.join(",", derivationPath(a)).compareTo(String.join(",", derivationPath(b))) < 0;
    }

    public Collection<Integer> bestNodes() {
        return Collections.unmodifiableCollection(best.values());
    }

    public CandidateRelation toCandidate(int index) {
        Node n = nodes.get(index);
        return new CandidateRelation(n.sourceId(), n.targetId(), n.relationType(), n.confidence(),
                derivationPath(index), rulePath(index), null);
    }
}
