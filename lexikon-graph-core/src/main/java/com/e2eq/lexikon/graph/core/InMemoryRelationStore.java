package com.e2eq.lexikon.graph.core;

import com.e2eq.lexikon.graph.exceptions.RelationNotFoundException;
import org.jboss.logging.Logger;

import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Heap-backed {@link RelationStore} with sorted indexes by source, target, type and status.
 * <p>
 * A single read/write lock makes each insert-or-merge atomic per key and gives readers a consistent view.
 * Used by unit tests and by deployments that do not configure a database.
 * </p>
 */
public class InMemoryRelationStore implements RelationStore {
    private static final Logger LOG = Logger.getLogger(InMemoryRelationStore.class);

    private final RelationTypeRegistry registry;
    private final Supplier<String> idGenerator;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final NavigableMap<String, Relation> byId = new TreeMap<>();
    private final Map<String, String> idByKey = new HashMap<>();
    // term -> type -> relation ids
    private final NavigableMap<String, NavigableMap<String, NavigableSet<String>>> bySource = new TreeMap<>();
    private final NavigableMap<String, NavigableMap<String, NavigableSet<String>>> byTarget = new TreeMap<>();
    // constituent relation id -> ids of inferred relations whose derivation uses it
    private final Map<String, Set<String>> derivedFrom = new HashMap<>();
    private final Map<Relation.Status, NavigableSet<String>> byStatus = new EnumMap<>(Relation.Status.class);
    // term -> number of relations referencing it
    private final NavigableMap<String, Integer> termRefs = new TreeMap<>();

    public InMemoryRelationStore(RelationTypeRegistry registry) {
        this(registry, () -> UUID.randomUUID().toString());
    }

    public InMemoryRelationStore(RelationTypeRegistry registry, Supplier<String> idGenerator) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    @Override
    public RelationTypeRegistry registry() {
        return registry;
    }

    @Override
    public PutResult put(Relation relation) {
        RelationValidator.validate(relation, registry);
        lock.writeLock().lock();
        try {
            return putLocked(relation);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<PutResult> putAll(List<Relation> relations) {
        for (Relation r : relations) {
            RelationValidator.validate(r, registry);
        }
        lock.writeLock().lock();
        try {
            List<PutResult> results = new ArrayList<>(relations.size());
            for (Relation r : relations) {
                results.add(putLocked(r));
            }
            return results;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private PutResult putLocked(Relation relation) {
        String key = RelationKey.of(relation, registry).asString();
        String existingId = idByKey.get(key);
        if (existingId == null) {
            Relation stored = relation.copy();
            if (stored.getId() == null) stored.setId(idGenerator.get());
            if (stored.getCreatedAt() == null) stored.setCreatedAt(new Date());
            index(stored, key);
            return PutResult.created(stored.getId());
        }
        Relation existing = byId.get(existingId);
        MergePolicy.Action action = MergePolicy.decide(existing, relation);
        unindexDerivation(existing);
        unindexStatus(existing);
        PutResult result = MergePolicy.apply(action, existing, relation);
        indexStatus(existing);
        indexDerivation(existing);
        if (LOG.isDebugEnabled()) {
            LOG.debugf("put %s resolved as %s against %s", relation, action, existingId);
        }
        return result;
    }

    @Override
    public Optional<Relation> get(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byId.get(id)).map(Relation::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Relation> find(String sourceId, String targetId, String relationType) {
        boolean symmetric = registry.isSymmetric(relationType);
        String key = RelationKey.of(sourceId, relationType, targetId, symmetric).asString();
        lock.readLock().lock();
        try {
            return Optional.ofNullable(idByKey.get(key)).map(byId::get).map(Relation::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Relation> getOutgoing(String termId, String relationType) {
        lock.readLock().lock();
        try {
            return copies(lookup(bySource, termId, relationType));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Relation> getIncoming(String termId, String relationType) {
        lock.readLock().lock();
        try {
            return copies(lookup(byTarget, termId, relationType));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Relation> neighborhood(Collection<String> seedTermIds, int depth) {
        if (depth <= 0 || seedTermIds.isEmpty()) return List.of();
        lock.readLock().lock();
        try {
            Map<String, Relation> found = new LinkedHashMap<>();
            Set<String> visited = new HashSet<>(seedTermIds);
            Set<String> frontier = new LinkedHashSet<>(seedTermIds);
            for (int hop = 0; hop < depth && !frontier.isEmpty(); hop++) {
                Set<String> next = new LinkedHashSet<>();
                for (String term : frontier) {
                    for (String id : lookup(bySource, term, null)) {
                        Relation r = byId.get(id);
                        if (!r.isConfirmed()) continue;
                        found.putIfAbsent(id, r);
                        if (visited.add(r.getTargetId())) next.add(r.getTargetId());
                    }
                    for (String id : lookup(byTarget, term, null)) {
                        Relation r = byId.get(id);
                        if (!r.isConfirmed() || !registry.isSymmetric(r.getRelationType())) continue;
                        found.putIfAbsent(id, r);
                        if (visited.add(r.getSourceId())) next.add(r.getSourceId());
                    }
                }
                frontier = next;
            }
            List<Relation> out = new ArrayList<>(found.size());
            for (Relation r : found.values()) out.add(r.copy());
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Relation> delete(String id) {
        lock.writeLock().lock();
        try {
            Relation removed = byId.get(id);
            if (removed == null) throw new RelationNotFoundException(id);
            unindex(removed);
            return copies(derivedFrom.getOrDefault(id, Set.of()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Relation> findDerivedFrom(String relationId) {
        lock.readLock().lock();
        try {
            return copies(derivedFrom.getOrDefault(relationId, Set.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void update(Relation relation) {
        RelationValidator.validate(relation, registry);
        lock.writeLock().lock();
        try {
            Relation existing = byId.get(relation.getId());
            if (existing == null) throw new RelationNotFoundException(relation.getId());
            unindexDerivation(existing);
            unindexStatus(existing);
            existing.setStatus(relation.getStatus());
            existing.setProvenance(relation.getProvenance());
            existing.setConfidence(relation.getConfidence());
            existing.setDerivationPath(relation.getDerivationPath());
            existing.setRulePath(relation.getRulePath());
            existing.setMetadata(relation.getMetadata());
            indexStatus(existing);
            indexDerivation(existing);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Relation> findByStatus(Relation.Status status, int limit) {
        lock.readLock().lock();
        try {
            List<Relation> out = new ArrayList<>();
            for (String id : byStatus.getOrDefault(status, Collections.emptyNavigableSet())) {
                if (out.size() >= limit) break;
                out.add(byId.get(id).copy());
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long count() {
        lock.readLock().lock();
        try {
            return byId.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Relation> page(String afterId, int limit) {
        lock.readLock().lock();
        try {
            NavigableMap<String, Relation> tail = afterId == null ? byId : byId.tailMap(afterId, false);
            List<Relation> out = new ArrayList<>(Math.min(limit, tail.size()));
            for (Relation r : tail.values()) {
                if (out.size() >= limit) break;
                out.add(r.copy());
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> termIds(String afterTermId, int limit) {
        lock.readLock().lock();
        try {
            NavigableMap<String, Integer> tail = afterTermId == null ? termRefs : termRefs.tailMap(afterTermId, false);
            List<String> out = new ArrayList<>();
            for (String t : tail.keySet()) {
                if (out.size() >= limit) break;
                out.add(t);
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void restore(Relation relation) {
        RelationValidator.validate(relation, registry);
        if (relation.getId() == null) {
            throw new IllegalArgumentException("restore requires a relation id");
        }
        String key = RelationKey.of(relation, registry).asString();
        lock.writeLock().lock();
        try {
            Relation sameId = byId.get(relation.getId());
            if (sameId != null) unindex(sameId);
            String keyOwner = idByKey.get(key);
            if (keyOwner != null && !keyOwner.equals(relation.getId())) {
                unindex(byId.get(keyOwner));
            }
            index(relation.copy(), key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // --- indexing -------------------------------------------------------------------------------

    private void index(Relation r, String key) {
        byId.put(r.getId(), r);
        idByKey.put(key, r.getId());
        bySource.computeIfAbsent(r.getSourceId(), k -> new TreeMap<>())
                .computeIfAbsent(r.getRelationType(), k -> new TreeSet<>()).add(r.getId());
        byTarget.computeIfAbsent(r.getTargetId(), k -> new TreeMap<>())
                .computeIfAbsent(r.getRelationType(), k -> new TreeSet<>()).add(r.getId());
        termRefs.merge(r.getSourceId(), 1, Integer::sum);
        termRefs.merge(r.getTargetId(), 1, Integer::sum);
        indexStatus(r);
        indexDerivation(r);
    }

    private void unindex(Relation r) {
        byId.remove(r.getId());
        idByKey.remove(RelationKey.of(r, registry).asString());
        removeFrom(bySource, r.getSourceId(), r.getRelationType(), r.getId());
        removeFrom(byTarget, r.getTargetId(), r.getRelationType(), r.getId());
        termRefs.computeIfPresent(r.getSourceId(), (k, v) -> v > 1 ? v - 1 : null);
        termRefs.computeIfPresent(r.getTargetId(), (k, v) -> v > 1 ? v - 1 : null);
        unindexStatus(r);
        unindexDerivation(r);
    }

    private void indexStatus(Relation r) {
        byStatus.computeIfAbsent(r.getStatus(), k -> new TreeSet<>()).add(r.getId());
    }

    private void unindexStatus(Relation r) {
        NavigableSet<String> ids = byStatus.get(r.getStatus());
        if (ids != null) ids.remove(r.getId());
    }

    private void indexDerivation(Relation r) {
        if (!r.isInferred()) return;
        for (String constituent : r.getDerivationPath()) {
            derivedFrom.computeIfAbsent(constituent, k -> new LinkedHashSet<>()).add(r.getId());
        }
    }

    private void unindexDerivation(Relation r) {
        for (String constituent : r.getDerivationPath()) {
            Set<String> ids = derivedFrom.get(constituent);
            if (ids == null) continue;
            ids.remove(r.getId());
            if (ids.isEmpty()) derivedFrom.remove(constituent);
        }
    }

    private static void removeFrom(NavigableMap<String, NavigableMap<String, NavigableSet<String>>> index,
                                   String term, String type, String id) {
        NavigableMap<String, NavigableSet<String>> byType = index.get(term);
        if (byType == null) return;
        NavigableSet<String> ids = byType.get(type);
        if (ids == null) return;
        ids.remove(id);
        if (ids.isEmpty()) byType.remove(type);
        if (byType.isEmpty()) index.remove(term);
    }

    private static Collection<String> lookup(NavigableMap<String, NavigableMap<String, NavigableSet<String>>> index,
                                             String term, String type) {
        NavigableMap<String, NavigableSet<String>> byType = index.get(term);
        if (byType == null) return List.of();
        if (type != null) return byType.getOrDefault(type, Collections.emptyNavigableSet());
        List<String> all = new ArrayList<>();
        for (NavigableSet<String> ids : byType.values()) all.addAll(ids);
        return all;
    }

    private List<Relation> copies(Collection<String> ids) {
        List<Relation> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            Relation r = byId.get(id);
            if (r != null) out.add(r.copy());
        }
        return out;
    }
}
