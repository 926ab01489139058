package com.e2eq.lexikon.graph.core;

import com.e2eq.lexikon.graph.exceptions.RelationNotFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence and indexed lookup of relations.
 * <p>
 * Every write is an atomic insert-or-merge keyed by {@link RelationKey}; implementations enforce the key
 * with a uniqueness constraint at the storage boundary rather than by check-then-insert. Reads return
 * detached copies.
 * </p>
 */
public interface RelationStore {

    RelationTypeRegistry registry();

    /**
     * Inserts a relation or merges it into the existing row with the same key.
     *
     * @throws com.e2eq.lexikon.graph.exceptions.InvalidRelationTypeException on unknown type,
     *         confidence outside [0,1] or a self-loop on a non-reflexive type
     * @throws com.e2eq.lexikon.graph.exceptions.StoreUnavailableException on backend failure
     */
    PutResult put(Relation relation);

    /**
     * Writes a batch so that a failure leaves none of the rows it created behind. The default
     * implementation compensates by deleting the rows it created before rethrowing; merges into
     * pre-existing rows are only ever confidence increases and are not undone.
     */
    default List<PutResult> putAll(List<Relation> relations) {
        List<PutResult> results = new ArrayList<>(relations.size());
        try {
            for (Relation r : relations) {
                results.add(put(r));
            }
        } catch (RuntimeException e) {
            for (PutResult done : results) {
                if (!done.isCreated()) continue;
                try {
                    delete(done.id());
                } catch (RuntimeException compensation) {
                    e.addSuppressed(compensation);
                }
            }
            throw e;
        }
        return results;
    }

    Optional<Relation> get(String id);

    /**
     * Direction-aware lookup: for symmetric types {@code (a, b)} and {@code (b, a)} find the same row.
     */
    Optional<Relation> find(String sourceId, String targetId, String relationType);

    default boolean exists(String sourceId, String targetId, String relationType) {
        return find(sourceId, targetId, relationType).isPresent();
    }

    /** Relations stored with {@code termId} as source; {@code relationType} null means any type. */
    List<Relation> getOutgoing(String termId, String relationType);

    /** Relations stored with {@code termId} as target; {@code relationType} null means any type. */
    List<Relation> getIncoming(String termId, String relationType);

    /**
     * All confirmed relations within {@code depth} hops of the seeds, following outgoing edges and
     * symmetric edges in either direction.
     */
    List<Relation> neighborhood(Collection<String> seedTermIds, int depth);

    /**
     * Deletes a relation.
     *
     * @return inferred relations whose derivation path references the deleted relation
     * @throws RelationNotFoundException if no relation has this id
     */
    List<Relation> delete(String id);

    /** Inferred relations whose derivation path references {@code relationId}. */
    List<Relation> findDerivedFrom(String relationId);

    /**
     * Replaces status, provenance, confidence, derivation and metadata of an existing relation.
     *
     * @throws RelationNotFoundException if no relation has this id
     */
    void update(Relation relation);

    List<Relation> findByStatus(Relation.Status status, int limit);

    long count();

    /** Relations ordered by id, strictly after {@code afterId} (null for the first page). */
    List<Relation> page(String afterId, int limit);

    /** Distinct term ids referenced by any relation, ordered, strictly after {@code afterTermId}. */
    List<String> termIds(String afterTermId, int limit);

    /**
     * Writes a relation verbatim, keeping its id, status, provenance and derivation. Replaying the
     * same relation is a no-op, so migrations can be re-run.
     */
    void restore(Relation relation);

    default Relation require(String id) {
        return get(id).orElseThrow(() -> new RelationNotFoundException(id));
    }
}
