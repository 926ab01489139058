package com.e2eq.lexikon.graph.backend;

import com.e2eq.lexikon.graph.core.*;
import com.e2eq.lexikon.graph.exceptions.RelationNotFoundException;
import org.jboss.logging.Logger;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * A primary store that is the source of truth plus an optional graph replica kept as a read optimization.
 * <p>
 * Writes go to the primary first and the resulting rows are mirrored into the replica verbatim. Replica failures
 * never fail the caller; they are counted over a sliding window of recent replica operations, and once the
 * failure rate exceeds the configured maximum the replica is disabled and every read is served by the primary.
 * Traversal reads go to the replica only while it is enabled and a {@link BackendDecision} selected it.
 * </p>
 */
public class ReplicatedRelationStore implements RelationStore {
    private static final Logger LOG = Logger.getLogger(ReplicatedRelationStore.class);

    private final RelationStore primary;
    private final RelationStore replica;
    private final double maxErrorRate;
    private final boolean[] window;
    private int windowPos;
    private int windowFailures;
    private final AtomicBoolean replicaEnabled;
    private volatile boolean readFromReplica;

    public ReplicatedRelationStore(RelationStore primary, RelationStore replica, double maxErrorRate, int windowSize) {
        this.primary = primary;
        this.replica = replica;
        this.maxErrorRate = maxErrorRate;
        this.window = new boolean[Math.max(1, windowSize)];
        this.replicaEnabled = new AtomicBoolean(replica != null);
    }

    public RelationStore primary() {
        return primary;
    }

    public Optional<RelationStore> replica() {
        return Optional.ofNullable(replica);
    }

    public boolean isReplicaEnabled() {
        return replicaEnabled.get();
    }

    public boolean isReadingFromReplica() {
        return readFromReplica && replicaEnabled.get();
    }

    public void applyDecision(BackendDecision decision) {
        readFromReplica = decision.useGraph() && replica != null;
        LOG.infof("traversal reads now served by %s", isReadingFromReplica() ? "graph replica" : "primary");
    }

    public void disableReplica(String reason) {
        if (replicaEnabled.compareAndSet(true, false)) {
            LOG.warnf("graph replica disabled: %s; all reads served by primary", reason);
        }
    }

    /** Re-enables a replica after it has been resynchronized, e.g. by {@link RelationStoreMigrator}. */
    public synchronized void enableReplica() {
        if (replica == null) return;
        Arrays.fill(window, false);
        windowFailures = 0;
        windowPos = 0;
        replicaEnabled.set(true);
    }

    public synchronized double replicaErrorRate() {
        return (double) windowFailures / window.length;
    }

    // --- writes ---------------------------------------------------------------------------------

    @Override
    public RelationTypeRegistry registry() {
        return primary.registry();
    }

    @Override
    public PutResult put(Relation relation) {
        PutResult result = primary.put(relation);
        if (!result.isSkipped()) mirrorRow(result.id());
        return result;
    }

    @Override
    public List<PutResult> putAll(List<Relation> relations) {
        List<PutResult> results = primary.putAll(relations);
        for (PutResult r : results) {
            if (!r.isSkipped()) mirrorRow(r.id());
        }
        return results;
    }

    @Override
    public List<Relation> delete(String id) {
        List<Relation> affected = primary.delete(id);
        mirror("delete " + id, () -> {
            try {
                replica.delete(id);
            } catch (RelationNotFoundException e) {
                // never reached the replica, e.g. written while it was disabled
                LOG.debugf("graph replica had no row %s to delete", id);
            }
        });
        return affected;
    }

    @Override
    public void update(Relation relation) {
        primary.update(relation);
        mirrorRow(relation.getId());
    }

    @Override
    public void restore(Relation relation) {
        primary.restore(relation);
        mirror("restore " + relation.getId(), () -> replica.restore(relation));
    }

    private void mirrorRow(String id) {
        mirror("mirror " + id, () -> primary.get(id).ifPresent(replica::restore));
    }

    private void mirror(String op, Runnable action) {
        if (!replicaEnabled.get()) return;
        try {
            action.run();
            record(true);
        } catch (RuntimeException e) {
            LOG.warnf("graph replica %s failed: %s", op, e.getMessage());
            record(false);
        }
    }

    private void record(boolean success) {
        double rate;
        synchronized (this) {
            if (window[windowPos]) windowFailures--;
            window[windowPos] = !success;
            if (!success) windowFailures++;
            windowPos = (windowPos + 1) % window.length;
            rate = (double) windowFailures / window.length;
        }
        if (rate > maxErrorRate) {
            disableReplica(String.format("error rate %.3f exceeds %.3f", rate, maxErrorRate));
        }
    }

    // --- reads ----------------------------------------------------------------------------------

    private <T> T read(String op, Supplier<T> fromReplica, Supplier<T> fromPrimary) {
        if (isReadingFromReplica()) {
            try {
                T value = fromReplica.get();
                record(true);
                return value;
            } catch (RuntimeException e) {
                LOG.warnf("graph replica %s failed, serving from primary: %s", op, e.getMessage());
                record(false);
            }
        }
        return fromPrimary.get();
    }

    @Override
    public Optional<Relation> get(String id) {
        return primary.get(id);
    }

    @Override
    public Optional<Relation> find(String sourceId, String targetId, String relationType) {
        return primary.find(sourceId, targetId, relationType);
    }

    @Override
    public List<Relation> getOutgoing(String termId, String relationType) {
        return read("getOutgoing", () -> replica.getOutgoing(termId, relationType),
                () -> primary.getOutgoing(termId, relationType));
    }

    @Override
    public List<Relation> getIncoming(String termId, String relationType) {
        return read("getIncoming", () -> replica.getIncoming(termId, relationType),
                () -> primary.getIncoming(termId, relationType));
    }

    @Override
    public List<Relation> neighborhood(Collection<String> seedTermIds, int depth) {
        return read("neighborhood", () -> replica.neighborhood(seedTermIds, depth),
                () -> primary.neighborhood(seedTermIds, depth));
    }

    @Override
    public List<Relation> findDerivedFrom(String relationId) {
        return primary.findDerivedFrom(relationId);
    }

    @Override
    public List<Relation> findByStatus(Relation.Status status, int limit) {
        return primary.findByStatus(status, limit);
    }

    @Override
    public long count() {
        return primary.count();
    }

    @Override
    public List<Relation> page(String afterId, int limit) {
        return primary.page(afterId, limit);
    }

    @Override
    public List<String> termIds(String afterTermId, int limit) {
        return primary.termIds(afterTermId, limit);
    }
}
