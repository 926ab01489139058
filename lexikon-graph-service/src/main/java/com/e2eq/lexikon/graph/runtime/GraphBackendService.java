package com.e2eq.lexikon.graph.runtime;

import com.e2eq.lexikon.graph.backend.BackendDecision;
import com.e2eq.lexikon.graph.backend.BackendSelector;
import com.e2eq.lexikon.graph.backend.MigrationReport;
import com.e2eq.lexikon.graph.backend.RelationStoreMigrator;
import com.e2eq.lexikon.graph.backend.ReplicatedRelationStore;
import com.e2eq.lexikon.graph.core.RelationStore;
import com.e2eq.lexikon.graph.exceptions.StoreUnavailableException;
import io.quarkus.logging.Log;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the current backend decision, re-evaluates it on demand, copies the primary store into the graph
 * replica and rolls back from the replica to the primary.
 */
@ApplicationScoped
public class GraphBackendService {

    @Inject
    ReplicatedRelationStore store;

    @Inject
    BackendSelector selector;

    @Inject
    RelationStoreMigrator migrator;

    @ConfigProperty(name = "lexikon.graph.backend.evaluate-on-start", defaultValue = "true")
    boolean evaluateOnStart;

    private final AtomicReference<BackendDecision> current = new AtomicReference<>(
            BackendDecision.relational(0L, "not evaluated yet"));

    void onStart(@Observes StartupEvent event) {
        if (evaluateOnStart) {
            evaluate();
        }
    }

    public BackendDecision current() {
        return current.get();
    }

    public synchronized BackendDecision evaluate() {
        RelationStore graph = store.isReplicaEnabled() ? store.replica().orElse(null) : null;
        BackendDecision decision = selector.evaluate(store.primary(), graph);
        store.applyDecision(decision);
        current.set(decision);
        return decision;
    }

    /**
     * Copies the primary into the replica, resuming after {@code afterId} when given. A completed migration
     * re-enables a replica that was disabled for errors.
     *
     * @throws StoreUnavailableException when no graph replica is configured
     */
    public synchronized MigrationReport migrate(String afterId) {
        RelationStore replica = store.replica()
                .orElseThrow(() -> new StoreUnavailableException("No graph replica is configured"));
        MigrationReport report = migrator.migrate(store.primary(), replica, afterId);
        if (report.completed() && !store.isReplicaEnabled()) {
            store.enableReplica();
            Log.infof("graph replica re-enabled after migration of %d relation(s)", report.copied());
        }
        return report;
    }

    /**
     * Moves traversal reads back to the primary, then imports every replica row the primary lacks. Rows the
     * primary already holds are left untouched; reads keep being served by the primary while the import runs.
     *
     * @throws StoreUnavailableException when no graph replica is configured
     */
    public synchronized MigrationReport rollback(String afterId) {
        RelationStore replica = store.replica()
                .orElseThrow(() -> new StoreUnavailableException("No graph replica is configured"));
        BackendDecision decision = BackendDecision.relational(store.primary().count(), "rolled back from graph replica");
        store.applyDecision(decision);
        current.set(decision);
        MigrationReport report = migrator.importMissing(replica, store.primary(), afterId);
        Log.infof("rollback imported %d relation(s) from the graph replica, %d already present",
                report.copied(), report.skipped());
        return report;
    }
}
