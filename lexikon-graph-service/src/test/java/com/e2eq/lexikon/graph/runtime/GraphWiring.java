package com.e2eq.lexikon.graph.runtime;

import com.e2eq.lexikon.graph.backend.BackendSelector;
import com.e2eq.lexikon.graph.backend.RelationStoreMigrator;
import com.e2eq.lexikon.graph.backend.ReplicatedRelationStore;
import com.e2eq.lexikon.graph.core.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The object graph {@link GraphCoreProducers} builds, assembled by hand over in-memory stores.
 */
public class GraphWiring {

    public final InferenceSettings settings;
    public final RelationTypeRegistry registry;
    public final InMemoryRelationStore primary;
    public final InMemoryRelationStore replica;
    public final ReplicatedRelationStore store;
    public final InferenceOrchestrator orchestrator;
    public final RelationService relationService;
    public final ReviewQueue reviewQueue;
    public final BulkReinferenceJob bulkJob;

    public GraphWiring(InferenceSettings settings, boolean withReplica) {
        this.settings = settings;
        try {
            this.registry = new YamlRelationTypeLoader().loadDefault();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        AtomicInteger seq = new AtomicInteger();
        this.primary = new InMemoryRelationStore(registry, () -> String.format("r%03d", seq.incrementAndGet()));
        this.replica = withReplica ? new InMemoryRelationStore(registry) : null;
        this.store = new ReplicatedRelationStore(primary, replica, settings.replicaMaxErrorRate(),
                settings.replicaWindow());
        this.orchestrator = new InferenceOrchestrator(store, new RuleEngine(registry, settings), settings);
        this.relationService = new RelationService(store, orchestrator, TermDirectory.permissive(), settings);
        this.reviewQueue = new ReviewQueue(store);
        this.bulkJob = new BulkReinferenceJob(store, orchestrator, new InMemoryCheckpointStore(),
                settings.bulkChunkSize());
    }

    public static GraphWiring inMemory() {
        return new GraphWiring(InferenceSettings.defaults(), false);
    }

    public GraphBackendService backendService() {
        GraphBackendService service = new GraphBackendService();
        service.store = store;
        service.selector = new BackendSelector(settings);
        service.migrator = new RelationStoreMigrator(2);
        return service;
    }

    public ReinferenceRunner reinferenceRunner() {
        ReinferenceRunner runner = new ReinferenceRunner();
        runner.job = bulkJob;
        return runner;
    }

    /** Cat is_a Mammal is_a Animal, both asserted at 1.0. */
    public GraphWiring withTaxonomy() {
        relationService.createRelation("Cat", "Mammal", "is_a", 1.0, "tester", null);
        relationService.createRelation("Mammal", "Animal", "is_a", 1.0, "tester", null);
        return this;
    }
}
