package com.e2eq.lexikon.graph.runtime;

import com.e2eq.lexikon.graph.backend.BackendSelector;
import com.e2eq.lexikon.graph.backend.ReplicatedRelationStore;
import com.e2eq.lexikon.graph.backend.RelationStoreMigrator;
import com.e2eq.lexikon.graph.core.*;
import com.e2eq.lexikon.graph.mongo.MongoCheckpointStore;
import com.e2eq.lexikon.graph.mongo.MongoRelationStore;
import com.e2eq.lexikon.graph.neo4j.Neo4jRelationStore;
import com.e2eq.lexikon.graph.exceptions.StoreUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import io.quarkus.arc.DefaultBean;
import io.quarkus.logging.Log;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Wires the CDI-free graph core into the application: settings and relation types from configuration,
 * the primary store with its optional Neo4j replica, and the services built on top of them.
 */
@ApplicationScoped
public class GraphCoreProducers {

    public static final String STORE_MEMORY = "memory";
    public static final String STORE_MONGO = "mongo";

    @Inject
    MongoClient mongoClient;

    @Inject
    ObjectMapper objectMapper;

    private Neo4jRelationStore graphReplica;

    @Produces
    @DefaultBean
    @Singleton
    public InferenceSettings inferenceSettings() {
        InferenceSettings settings = readSettings(ConfigProvider.getConfig());
        Log.infof("GraphCoreProducers: inference settings %s", settings);
        return settings;
    }

    static InferenceSettings readSettings(Config config) {
        InferenceSettings d = InferenceSettings.defaults();
        return new InferenceSettings(
                config.getOptionalValue("lexikon.graph.decay", Double.class).orElse(d.decay()),
                config.getOptionalValue("lexikon.graph.default-max-depth", Integer.class).orElse(d.defaultMaxDepth()),
                config.getOptionalValue("lexikon.graph.max-depth-limit", Integer.class).orElse(d.maxDepthLimit()),
                config.getOptionalValue("lexikon.graph.min-confidence", Double.class).orElse(d.minConfidence()),
                config.getOptionalValue("lexikon.graph.edge-threshold", Long.class).orElse(d.edgeThreshold()),
                config.getOptionalValue("lexikon.graph.latency-ratio", Double.class).orElse(d.latencyRatio()),
                config.getOptionalValue("lexikon.graph.benchmark.samples", Integer.class).orElse(d.benchmarkSamples()),
                config.getOptionalValue("lexikon.graph.benchmark.depth", Integer.class).orElse(d.benchmarkDepth()),
                config.getOptionalValue("lexikon.graph.replica.max-error-rate", Double.class)
                        .orElse(d.replicaMaxErrorRate()),
                config.getOptionalValue("lexikon.graph.replica.window", Integer.class).orElse(d.replicaWindow()),
                config.getOptionalValue("lexikon.graph.bulk.chunk-size", Integer.class).orElse(d.bulkChunkSize()),
                config.getOptionalValue("lexikon.graph.verify-terms", Boolean.class).orElse(d.verifyTerms()));
    }

    @Produces
    @DefaultBean
    @Singleton
    public RelationTypeRegistry relationTypeRegistry() {
        YamlRelationTypeLoader loader = new YamlRelationTypeLoader();
        Optional<Path> path = resolveYamlPath();
        try {
            RelationTypeRegistry registry;
            if (path.isPresent() && Files.exists(path.get())) {
                Log.infof("GraphCoreProducers: loading relation types from %s", path.get());
                registry = loader.loadFromPath(path.get());
            } else {
                registry = loader.loadDefault();
            }
            Log.infof("GraphCoreProducers: %d relation type(s) registered", registry.types().size());
            return registry;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read relation types", e);
        }
    }

    private Optional<Path> resolveYamlPath() {
        Optional<String> configured = ConfigProvider.getConfig()
                .getOptionalValue("lexikon.graph.relation-types.path", String.class);
        if (configured.isPresent() && !configured.get().isBlank()) return Optional.of(Path.of(configured.get()));
        String env = System.getenv("LEXIKON_RELATION_TYPES");
        if (env != null && !env.isBlank()) return Optional.of(Path.of(env));
        Path conventional = Path.of("config", "relation-types.yaml");
        if (Files.exists(conventional)) return Optional.of(conventional);
        return Optional.empty();
    }

    /** Accepts every term id; applications with a term catalogue provide their own bean. */
    @Produces
    @DefaultBean
    @Singleton
    public TermDirectory termDirectory() {
        return TermDirectory.permissive();
    }

    @Produces
    @Singleton
    public ReplicatedRelationStore relationStore(RelationTypeRegistry registry, InferenceSettings settings) {
        RelationStore primary = STORE_MONGO.equals(storeKind())
                ? new MongoRelationStore(mongoDatabase().getCollection(
                        config("lexikon.graph.mongo.collection.relations", "relations")), registry)
                : new InMemoryRelationStore(registry);
        Log.infof("GraphCoreProducers: primary relation store is %s", primary.getClass().getSimpleName());

        Optional<String> neo4jUri = ConfigProvider.getConfig().getOptionalValue("lexikon.graph.neo4j.uri", String.class);
        if (neo4jUri.isPresent() && !neo4jUri.get().isBlank()) {
            try {
                graphReplica = Neo4jRelationStore.connect(neo4jUri.get(),
                        config("lexikon.graph.neo4j.username", "neo4j"),
                        config("lexikon.graph.neo4j.password", "password"),
                        registry, objectMapper);
            } catch (StoreUnavailableException | IllegalArgumentException e) {
                Log.warnf("GraphCoreProducers: graph replica unavailable, continuing without it: %s", e.getMessage());
                graphReplica = null;
            }
        }
        return new ReplicatedRelationStore(primary, graphReplica, settings.replicaMaxErrorRate(),
                settings.replicaWindow());
    }

    @Produces
    @Singleton
    public CheckpointStore checkpointStore() {
        if (STORE_MONGO.equals(storeKind())) {
            return new MongoCheckpointStore(mongoDatabase().getCollection(
                    config("lexikon.graph.mongo.collection.checkpoints", "reinference_jobs")));
        }
        return new InMemoryCheckpointStore();
    }

    @Produces
    @Singleton
    public RuleEngine ruleEngine(RelationTypeRegistry registry, InferenceSettings settings) {
        return new RuleEngine(registry, settings);
    }

    @Produces
    @Singleton
    public InferenceOrchestrator inferenceOrchestrator(ReplicatedRelationStore store, RuleEngine engine,
                                                      InferenceSettings settings) {
        return new InferenceOrchestrator(store, engine, settings);
    }

    @Produces
    @Singleton
    public RelationService relationService(ReplicatedRelationStore store, InferenceOrchestrator orchestrator,
                                           TermDirectory terms, InferenceSettings settings) {
        return new RelationService(store, orchestrator, terms, settings);
    }

    @Produces
    @Singleton
    public ReviewQueue reviewQueue(ReplicatedRelationStore store) {
        return new ReviewQueue(store);
    }

    @Produces
    @Singleton
    public BulkReinferenceJob bulkReinferenceJob(ReplicatedRelationStore store, InferenceOrchestrator orchestrator,
                                                 CheckpointStore checkpoints, InferenceSettings settings) {
        return new BulkReinferenceJob(store, orchestrator, checkpoints, settings.bulkChunkSize());
    }

    @Produces
    @Singleton
    public BackendSelector backendSelector(InferenceSettings settings) {
        return new BackendSelector(settings);
    }

    @Produces
    @Singleton
    public RelationStoreMigrator relationStoreMigrator() {
        return new RelationStoreMigrator(ConfigProvider.getConfig()
                .getOptionalValue("lexikon.graph.migration.page-size", Integer.class).orElse(500));
    }

    @PreDestroy
    void close() {
        if (graphReplica != null) graphReplica.close();
    }

    private MongoDatabase mongoDatabase() {
        String database = ConfigProvider.getConfig()
                .getOptionalValue("quarkus.mongodb.database", String.class).orElse("lexikon");
        return mongoClient.getDatabase(database);
    }

    private static String storeKind() {
        return config("lexikon.graph.store", STORE_MEMORY);
    }

    private static String config(String name, String defaultValue) {
        return ConfigProvider.getConfig().getOptionalValue(name, String.class).orElse(defaultValue);
    }
}
