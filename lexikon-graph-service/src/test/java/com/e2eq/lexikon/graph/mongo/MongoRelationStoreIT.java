package com.e2eq.lexikon.graph.mongo;

import com.e2eq.lexikon.graph.backend.ReplicatedRelationStore;
import com.e2eq.lexikon.graph.core.*;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.TestProfile;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
@TestProfile(MongoStoreProfile.class)
public class MongoRelationStoreIT {

    @Inject
    ReplicatedRelationStore store;

    @Inject
    RelationService relationService;

    @Inject
    InferenceOrchestrator orchestrator;

    private String p;

    @BeforeEach
    void prefix() {
        p = UUID.randomUUID().toString().substring(0, 8) + "-";
    }

    @Test
    void primaryIsMongo() {
        assertTrue(store.primary() instanceof MongoRelationStore);
    }

    @Test
    void duplicateKeyMergesIntoExistingRow() {
        PutResult first = relationService.createRelation(p + "Dog", p + "Mammal", "is_a", 0.6, "it", null);
        PutResult second = relationService.createRelation(p + "Dog", p + "Mammal", "is_a", 0.9, "it", null);

        assertTrue(first.isCreated());
        assertEquals(PutResult.Outcome.MERGED, second.outcome());
        assertEquals(first.id(), second.id());
        assertEquals(0.9, store.require(first.id()).getConfidence(), 1e-9);
    }

    @Test
    void symmetricKeyIsDirectionIndependent() {
        PutResult a = relationService.createRelation(p + "Dog", p + "Wolf", "related_to", 0.7, "it", null);
        PutResult b = relationService.createRelation(p + "Wolf", p + "Dog", "related_to", 0.8, "it", null);

        assertEquals(a.id(), b.id());
        assertTrue(store.find(p + "Wolf", p + "Dog", "related_to").isPresent());
    }

    @Test
    void neighborhoodIsBoundedByDepthAndCrossesSymmetricEdges() {
        relationService.createRelation(p + "A", p + "B", "is_a", 1.0, "it", null);
        relationService.createRelation(p + "B", p + "C", "is_a", 1.0, "it", null);
        relationService.createRelation(p + "C", p + "D", "is_a", 1.0, "it", null);
        relationService.createRelation(p + "X", p + "A", "related_to", 1.0, "it", null);

        assertEquals(2, store.neighborhood(List.of(p + "A"), 1).size());
        assertEquals(3, store.neighborhood(List.of(p + "A"), 2).size());
        assertEquals(4, store.neighborhood(List.of(p + "A"), 3).size());
    }

    @Test
    void inferenceAndCascadeAgainstMongo() {
        String catMammal = relationService.createRelation(p + "Cat", p + "Mammal", "is_a", 1.0, "it", null).id();
        relationService.createRelation(p + "Mammal", p + "Animal", "is_a", 1.0, "it", null);

        List<CandidateRelation> inferred = orchestrator.infer(p + "Cat", List.of(InferenceRule.TRANSITIVE), 2);
        assertEquals(1, inferred.size());
        assertEquals(0.9, inferred.get(0).confidence(), 1e-9);
        assertEquals(List.of(inferred.get(0).relationId()),
                store.findDerivedFrom(catMammal).stream().map(Relation::getId).collect(Collectors.toList()));

        InvalidationReport report = relationService.deleteRelation(catMammal);

        assertEquals(List.of(inferred.get(0).relationId()), report.retracted());
        assertTrue(store.get(inferred.get(0).relationId()).isEmpty());
    }

    @Test
    void concurrentPutsOfOneKeyCreateOneDocument() throws Exception {
        RelationStore mongo = store.primary();
        int threads = 4;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<PutResult> results = new ArrayList<>();
        try {
            List<Future<PutResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                double confidence = 0.5 + i * 0.1;
                String support = "s" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return mongo.put(Relation.inferred(p + "A", "is_a", p + "C", confidence, List.of(support),
                            List.of("TRANSITIVE"), "it"));
                }));
            }
            start.countDown();
            for (Future<PutResult> f : futures) results.add(f.get());
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, results.stream().filter(PutResult::isCreated).count());
        assertEquals(1, results.stream().map(PutResult::id).distinct().count());
        List<Relation> rows = mongo.getOutgoing(p + "A", "is_a");
        assertEquals(1, rows.size());
        assertEquals(0.8, rows.get(0).getConfidence(), 1e-9);
        assertEquals(List.of("s3"), rows.get(0).getDerivationPath());
        assertEquals(Relation.Status.PROVISIONAL, rows.get(0).getStatus());
    }
}
