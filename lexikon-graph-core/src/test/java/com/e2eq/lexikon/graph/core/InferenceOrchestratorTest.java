package com.e2eq.lexikon.graph.core;

import com.e2eq.lexikon.graph.exceptions.InferenceCancelledException;
import com.e2eq.lexikon.graph.exceptions.StoreUnavailableException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static com.e2eq.lexikon.graph.core.GraphFixtures.asserted;
import static org.junit.jupiter.api.Assertions.*;

public class InferenceOrchestratorTest {

    private final InferenceSettings settings = InferenceSettings.defaults();

    private InferenceOrchestrator orchestrator(RelationStore store) {
        return new InferenceOrchestrator(store, new RuleEngine(store.registry(), settings), settings);
    }

    @Test
    public void basicTransitiveChain() {
        InMemoryRelationStore store = GraphFixtures.store();
        String catMammal = store.put(asserted("Cat", "is_a", "Mammal", 1.0)).id();
        String mammalAnimal = store.put(asserted("Mammal", "is_a", "Animal", 1.0)).id();

        List<CandidateRelation> out = orchestrator(store).infer("Cat", List.of(InferenceRule.TRANSITIVE), 2);

        assertEquals(1, out.size());
        CandidateRelation c = out.get(0);
        assertEquals("Cat", c.sourceId());
        assertEquals("Animal", c.targetId());
        assertEquals("is_a", c.relationType());
        assertEquals(0.9, c.confidence(), 1e-9);
        assertEquals(List.of(catMammal, mammalAnimal), c.derivationPath());

        Relation stored = store.require(c.relationId());
        assertEquals(Relation.Status.PROVISIONAL, stored.getStatus());
        assertEquals(Relation.Provenance.INFERRED, stored.getProvenance());
        assertEquals(List.of(catMammal, mammalAnimal), stored.getDerivationPath());
        assertEquals(List.of("TRANSITIVE"), stored.getRulePath());
    }

    @Test
    public void inferenceIsIdempotent() {
        InMemoryRelationStore store = GraphFixtures.store();
        store.put(asserted("A", "is_a", "B", 1.0));
        store.put(asserted("B", "is_a", "C", 0.8));
        store.put(asserted("C", "is_a", "D", 0.7));
        InferenceOrchestrator orch = orchestrator(store);

        List<CandidateRelation> first = orch.infer("A", List.of(InferenceRule.TRANSITIVE), 3);
        long countAfterFirst = store.count();
        List<CandidateRelation> second = orch.infer("A", List.of(InferenceRule.TRANSITIVE), 3);

        assertEquals(2, first.size());
        assertEquals(first, second);
        assertEquals(countAfterFirst, store.count());
        assertEquals(2, store.findByStatus(Relation.Status.PROVISIONAL, 10).size());
    }

    @Test
    public void inferredConfidenceNeverExceedsItsWeakestConstituent() {
        InMemoryRelationStore store = GraphFixtures.store();
        store.put(asserted("A", "is_a", "B", 0.8));
        store.put(asserted("B", "is_a", "C", 0.7));
        store.put(asserted("C", "is_a", "D", 0.9));
        store.put(asserted("A", "equivalent_to", "E", 0.95));
        store.put(asserted("E", "part_of", "F", 0.6));

        List<CandidateRelation> out = orchestrator(store).infer("A", null, 4);

        assertFalse(out.isEmpty());
        for (CandidateRelation c : out) {
            double weakest = c.derivationPath().stream()
                    .mapToDouble(id -> store.require(id).getConfidence()).min().orElseThrow();
            assertTrue(c.confidence() <= weakest * settings.decay() + 1e-12, c + " exceeds " + weakest);
        }
        for (int i = 1; i < out.size(); i++) {
            assertTrue(out.get(i - 1).confidence() >= out.get(i).confidence(), "sorted by confidence descending");
        }
    }

    @Test
    public void cycleDoesNotProduceSelfLoop() {
        InMemoryRelationStore store = GraphFixtures.store();
        store.put(asserted("A", "is_a", "B", 1.0));
        store.put(asserted("B", "is_a", "C", 1.0));
        store.put(asserted("C", "is_a", "A", 1.0));

        List<CandidateRelation> out = orchestrator(store).infer("A", List.of(InferenceRule.TRANSITIVE), 3);

        assertEquals(List.of("A>C"), out.stream().map(c -> c.sourceId() + ">" + c.targetId()).collect(Collectors.toList()));
        for (Relation r : store.page(null, 100)) {
            assertNotEquals(r.getSourceId(), r.getTargetId());
        }
    }

    @Test
    public void confirmedDuplicatesAreDroppedFromTheResult() {
        InMemoryRelationStore store = GraphFixtures.store();
        store.put(asserted("A", "is_a", "B", 1.0));
        store.put(asserted("B", "is_a", "C", 1.0));
        store.put(asserted("A", "is_a", "C", 0.5));

        List<CandidateRelation> out = orchestrator(store).infer("A", List.of(InferenceRule.TRANSITIVE), 2);

        assertTrue(out.isEmpty());
        assertEquals(0.5, store.find("A", "C", "is_a").orElseThrow().getConfidence(), 1e-9);
        assertTrue(store.findByStatus(Relation.Status.PROVISIONAL, 10).isEmpty());
    }

    @Test
    public void noOutgoingEdgesOrNonPositiveDepthYieldsNothing() {
        InMemoryRelationStore store = GraphFixtures.store();
        store.put(asserted("A", "is_a", "B", 1.0));
        store.put(asserted("B", "is_a", "C", 1.0));
        InferenceOrchestrator orch = orchestrator(store);

        assertTrue(orch.infer("C", null, 3).isEmpty());
        assertTrue(orch.infer("A", null, 0).isEmpty());
        assertTrue(orch.infer("A", null, -1).isEmpty());
        assertTrue(orch.infer("unknown", null, 3).isEmpty());
    }

    @Test
    public void depthBoundsDerivationLength() {
        InMemoryRelationStore store = GraphFixtures.store();
        store.put(asserted("A", "is_a", "B", 1.0));
        store.put(asserted("B", "is_a", "C", 1.0));
        store.put(asserted("C", "is_a", "D", 1.0));

        assertEquals(1, orchestrator(store).infer("A", List.of(InferenceRule.TRANSITIVE), 2).size());
        assertEquals(2, orchestrator(store).infer("A", List.of(InferenceRule.TRANSITIVE), 50).size());
    }

    @Test
    public void inverseRuleUsesIncomingRelations() {
        InMemoryRelationStore store = GraphFixtures.store();
        store.put(asserted("Wheel", "part_of", "Car", 1.0));
        store.put(asserted("Car", "part_of", "Fleet", 1.0));

        List<CandidateRelation> out = orchestrator(store).infer("Car", List.of(InferenceRule.INVERSE), 2);

        assertEquals(1, out.size());
        assertEquals("Car", out.get(0).sourceId());
        assertEquals("has_part", out.get(0).relationType());
        assertEquals("Wheel", out.get(0).targetId());
        assertEquals(0.9, out.get(0).confidence(), 1e-9);
    }

    @Test
    public void equivalenceStoredFromTheOtherEndStillPropagates() {
        InMemoryRelationStore store = GraphFixtures.store();
        store.put(asserted("Auto", "equivalent_to", "Car", 1.0));
        store.put(asserted("Auto", "is_a", "Vehicle", 1.0));

        List<CandidateRelation> out = orchestrator(store).infer("Car", List.of(InferenceRule.EQUIVALENCE), 2);

        assertEquals(1, out.size());
        assertEquals("Car", out.get(0).sourceId());
        assertEquals("Vehicle", out.get(0).targetId());
        assertEquals("is_a", out.get(0).relationType());
    }

    @Test
    public void cancelledRunPersistsNothing() {
        InMemoryRelationStore store = GraphFixtures.store();
        store.put(asserted("A", "is_a", "B", 1.0));
        store.put(asserted("B", "is_a", "C", 1.0));
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(InferenceCancelledException.class,
                () -> orchestrator(store).infer("A", List.of(InferenceRule.TRANSITIVE), 3, token));
        assertEquals(2, store.count());
    }

    @Test
    public void storeFailureDuringPersistLeavesNoPartialWrites() {
        InMemoryRelationStore backing = GraphFixtures.store();
        backing.put(asserted("A", "is_a", "B", 1.0));
        backing.put(asserted("B", "is_a", "C", 1.0));
        backing.put(asserted("C", "is_a", "D", 1.0));
        FlakyRelationStoreTestDouble store = new FlakyRelationStoreTestDouble(backing);
        store.failPutNumber(2);

        assertThrows(StoreUnavailableException.class,
                () -> orchestrator(store).infer("A", List.of(InferenceRule.TRANSITIVE), 3));
        assertEquals(3, backing.count());
        assertTrue(backing.findByStatus(Relation.Status.PROVISIONAL, 10).isEmpty());
    }

    @Test
    public void storeFailureReadingSnapshotPropagates() {
        InMemoryRelationStore backing = GraphFixtures.store();
        backing.put(asserted("A", "is_a", "B", 1.0));
        FlakyRelationStoreTestDouble store = new FlakyRelationStoreTestDouble(backing);
        store.failNeighborhoodOnce("A", () -> new StoreUnavailableException("down"));

        assertThrows(StoreUnavailableException.class, () -> orchestrator(store).infer("A", null, 3));
        assertEquals(1, backing.count());
    }

    @Test
    public void concurrentRunsForDifferentTermsDoNotInterfere() throws Exception {
        InMemoryRelationStore store = GraphFixtures.store();
        for (int i = 0; i < 20; i++) {
            store.put(asserted("S" + i, "is_a", "M" + i, 1.0));
            store.put(asserted("M" + i, "is_a", "T" + i, 1.0));
        }
        InferenceOrchestrator orch = orchestrator(store);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<CandidateRelation>>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                String term = "S" + i;
                futures.add(pool.submit(() -> orch.infer(term, List.of(InferenceRule.TRANSITIVE), 2)));
            }
            for (int i = 0; i < 20; i++) {
                List<CandidateRelation> out = futures.get(i).get();
                assertEquals(1, out.size());
                assertEquals("T" + i, out.get(0).targetId());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(20, store.findByStatus(Relation.Status.PROVISIONAL, 100).size());
    }
}
