package com.e2eq.lexikon.graph.core;

import com.e2eq.lexikon.graph.exceptions.StoreUnavailableException;
import com.e2eq.lexikon.graph.exceptions.UnknownTermException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static com.e2eq.lexikon.graph.core.GraphFixtures.asserted;
import static org.junit.jupiter.api.Assertions.*;

public class BulkReinferenceJobTest {

    private FlakyRelationStoreTestDouble store;
    private InMemoryCheckpointStore checkpoints;
    private BulkReinferenceJob job;

    @BeforeEach
    public void setUp() {
        InMemoryRelationStore backing = GraphFixtures.store();
        backing.put(asserted("A", "is_a", "B", 1.0));
        backing.put(asserted("B", "is_a", "C", 1.0));
        store = new FlakyRelationStoreTestDouble(backing);
        InferenceSettings settings = InferenceSettings.defaults();
        InferenceOrchestrator orchestrator =
                new InferenceOrchestrator(store, new RuleEngine(store.registry(), settings), settings);
        checkpoints = new InMemoryCheckpointStore();
        job = new BulkReinferenceJob(store, orchestrator, checkpoints, 2);
    }

    @Test
    public void processesEveryTermAcrossChunks() {
        ReinferenceCheckpoint done = job.run(List.of(InferenceRule.TRANSITIVE), 3);

        assertEquals(ReinferenceCheckpoint.Status.COMPLETED, done.status());
        assertEquals(3, done.processedTerms());
        assertEquals(0, done.skippedTerms());
        assertEquals(1, done.inferredRelations());
        assertEquals("C", done.lastTermId());
        assertTrue(store.exists("A", "C", "is_a"));
        assertEquals(done, job.status(done.jobId()).orElseThrow());
    }

    @Test
    public void failedJobResumesAfterLastCompletedTerm() {
        store.failNeighborhoodOnce("B", () -> new StoreUnavailableException("connection reset"));

        ReinferenceCheckpoint failed = job.run(List.of(InferenceRule.TRANSITIVE), 3);

        assertEquals(ReinferenceCheckpoint.Status.FAILED, failed.status());
        assertEquals("A", failed.lastTermId());
        assertEquals(1, failed.processedTerms());
        assertTrue(failed.error().contains("STORE_UNAVAILABLE"));
        assertEquals(ReinferenceCheckpoint.Status.FAILED, checkpoints.find(failed.jobId()).orElseThrow().status());

        ReinferenceCheckpoint resumed = job.resume(failed.jobId());

        assertEquals(ReinferenceCheckpoint.Status.COMPLETED, resumed.status());
        assertEquals(3, resumed.processedTerms());
        assertNull(resumed.error());
        assertEquals(1, store.neighborhoodCalls("A"), "completed terms are not processed again");
        assertEquals(2, store.neighborhoodCalls("B"));
    }

    @Test
    public void structuralErrorsAreCountedAndSkipped() {
        store.failNeighborhoodOnce("B", () -> new UnknownTermException("B"));

        ReinferenceCheckpoint done = job.run(null, 3);

        assertEquals(ReinferenceCheckpoint.Status.COMPLETED, done.status());
        assertEquals(3, done.processedTerms());
        assertEquals(1, done.skippedTerms());
    }

    @Test
    public void resumingCompletedJobIsANoOp() {
        ReinferenceCheckpoint done = job.run(List.of(InferenceRule.TRANSITIVE), 3);
        int calls = store.totalNeighborhoodCalls();

        assertEquals(done, job.resume(done.jobId()));
        assertEquals(calls, store.totalNeighborhoodCalls());
        assertThrows(NoSuchElementException.class, () -> job.resume("no-such-job"));
    }
}
