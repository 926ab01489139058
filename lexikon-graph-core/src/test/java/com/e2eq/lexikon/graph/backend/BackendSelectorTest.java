package com.e2eq.lexikon.graph.backend;

import com.e2eq.lexikon.graph.core.GraphFixtures;
import com.e2eq.lexikon.graph.core.InMemoryRelationStore;
import com.e2eq.lexikon.graph.core.InferenceSettings;
import com.e2eq.lexikon.graph.core.RelationStore;
import com.e2eq.lexikon.graph.exceptions.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static com.e2eq.lexikon.graph.core.GraphFixtures.asserted;
import static org.junit.jupiter.api.Assertions.*;

public class BackendSelectorTest {

    /** Benchmark double returning a fixed p95 per store. */
    static final class FixedBenchmark extends NeighborhoodBenchmark {
        final Map<RelationStore, Long> p95 = new IdentityHashMap<>();

        @Override
        public long p95Nanos(RelationStore store, List<String> sampleTerms, int depth) {
            Long v = p95.get(store);
            if (v == null) throw new StoreUnavailableException("graph unreachable");
            return v;
        }
    }

    private InMemoryRelationStore relational;
    private InMemoryRelationStore graph;
    private FixedBenchmark benchmark;

    @BeforeEach
    public void setUp() {
        relational = GraphFixtures.store();
        graph = GraphFixtures.store();
        for (String[] e : new String[][]{{"A", "B"}, {"B", "C"}, {"C", "D"}}) {
            relational.put(asserted(e[0], "is_a", e[1], 1.0));
            graph.put(asserted(e[0], "is_a", e[1], 1.0));
        }
        benchmark = new FixedBenchmark();
    }

    @Test
    public void smallGraphStaysRelationalWithoutBenchmark() {
        BackendDecision d = new BackendSelector(InferenceSettings.defaults(), benchmark).evaluate(relational, graph);

        assertEquals(BackendDecision.Backend.RELATIONAL, d.backend());
        assertFalse(d.benchmarked());
        assertEquals(3, d.edgeCount());
    }

    @Test
    public void graphAdoptedOnlyWhenTwiceAsFast() {
        BackendSelector selector = new BackendSelector(InferenceSettings.defaults().withEdgeThreshold(2), benchmark);
        benchmark.p95.put(relational, 100L);

        benchmark.p95.put(graph, 40L);
        BackendDecision faster = selector.evaluate(relational, graph);
        assertTrue(faster.useGraph());
        assertTrue(faster.benchmarked());
        assertEquals(100L, faster.relationalP95Nanos());
        assertEquals(40L, faster.graphP95Nanos());

        benchmark.p95.put(graph, 50L);
        assertFalse(selector.evaluate(relational, graph).useGraph());

        benchmark.p95.put(graph, 70L);
        assertFalse(selector.evaluate(relational, graph).useGraph());
    }

    @Test
    public void missingOrFailingGraphKeepsRelational() {
        BackendSelector selector = new BackendSelector(InferenceSettings.defaults().withEdgeThreshold(2), benchmark);
        benchmark.p95.put(relational, 100L);

        assertFalse(selector.evaluate(relational, null).useGraph());
        BackendDecision failed = selector.evaluate(relational, graph);
        assertFalse(failed.useGraph());
        assertTrue(failed.reason().contains("graph unreachable"));
    }

    @Test
    public void percentileUsesNearestRank() {
        long[] samples = new long[100];
        for (int i = 0; i < samples.length; i++) samples[i] = i + 1;

        assertEquals(95L, NeighborhoodBenchmark.percentile(samples, 0.95));
        assertEquals(7L, NeighborhoodBenchmark.percentile(new long[]{7}, 0.95));
    }

    @Test
    public void benchmarkTimesEveryNeighborhoodCall() {
        long[] tick = {0};
        NeighborhoodBenchmark timed = new NeighborhoodBenchmark(() -> tick[0] += 10, 2);

        assertEquals(10L, timed.p95Nanos(relational, List.of("A", "B"), 2));
        assertEquals(0L, timed.p95Nanos(relational, List.of(), 2));
    }
}
