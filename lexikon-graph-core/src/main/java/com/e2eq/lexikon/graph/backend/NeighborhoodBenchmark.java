package com.e2eq.lexikon.graph.backend;

import com.e2eq.lexikon.graph.core.RelationStore;

import java.util.Arrays;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Measures bounded-depth neighborhood expansion latency of a store.
 */
public class NeighborhoodBenchmark {

    private final LongSupplier nanoClock;
    private final int rounds;

    public NeighborhoodBenchmark() {
        this(System::nanoTime, 3);
    }

    public NeighborhoodBenchmark(LongSupplier nanoClock, int rounds) {
        this.nanoClock = nanoClock;
        this.rounds = Math.max(1, rounds);
    }

    /**
     * Expands the neighborhood of every sample term {@code rounds} times and returns the 95th percentile of the
     * per-call latencies, in nanoseconds.
     */
    public long p95Nanos(RelationStore store, List<String> sampleTerms, int depth) {
        if (sampleTerms.isEmpty()) return 0L;
        long[] samples = new long[sampleTerms.size() * rounds];
        int i = 0;
        for (int round = 0; round < rounds; round++) {
            for (String term : sampleTerms) {
                long start = nanoClock.getAsLong();
                store.neighborhood(List.of(term), depth);
                samples[i++] = nanoClock.getAsLong() - start;
            }
        }
        return percentile(samples, 0.95d);
    }

    static long percentile(long[] samples, double p) {
        long[] sorted = samples.clone();
        Arrays.sort(sorted);
        int rank = (int) Math.ceil(p * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(rank, sorted.length - 1))];
    }
}
