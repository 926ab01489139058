package com.e2eq.lexikon.graph.backend;

import java.util.Date;

/**
 * Outcome of one backend evaluation.
 *
 * @param relationalP95Nanos p95 neighborhood latency of the primary store, or -1 when not benchmarked
 * @param graphP95Nanos p95 neighborhood latency of the graph store, or -1 when not benchmarked
 */
public record BackendDecision(Backend backend,
                              long edgeCount,
                              boolean benchmarked,
                              long relationalP95Nanos,
                              long graphP95Nanos,
                              String reason,
                              Date evaluatedAt) {

    public enum Backend { RELATIONAL, GRAPH }

    public static BackendDecision relational(long edgeCount, String reason) {
        return new BackendDecision(Backend.RELATIONAL, edgeCount, false, -1L, -1L, reason, new Date());
    }

    public boolean useGraph() {
        return backend == Backend.GRAPH;
    }
}
