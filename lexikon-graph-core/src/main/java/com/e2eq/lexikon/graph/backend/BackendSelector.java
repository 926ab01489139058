package com.e2eq.lexikon.graph.backend;

import com.e2eq.lexikon.graph.core.InferenceSettings;
import com.e2eq.lexikon.graph.core.RelationStore;
import org.jboss.logging.Logger;

import java.util.Date;
import java.util.List;

/**
 * Chooses between the relational store and the graph store from measured scale.
 * <p>
 * Below the edge threshold the relational store is kept without benchmarking. Above it both stores expand the
 * same sample neighborhoods, and the graph store is adopted only when its p95 latency is below
 * {@code latencyRatio} times the relational p95.
 * </p>
 */
public class BackendSelector {
    private static final Logger LOG = Logger.getLogger(BackendSelector.class);

    private final InferenceSettings settings;
    private final NeighborhoodBenchmark benchmark;

    public BackendSelector(InferenceSettings settings) {
        this(settings, new NeighborhoodBenchmark());
    }

    public BackendSelector(InferenceSettings settings, NeighborhoodBenchmark benchmark) {
        this.settings = settings;
        this.benchmark = benchmark;
    }

    /**
     * @param graph candidate graph store; null when none is configured
     */
    public BackendDecision evaluate(RelationStore relational, RelationStore graph) {
        long count = relational.count();
        if (graph == null) {
            return BackendDecision.relational(count, "no graph backend configured");
        }
        if (count <= settings.edgeThreshold()) {
            return BackendDecision.relational(count,
                    "edge count " + count + " does not exceed threshold " + settings.edgeThreshold());
        }
        List<String> sample = relational.termIds(null, settings.benchmarkSamples());
        if (sample.isEmpty()) {
            return BackendDecision.relational(count, "no terms to benchmark");
        }

        long relationalP95 = benchmark.p95Nanos(relational, sample, settings.benchmarkDepth());
        long graphP95;
        try {
            graphP95 = benchmark.p95Nanos(graph, sample, settings.benchmarkDepth());
        } catch (RuntimeException e) {
            LOG.warnf(e, "graph backend benchmark failed; keeping relational backend");
            return new BackendDecision(BackendDecision.Backend.RELATIONAL, count, true, relationalP95, -1L,
                    "graph benchmark failed: " + e.getMessage(), new Date());
        }

        boolean adopt = graphP95 < settings.latencyRatio() * relationalP95;
        String reason = String.format("graph p95 %dns vs relational p95 %dns (ratio %.2f required)",
                graphP95, relationalP95, settings.latencyRatio());
        LOG.infof("backend evaluation over %d edges: %s -> %s", count, reason, adopt ? "GRAPH" : "RELATIONAL");
        return new BackendDecision(adopt ? BackendDecision.Backend.GRAPH : BackendDecision.Backend.RELATIONAL,
                count, true, relationalP95, graphP95, reason, new Date());
    }
}
