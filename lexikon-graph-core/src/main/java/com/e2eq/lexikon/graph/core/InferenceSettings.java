package com.e2eq.lexikon.graph.core;

/**
 * Tunables for inference, backend selection and bulk processing.
 *
 * @param decay per-hop confidence multiplier applied by derivation rules
 * @param defaultMaxDepth depth used when a caller does not supply one
 * @param maxDepthLimit upper bound that requested depths are clamped to
 * @param minConfidence candidates below this confidence are pruned
 * @param edgeThreshold edge count above which the backend benchmark runs
 * @param latencyRatio graph backend is adopted when its p95 is below this fraction of the primary's p95
 * @param benchmarkSamples number of seed terms sampled per benchmark run
 * @param benchmarkDepth neighborhood depth expanded by the benchmark
 * @param replicaMaxErrorRate replica write failure rate that disables the replica
 * @param replicaWindow number of recent replica writes the failure rate is computed over
 * @param bulkChunkSize terms fetched per page by bulk re-inference
 * @param verifyTerms check term existence before accepting asserted relations
 */
public record InferenceSettings(double decay,
                                int defaultMaxDepth,
                                int maxDepthLimit,
                                double minConfidence,
                                long edgeThreshold,
                                double latencyRatio,
                                int benchmarkSamples,
                                int benchmarkDepth,
                                double replicaMaxErrorRate,
                                int replicaWindow,
                                int bulkChunkSize,
                                boolean verifyTerms) {

    public InferenceSettings {
        if (decay <= 0.0d || decay > 1.0d) {
            throw new IllegalArgumentException("decay must be in (0,1], was " + decay);
        }
        if (minConfidence < 0.0d || minConfidence > 1.0d) {
            throw new IllegalArgumentException("minConfidence must be in [0,1], was " + minConfidence);
        }
        if (maxDepthLimit < 1) {
            throw new IllegalArgumentException("maxDepthLimit must be positive");
        }
        if (defaultMaxDepth < 1 || defaultMaxDepth > maxDepthLimit) {
            throw new IllegalArgumentException("defaultMaxDepth must be in [1," + maxDepthLimit + "]");
        }
        if (latencyRatio <= 0.0d) {
            throw new IllegalArgumentException("latencyRatio must be positive");
        }
        if (replicaWindow < 1 || bulkChunkSize < 1 || benchmarkSamples < 1 || benchmarkDepth < 1) {
            throw new IllegalArgumentException("window, chunk and benchmark sizes must be positive");
        }
    }

    public static InferenceSettings defaults() {
        return new InferenceSettings(0.9d, 3, 10, 0.0d, 5_000L, 0.5d, 20, 3, 0.05d, 100, 100, false);
    }

    public InferenceSettings withMinConfidence(double value) {
        return new InferenceSettings(decay, defaultMaxDepth, maxDepthLimit, value, edgeThreshold, latencyRatio,
                benchmarkSamples, benchmarkDepth, replicaMaxErrorRate, replicaWindow, bulkChunkSize, verifyTerms);
    }

    public InferenceSettings withEdgeThreshold(long value) {
        return new InferenceSettings(decay, defaultMaxDepth, maxDepthLimit, minConfidence, value, latencyRatio,
                benchmarkSamples, benchmarkDepth, replicaMaxErrorRate, replicaWindow, bulkChunkSize, verifyTerms);
    }

    public InferenceSettings withReplicaLimits(double maxErrorRate, int window) {
        return new InferenceSettings(decay, defaultMaxDepth, maxDepthLimit, minConfidence, edgeThreshold, latencyRatio,
                benchmarkSamples, benchmarkDepth, maxErrorRate, window, bulkChunkSize, verifyTerms);
    }

    public InferenceSettings withBulkChunkSize(int value) {
        return new InferenceSettings(decay, defaultMaxDepth, maxDepthLimit, minConfidence, edgeThreshold, latencyRatio,
                benchmarkSamples, benchmarkDepth, replicaMaxErrorRate, replicaWindow, value, verifyTerms);
    }

    public InferenceSettings withVerifyTerms(boolean value) {
        return new InferenceSettings(decay, defaultMaxDepth, maxDepthLimit, minConfidence, edgeThreshold, latencyRatio,
                benchmarkSamples, benchmarkDepth, replicaMaxErrorRate, replicaWindow, bulkChunkSize, value);
    }

    /**
     * Clamps a requested depth to {@link #maxDepthLimit()}; non-positive values pass through unchanged.
     */
    public int clampDepth(int requested) {
        return Math.min(requested, maxDepthLimit);
    }
}
