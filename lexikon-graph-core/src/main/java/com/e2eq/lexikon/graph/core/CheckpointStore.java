package com.e2eq.lexikon.graph.core;

import java.util.Optional;

/**
 * Durable storage of {@link ReinferenceCheckpoint}s, keyed by job id.
 */
public interface CheckpointStore {

    void save(ReinferenceCheckpoint checkpoint);

    Optional<ReinferenceCheckpoint> find(String jobId);
}
