package com.e2eq.lexikon.graph.core;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, ReinferenceCheckpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public void save(ReinferenceCheckpoint checkpoint) {
        checkpoints.put(checkpoint.jobId(), checkpoint);
    }

    @Override
    public Optional<ReinferenceCheckpoint> find(String jobId) {
        return Optional.ofNullable(checkpoints.get(jobId));
    }
}
