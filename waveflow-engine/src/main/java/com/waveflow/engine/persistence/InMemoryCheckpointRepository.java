package com.waveflow.engine.persistence;

import com.waveflow.core.model.Checkpoint;
import com.waveflow.core.repository.CheckpointRepository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of CheckpointRepository.
 * All operations are guarded by one mutex; insertion order is creation order.
 */
public class InMemoryCheckpointRepository implements CheckpointRepository {

    private final Object lock = new Object();
    private final Map<String, Checkpoint> checkpoints = new LinkedHashMap<>();

    @Override
    public void save(Checkpoint checkpoint) {
        synchronized (lock) {
            checkpoints.put(checkpoint.checkpointId(), checkpoint);
        }
    }

    @Override
    public Optional<Checkpoint> findById(String checkpointId) {
        if (checkpointId == null) {
            return Optional.empty();
        }
        synchronized (lock) {
            return Optional.ofNullable(checkpoints.get(checkpointId));
        }
    }

    @Override
    public List<Checkpoint> findAll() {
        synchronized (lock) {
            return new ArrayList<>(checkpoints.values());
        }
    }

    @Override
    public int count() {
        synchronized (lock) {
            return checkpoints.size();
        }
    }

    @Override
    public void clear() {
        synchronized (lock) {
            checkpoints.clear();
        }
    }
}
