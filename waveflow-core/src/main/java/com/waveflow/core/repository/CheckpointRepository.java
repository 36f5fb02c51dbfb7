package com.waveflow.core.repository;

import com.waveflow.core.model.Checkpoint;

import java.util.List;
import java.util.Optional;

/**
 * Registry of checkpoints created by an executor.
 * Implementations must be safe for concurrent use.
 */
public interface CheckpointRepository {

    /**
     * Store a checkpoint, replacing one with the same id.
     *
     * @param checkpoint The checkpoint to store
     */
    void save(Checkpoint checkpoint);

    /**
     * Find a checkpoint by ID.
     *
     * @param checkpointId The checkpoint ID
     * @return The checkpoint if found
     */
    Optional<Checkpoint> findById(String checkpointId);

    /**
     * Get all checkpoints in creation order.
     *
     * @return All stored checkpoints
     */
    List<Checkpoint> findAll();

    /**
     * Count stored checkpoints.
     */
    int count();

    /**
     * Remove every checkpoint.
     */
    void clear();
}
