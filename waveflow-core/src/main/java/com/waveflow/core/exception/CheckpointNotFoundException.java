package com.waveflow.core.exception;

/**
 * Thrown when a resume or rollback names a checkpoint the registry does not hold.
 */
public class CheckpointNotFoundException extends WaveflowException {

    public static final String ERROR_CODE = "CHECKPOINT_NOT_FOUND";

    private final String checkpointId;

    public CheckpointNotFoundException(String checkpointId) {
        super(ERROR_CODE, String.format("Checkpoint not found: %s", checkpointId));
        this.checkpointId = checkpointId;
    }

    public String getCheckpointId() {
        return checkpointId;
    }
}
