package com.waveflow.core.exception;

/**
 * Thrown when a step writes a workflow state key owned by another step.
 */
public class StateOwnershipException extends WaveflowException {

    public static final String ERROR_CODE = "STATE_OWNERSHIP_VIOLATION";

    private final String key;
    private final String owner;
    private final String writer;

    public StateOwnershipException(String key, String owner, String writer) {
        super(ERROR_CODE, String.format(
            "State key '%s' is owned by step '%s' and cannot be written by step '%s'",
            key, owner, writer
        ));
        this.key = key;
        this.owner = owner;
        this.writer = writer;
    }

    public String getKey() {
        return key;
    }

    public String getOwner() {
        return owner;
    }

    public String getWriter() {
        return writer;
    }
}
