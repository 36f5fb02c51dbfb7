package com.waveflow.core.model;

/**
 * Aggregate status of a workflow run or a rollback.
 */
public enum ExecutionStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    ROLLED_BACK("rolled_back"),

    /**
     * Reserved for callers that park a run between resumptions.
     * The executor itself never produces it.
     */
    PAUSED("paused");

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ROLLED_BACK;
    }
}
