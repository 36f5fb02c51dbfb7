package com.waveflow.core.model;

/**
 * Lifecycle states for a single step within one workflow run.
 */
public enum StepStatus {
    /**
     * Step has not been attempted yet.
     * Transitions: -> RUNNING, SKIPPED
     */
    PENDING("pending"),

    /**
     * Step is being executed by a worker.
     * Transitions: -> COMPLETED, FAILED
     */
    RUNNING("running"),

    /**
     * Step finished successfully. Terminal for scheduling.
     * Transitions: -> ROLLED_BACK (explicit rollback only)
     */
    COMPLETED("completed"),

    /**
     * Step failed after exhausting its retries. Terminal.
     */
    FAILED("failed"),

    /**
     * Step never ran: a dependency failed or was unmet, or the run halted. Terminal.
     */
    SKIPPED("skipped"),

    /**
     * Step's side effects were reversed by its rollback action.
     */
    ROLLED_BACK("rolled_back");

    private final String value;

    StepStatus(String value) {
        this.value = value;
    }

    /**
     * Lower-case wire value used in exported JSON.
     */
    public String value() {
        return value;
    }

    /**
     * Check if the scheduler treats this state as settled (never picked again).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    /**
     * Check if this state means the step is being worked on.
     */
    public boolean isActive() {
        return this == RUNNING;
    }
}
