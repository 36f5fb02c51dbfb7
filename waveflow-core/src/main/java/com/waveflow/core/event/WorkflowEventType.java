package com.waveflow.core.event;

import java.util.Arrays;
import java.util.Optional;

/**
 * Types of events published while a workflow runs or rolls back.
 */
public enum WorkflowEventType {
    // Step lifecycle events
    STEP_STARTED("workflow:step:started"),
    STEP_COMPLETED("workflow:step:completed"),
    STEP_FAILED("workflow:step:failed"),

    // Checkpoint events
    CHECKPOINT_CREATED("workflow:checkpoint:created"),

    // Rollback events
    ROLLBACK_STARTED("workflow:rollback:started"),
    ROLLBACK_COMPLETED("workflow:rollback:completed");

    private final String value;

    WorkflowEventType(String value) {
        this.value = value;
    }

    /**
     * Get the wire value, e.g. {@code workflow:step:started}.
     */
    public String value() {
        return value;
    }

    public boolean isStepEvent() {
        return value.startsWith("workflow:step:");
    }

    public boolean isRollbackEvent() {
        return value.startsWith("workflow:rollback:");
    }

    /**
     * Look up a type by its wire value.
     */
    public static Optional<WorkflowEventType> fromValue(String value) {
        return Arrays.stream(values())
            .filter(t -> t.value.equals(value))
            .findFirst();
    }

    /**
     * Check whether this type's wire value matches a pattern.
     * A single {@code *} matches everything; a trailing {@code *} matches a prefix.
     */
    public boolean matches(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return false;
        }
        if ("*".equals(pattern)) {
            return true;
        }
        if (pattern.endsWith("*")) {
            return value.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return value.equals(pattern);
    }
}
