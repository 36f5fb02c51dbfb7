package com.waveflow.core.exception;

import java.util.List;

/**
 * Thrown when a submitted step set is rejected before execution.
 */
public class WorkflowValidationException extends WaveflowException {

    public static final String ERROR_CODE = "WORKFLOW_VALIDATION_FAILED";

    private final List<String> cyclePath;

    public WorkflowValidationException(String message) {
        super(ERROR_CODE, message);
        this.cyclePath = List.of();
    }

    public WorkflowValidationException(String field, String reason) {
        this(field, reason, List.of());
    }

    private WorkflowValidationException(String field, String reason, List<String> cyclePath) {
        super(ERROR_CODE, String.format("Invalid workflow: %s - %s", field, reason));
        this.cyclePath = List.copyOf(cyclePath);
    }

    /**
     * Create an exception for a dependency cycle.
     *
     * @param cyclePath Step ids along the cycle, first id repeated at the end
     */
    public static WorkflowValidationException cycle(List<String> cyclePath) {
        return new WorkflowValidationException(
            "dependencies",
            "dependency cycle " + String.join(" -> ", cyclePath),
            cyclePath
        );
    }

    /**
     * Get the step ids along the detected cycle, empty for other failures.
     */
    public List<String> getCyclePath() {
        return cyclePath;
    }
}
