package com.waveflow.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregate outcome of a workflow run or of a rollback.
 */
public record ExecutionResult(
    String executionId,
    String workflowType,
    boolean success,
    String message,
    ExecutionStatus status,
    Map<String, StepResult> stepResults,
    Checkpoint checkpoint,
    Instant startedAt,
    Instant completedAt,
    Duration duration,
    List<String> errors
) {
    public ExecutionResult {
        stepResults = stepResults != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(stepResults))
            : Map.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
        duration = duration != null ? duration : Duration.ZERO;
        message = message != null ? message : "";
    }

    /**
     * Get the result for one step.
     */
    public Optional<StepResult> stepResult(String stepId) {
        return Optional.ofNullable(stepResults.get(stepId));
    }

    /**
     * Get the status of one step, PENDING when the step has no result.
     */
    public StepStatus stepStatus(String stepId) {
        return stepResult(stepId).map(StepResult::status).orElse(StepStatus.PENDING);
    }

    public long completedCount() {
        return countByStatus(StepStatus.COMPLETED);
    }

    public long countByStatus(StepStatus status) {
        return stepResults.values().stream()
            .filter(r -> r.status() == status)
            .count();
    }

    public int totalSteps() {
        return stepResults.size();
    }

    public Optional<Checkpoint> latestCheckpoint() {
        return Optional.ofNullable(checkpoint);
    }
}
