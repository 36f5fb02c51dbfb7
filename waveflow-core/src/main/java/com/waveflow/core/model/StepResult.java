package com.waveflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one step within a run.
 * Transitions produce new instances; an instance is never modified.
 *
 * Invariants:
 * - output set only when status == COMPLETED (or ROLLED_BACK, carried over)
 * - error set when status == FAILED or SKIPPED
 * - completionSequence > 0 iff the step reached COMPLETED in some run
 * - retryAttempts <= the step's retryCount
 */
public record StepResult(
    String stepId,
    StepStatus status,

    // Timing
    Instant startedAt,
    Instant completedAt,
    Duration duration,

    // Data
    JsonNode output,
    String error,
    int retryAttempts,

    // Ordering
    int wave,
    long completionSequence
) {
    public StepResult {
        Objects.requireNonNull(stepId, "Step id cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
        duration = duration != null ? duration : Duration.ZERO;
    }

    /**
     * Create a result for a step that was never attempted.
     */
    public static StepResult pending(String stepId) {
        return new StepResult(stepId, StepStatus.PENDING, null, null, Duration.ZERO,
            null, null, 0, 0, 0L);
    }

    /**
     * Create a result for a step that just started running.
     */
    public static StepResult running(String stepId, Instant startedAt, int wave) {
        return new StepResult(stepId, StepStatus.RUNNING, startedAt, null, Duration.ZERO,
            null, null, 0, wave, 0L);
    }

    /**
     * Create a result for a step that will not run.
     */
    public static StepResult skipped(String stepId, String reason, int wave) {
        return new StepResult(stepId, StepStatus.SKIPPED, null, Instant.now(), Duration.ZERO,
            null, reason, 0, wave, 0L);
    }

    /**
     * Create a copy with the step completed successfully.
     */
    public StepResult withCompleted(JsonNode stepOutput, int retries, Instant finishedAt, long sequence) {
        return new StepResult(stepId, StepStatus.COMPLETED, startedAt, finishedAt,
            elapsed(startedAt, finishedAt), stepOutput, null, retries, wave, sequence);
    }

    /**
     * Create a copy with the step failed after its last attempt.
     */
    public StepResult withFailed(String lastError, int retries, Instant finishedAt) {
        return new StepResult(stepId, StepStatus.FAILED, startedAt, finishedAt,
            elapsed(startedAt, finishedAt), null, lastError, retries, wave, 0L);
    }

    /**
     * Create a copy marked as compensated. Timing and ordering are kept for audit.
     */
    public StepResult withRolledBack() {
        return new StepResult(stepId, StepStatus.ROLLED_BACK, startedAt, completedAt,
            duration, output, error, retryAttempts, wave, completionSequence);
    }

    /**
     * Create an independent deep copy.
     */
    public StepResult copy() {
        return new StepResult(stepId, status, startedAt, completedAt, duration,
            output != null ? output.deepCopy() : null, error, retryAttempts, wave, completionSequence);
    }

    public boolean isCompleted() {
        return status == StepStatus.COMPLETED;
    }

    public boolean isFailed() {
        return status == StepStatus.FAILED;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    private static Duration elapsed(Instant from, Instant to) {
        if (from == null || to == null) {
            return Duration.ZERO;
        }
        return Duration.between(from, to);
    }
}
