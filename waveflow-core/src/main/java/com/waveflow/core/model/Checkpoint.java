package com.waveflow.core.model;

import com.waveflow.core.state.WorkflowStateSnapshot;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable snapshot of step results and workflow state, taken after a wave.
 *
 * Invariants:
 * - stepResults holds deep copies, independent of the live run
 * - wave is the last wave whose results are included
 * - never modified once created
 */
public record Checkpoint(
    String checkpointId,
    Instant createdAt,
    int wave,
    Map<String, StepResult> stepResults,
    WorkflowStateSnapshot workflowState,
    Map<String, String> metadata
) {
    // Metadata keys
    public static final String META_WORKFLOW_TYPE = "workflowType";
    public static final String META_EXECUTION_ID = "executionId";
    public static final String META_TRIGGER = "trigger";

    public static final String TRIGGER_WAVE = "wave";
    public static final String TRIGGER_MANUAL = "manual";

    public Checkpoint {
        Objects.requireNonNull(checkpointId, "Checkpoint id cannot be null");
        createdAt = createdAt != null ? createdAt : Instant.now();
        Map<String, StepResult> copied = new LinkedHashMap<>();
        if (stepResults != null) {
            stepResults.forEach((id, result) -> copied.put(id, result.copy()));
        }
        stepResults = Collections.unmodifiableMap(copied);
        workflowState = workflowState != null ? workflowState : WorkflowStateSnapshot.empty();
        metadata = metadata != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
            : Map.of();
    }

    /**
     * Capture a new checkpoint with a generated id.
     */
    public static Checkpoint capture(
            Map<String, StepResult> stepResults,
            WorkflowStateSnapshot workflowState,
            int wave,
            Map<String, String> metadata) {
        return new Checkpoint(
            UUID.randomUUID().toString(),
            Instant.now(),
            wave,
            stepResults,
            workflowState,
            metadata
        );
    }

    /**
     * Get the ids of the steps that were COMPLETED when this checkpoint was taken.
     */
    public Set<String> completedStepIds() {
        Set<String> completed = new LinkedHashSet<>();
        stepResults.forEach((id, result) -> {
            if (result.isCompleted()) {
                completed.add(id);
            }
        });
        return completed;
    }

    /**
     * Get the highest completion sequence recorded in this checkpoint.
     */
    public long lastCompletionSequence() {
        return stepResults.values().stream()
            .mapToLong(StepResult::completionSequence)
            .max()
            .orElse(0L);
    }

    /**
     * Get deep copies of the stored results, ready to seed a resumed run.
     */
    public Map<String, StepResult> copyStepResults() {
        Map<String, StepResult> copy = new LinkedHashMap<>();
        stepResults.forEach((id, result) -> copy.put(id, result.copy()));
        return copy;
    }
}
