package com.waveflow.core.event;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable notification about something that happened in a workflow.
 * Fields that do not apply to the event type are null.
 */
public record WorkflowEvent(
    // Identity
    UUID eventId,
    WorkflowEventType type,
    Instant timestamp,
    String source,

    // Context
    String workflowType,
    String executionId,

    // Step events
    String stepId,
    String stepName,
    Duration duration,
    String error,

    // Checkpoint events
    String checkpointId,

    // Rollback events
    String reason,
    List<String> stepsRolledBack
) {
    public static final String SOURCE_EXECUTOR = "workflow_executor";

    public WorkflowEvent {
        Objects.requireNonNull(type, "Event type cannot be null");
        eventId = eventId != null ? eventId : UUID.randomUUID();
        timestamp = timestamp != null ? timestamp : Instant.now();
        source = source != null ? source : SOURCE_EXECUTOR;
        stepsRolledBack = stepsRolledBack != null ? List.copyOf(stepsRolledBack) : null;
    }

    public static WorkflowEvent stepStarted(String workflowType, String executionId,
                                            String stepId, String stepName) {
        return new WorkflowEvent(null, WorkflowEventType.STEP_STARTED, null, null,
            workflowType, executionId, stepId, stepName, null, null, null, null, null);
    }

    public static WorkflowEvent stepCompleted(String workflowType, String executionId,
                                              String stepId, String stepName, Duration duration) {
        return new WorkflowEvent(null, WorkflowEventType.STEP_COMPLETED, null, null,
            workflowType, executionId, stepId, stepName, duration, null, null, null, null);
    }

    public static WorkflowEvent stepFailed(String workflowType, String executionId,
                                           String stepId, String stepName, String error) {
        return new WorkflowEvent(null, WorkflowEventType.STEP_FAILED, null, null,
            workflowType, executionId, stepId, stepName, null, error, null, null, null);
    }

    public static WorkflowEvent checkpointCreated(String workflowType, String executionId,
                                                  String checkpointId) {
        return new WorkflowEvent(null, WorkflowEventType.CHECKPOINT_CREATED, null, null,
            workflowType, executionId, null, null, null, null, checkpointId, null, null);
    }

    public static WorkflowEvent rollbackStarted(String workflowType, String reason,
                                                String checkpointId) {
        return new WorkflowEvent(null, WorkflowEventType.ROLLBACK_STARTED, null, null,
            workflowType, null, null, null, null, null, checkpointId, reason, null);
    }

    public static WorkflowEvent rollbackCompleted(String workflowType, String reason,
                                                  String checkpointId, List<String> stepsRolledBack) {
        return new WorkflowEvent(null, WorkflowEventType.ROLLBACK_COMPLETED, null, null,
            workflowType, null, null, null, null, null, checkpointId, reason, stepsRolledBack);
    }

    /**
     * Number of steps rolled back, 0 for events other than ROLLBACK_COMPLETED.
     */
    public int stepsRolledBackCount() {
        return stepsRolledBack != null ? stepsRolledBack.size() : 0;
    }
}
