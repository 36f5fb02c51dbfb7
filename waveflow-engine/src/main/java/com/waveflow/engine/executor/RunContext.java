package com.waveflow.engine.executor;

import com.waveflow.core.model.StepResult;
import com.waveflow.core.state.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-run data shared by every step of one execution.
 */
final class RunContext {

    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    private final String executionId;
    private final String workflowType;
    private final String traceId;
    private final WorkflowState state;
    private final AtomicLong sequence;
    private final ProgressCallback progressCallback;

    RunContext(
            String executionId,
            String workflowType,
            String traceId,
            WorkflowState state,
            long lastSequence,
            ProgressCallback progressCallback) {
        this.executionId = executionId;
        this.workflowType = workflowType;
        this.traceId = traceId;
        this.state = state;
        this.sequence = new AtomicLong(lastSequence);
        this.progressCallback = progressCallback;
    }

    String executionId() {
        return executionId;
    }

    String workflowType() {
        return workflowType;
    }

    String traceId() {
        return traceId;
    }

    WorkflowState state() {
        return state;
    }

    /**
     * Claim the next completion sequence number.
     */
    long nextSequence() {
        return sequence.incrementAndGet();
    }

    void notifyProgress(StepResult result) {
        if (progressCallback == null) {
            return;
        }
        try {
            progressCallback.onProgress(result.stepId(), result);
        } catch (RuntimeException e) {
            log.warn("Progress callback failed for step {}: {}", result.stepId(), e.getMessage());
        }
    }
}
