package com.waveflow.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the workflow executor.
 * Every recording method is a no-op until the binder is bound to a registry.
 *
 * Metrics exposed:
 * - Workflow runs started, completed and failed, with duration
 * - Step outcomes, retries, exceeded timeouts and duration
 * - Checkpoints and rollbacks
 * - Steps currently running
 */
public class ExecutorMetrics implements MeterBinder {

    // Metric names
    public static final String WORKFLOW_STARTED = "waveflow.workflows.started";
    public static final String WORKFLOW_COMPLETED = "waveflow.workflows.completed";
    public static final String WORKFLOW_FAILED = "waveflow.workflows.failed";
    public static final String WORKFLOW_DURATION = "waveflow.workflow.duration";

    public static final String STEP_COMPLETED = "waveflow.steps.completed";
    public static final String STEP_FAILED = "waveflow.steps.failed";
    public static final String STEP_SKIPPED = "waveflow.steps.skipped";
    public static final String STEP_RETRIES = "waveflow.step.retries";
    public static final String STEP_TIMEOUTS = "waveflow.step.timeouts";
    public static final String STEP_DURATION = "waveflow.step.duration";
    public static final String STEPS_ACTIVE = "waveflow.steps.active";

    public static final String CHECKPOINTS = "waveflow.checkpoints.created";
    public static final String ROLLBACKS = "waveflow.rollbacks";
    public static final String ROLLBACK_FAILURES = "waveflow.rollback.failures";

    public static final String TAG_WORKFLOW_TYPE = "workflow_type";

    private volatile MeterRegistry registry;
    private final AtomicInteger activeSteps = new AtomicInteger(0);

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(STEPS_ACTIVE, activeSteps, AtomicInteger::get)
            .description("Number of steps currently running")
            .register(registry);
    }

    public boolean isBound() {
        return registry != null;
    }

    public int getActiveSteps() {
        return activeSteps.get();
    }

    // ========== Workflow Metrics ==========

    public void workflowStarted(String workflowType) {
        count(WORKFLOW_STARTED, workflowType, "Total workflow runs started");
    }

    public void workflowCompleted(String workflowType, Duration duration) {
        count(WORKFLOW_COMPLETED, workflowType, "Total workflow runs completed successfully");
        recordWorkflowDuration(workflowType, "success", duration);
    }

    public void workflowFailed(String workflowType, Duration duration) {
        count(WORKFLOW_FAILED, workflowType, "Total workflow runs failed");
        recordWorkflowDuration(workflowType, "failure", duration);
    }

    // ========== Step Metrics ==========

    public void stepStarted() {
        activeSteps.incrementAndGet();
    }

    public void stepFinished() {
        activeSteps.updateAndGet(v -> Math.max(0, v - 1));
    }

    public void stepCompleted(String workflowType, String stepId, Duration duration) {
        count(STEP_COMPLETED, workflowType, "Total steps completed");
        recordStepDuration(workflowType, stepId, "success", duration);
    }

    public void stepFailed(String workflowType, String stepId, Duration duration) {
        count(STEP_FAILED, workflowType, "Total steps failed after their last attempt");
        recordStepDuration(workflowType, stepId, "failure", duration);
    }

    public void stepSkipped(String workflowType) {
        count(STEP_SKIPPED, workflowType, "Total steps skipped");
    }

    public void stepRetried(String workflowType, String stepId) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Counter.builder(STEP_RETRIES)
            .tag(TAG_WORKFLOW_TYPE, tagValue(workflowType))
            .tag("step", stepId)
            .description("Total step retry attempts")
            .register(current)
            .increment();
    }

    public void stepTimeoutExceeded(String workflowType, String stepId) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Counter.builder(STEP_TIMEOUTS)
            .tag(TAG_WORKFLOW_TYPE, tagValue(workflowType))
            .tag("step", stepId)
            .description("Total step attempts that ran past their timeout")
            .register(current)
            .increment();
    }

    // ========== Checkpoint and Rollback Metrics ==========

    public void checkpointCreated(String workflowType) {
        count(CHECKPOINTS, workflowType, "Total checkpoints created");
    }

    public void rollbackExecuted(String workflowType) {
        count(ROLLBACKS, workflowType, "Total rollbacks executed");
    }

    public void rollbackFailed(String workflowType, String stepId) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Counter.builder(ROLLBACK_FAILURES)
            .tag(TAG_WORKFLOW_TYPE, tagValue(workflowType))
            .tag("step", stepId)
            .description("Total rollback actions that failed")
            .register(current)
            .increment();
    }

    // ========== Helper Methods ==========

    private void count(String name, String workflowType, String description) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Counter.builder(name)
            .tag(TAG_WORKFLOW_TYPE, tagValue(workflowType))
            .description(description)
            .register(current)
            .increment();
    }

    private void recordWorkflowDuration(String workflowType, String outcome, Duration duration) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Timer.builder(WORKFLOW_DURATION)
            .tag(TAG_WORKFLOW_TYPE, tagValue(workflowType))
            .tag("outcome", outcome)
            .description("Workflow run duration")
            .register(current)
            .record(duration);
    }

    private void recordStepDuration(String workflowType, String stepId, String outcome, Duration duration) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Timer.builder(STEP_DURATION)
            .tag(TAG_WORKFLOW_TYPE, tagValue(workflowType))
            .tag("step", stepId)
            .tag("outcome", outcome)
            .description("Step duration across all attempts")
            .register(current)
            .record(duration);
    }

    private static String tagValue(String value) {
        return value == null || value.isBlank() ? "unspecified" : value;
    }
}
