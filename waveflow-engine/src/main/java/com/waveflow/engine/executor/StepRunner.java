package com.waveflow.engine.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.waveflow.core.event.WorkflowEvent;
import com.waveflow.core.model.StepDefinition;
import com.waveflow.core.model.StepResult;
import com.waveflow.core.step.StepContext;
import com.waveflow.core.step.StepException;
import com.waveflow.engine.logging.LoggingContext;
import com.waveflow.engine.metrics.ExecutorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Runs one step with its retries on the calling thread.
 *
 * Attempts run back to back with no delay. A non-retryable StepException ends the
 * attempts early; any RuntimeException counts as retryable. Only the last error is kept.
 */
class StepRunner {

    private static final Logger log = LoggerFactory.getLogger(StepRunner.class);

    private final EventPublisher publisher;
    private final ExecutorMetrics metrics;

    StepRunner(EventPublisher publisher, ExecutorMetrics metrics) {
        this.publisher = publisher;
        this.metrics = metrics;
    }

    StepResult run(StepDefinition step, RunContext ctx, int wave) {
        StepResult running = StepResult.running(step.stepId(), Instant.now(), wave);
        publisher.publish(WorkflowEvent.stepStarted(
            ctx.workflowType(), ctx.executionId(), step.stepId(), step.name()));
        metrics.stepStarted();

        int maxAttempts = step.retryCount() + 1;
        int attempt = 0;
        String lastError = null;

        try {
            while (attempt < maxAttempts) {
                attempt++;
                if (attempt > 1) {
                    metrics.stepRetried(ctx.workflowType(), step.stepId());
                }

                try (LoggingContext lc = LoggingContext.forStep(
                        ctx.workflowType(), ctx.executionId(), ctx.traceId(), step.stepId(), attempt, wave)) {
                    long attemptStart = System.nanoTime();
                    try {
                        JsonNode output = step.action().execute(newContext(step, ctx, attempt));
                        checkTimeout(step, ctx, attemptStart);
                        return complete(step, ctx, running, output, attempt - 1);
                    } catch (StepException e) {
                        checkTimeout(step, ctx, attemptStart);
                        lastError = e.getMessage();
                        if (!e.isRetryable()) {
                            log.warn("Step {} attempt {} failed permanently [{}]: {}",
                                step.stepId(), attempt, e.getErrorCode(), e.getMessage());
                            break;
                        }
                        log.warn("Step {} attempt {}/{} failed [{}]: {}",
                            step.stepId(), attempt, maxAttempts, e.getErrorCode(), e.getMessage());
                    } catch (RuntimeException e) {
                        checkTimeout(step, ctx, attemptStart);
                        lastError = messageOf(e);
                        log.warn("Step {} attempt {}/{} failed: {}",
                            step.stepId(), attempt, maxAttempts, lastError, e);
                    }
                }
            }
            return fail(step, ctx, running, lastError, attempt - 1);
        } finally {
            metrics.stepFinished();
        }
    }

    /**
     * Build the FAILED result for a step whose run ended with an unexpected throwable.
     */
    StepResult unexpectedFailure(StepDefinition step, RunContext ctx, int wave, Throwable error) {
        log.error("Unexpected error running step {}: {}", step.stepId(), error.getMessage(), error);
        StepResult running = StepResult.running(step.stepId(), Instant.now(), wave);
        return fail(step, ctx, running, messageOf(error), 0);
    }

    /**
     * Record a step that will not run.
     */
    StepResult skip(StepDefinition step, RunContext ctx, int wave, String reason) {
        StepResult skipped = StepResult.skipped(step.stepId(), reason, wave);
        log.info("Skipping step {}: {}", step.stepId(), reason);
        metrics.stepSkipped(ctx.workflowType());
        ctx.notifyProgress(skipped);
        return skipped;
    }

    private StepResult complete(StepDefinition step, RunContext ctx, StepResult running,
                                JsonNode output, int retries) {
        StepResult completed = running.withCompleted(output, retries, Instant.now(), ctx.nextSequence());
        log.info("Step {} completed in {} ms (retries={})",
            step.stepId(), completed.duration().toMillis(), retries);
        metrics.stepCompleted(ctx.workflowType(), step.stepId(), completed.duration());
        publisher.publish(WorkflowEvent.stepCompleted(
            ctx.workflowType(), ctx.executionId(), step.stepId(), step.name(), completed.duration()));
        ctx.notifyProgress(completed);
        return completed;
    }

    private StepResult fail(StepDefinition step, RunContext ctx, StepResult running,
                            String error, int retries) {
        StepResult failed = running.withFailed(error, retries, Instant.now());
        log.error("Step {} failed after {} attempt(s): {}", step.stepId(), retries + 1, error);
        metrics.stepFailed(ctx.workflowType(), step.stepId(), failed.duration());
        publisher.publish(WorkflowEvent.stepFailed(
            ctx.workflowType(), ctx.executionId(), step.stepId(), step.name(), error));
        ctx.notifyProgress(failed);
        return failed;
    }

    private static StepContext newContext(StepDefinition step, RunContext ctx, int attempt) {
        return new StepContext(
            ctx.executionId(),
            ctx.workflowType(),
            step.stepId(),
            step.name(),
            attempt,
            step.params().deepCopy(),
            ctx.state().forStep(step.stepId())
        );
    }

    private void checkTimeout(StepDefinition step, RunContext ctx, long attemptStartNanos) {
        if (step.timeout() == null) {
            return;
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - attemptStartNanos);
        if (elapsed.compareTo(step.timeout()) > 0) {
            log.warn("Step {} ran {} ms, past its timeout of {} ms",
                step.stepId(), elapsed.toMillis(), step.timeout().toMillis());
            metrics.stepTimeoutExceeded(ctx.workflowType(), step.stepId());
        }
    }

    static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
