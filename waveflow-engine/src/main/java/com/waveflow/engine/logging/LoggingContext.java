package com.waveflow.engine.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include the run and step being worked on.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forRun("month_end_close", executionId)) {
 *     log.info("Starting wave"); // Automatically includes workflowType, executionId
 * }
 * </pre>
 *
 * Closing a context restores whatever values the keys held before it was opened,
 * so step contexts can nest inside a run context on the same thread.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String WORKFLOW_TYPE = "workflowType";
    public static final String EXECUTION_ID = "executionId";
    public static final String STEP_ID = "stepId";
    public static final String ATTEMPT = "attempt";
    public static final String WAVE = "wave";
    public static final String TRACE_ID = "traceId";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for a workflow run.
     */
    public static LoggingContext forRun(String workflowType, String executionId) {
        return forRun(workflowType, executionId, null);
    }

    /**
     * Create a logging context for a workflow run with an explicit trace id.
     */
    public static LoggingContext forRun(String workflowType, String executionId, String traceId) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(WORKFLOW_TYPE, workflowType);
        ctx.put(EXECUTION_ID, executionId);
        ctx.ensureTraceId(traceId);
        return ctx;
    }

    /**
     * Create a logging context for one step attempt.
     * Must be opened on the thread that runs the attempt.
     */
    public static LoggingContext forStep(
            String workflowType,
            String executionId,
            String traceId,
            String stepId,
            int attempt,
            int wave) {
        LoggingContext ctx = forRun(workflowType, executionId, traceId);
        ctx.put(STEP_ID, stepId);
        ctx.put(ATTEMPT, String.valueOf(attempt));
        ctx.put(WAVE, String.valueOf(wave));
        return ctx;
    }

    /**
     * Create a logging context for a rollback.
     */
    public static LoggingContext forRollback(String workflowType) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(WORKFLOW_TYPE, workflowType);
        ctx.ensureTraceId(null);
        return ctx;
    }

    /**
     * Create a logging context for one wave of a run.
     */
    public static LoggingContext forWave(int wave) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(WAVE, String.valueOf(wave));
        return ctx;
    }

    /**
     * Get current execution ID from context.
     */
    public static String getExecutionId() {
        return MDC.get(EXECUTION_ID);
    }

    /**
     * Get current step ID from context.
     */
    public static String getStepId() {
        return MDC.get(STEP_ID);
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private void ensureTraceId(String traceId) {
        if (traceId != null) {
            put(TRACE_ID, traceId);
        } else if (MDC.get(TRACE_ID) == null) {
            put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
