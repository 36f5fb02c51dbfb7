package com.waveflow.engine.executor;

import com.waveflow.core.event.WorkflowEvent;
import com.waveflow.core.event.WorkflowEventBus;
import com.waveflow.core.exception.CheckpointNotFoundException;
import com.waveflow.core.exception.WorkflowValidationException;
import com.waveflow.core.model.Checkpoint;
import com.waveflow.core.model.ExecutionResult;
import com.waveflow.core.model.ExecutionStatus;
import com.waveflow.core.model.StepDefinition;
import com.waveflow.core.model.StepResult;
import com.waveflow.core.repository.CheckpointRepository;
import com.waveflow.core.state.WorkflowState;
import com.waveflow.engine.config.ExecutorProperties;
import com.waveflow.engine.event.InMemoryWorkflowEventBus;
import com.waveflow.engine.logging.LoggingContext;
import com.waveflow.engine.metrics.ExecutorMetrics;
import com.waveflow.engine.persistence.InMemoryCheckpointRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Executes a set of steps in dependency order.
 *
 * Each loop iteration is a wave: the ready steps that may run in parallel go to the
 * worker pool and are all awaited, then the sequential ones run one at a time on the
 * calling thread. A step never starts before all of its dependencies completed.
 *
 * Per-step failures never escape {@link #execute}; they are reported in the returned
 * {@link ExecutionResult}. Only submission errors (validation, unknown resume
 * checkpoint) and use after shutdown are thrown.
 */
public class WorkflowExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutor.class);

    static final String DEPENDENCIES_NOT_MET = "Dependencies not met";
    static final String STOPPED_AFTER_FAILURE = "Workflow stopped due to prior failure";

    private final ExecutorProperties properties;
    private final CheckpointRepository checkpointRepository;
    private final ExecutorMetrics metrics;
    private final EventPublisher publisher;
    private final WaveScheduler scheduler = new WaveScheduler();
    private final StepGraphValidator validator = new StepGraphValidator();
    private final StepRunner stepRunner;
    private final ParallelStepRunner parallelRunner;
    private final RollbackCoordinator rollbackCoordinator;
    private volatile ProgressCallback progressCallback;

    public WorkflowExecutor() {
        this(ExecutorProperties.defaults());
    }

    public WorkflowExecutor(ExecutorProperties properties) {
        this(properties, new InMemoryCheckpointRepository(), new InMemoryWorkflowEventBus(), new ExecutorMetrics());
    }

    public WorkflowExecutor(
            ExecutorProperties properties,
            CheckpointRepository checkpointRepository,
            WorkflowEventBus eventBus,
            ExecutorMetrics metrics) {
        this.properties = properties;
        this.checkpointRepository = checkpointRepository;
        this.metrics = metrics;
        this.publisher = new EventPublisher(eventBus);
        this.stepRunner = new StepRunner(publisher, metrics);
        this.parallelRunner = new ParallelStepRunner(properties.maxWorkers());
        this.rollbackCoordinator = new RollbackCoordinator(checkpointRepository, eventBus, metrics);
    }

    /**
     * Set the callback notified of every settled step. Applies to runs started afterwards.
     */
    public void setProgressCallback(ProgressCallback progressCallback) {
        this.progressCallback = progressCallback;
    }

    public ExecutorProperties getProperties() {
        return properties;
    }

    // ========== Execution ==========

    public ExecutionResult execute(List<StepDefinition> steps) {
        return execute(steps, "", new WorkflowState(), null);
    }

    public ExecutionResult execute(List<StepDefinition> steps, String workflowType) {
        return execute(steps, workflowType, new WorkflowState(), null);
    }

    public ExecutionResult execute(List<StepDefinition> steps, String workflowType, WorkflowState workflowState) {
        return execute(steps, workflowType, workflowState, null);
    }

    /**
     * Execute the steps.
     *
     * @param steps Step definitions; ids must be unique
     * @param workflowType Label carried on events, logs and metrics
     * @param workflowState Shared state; on resume it is replaced by the checkpoint's state
     * @param resumeFromCheckpoint Checkpoint to resume from, or null for a fresh run
     * @return The aggregate result
     * @throws WorkflowValidationException if the step set is rejected
     * @throws CheckpointNotFoundException if the resume checkpoint is unknown
     * @throws IllegalStateException if the executor was shut down
     */
    public ExecutionResult execute(
            List<StepDefinition> steps,
            String workflowType,
            WorkflowState workflowState,
            String resumeFromCheckpoint) {
        if (parallelRunner.isShutdown()) {
            throw new IllegalStateException("Workflow executor has been shut down");
        }
        validator.validate(steps, properties.validateGraph());
        Checkpoint resume = resumeFromCheckpoint != null
            ? checkpointRepository.findById(resumeFromCheckpoint)
                .orElseThrow(() -> new CheckpointNotFoundException(resumeFromCheckpoint))
            : null;

        Run run = new Run(
            List.copyOf(steps),
            workflowType != null ? workflowType : "",
            workflowState != null ? workflowState : new WorkflowState(),
            resume
        );
        return run.execute();
    }

    // ========== Rollback ==========

    public ExecutionResult rollback(List<StepDefinition> steps, Map<String, StepResult> stepResults, String reason) {
        return rollback(steps, stepResults, reason, null);
    }

    public ExecutionResult rollback(
            List<StepDefinition> steps,
            Map<String, StepResult> stepResults,
            String reason,
            String rollbackToCheckpoint) {
        return rollback(steps, stepResults, reason, rollbackToCheckpoint, "");
    }

    /**
     * Roll back completed steps, latest completed first.
     *
     * @throws CheckpointNotFoundException if rollbackToCheckpoint is unknown
     * @see RollbackCoordinator#rollback
     */
    public ExecutionResult rollback(
            List<StepDefinition> steps,
            Map<String, StepResult> stepResults,
            String reason,
            String rollbackToCheckpoint,
            String workflowType) {
        return rollbackCoordinator.rollback(steps, stepResults, reason, rollbackToCheckpoint, workflowType);
    }

    // ========== Checkpoints ==========

    public Checkpoint createCheckpoint(Map<String, StepResult> stepResults, WorkflowState workflowState) {
        return createCheckpoint(stepResults, workflowState, 0,
            Map.of(Checkpoint.META_TRIGGER, Checkpoint.TRIGGER_MANUAL));
    }

    /**
     * Snapshot results and state, register the checkpoint and publish CHECKPOINT_CREATED.
     */
    public Checkpoint createCheckpoint(
            Map<String, StepResult> stepResults,
            WorkflowState workflowState,
            int wave,
            Map<String, String> metadata) {
        Checkpoint checkpoint = Checkpoint.capture(
            stepResults,
            workflowState != null ? workflowState.snapshot() : null,
            wave,
            metadata
        );
        checkpointRepository.save(checkpoint);

        String workflowType = checkpoint.metadata().getOrDefault(Checkpoint.META_WORKFLOW_TYPE, "");
        metrics.checkpointCreated(workflowType);
        publisher.publish(WorkflowEvent.checkpointCreated(
            workflowType,
            checkpoint.metadata().get(Checkpoint.META_EXECUTION_ID),
            checkpoint.checkpointId()
        ));
        log.debug("Created checkpoint {} after wave {}", checkpoint.checkpointId(), wave);
        return checkpoint;
    }

    public Optional<Checkpoint> getCheckpoint(String checkpointId) {
        return checkpointRepository.findById(checkpointId);
    }

    public List<Checkpoint> listCheckpoints() {
        return checkpointRepository.findAll();
    }

    public void clearCheckpoints() {
        checkpointRepository.clear();
        log.debug("Cleared checkpoints");
    }

    // ========== Lifecycle ==========

    /**
     * Stop the worker pool, waiting for running steps up to the configured timeout.
     */
    public void shutdown() {
        if (parallelRunner.isShutdown()) {
            return;
        }
        log.info("Shutting down workflow executor");
        parallelRunner.shutdown(properties.shutdownTimeout());
        log.info("Workflow executor stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Mutable state of one execution.
     */
    private final class Run {
        private final List<StepDefinition> steps;
        private final String workflowType;
        private final WorkflowState state;
        private final Checkpoint resume;
        private final String executionId = UUID.randomUUID().toString();
        private final Instant startedAt = Instant.now();

        private final Map<String, StepResult> results = new LinkedHashMap<>();
        private final Set<String> completed = new HashSet<>();
        private Checkpoint latestCheckpoint;
        private int wave;

        Run(List<StepDefinition> steps, String workflowType, WorkflowState state, Checkpoint resume) {
            this.steps = steps;
            this.workflowType = workflowType;
            this.state = state;
            this.resume = resume;
        }

        ExecutionResult execute() {
            try (LoggingContext lc = LoggingContext.forRun(workflowType, executionId)) {
                metrics.workflowStarted(workflowType);
                try {
                    RunContext ctx = prepare(LoggingContext.getTraceId());
                    runWaves(ctx);
                    return finish();
                } catch (RuntimeException e) {
                    log.error("Workflow execution error: {}", e.getMessage(), e);
                    return unexpectedFailure(e);
                }
            }
        }

        private RunContext prepare(String traceId) {
            long lastSequence = 0L;
            if (resume != null) {
                results.putAll(resume.copyStepResults());
                completed.addAll(resume.completedStepIds());
                state.restore(resume.workflowState());
                wave = resume.wave();
                lastSequence = resume.lastCompletionSequence();
                log.info("Resuming from checkpoint {} after wave {} ({} step(s) already completed)",
                    resume.checkpointId(), wave, completed.size());
            }
            log.info("Starting workflow {} with {} step(s)", workflowType, steps.size());
            return new RunContext(executionId, workflowType, traceId, state, lastSequence, progressCallback);
        }

        private void runWaves(RunContext ctx) {
            while (true) {
                List<StepDefinition> ready = scheduler.readySteps(steps, completed, results);
                if (ready.isEmpty()) {
                    skipUnresolved(ctx, DEPENDENCIES_NOT_MET);
                    return;
                }

                Wave current = scheduler.plan(++wave, ready);
                try (LoggingContext wc = LoggingContext.forWave(current.number())) {
                    log.info("Starting wave {}: {} parallel, {} sequential step(s)",
                        current.number(), current.parallel().size(), current.sequential().size());

                    if (!runWave(ctx, current)) {
                        skipUnresolved(ctx, STOPPED_AFTER_FAILURE);
                        return;
                    }

                    if (properties.autoCheckpoint()) {
                        latestCheckpoint = createCheckpoint(results, state, current.number(), Map.of(
                            Checkpoint.META_WORKFLOW_TYPE, workflowType,
                            Checkpoint.META_EXECUTION_ID, executionId,
                            Checkpoint.META_TRIGGER, Checkpoint.TRIGGER_WAVE
                        ));
                    }
                }
            }
        }

        /**
         * @return false if the run must stop
         */
        private boolean runWave(RunContext ctx, Wave current) {
            int number = current.number();
            if (!current.parallel().isEmpty()) {
                List<StepResult> parallelResults = parallelRunner.runAll(
                    current.parallel(),
                    step -> stepRunner.run(step, ctx, number),
                    (step, error) -> stepRunner.unexpectedFailure(step, ctx, number, error)
                );
                boolean failed = false;
                for (StepResult result : parallelResults) {
                    failed |= record(result);
                }
                if (failed && properties.stopOnFailure()) {
                    return false;
                }
            }

            for (StepDefinition step : current.sequential()) {
                if (record(runSequential(step, ctx, number)) && properties.stopOnFailure()) {
                    return false;
                }
            }
            return true;
        }

        /**
         * Run a step on the calling thread. Anything the step runner lets through,
         * errors included, becomes a FAILED result as on the worker pool.
         */
        private StepResult runSequential(StepDefinition step, RunContext ctx, int number) {
            try {
                return stepRunner.run(step, ctx, number);
            } catch (Throwable t) {
                return stepRunner.unexpectedFailure(step, ctx, number, t);
            }
        }

        /**
         * @return true if the result is a failure
         */
        private boolean record(StepResult result) {
            results.put(result.stepId(), result);
            if (result.isCompleted()) {
                completed.add(result.stepId());
            }
            return result.isFailed();
        }

        private void skipUnresolved(RunContext ctx, String reason) {
            for (StepDefinition step : scheduler.unresolvedSteps(steps, completed, results)) {
                results.put(step.stepId(), stepRunner.skip(step, ctx, wave, reason));
            }
        }

        private ExecutionResult finish() {
            Instant completedAt = Instant.now();
            Duration duration = Duration.between(startedAt, completedAt);

            List<String> errors = new ArrayList<>();
            for (StepResult result : results.values()) {
                if (result.isFailed()) {
                    errors.add(String.format("Step '%s' failed: %s", result.stepId(), result.error()));
                }
            }

            boolean success = errors.isEmpty();
            String message = success
                ? "Workflow completed successfully"
                : String.format("Workflow failed: %d error(s)", errors.size());

            if (success) {
                metrics.workflowCompleted(workflowType, duration);
                log.info("Workflow {} completed in {} ms after {} wave(s)", workflowType, duration.toMillis(), wave);
            } else {
                metrics.workflowFailed(workflowType, duration);
                log.warn("Workflow {} failed in {} ms: {}", workflowType, duration.toMillis(), errors);
            }

            return new ExecutionResult(
                executionId,
                workflowType,
                success,
                message,
                success ? ExecutionStatus.COMPLETED : ExecutionStatus.FAILED,
                results,
                latestCheckpoint,
                startedAt,
                completedAt,
                duration,
                errors
            );
        }

        private ExecutionResult unexpectedFailure(RuntimeException e) {
            Instant completedAt = Instant.now();
            Duration duration = Duration.between(startedAt, completedAt);
            String message = StepRunner.messageOf(e);
            metrics.workflowFailed(workflowType, duration);
            return new ExecutionResult(
                executionId,
                workflowType,
                false,
                message,
                ExecutionStatus.FAILED,
                results,
                latestCheckpoint,
                startedAt,
                completedAt,
                duration,
                List.of(message)
            );
        }
    }
}
