package com.waveflow.engine.executor;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.waveflow.core.event.WorkflowEvent;
import com.waveflow.core.event.WorkflowEventType;
import com.waveflow.core.exception.CheckpointNotFoundException;
import com.waveflow.core.exception.WorkflowValidationException;
import com.waveflow.core.model.Checkpoint;
import com.waveflow.core.model.ExecutionResult;
import com.waveflow.core.model.ExecutionStatus;
import com.waveflow.core.model.StepDefinition;
import com.waveflow.core.model.StepResult;
import com.waveflow.core.model.StepStatus;
import com.waveflow.core.repository.CheckpointRepository;
import com.waveflow.core.state.WorkflowState;
import com.waveflow.engine.config.ExecutorProperties;
import com.waveflow.engine.event.InMemoryWorkflowEventBus;
import com.waveflow.engine.metrics.ExecutorMetrics;
import com.waveflow.engine.persistence.InMemoryCheckpointRepository;
import com.waveflow.engine.test.ExecutionTrace;
import com.waveflow.engine.test.ScriptedAction;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Wave execution, failure handling and notifications of the workflow executor.
 */
class WorkflowExecutorTest {

    private InMemoryWorkflowEventBus eventBus;
    private InMemoryCheckpointRepository checkpoints;
    private SimpleMeterRegistry registry;
    private ExecutionTrace trace;
    private WorkflowExecutor executor;

    @BeforeEach
    void setUp() {
        eventBus = new InMemoryWorkflowEventBus();
        checkpoints = new InMemoryCheckpointRepository();
        registry = new SimpleMeterRegistry();
        trace = new ExecutionTrace();
        executor = newExecutor(ExecutorProperties.defaults());
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private WorkflowExecutor newExecutor(ExecutorProperties properties) {
        ExecutorMetrics metrics = new ExecutorMetrics();
        metrics.bindTo(registry);
        return new WorkflowExecutor(properties, checkpoints, eventBus, metrics);
    }

    private void reconfigure(ExecutorProperties properties) {
        executor.shutdown();
        executor = newExecutor(properties);
    }

    private StepDefinition step(String id, String... dependencies) {
        return StepDefinition.builder(id)
            .action(ScriptedAction.succeeding(id, trace))
            .dependsOn(dependencies)
            .build();
    }

    private StepDefinition failing(String id, String... dependencies) {
        return StepDefinition.builder(id)
            .action(ScriptedAction.named(id).alwaysFail().traced(trace).build())
            .dependsOn(dependencies)
            .build();
    }

    private StepDefinition sequential(String id, String... dependencies) {
        return StepDefinition.builder(id)
            .action(ScriptedAction.succeeding(id, trace))
            .dependsOn(dependencies)
            .sequential()
            .build();
    }

    // ========== Wave Tests ==========

    @Test
    @DisplayName("Independent steps run concurrently and their dependent waits for both")
    void independentStepsRunConcurrently() {
        reconfigure(ExecutorProperties.builder().maxWorkers(2).build());
        CountDownLatch bothStarted = new CountDownLatch(2);
        StepDefinition a = StepDefinition.builder("a").action(ctx -> {
            bothStarted.countDown();
            awaitLatch(bothStarted);
            return ctx.newOutput().put("step", "a");
        }).build();
        StepDefinition b = StepDefinition.builder("b").action(ctx -> {
            bothStarted.countDown();
            awaitLatch(bothStarted);
            return ctx.newOutput().put("step", "b");
        }).build();

        ExecutionResult result = executor.execute(List.of(a, b, step("c", "a", "b")), "scenario");

        assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(result.success()).isTrue();
        assertThat(result.completedCount()).isEqualTo(3);
        assertThat(result.totalSteps()).isEqualTo(3);
        assertThat(result.message()).isEqualTo("Workflow completed successfully");

        StepResult ra = result.stepResults().get("a");
        StepResult rb = result.stepResults().get("b");
        StepResult rc = result.stepResults().get("c");
        assertThat(ra.wave()).isEqualTo(1);
        assertThat(rb.wave()).isEqualTo(1);
        assertThat(rc.wave()).isEqualTo(2);
        assertThat(rc.startedAt()).isAfterOrEqualTo(ra.completedAt()).isAfterOrEqualTo(rb.completedAt());
        assertThat(rc.completionSequence()).isEqualTo(3L);
    }

    @Test
    @DisplayName("Every step starts only after all of its dependencies completed")
    void dependenciesCompleteBeforeStart() {
        List<StepDefinition> steps = List.of(
            step("extract"),
            step("validate", "extract"),
            step("recon_a", "validate"),
            step("recon_b", "validate"),
            sequential("accruals", "recon_a", "recon_b"),
            step("lock", "accruals")
        );

        ExecutionResult result = executor.execute(steps, "ordering");

        assertThat(result.success()).isTrue();
        for (StepDefinition step : steps) {
            StepResult stepResult = result.stepResults().get(step.stepId());
            for (String dependency : step.dependencies()) {
                assertThat(stepResult.startedAt())
                    .isAfterOrEqualTo(result.stepResults().get(dependency).completedAt());
                assertThat(stepResult.completionSequence())
                    .isGreaterThan(result.stepResults().get(dependency).completionSequence());
            }
        }
        assertThat(result.stepResults().get("lock").wave()).isEqualTo(5);
    }

    @Test
    @DisplayName("Sequential steps run on the calling thread after the parallel subset")
    void sequentialAfterParallel() {
        ExecutionResult result = executor.execute(
            List.of(sequential("s1"), step("p1"), sequential("s2")), "mixed");

        assertThat(result.success()).isTrue();
        assertThat(trace.startOrder()).containsExactly("p1", "s1", "s2");
        assertThat(trace.threadOf("p1")).startsWith("waveflow-worker-");
        assertThat(trace.threadOf("s1")).isEqualTo(Thread.currentThread().getName());
    }

    @Test
    @DisplayName("No more steps run at once than there are workers")
    void workerPoolBoundsConcurrency() {
        reconfigure(ExecutorProperties.builder().maxWorkers(2).build());
        List<StepDefinition> steps = List.of("a", "b", "c", "d", "e").stream()
            .map(id -> StepDefinition.builder(id)
                .action(ScriptedAction.named(id).withDelay(Duration.ofMillis(40)).traced(trace).build())
                .build())
            .toList();

        ExecutionResult result = executor.execute(steps, "bounded");

        assertThat(result.completedCount()).isEqualTo(5);
        assertThat(trace.maxInFlight()).isLessThanOrEqualTo(2);
    }

    // ========== Retry Tests ==========

    @Test
    @DisplayName("A step failing twice with two retries completes")
    void retryThenSucceed() {
        ScriptedAction flaky = ScriptedAction.named("x").failFirst(2).build();
        StepDefinition x = StepDefinition.builder("x").action(flaky).retryCount(2).build();

        ExecutionResult result = executor.execute(List.of(x), "retry");

        assertThat(result.stepStatus("x")).isEqualTo(StepStatus.COMPLETED);
        assertThat(result.stepResults().get("x").retryAttempts()).isEqualTo(2);
        assertThat(flaky.getInvocationCount()).isEqualTo(3);
    }

    // ========== Failure Tests ==========

    @Test
    @DisplayName("Without stop-on-failure dependents of a failed step are skipped and others complete")
    void continueOnFailureSkipsDependents() {
        reconfigure(ExecutorProperties.builder().stopOnFailure(false).build());

        ExecutionResult result = executor.execute(
            List.of(failing("x"), step("y", "x"), step("z", "y"), step("w")), "continue");

        assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.success()).isFalse();
        assertThat(result.stepStatus("x")).isEqualTo(StepStatus.FAILED);
        assertThat(result.stepStatus("w")).isEqualTo(StepStatus.COMPLETED);
        assertThat(result.stepResults().get("y").status()).isEqualTo(StepStatus.SKIPPED);
        assertThat(result.stepResults().get("y").error()).isEqualTo("Dependencies not met");
        assertThat(result.stepResults().get("z").error()).isEqualTo("Dependencies not met");
        assertThat(result.errors()).containsExactly("Step 'x' failed: x failed on attempt 1");
        assertThat(result.message()).isEqualTo("Workflow failed: 1 error(s)");
    }

    @Test
    @DisplayName("With stop-on-failure every step not yet started is skipped")
    void stopOnFailureSkipsRemaining() {
        ExecutionResult result = executor.execute(
            List.of(failing("a"), step("b"), step("c", "b"), sequential("d")), "stop");

        assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.stepStatus("a")).isEqualTo(StepStatus.FAILED);
        assertThat(result.stepStatus("b")).isEqualTo(StepStatus.COMPLETED);
        for (String id : List.of("c", "d")) {
            assertThat(result.stepResults().get(id).status()).isEqualTo(StepStatus.SKIPPED);
            assertThat(result.stepResults().get(id).error()).isEqualTo("Workflow stopped due to prior failure");
        }
        assertThat(trace.startOrder()).doesNotContain("c", "d");
        assertThat(result.errors()).containsExactly("Step 'a' failed: a failed on attempt 1");
    }

    @Test
    @DisplayName("A failed sequential step stops the rest of its wave")
    void sequentialFailureStopsWave() {
        StepDefinition s1 = StepDefinition.builder("s1")
            .action(ScriptedAction.named("s1").alwaysFail().traced(trace).build())
            .sequential()
            .build();

        ExecutionResult result = executor.execute(List.of(s1, sequential("s2")), "stop");

        assertThat(result.stepStatus("s1")).isEqualTo(StepStatus.FAILED);
        assertThat(result.stepStatus("s2")).isEqualTo(StepStatus.SKIPPED);
        assertThat(trace.startOrder()).containsExactly("s1");
    }

    @Test
    @DisplayName("An error thrown by a sequential step fails the step instead of the run")
    void sequentialStepErrorBecomesFailedResult() {
        List<String> progress = new CopyOnWriteArrayList<>();
        executor.setProgressCallback((stepId, stepResult) -> progress.add(stepId));
        StepDefinition broken = StepDefinition.builder("broken")
            .action(ctx -> {
                throw new AssertionError("boom");
            })
            .sequential()
            .build();

        ExecutionResult result = executor.execute(List.of(broken, sequential("after")), "errors");

        assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.stepStatus("broken")).isEqualTo(StepStatus.FAILED);
        assertThat(result.stepResult("broken").orElseThrow().error()).isEqualTo("boom");
        assertThat(result.stepStatus("after")).isEqualTo(StepStatus.SKIPPED);
        assertThat(result.errors()).containsExactly("Step 'broken' failed: boom");
        assertThat(progress).containsExactly("broken", "after");
        assertThat(eventBus.getHistory(WorkflowEventType.STEP_FAILED, "errors", 10))
            .extracting(WorkflowEvent::stepId)
            .containsExactly("broken");
    }

    @Test
    @DisplayName("An error thrown by a parallel step fails the step instead of the run")
    void parallelStepErrorBecomesFailedResult() {
        StepDefinition broken = StepDefinition.builder("broken")
            .action(ctx -> {
                throw new AssertionError("boom");
            })
            .build();

        ExecutionResult result = executor.execute(List.of(broken), "errors");

        assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.stepStatus("broken")).isEqualTo(StepStatus.FAILED);
        assertThat(result.stepResult("broken").orElseThrow().error()).isEqualTo("boom");
    }

    @Test
    @DisplayName("Every failed step is listed in the errors")
    void allFailuresReported() {
        ExecutionResult result = executor.execute(List.of(failing("a"), failing("b")), "errors");

        assertThat(result.errors()).containsExactlyInAnyOrder(
            "Step 'a' failed: a failed on attempt 1",
            "Step 'b' failed: b failed on attempt 1");
        assertThat(result.message()).isEqualTo("Workflow failed: 2 error(s)");
    }

    // ========== Checkpoint Tests ==========

    @Test
    @DisplayName("A checkpoint is taken after every completed wave")
    void checkpointPerWave() {
        ExecutionResult result = executor.execute(
            List.of(step("a"), step("b", "a"), step("c", "b")), "checkpoints");

        assertThat(executor.listCheckpoints()).hasSize(3);
        Checkpoint latest = result.checkpoint();
        assertThat(latest).isNotNull();
        assertThat(latest.wave()).isEqualTo(3);
        assertThat(latest.completedStepIds()).containsExactlyInAnyOrder("a", "b", "c");
        assertThat(latest.metadata())
            .containsEntry(Checkpoint.META_EXECUTION_ID, result.executionId())
            .containsEntry(Checkpoint.META_WORKFLOW_TYPE, "checkpoints")
            .containsEntry(Checkpoint.META_TRIGGER, Checkpoint.TRIGGER_WAVE);
        assertThat(eventBus.getHistory(WorkflowEventType.CHECKPOINT_CREATED, "checkpoints", 10)).hasSize(3);
    }

    @Test
    @DisplayName("No checkpoint is taken for an aborted wave")
    void noCheckpointForAbortedWave() {
        ExecutionResult result = executor.execute(List.of(step("a"), failing("b", "a")), "aborted");

        assertThat(executor.listCheckpoints()).hasSize(1);
        assertThat(result.checkpoint().completedStepIds()).containsExactly("a");
    }

    @Test
    @DisplayName("Auto checkpoints can be disabled")
    void autoCheckpointDisabled() {
        reconfigure(ExecutorProperties.builder().autoCheckpoint(false).build());

        ExecutionResult result = executor.execute(List.of(step("a"), step("b", "a")), "manual");

        assertThat(result.checkpoint()).isNull();
        assertThat(executor.listCheckpoints()).isEmpty();
    }

    @Test
    @DisplayName("Resuming from an unknown checkpoint fails before any step runs")
    void unknownResumeCheckpoint() {
        assertThatThrownBy(() -> executor.execute(List.of(step("a")), "resume", new WorkflowState(), "nope"))
            .isInstanceOf(CheckpointNotFoundException.class)
            .hasMessage("Checkpoint not found: nope");
        assertThat(trace.startOrder()).isEmpty();
    }

    // ========== Validation Tests ==========

    @Test
    @DisplayName("Cyclic step sets are rejected before any step runs")
    void cycleRejected() {
        assertThatThrownBy(() -> executor.execute(List.of(step("a", "b"), step("b", "a"))))
            .isInstanceOf(WorkflowValidationException.class)
            .hasMessageContaining("dependency cycle");
        assertThat(trace.startOrder()).isEmpty();
        assertThat(eventBus.historySize()).isZero();
    }

    @Test
    @DisplayName("Without graph validation unresolvable steps end skipped")
    void legacyUnresolvableSteps() {
        reconfigure(ExecutorProperties.builder().validateGraph(false).build());

        ExecutionResult result = executor.execute(
            List.of(step("a"), step("b", "ghost"), step("c", "d"), step("d", "c")), "legacy");

        assertThat(result.stepStatus("a")).isEqualTo(StepStatus.COMPLETED);
        for (String id : List.of("b", "c", "d")) {
            assertThat(result.stepResults().get(id).status()).isEqualTo(StepStatus.SKIPPED);
            assertThat(result.stepResults().get(id).error()).isEqualTo("Dependencies not met");
        }
        assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
    }

    @Test
    @DisplayName("Duplicate step ids are rejected")
    void duplicatesRejected() {
        assertThatThrownBy(() -> executor.execute(List.of(step("a"), step("a"))))
            .isInstanceOf(WorkflowValidationException.class);
    }

    // ========== Notification Tests ==========

    @Test
    @DisplayName("Progress callback fires once per settled step, skipped steps included")
    void progressCallbackPerStep() {
        List<String> calls = new CopyOnWriteArrayList<>();
        Map<String, StepStatus> seen = new ConcurrentHashMap<>();
        executor.setProgressCallback((stepId, result) -> {
            calls.add(stepId);
            seen.put(stepId, result.status());
        });

        executor.execute(List.of(failing("a"), step("b"), step("c", "b")), "progress");

        assertThat(calls).containsExactlyInAnyOrder("a", "b", "c");
        assertThat(seen).containsOnly(
            entry("a", StepStatus.FAILED),
            entry("b", StepStatus.COMPLETED),
            entry("c", StepStatus.SKIPPED));
    }

    @Test
    @DisplayName("Step events carry the workflow type and execution id")
    void stepEventsPublished() {
        ExecutionResult result = executor.execute(List.of(step("a"), failing("b", "a")), "events");

        List<WorkflowEvent> stepEvents = eventBus.getHistory(null, "events", 100).stream()
            .filter(e -> e.type().isStepEvent())
            .toList();
        assertThat(stepEvents).extracting(WorkflowEvent::type).containsExactly(
            WorkflowEventType.STEP_STARTED, WorkflowEventType.STEP_COMPLETED,
            WorkflowEventType.STEP_STARTED, WorkflowEventType.STEP_FAILED);
        assertThat(stepEvents).allSatisfy(e -> assertThat(e.executionId()).isEqualTo(result.executionId()));
    }

    @Test
    @DisplayName("A failing event bus does not break the run")
    void eventBusFailureIgnored() {
        executor.shutdown();
        executor = new WorkflowExecutor(ExecutorProperties.defaults(), checkpoints,
            event -> { throw new IllegalStateException("bus down"); }, new ExecutorMetrics());

        ExecutionResult result = executor.execute(List.of(step("a"), step("b", "a")), "bus");

        assertThat(result.success()).isTrue();
        assertThat(result.completedCount()).isEqualTo(2);
    }

    // ========== State Tests ==========

    @Test
    @DisplayName("Steps share workflow state; writes are owned by the first writer")
    void sharedStateWithOwnership() {
        WorkflowState state = new WorkflowState();
        state.seed("period", "2024-01");
        StepDefinition load = StepDefinition.builder("load").action(ctx -> {
            ctx.getState().put("rows", 42);
            return null;
        }).build();
        StepDefinition report = StepDefinition.builder("report").dependsOn("load").action(ctx -> {
            long rows = ctx.getState().getLong("rows", -1);
            return ctx.newOutput()
                .put("rows", rows)
                .put("period", ctx.getState().getText("period", null));
        }).build();
        StepDefinition thief = StepDefinition.builder("thief").dependsOn("load").action(ctx -> {
            ctx.getState().put("rows", 0);
            return null;
        }).build();

        reconfigure(ExecutorProperties.builder().stopOnFailure(false).build());
        ExecutionResult result = executor.execute(List.of(load, report, thief), "state", state);

        assertThat(result.stepResults().get("report").output().get("rows").asLong()).isEqualTo(42);
        assertThat(result.stepResults().get("report").output().get("period").asText()).isEqualTo("2024-01");
        assertThat(result.stepStatus("thief")).isEqualTo(StepStatus.FAILED);
        assertThat(result.stepResults().get("thief").error()).contains("owned by step 'load'");
        assertThat(state.get("rows").orElseThrow().asLong()).isEqualTo(42);
    }

    // ========== Internal Failure Tests ==========

    @Test
    @DisplayName("An internal failure is returned as a FAILED result")
    void internalFailureBecomesFailedResult() {
        CheckpointRepository broken = new InMemoryCheckpointRepository() {
            @Override
            public void save(Checkpoint checkpoint) {
                throw new IllegalStateException("checkpoint store unavailable");
            }
        };
        executor.shutdown();
        executor = new WorkflowExecutor(ExecutorProperties.defaults(), broken, eventBus, new ExecutorMetrics());

        ExecutionResult result = executor.execute(List.of(step("a"), step("b", "a")), "internal");

        assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("checkpoint store unavailable");
        assertThat(result.errors()).containsExactly("checkpoint store unavailable");
        assertThat(result.stepStatus("a")).isEqualTo(StepStatus.COMPLETED);
        assertThat(result.stepResult("b")).isEmpty();
    }

    // ========== Lifecycle and Metrics Tests ==========

    @Test
    @DisplayName("Execute after shutdown is refused")
    void executeAfterShutdown() {
        executor.shutdown();

        assertThatThrownBy(() -> executor.execute(List.of(step("a"))))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Workflow and step counters are recorded per workflow type")
    void metricsRecorded() {
        executor.execute(List.of(step("a"), step("b")), "metrics");
        executor.execute(List.of(failing("c")), "metrics");

        assertThat(registry.get("waveflow.workflows.started").tag("workflow_type", "metrics").counter().count())
            .isEqualTo(2.0);
        assertThat(registry.get("waveflow.workflows.completed").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("waveflow.workflows.failed").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("waveflow.steps.completed").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("waveflow.checkpoints.created").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Step params given to the action are not the definition's own tree")
    void paramsAreCopied() {
        ScriptedAction action = ScriptedAction.named("p").build();
        StepDefinition step = StepDefinition.builder("p")
            .action(action)
            .params(JsonNodeFactory.instance.objectNode().put("entity", "US01"))
            .build();

        executor.execute(List.of(step), "params");

        assertThat(action.getLastContext().getParams()).isEqualTo(step.params()).isNotSameAs(step.params());
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("peer step never started");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
