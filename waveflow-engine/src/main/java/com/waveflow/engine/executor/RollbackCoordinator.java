package com.waveflow.engine.executor;

import com.waveflow.core.event.WorkflowEvent;
import com.waveflow.core.event.WorkflowEventBus;
import com.waveflow.core.exception.CheckpointNotFoundException;
import com.waveflow.core.model.Checkpoint;
import com.waveflow.core.model.ExecutionResult;
import com.waveflow.core.model.ExecutionStatus;
import com.waveflow.core.model.StepDefinition;
import com.waveflow.core.model.StepResult;
import com.waveflow.core.repository.CheckpointRepository;
import com.waveflow.core.step.StepException;
import com.waveflow.engine.logging.LoggingContext;
import com.waveflow.engine.metrics.ExecutorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Undoes completed steps by invoking their rollback actions.
 *
 * Steps are undone latest-completed first. Each rollback action runs once with a copy
 * of the step's params; a failure is recorded and the remaining rollbacks still run.
 * Completed steps without a rollback action are left COMPLETED.
 */
public class RollbackCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RollbackCoordinator.class);

    private final CheckpointRepository checkpointRepository;
    private final EventPublisher publisher;
    private final ExecutorMetrics metrics;

    public RollbackCoordinator(
            CheckpointRepository checkpointRepository,
            WorkflowEventBus eventBus,
            ExecutorMetrics metrics) {
        this.checkpointRepository = checkpointRepository;
        this.publisher = new EventPublisher(eventBus);
        this.metrics = metrics;
    }

    /**
     * Roll back completed steps.
     *
     * @param steps The step definitions, used to look up rollback actions
     * @param stepResults Current results; not modified
     * @param reason Free-text reason, carried on events
     * @param checkpointId Only undo steps completed after this checkpoint, or null for all
     * @param workflowType Workflow type for events and metrics
     * @return Result with status ROLLED_BACK and the updated step results
     * @throws CheckpointNotFoundException if checkpointId is unknown
     */
    public ExecutionResult rollback(
            List<StepDefinition> steps,
            Map<String, StepResult> stepResults,
            String reason,
            String checkpointId,
            String workflowType) {
        Checkpoint checkpoint = checkpointId != null
            ? checkpointRepository.findById(checkpointId)
                .orElseThrow(() -> new CheckpointNotFoundException(checkpointId))
            : null;
        String type = workflowType != null ? workflowType : "";
        Instant startedAt = Instant.now();

        try (LoggingContext lc = LoggingContext.forRollback(type)) {
            log.info("Starting rollback (checkpoint={}): {}", checkpointId, reason);
            publisher.publish(WorkflowEvent.rollbackStarted(type, reason, checkpointId));

            Map<String, StepResult> updated = new LinkedHashMap<>();
            stepResults.forEach((id, result) -> updated.put(id, result.copy()));
            Map<String, StepDefinition> byId = steps.stream()
                .collect(Collectors.toMap(StepDefinition::stepId, Function.identity(), (a, b) -> a));

            List<String> rolledBack = new ArrayList<>();
            List<String> errors = new ArrayList<>();

            for (StepResult target : targets(updated, checkpoint)) {
                StepDefinition step = byId.get(target.stepId());
                if (step == null || !step.hasRollback()) {
                    log.debug("No rollback action for step {}", target.stepId());
                    continue;
                }
                try {
                    step.rollbackAction().rollback(step.params().deepCopy());
                    updated.put(step.stepId(), target.withRolledBack());
                    rolledBack.add(step.stepId());
                    log.info("Rolled back step: {}", step.stepId());
                } catch (StepException | RuntimeException e) {
                    String error = "Rollback failed for " + step.stepId() + ": " + StepRunner.messageOf(e);
                    log.error(error);
                    errors.add(error);
                    metrics.rollbackFailed(type, step.stepId());
                }
            }

            metrics.rollbackExecuted(type);
            publisher.publish(WorkflowEvent.rollbackCompleted(type, reason, checkpointId, rolledBack));

            Instant completedAt = Instant.now();
            String message = String.format("Rolled back %d step(s)", rolledBack.size());
            log.info("{} with {} error(s)", message, errors.size());

            return new ExecutionResult(
                UUID.randomUUID().toString(),
                type,
                errors.isEmpty(),
                message,
                ExecutionStatus.ROLLED_BACK,
                updated,
                checkpoint,
                startedAt,
                completedAt,
                Duration.between(startedAt, completedAt),
                errors
            );
        }
    }

    /**
     * Completed results to undo, latest completion first. Ties keep reverse insertion order.
     */
    private static List<StepResult> targets(Map<String, StepResult> results, Checkpoint checkpoint) {
        Set<String> keep = checkpoint != null ? checkpoint.completedStepIds() : Set.of();
        List<StepResult> targets = results.values().stream()
            .filter(StepResult::isCompleted)
            .filter(r -> !keep.contains(r.stepId()))
            .collect(Collectors.toCollection(ArrayList::new));
        Collections.reverse(targets);
        targets.sort(Comparator.comparingLong(StepResult::completionSequence).reversed());
        return targets;
    }
}
