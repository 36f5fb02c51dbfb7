package com.waveflow.examples.close;

import com.waveflow.core.model.ExecutionResult;
import com.waveflow.core.model.StepDefinition;
import com.waveflow.core.state.WorkflowState;
import com.waveflow.engine.executor.WorkflowExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the month-end close for a period and rolls it back when it fails.
 */
public class MonthEndClose {

    private static final Logger log = LoggerFactory.getLogger(MonthEndClose.class);

    public static final String STATE_PERIOD = "period";

    /**
     * @param execution Result of the close run
     * @param rollback Result of the rollback, or null when the close succeeded
     */
    public record Outcome(ExecutionResult execution, ExecutionResult rollback) {

        public boolean rolledBack() {
            return rollback != null;
        }
    }

    private final WorkflowExecutor executor;
    private final CloseActivities activities;

    public MonthEndClose(WorkflowExecutor executor, CloseActivities activities) {
        this.executor = executor;
        this.activities = activities;
    }

    public Outcome close(String period) {
        List<StepDefinition> steps = MonthEndCloseWorkflow.createSteps(activities, period);
        WorkflowState state = new WorkflowState();
        state.seed(STATE_PERIOD, period);

        log.info("Starting month-end close for {}", period);
        ExecutionResult result = executor.execute(steps, MonthEndCloseWorkflow.WORKFLOW_TYPE, state);
        if (result.success()) {
            log.info("Close for {} completed: {}/{} steps", period, result.completedCount(), result.totalSteps());
            return new Outcome(result, null);
        }

        log.warn("Close for {} failed, rolling back: {}", period, result.errors());
        ExecutionResult rollback = executor.rollback(
            steps,
            result.stepResults(),
            "Close failed: " + String.join("; ", result.errors()),
            null,
            MonthEndCloseWorkflow.WORKFLOW_TYPE
        );
        if (!rollback.success()) {
            log.error("Rollback for {} incomplete: {}", period, rollback.errors());
        }
        return new Outcome(result, rollback);
    }
}
