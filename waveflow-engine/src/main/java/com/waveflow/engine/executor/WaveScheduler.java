package com.waveflow.engine.executor;

import com.waveflow.core.model.StepDefinition;
import com.waveflow.core.model.StepResult;
import com.waveflow.core.model.StepStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides which steps may start next.
 *
 * A step is ready when:
 * - it is not completed and has no settled result yet
 * - every dependency is completed
 * - no dependency has failed
 */
public class WaveScheduler {

    /**
     * Find the ready steps, in submission order.
     */
    public List<StepDefinition> readySteps(
            List<StepDefinition> steps,
            Set<String> completed,
            Map<String, StepResult> results) {
        List<StepDefinition> ready = new ArrayList<>();
        for (StepDefinition step : steps) {
            if (!isUnresolved(step, completed, results)) {
                continue;
            }
            boolean dependenciesMet = completed.containsAll(step.dependencies());
            boolean dependencyFailed = step.dependencies().stream()
                .map(results::get)
                .anyMatch(r -> r != null && r.status() == StepStatus.FAILED);
            if (dependenciesMet && !dependencyFailed) {
                ready.add(step);
            }
        }
        return ready;
    }

    /**
     * Split ready steps into a wave.
     */
    public Wave plan(int number, List<StepDefinition> ready) {
        List<StepDefinition> parallel = new ArrayList<>();
        List<StepDefinition> sequential = new ArrayList<>();
        for (StepDefinition step : ready) {
            if (step.canRunParallel()) {
                parallel.add(step);
            } else {
                sequential.add(step);
            }
        }
        return new Wave(number, parallel, sequential);
    }

    /**
     * Find the steps that have neither completed nor settled.
     */
    public List<StepDefinition> unresolvedSteps(
            List<StepDefinition> steps,
            Set<String> completed,
            Map<String, StepResult> results) {
        List<StepDefinition> unresolved = new ArrayList<>();
        for (StepDefinition step : steps) {
            if (isUnresolved(step, completed, results)) {
                unresolved.add(step);
            }
        }
        return unresolved;
    }

    private static boolean isUnresolved(StepDefinition step, Set<String> completed, Map<String, StepResult> results) {
        if (completed.contains(step.stepId())) {
            return false;
        }
        StepResult existing = results.get(step.stepId());
        return existing == null || !existing.isTerminal();
    }
}
