package com.waveflow.engine.executor;

import com.waveflow.core.exception.WorkflowValidationException;
import com.waveflow.core.model.StepDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rejects step sets that cannot be scheduled.
 */
public class StepGraphValidator {

    /**
     * Validate a submitted step set.
     *
     * @param steps The submitted steps
     * @param checkGraph Whether to also reject unknown dependencies and cycles
     * @throws WorkflowValidationException if the set is rejected
     */
    public void validate(List<StepDefinition> steps, boolean checkGraph) {
        if (steps == null || steps.isEmpty()) {
            throw new WorkflowValidationException("steps", "at least one step is required");
        }

        Map<String, StepDefinition> byId = new LinkedHashMap<>();
        for (StepDefinition step : steps) {
            if (byId.putIfAbsent(step.stepId(), step) != null) {
                throw new WorkflowValidationException("steps",
                    String.format("duplicate step id '%s'", step.stepId()));
            }
        }

        if (!checkGraph) {
            return;
        }

        for (StepDefinition step : steps) {
            for (String dependency : step.dependencies()) {
                if (!byId.containsKey(dependency)) {
                    throw new WorkflowValidationException("dependencies",
                        String.format("step '%s' depends on unknown step '%s'", step.stepId(), dependency));
                }
            }
        }

        Optional<List<String>> cycle = findCycle(steps);
        if (cycle.isPresent()) {
            throw WorkflowValidationException.cycle(cycle.get());
        }
    }

    /**
     * Find a dependency cycle. Dependencies on ids outside the set are ignored.
     *
     * @return Step ids along the cycle with the first id repeated at the end
     */
    public Optional<List<String>> findCycle(List<StepDefinition> steps) {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (StepDefinition step : steps) {
            edges.put(step.stepId(), step.dependencies());
        }

        Set<String> done = new HashSet<>();
        for (String start : edges.keySet()) {
            if (done.contains(start)) {
                continue;
            }
            List<String> cycle = search(start, edges, done);
            if (cycle != null) {
                return Optional.of(cycle);
            }
        }
        return Optional.empty();
    }

    // Iterative DFS; the stack holds the current path
    private static List<String> search(String start, Map<String, List<String>> edges, Set<String> done) {
        Deque<String> path = new ArrayDeque<>();
        Deque<Integer> nextChild = new ArrayDeque<>();
        Map<String, Integer> onPath = new HashMap<>();

        path.push(start);
        nextChild.push(0);
        onPath.put(start, 0);

        while (!path.isEmpty()) {
            String current = path.peek();
            int index = nextChild.pop();
            List<String> dependencies = edges.getOrDefault(current, List.of());

            if (index >= dependencies.size()) {
                path.pop();
                onPath.remove(current);
                done.add(current);
                continue;
            }
            nextChild.push(index + 1);

            String dependency = dependencies.get(index);
            if (!edges.containsKey(dependency) || done.contains(dependency)) {
                continue;
            }
            if (onPath.containsKey(dependency)) {
                List<String> cycle = new ArrayList<>();
                List<String> ordered = new ArrayList<>(path);
                Collections.reverse(ordered);
                cycle.addAll(ordered.subList(onPath.get(dependency), ordered.size()));
                cycle.add(dependency);
                return cycle;
            }
            onPath.put(dependency, path.size());
            path.push(dependency);
            nextChild.push(0);
        }
        return null;
    }
}
