package com.waveflow.engine.executor;

import com.waveflow.core.model.StepDefinition;

import java.util.List;

/**
 * One scheduling round: the ready steps split into those that may share the worker
 * pool and those that must run one at a time afterwards. Both lists keep submission order.
 */
public record Wave(
    int number,
    List<StepDefinition> parallel,
    List<StepDefinition> sequential
) {
    public Wave {
        parallel = List.copyOf(parallel);
        sequential = List.copyOf(sequential);
    }

    public int size() {
        return parallel.size() + sequential.size();
    }

    public boolean isEmpty() {
        return parallel.isEmpty() && sequential.isEmpty();
    }
}
