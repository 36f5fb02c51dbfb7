package com.waveflow.core.step;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Business logic for one workflow step.
 * Callers implement this interface once per kind of step.
 */
@FunctionalInterface
public interface StepAction {

    /**
     * Execute the step.
     *
     * @param context Execution context providing params, shared state and attempt info
     * @return The step output, may be {@code null}
     * @throws StepException if the step fails
     */
    JsonNode execute(StepContext context) throws StepException;
}
