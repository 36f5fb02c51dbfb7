package com.waveflow.core.step;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Compensating action that reverses the side effects of a completed step.
 * Receives only the step's original params, never its output or the workflow state.
 */
@FunctionalInterface
public interface RollbackAction {

    /**
     * Undo the step.
     *
     * @param params Copy of the params the step was defined with
     * @throws StepException if the compensation fails
     */
    void rollback(JsonNode params) throws StepException;
}
