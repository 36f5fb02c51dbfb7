package com.waveflow.core.step;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.waveflow.core.state.StepStateView;

/**
 * Context handed to a {@link StepAction} for one attempt.
 */
public class StepContext {

    private final String executionId;
    private final String workflowType;
    private final String stepId;
    private final String stepName;
    private final int attemptNumber;
    private final JsonNode params;
    private final StepStateView state;

    public StepContext(
            String executionId,
            String workflowType,
            String stepId,
            String stepName,
            int attemptNumber,
            JsonNode params,
            StepStateView state) {
        this.executionId = executionId;
        this.workflowType = workflowType;
        this.stepId = stepId;
        this.stepName = stepName;
        this.attemptNumber = attemptNumber;
        this.params = params;
        this.state = state;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowType() {
        return workflowType;
    }

    public String getStepId() {
        return stepId;
    }

    public String getStepName() {
        return stepName;
    }

    /**
     * Get the attempt number, starting at 1.
     */
    public int getAttemptNumber() {
        return attemptNumber;
    }

    /**
     * Get this attempt's private copy of the step params.
     */
    public JsonNode getParams() {
        return params;
    }

    /**
     * Get a text param, or the fallback when absent.
     */
    public String getParam(String name, String fallback) {
        JsonNode value = params.get(name);
        return value != null && !value.isNull() ? value.asText() : fallback;
    }

    /**
     * Get the shared workflow state as seen by this step.
     */
    public StepStateView getState() {
        return state;
    }

    /**
     * Create an empty object node for building step output.
     */
    public ObjectNode newOutput() {
        return JsonNodeFactory.instance.objectNode();
    }
}
