package com.waveflow.core.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Optional;
import java.util.Set;

/**
 * A step's handle on the shared {@link WorkflowState}.
 * Writes are attributed to the bound step id.
 */
public final class StepStateView {

    private final WorkflowState state;
    private final String stepId;

    StepStateView(WorkflowState state, String stepId) {
        this.state = state;
        this.stepId = stepId;
    }

    public String stepId() {
        return stepId;
    }

    public Optional<JsonNode> get(String key) {
        return state.get(key);
    }

    public long getLong(String key, long fallback) {
        return state.get(key).filter(JsonNode::isNumber).map(JsonNode::asLong).orElse(fallback);
    }

    public String getText(String key, String fallback) {
        return state.get(key).filter(v -> !v.isNull()).map(JsonNode::asText).orElse(fallback);
    }

    public boolean contains(String key) {
        return state.contains(key);
    }

    public Set<String> keys() {
        return state.keys();
    }

    public void put(String key, JsonNode value) {
        state.write(stepId, key, value);
    }

    public void put(String key, String value) {
        state.write(stepId, key, JsonNodeFactory.instance.textNode(value));
    }

    public void put(String key, long value) {
        state.write(stepId, key, JsonNodeFactory.instance.numberNode(value));
    }

    public boolean remove(String key) {
        return state.remove(stepId, key);
    }
}
