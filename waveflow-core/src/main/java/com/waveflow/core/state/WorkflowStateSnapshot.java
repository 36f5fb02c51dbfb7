package com.waveflow.core.state;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable point-in-time copy of a {@link WorkflowState}.
 *
 * Invariants:
 * - values are deep copies, never shared with the live state
 * - every key in owners is also a key in values
 */
public record WorkflowStateSnapshot(
    Map<String, JsonNode> values,
    Map<String, String> owners
) {
    public WorkflowStateSnapshot {
        Map<String, JsonNode> copiedValues = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((key, value) -> copiedValues.put(key, value != null ? value.deepCopy() : null));
        }
        values = Collections.unmodifiableMap(copiedValues);
        owners = owners != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(owners))
            : Map.of();
    }

    public static WorkflowStateSnapshot empty() {
        return new WorkflowStateSnapshot(Map.of(), Map.of());
    }

    /**
     * Get a copy of one value.
     */
    public Optional<JsonNode> get(String key) {
        JsonNode value = values.get(key);
        return value != null ? Optional.of(value.deepCopy()) : Optional.empty();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }
}
