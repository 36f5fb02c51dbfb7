package com.waveflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.waveflow.core.step.RollbackAction;
import com.waveflow.core.step.StepAction;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Definition of a step within a submitted step set.
 * Describes what to execute, not run-specific data.
 *
 * Invariants:
 * - stepId is non-empty and unique within one submitted set
 * - retryCount >= 0
 * - timeout, if set, is positive (stored, not enforced)
 */
public record StepDefinition(
    // Identity
    String stepId,
    String name,

    // Execution
    StepAction action,
    List<String> dependencies,
    boolean canRunParallel,
    boolean required,
    Duration timeout,
    int retryCount,

    // Compensation
    RollbackAction rollbackAction,

    // Input
    JsonNode params
) {
    public StepDefinition {
        if (stepId == null || stepId.isBlank()) {
            throw new IllegalArgumentException("Step id cannot be empty");
        }
        Objects.requireNonNull(action, "Step action cannot be null for step " + stepId);
        if (retryCount < 0) {
            throw new IllegalArgumentException("Retry count must be >= 0 for step " + stepId);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Timeout must be positive for step " + stepId);
        }
        name = name != null ? name : stepId;
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        params = params != null ? params : JsonNodeFactory.instance.objectNode();
    }

    /**
     * Check if this step has a compensating action.
     */
    public boolean hasRollback() {
        return rollbackAction != null;
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    /**
     * Builder for StepDefinition.
     */
    public static Builder builder(String stepId) {
        return new Builder().stepId(stepId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String stepId;
        private String name;
        private StepAction action;
        private final List<String> dependencies = new ArrayList<>();
        private boolean canRunParallel = true;
        private boolean required = true;
        private Duration timeout;
        private int retryCount = 0;
        private RollbackAction rollbackAction;
        private JsonNode params;

        public Builder stepId(String stepId) {
            this.stepId = stepId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder action(StepAction action) {
            this.action = action;
            return this;
        }

        public Builder dependsOn(String... stepIds) {
            this.dependencies.addAll(List.of(stepIds));
            return this;
        }

        public Builder dependencies(List<String> stepIds) {
            this.dependencies.clear();
            this.dependencies.addAll(stepIds);
            return this;
        }

        public Builder canRunParallel(boolean canRunParallel) {
            this.canRunParallel = canRunParallel;
            return this;
        }

        /**
         * Shorthand for {@code canRunParallel(false)}.
         */
        public Builder sequential() {
            this.canRunParallel = false;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder rollbackAction(RollbackAction rollbackAction) {
            this.rollbackAction = rollbackAction;
            return this;
        }

        public Builder params(JsonNode params) {
            this.params = params;
            return this;
        }

        public StepDefinition build() {
            return new StepDefinition(
                stepId, name, action, dependencies, canRunParallel, required,
                timeout, retryCount, rollbackAction, params
            );
        }
    }
}
