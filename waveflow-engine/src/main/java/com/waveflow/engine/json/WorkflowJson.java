package com.waveflow.engine.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.waveflow.core.event.WorkflowEvent;
import com.waveflow.core.exception.WaveflowException;
import com.waveflow.core.model.Checkpoint;
import com.waveflow.core.model.ExecutionResult;
import com.waveflow.core.model.StepDefinition;
import com.waveflow.core.model.StepResult;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Exports results, checkpoints, events and step descriptions as snake_case JSON trees.
 * Timestamps are ISO-8601 strings and durations are seconds rounded to three decimals.
 */
public class WorkflowJson {

    public static final String ERROR_CODE = "SERIALIZATION_FAILED";

    private final ObjectMapper objectMapper;

    public WorkflowJson() {
        this(defaultObjectMapper());
    }

    public WorkflowJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public ObjectNode toJson(ExecutionResult result) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("execution_id", result.executionId());
        node.put("workflow_type", result.workflowType());
        node.put("success", result.success());
        node.put("message", result.message());
        node.put("status", result.status().value());
        ObjectNode steps = node.putObject("step_results");
        result.stepResults().forEach((id, stepResult) -> steps.set(id, toJson(stepResult)));
        node.set("checkpoint", result.checkpoint() != null ? toJson(result.checkpoint()) : null);
        node.set("started_at", instant(result.startedAt()));
        node.set("completed_at", instant(result.completedAt()));
        node.put("duration_seconds", seconds(result.duration()));
        ArrayNode errors = node.putArray("errors");
        result.errors().forEach(errors::add);
        node.put("completed_count", result.completedCount());
        node.put("total_steps", result.totalSteps());
        return node;
    }

    public ObjectNode toJson(StepResult result) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("step_id", result.stepId());
        node.put("status", result.status().value());
        node.set("started_at", instant(result.startedAt()));
        node.set("completed_at", instant(result.completedAt()));
        node.set("result", result.output() != null ? result.output().deepCopy() : null);
        node.put("error", result.error());
        node.put("retry_attempts", result.retryAttempts());
        node.put("duration_seconds", seconds(result.duration()));
        node.put("wave", result.wave());
        node.put("completion_sequence", result.completionSequence());
        return node;
    }

    public ObjectNode toJson(Checkpoint checkpoint) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("checkpoint_id", checkpoint.checkpointId());
        node.set("created_at", instant(checkpoint.createdAt()));
        node.put("wave", checkpoint.wave());
        ObjectNode steps = node.putObject("step_results");
        checkpoint.stepResults().forEach((id, stepResult) -> steps.set(id, toJson(stepResult)));
        ObjectNode state = node.putObject("workflow_state");
        checkpoint.workflowState().values().forEach((key, value) -> state.set(key, value != null ? value.deepCopy() : null));
        ObjectNode metadata = node.putObject("metadata");
        checkpoint.metadata().forEach(metadata::put);
        return node;
    }

    public ObjectNode toJson(WorkflowEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("event_id", event.eventId().toString());
        node.put("event_type", event.type().value());
        node.set("timestamp", instant(event.timestamp()));
        node.put("source", event.source());
        node.put("workflow_type", event.workflowType());
        putIfPresent(node, "execution_id", event.executionId());
        if (event.type().isStepEvent()) {
            node.put("step_id", event.stepId());
            node.put("step_name", event.stepName());
            node.put("duration_seconds", seconds(event.duration()));
            node.put("error_message", event.error());
        } else {
            putIfPresent(node, "checkpoint_id", event.checkpointId());
        }
        if (event.type().isRollbackEvent()) {
            node.put("rollback_reason", event.reason());
            node.put("steps_rolled_back", event.stepsRolledBackCount());
        }
        return node;
    }

    /**
     * Describe a step definition without its actions.
     */
    public ObjectNode describe(StepDefinition step) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("step_id", step.stepId());
        node.put("name", step.name());
        ArrayNode dependencies = node.putArray("dependencies");
        step.dependencies().forEach(dependencies::add);
        node.put("can_run_parallel", step.canRunParallel());
        node.put("is_required", step.required());
        if (step.timeout() != null) {
            node.put("timeout_seconds", seconds(step.timeout()));
        } else {
            node.putNull("timeout_seconds");
        }
        node.put("retry_count", step.retryCount());
        node.put("has_rollback", step.hasRollback());
        node.set("params", step.params().deepCopy());
        return node;
    }

    /**
     * Write a tree as a JSON string.
     *
     * @throws WaveflowException with code SERIALIZATION_FAILED
     */
    public String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new WaveflowException(ERROR_CODE, "Failed to serialize JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Write a tree as an indented JSON string.
     *
     * @throws WaveflowException with code SERIALIZATION_FAILED
     */
    public String writePretty(JsonNode node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new WaveflowException(ERROR_CODE, "Failed to serialize JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse a JSON string into a tree.
     *
     * @throws WaveflowException with code SERIALIZATION_FAILED
     */
    public JsonNode read(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new WaveflowException(ERROR_CODE, "Failed to parse JSON: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode instant(Instant instant) {
        return instant != null ? objectMapper.valueToTree(instant) : null;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    static double seconds(Duration duration) {
        if (duration == null) {
            return 0.0;
        }
        return BigDecimal.valueOf(duration.toNanos(), 9)
            .setScale(3, RoundingMode.HALF_UP)
            .doubleValue();
    }
}
