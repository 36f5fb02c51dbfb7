package com.waveflow.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.waveflow.core.state.WorkflowState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointTest {

    private static final Instant START = Instant.parse("2024-01-31T10:00:00Z");

    @Test
    void capture_shouldDeepCopyResultsAndState() {
        ObjectNode output = JsonNodeFactory.instance.objectNode().put("rows", 5);
        Map<String, StepResult> results = new LinkedHashMap<>();
        results.put("a", StepResult.running("a", START, 1).withCompleted(output, 0, START.plusSeconds(1), 1L));
        WorkflowState state = new WorkflowState();
        state.write("a", "total", JsonNodeFactory.instance.numberNode(100));

        Checkpoint checkpoint = Checkpoint.capture(results, state.snapshot(), 1, Map.of("trigger", "wave"));

        output.put("rows", 6);
        results.put("b", StepResult.pending("b"));
        state.write("a", "total", JsonNodeFactory.instance.numberNode(200));

        assertNotNull(checkpoint.checkpointId());
        assertEquals(1, checkpoint.stepResults().size());
        assertEquals(5, checkpoint.stepResults().get("a").output().get("rows").asInt());
        assertEquals(100, checkpoint.workflowState().get("total").orElseThrow().asInt());
        assertEquals("wave", checkpoint.metadata().get("trigger"));
        assertEquals(1, checkpoint.wave());
    }

    @Test
    void capture_shouldGenerateDistinctIds() {
        Checkpoint first = Checkpoint.capture(Map.of(), null, 0, null);
        Checkpoint second = Checkpoint.capture(Map.of(), null, 0, null);

        assertNotEquals(first.checkpointId(), second.checkpointId());
        assertTrue(first.workflowState().isEmpty());
        assertTrue(first.metadata().isEmpty());
    }

    @Test
    void completedStepIds_shouldOnlyIncludeCompleted() {
        Map<String, StepResult> results = new LinkedHashMap<>();
        results.put("a", StepResult.running("a", START, 1).withCompleted(null, 0, START, 1L));
        results.put("b", StepResult.running("b", START, 1).withFailed("x", 0, START));
        results.put("c", StepResult.skipped("c", "Dependencies not met", 2));
        results.put("d", StepResult.running("d", START, 2).withCompleted(null, 0, START, 3L));

        Checkpoint checkpoint = Checkpoint.capture(results, null, 2, Map.of());

        assertEquals(Set.of("a", "d"), checkpoint.completedStepIds());
        assertEquals(3L, checkpoint.lastCompletionSequence());
    }

    @Test
    void copyStepResults_shouldBeIndependentOfCheckpoint() {
        Map<String, StepResult> results = new LinkedHashMap<>();
        results.put("a", StepResult.running("a", START, 1)
            .withCompleted(JsonNodeFactory.instance.objectNode().put("k", 1), 0, START, 1L));
        Checkpoint checkpoint = Checkpoint.capture(results, null, 1, Map.of());

        Map<String, StepResult> copy = checkpoint.copyStepResults();
        ((ObjectNode) copy.get("a").output()).put("k", 2);
        copy.remove("a");

        assertEquals(1, checkpoint.stepResults().get("a").output().get("k").asInt());
        assertThrows(UnsupportedOperationException.class, () -> checkpoint.stepResults().clear());
    }
}
