package com.waveflow.core.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.waveflow.core.exception.StateOwnershipException;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Workflow state shared by every step of a run, including steps running in parallel.
 *
 * Values are Jackson trees. Every read and write happens under a read/write lock and
 * reads hand out copies, so no caller can mutate a stored value in place.
 *
 * Field ownership:
 * - a key belongs to the first step that writes it
 * - only the owning step may overwrite or remove the key afterwards
 * - keys seeded by the caller have no owner until a step claims them by writing
 * - every step may read every key
 */
public class WorkflowState {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, JsonNode> values = new LinkedHashMap<>();
    private final Map<String, String> owners = new LinkedHashMap<>();

    public WorkflowState() {
    }

    /**
     * Create a state seeded with unowned values.
     */
    public WorkflowState(Map<String, JsonNode> initialValues) {
        if (initialValues != null) {
            initialValues.forEach(this::seed);
        }
    }

    /**
     * Create a state holding a copy of the snapshot's values and owners.
     */
    public static WorkflowState fromSnapshot(WorkflowStateSnapshot snapshot) {
        WorkflowState state = new WorkflowState();
        state.restore(snapshot);
        return state;
    }

    /**
     * Put an unowned value. Used by callers before a run starts.
     */
    public void seed(String key, JsonNode value) {
        Objects.requireNonNull(key, "State key cannot be null");
        lock.writeLock().lock();
        try {
            values.put(key, copyOf(value));
            owners.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void seed(String key, String value) {
        seed(key, JsonNodeFactory.instance.textNode(value));
    }

    public void seed(String key, long value) {
        seed(key, JsonNodeFactory.instance.numberNode(value));
    }

    /**
     * Write a value on behalf of a step.
     *
     * @throws StateOwnershipException if another step owns the key
     */
    public void write(String stepId, String key, JsonNode value) {
        Objects.requireNonNull(stepId, "Writer step id cannot be null");
        Objects.requireNonNull(key, "State key cannot be null");
        lock.writeLock().lock();
        try {
            checkOwnership(stepId, key);
            values.put(key, copyOf(value));
            owners.put(key, stepId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove a value on behalf of a step.
     *
     * @return true if the key was present
     * @throws StateOwnershipException if another step owns the key
     */
    public boolean remove(String stepId, String key) {
        lock.writeLock().lock();
        try {
            checkOwnership(stepId, key);
            owners.remove(key);
            return values.remove(key) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Get a copy of a value.
     */
    public Optional<JsonNode> get(String key) {
        lock.readLock().lock();
        try {
            JsonNode value = values.get(key);
            return value != null ? Optional.of(value.deepCopy()) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String key) {
        lock.readLock().lock();
        try {
            return values.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Get the step that owns a key, if any.
     */
    public Optional<String> ownerOf(String key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(owners.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> keys() {
        lock.readLock().lock();
        try {
            return new LinkedHashSet<>(values.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return values.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Take an immutable deep copy of values and owners.
     */
    public WorkflowStateSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new WorkflowStateSnapshot(values, owners);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replace the entire contents with a copy of the snapshot.
     */
    public void restore(WorkflowStateSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
        lock.writeLock().lock();
        try {
            values.clear();
            owners.clear();
            snapshot.values().forEach((key, value) -> values.put(key, copyOf(value)));
            owners.putAll(snapshot.owners());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Get the view of this state a single step works with.
     */
    public StepStateView forStep(String stepId) {
        return new StepStateView(this, stepId);
    }

    private void checkOwnership(String stepId, String key) {
        String owner = owners.get(key);
        if (owner != null && !owner.equals(stepId)) {
            throw new StateOwnershipException(key, owner, stepId);
        }
    }

    private static JsonNode copyOf(JsonNode value) {
        return value != null ? value.deepCopy() : JsonNodeFactory.instance.nullNode();
    }
}
