package com.waveflow.engine.event;

import com.waveflow.core.event.WorkflowEvent;
import com.waveflow.core.event.WorkflowEventBus;
import com.waveflow.core.event.WorkflowEventListener;
import com.waveflow.core.event.WorkflowEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process event bus with per-type and pattern subscriptions.
 *
 * Listeners run synchronously on the publishing thread. A failing listener is logged
 * and does not affect other listeners or the publisher. Every published event is
 * kept in a bounded history, oldest dropped first.
 */
public class InMemoryWorkflowEventBus implements WorkflowEventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkflowEventBus.class);

    public static final int DEFAULT_MAX_HISTORY = 500;
    public static final int DEFAULT_HISTORY_LIMIT = 100;

    private final Map<WorkflowEventType, CopyOnWriteArrayList<WorkflowEventListener>> listeners = new ConcurrentHashMap<>();
    private final Map<String, CopyOnWriteArrayList<WorkflowEventListener>> patternListeners = new ConcurrentHashMap<>();
    private final Deque<WorkflowEvent> history = new ArrayDeque<>();
    private final int maxHistory;
    private volatile WorkflowEventBus externalPublisher;

    public InMemoryWorkflowEventBus() {
        this(DEFAULT_MAX_HISTORY);
    }

    public InMemoryWorkflowEventBus(int maxHistory) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("Max history must be >= 1");
        }
        this.maxHistory = maxHistory;
    }

    /**
     * Forward every published event to another bus, e.g. a message broker adapter.
     * Pass null to remove it.
     */
    public void setExternalPublisher(WorkflowEventBus externalPublisher) {
        this.externalPublisher = externalPublisher;
    }

    /**
     * Subscribe to one event type. Subscribing the same listener twice has no effect.
     */
    public void subscribe(WorkflowEventType type, WorkflowEventListener listener) {
        if (listeners.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).addIfAbsent(listener)) {
            log.debug("Subscribed listener to {}", type.value());
        }
    }

    /**
     * Subscribe to every event type whose wire value matches a pattern such as
     * {@code workflow:step:*}.
     */
    public void subscribePattern(String pattern, WorkflowEventListener listener) {
        if (patternListeners.computeIfAbsent(pattern, k -> new CopyOnWriteArrayList<>()).addIfAbsent(listener)) {
            log.debug("Subscribed listener to pattern {}", pattern);
        }
    }

    /**
     * @return true if the listener was subscribed to the type
     */
    public boolean unsubscribe(WorkflowEventType type, WorkflowEventListener listener) {
        CopyOnWriteArrayList<WorkflowEventListener> list = listeners.get(type);
        boolean removed = list != null && list.remove(listener);
        if (removed) {
            log.debug("Unsubscribed listener from {}", type.value());
        }
        return removed;
    }

    /**
     * @return true if the listener was subscribed to the pattern
     */
    public boolean unsubscribePattern(String pattern, WorkflowEventListener listener) {
        CopyOnWriteArrayList<WorkflowEventListener> list = patternListeners.get(pattern);
        return list != null && list.remove(listener);
    }

    @Override
    public void publish(WorkflowEvent event) {
        String key = event.type().value();
        record(event);

        for (WorkflowEventListener listener : listeners.getOrDefault(event.type(), new CopyOnWriteArrayList<>())) {
            dispatch(listener, event, key);
        }

        patternListeners.forEach((pattern, list) -> {
            if (event.type().matches(pattern)) {
                for (WorkflowEventListener listener : list) {
                    dispatch(listener, event, pattern);
                }
            }
        });

        WorkflowEventBus external = externalPublisher;
        if (external != null) {
            try {
                external.publish(event);
            } catch (RuntimeException e) {
                log.error("External publisher failed for {}: {}", key, e.getMessage(), e);
            }
        }

        log.debug("Published workflow event: {}", key);
    }

    /**
     * Get recent events, oldest first.
     *
     * @param type Event type to filter by, or null for all
     * @param workflowType Workflow type to filter by, or null for all
     * @param limit Maximum number of events, taken from the most recent
     */
    public List<WorkflowEvent> getHistory(WorkflowEventType type, String workflowType, int limit) {
        List<WorkflowEvent> matching = new ArrayList<>();
        synchronized (history) {
            for (WorkflowEvent event : history) {
                if (type != null && event.type() != type) {
                    continue;
                }
                if (workflowType != null && !workflowType.equals(event.workflowType())) {
                    continue;
                }
                matching.add(event);
            }
        }
        int from = Math.max(0, matching.size() - Math.max(0, limit));
        return new ArrayList<>(matching.subList(from, matching.size()));
    }

    public List<WorkflowEvent> getHistory() {
        return getHistory(null, null, DEFAULT_HISTORY_LIMIT);
    }

    public int historySize() {
        synchronized (history) {
            return history.size();
        }
    }

    public void clearListeners() {
        listeners.clear();
        patternListeners.clear();
    }

    public void clearHistory() {
        synchronized (history) {
            history.clear();
        }
    }

    private void record(WorkflowEvent event) {
        synchronized (history) {
            history.addLast(event);
            while (history.size() > maxHistory) {
                history.removeFirst();
            }
        }
    }

    private void dispatch(WorkflowEventListener listener, WorkflowEvent event, String subscription) {
        try {
            listener.onEvent(event);
        } catch (Exception e) {
            log.error("Listener error for {}: {}", subscription, e.getMessage(), e);
        }
    }
}
