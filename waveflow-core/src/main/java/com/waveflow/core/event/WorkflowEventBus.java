package com.waveflow.core.event;

/**
 * Outbound port for workflow events.
 * Publishing is fire-and-forget: callers never retry or buffer.
 */
@FunctionalInterface
public interface WorkflowEventBus {

    /**
     * Publish an event.
     *
     * @param event The event to publish
     */
    void publish(WorkflowEvent event);

    /**
     * Event bus that drops every event.
     */
    static WorkflowEventBus noop() {
        return event -> { };
    }
}
