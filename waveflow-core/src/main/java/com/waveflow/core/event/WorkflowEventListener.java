package com.waveflow.core.event;

/**
 * Receives events from an event bus subscription.
 */
@FunctionalInterface
public interface WorkflowEventListener {

    void onEvent(WorkflowEvent event) throws Exception;
}
