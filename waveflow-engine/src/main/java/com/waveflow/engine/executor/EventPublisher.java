package com.waveflow.engine.executor;

import com.waveflow.core.event.WorkflowEvent;
import com.waveflow.core.event.WorkflowEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes to the event bus without letting a bus failure reach the run.
 */
final class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private final WorkflowEventBus eventBus;

    EventPublisher(WorkflowEventBus eventBus) {
        this.eventBus = eventBus != null ? eventBus : WorkflowEventBus.noop();
    }

    void publish(WorkflowEvent event) {
        try {
            eventBus.publish(event);
        } catch (RuntimeException e) {
            log.warn("Failed to publish {}: {}", event.type().value(), e.getMessage());
        }
    }
}
