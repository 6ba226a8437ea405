package de.bsommerfeld.labreport.core.event;

/**
 * Receiver of change events for the topics it has joined. Implementations
 * must not block: delivery happens on the publishing thread while the topic
 * is locked.
 */
public interface ChangeSubscriber {

    /** Stable identifier used in log output. */
    String id();

    void deliver(ChangeEvent event);
}
