package de.bsommerfeld.labreport.core.event;

import java.time.Instant;

/**
 * A single change published on a topic.
 *
 * @param topic       identifier of the report whose subtree changed
 * @param type        what happened
 * @param payload     the full updated entity, or one of the
 *                    {@link ChangePayloads} records for deletes and subtopic
 *                    changes
 * @param publishedAt when the notifier accepted the event
 */
public record ChangeEvent(String topic, ChangeType type, Object payload, Instant publishedAt) {

    public String eventName() {
        return type.eventName();
    }
}
