package de.bsommerfeld.labreport.core.event;

/**
 * Topic-scoped, best-effort change broadcast. A topic is a report
 * identifier.
 *
 * <ul>
 * <li>Fire-and-forget: no delivery confirmation.</li>
 * <li>Events on one topic reach each subscriber in publish order. There is no
 * ordering across topics.</li>
 * <li>Nothing is retained: a subscriber that joins after a publish never
 * receives it.</li>
 * </ul>
 */
public interface ChangeNotifier {

    /**
     * Delivers a change to every current subscriber of {@code topic}. A topic
     * without subscribers is not an error.
     */
    void publish(String topic, ChangeType type, Object payload);

    void subscribe(String topic, ChangeSubscriber subscriber);

    void unsubscribe(String topic, ChangeSubscriber subscriber);

    /**
     * Removes the subscriber from every topic it joined. Called when a realtime
     * connection closes.
     */
    void unsubscribeAll(ChangeSubscriber subscriber);

    int subscriberCount(String topic);
}
