package de.bsommerfeld.labreport.core.event;

import com.google.common.util.concurrent.Striped;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;

/**
 * In-process {@link ChangeNotifier} backed by a concurrent topic membership
 * table.
 *
 * <h3>Threading model</h3>
 * <ul>
 * <li><strong>Membership</strong>: each topic maps to a concurrent key set.
 * Subscribe and unsubscribe never block a publish. A publish iterating a
 * set while members come and go sees a weakly-consistent view of it and never
 * fails with a concurrent modification.</li>
 * <li><strong>Delivery</strong>: publishes on the same topic are serialized by
 * a striped lock, so every subscriber observes one topic's events in publish
 * order. Publishes on different topics run in parallel unless their stripes
 * collide.</li>
 * </ul>
 *
 * <p>
 * A subscriber that throws is logged and skipped. The remaining subscribers
 * still receive the event and the publisher never sees the failure.
 */
@Singleton
public class TopicChangeNotifier implements ChangeNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(TopicChangeNotifier.class);
    private static final int LOCK_STRIPES = 64;

    private final Map<String, Set<ChangeSubscriber>> topics = new ConcurrentHashMap<>();
    private final Striped<Lock> topicLocks = Striped.lock(LOCK_STRIPES);
    private final ApplicationEventBus eventBus;
    private final Clock clock;

    @Inject
    public TopicChangeNotifier(ApplicationEventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Override
    public void publish(String topic, ChangeType type, Object payload) {
        ChangeEvent event = new ChangeEvent(topic, type, payload, clock.instant());
        Lock lock = topicLocks.get(topic);
        lock.lock();
        try {
            Set<ChangeSubscriber> subscribers = topics.get(topic);
            int delivered = 0;
            if (subscribers != null) {
                for (ChangeSubscriber subscriber : subscribers) {
                    try {
                        subscriber.deliver(event);
                        delivered++;
                    } catch (RuntimeException e) {
                        LOG.warn("Subscriber {} failed to receive {} on topic {}",
                                subscriber.id(), type.eventName(), topic, e);
                    }
                }
            }
            LOG.debug("Published {} on topic {} to {} subscriber(s)", type.eventName(), topic, delivered);
            eventBus.post(event);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void subscribe(String topic, ChangeSubscriber subscriber) {
        // add inside compute: a concurrent unsubscribe may drop the emptied set
        topics.compute(topic, (k, members) -> {
            Set<ChangeSubscriber> target = members != null ? members : ConcurrentHashMap.newKeySet();
            target.add(subscriber);
            return target;
        });
        LOG.info("Subscriber {} joined topic {}", subscriber.id(), topic);
    }

    @Override
    public void unsubscribe(String topic, ChangeSubscriber subscriber) {
        topics.computeIfPresent(topic, (k, members) -> leave(members, subscriber));
        LOG.info("Subscriber {} left topic {}", subscriber.id(), topic);
    }

    @Override
    public void unsubscribeAll(ChangeSubscriber subscriber) {
        for (String topic : topics.keySet()) {
            topics.computeIfPresent(topic, (k, members) -> leave(members, subscriber));
        }
        LOG.debug("Subscriber {} removed from all topics", subscriber.id());
    }

    private static Set<ChangeSubscriber> leave(Set<ChangeSubscriber> members, ChangeSubscriber subscriber) {
        members.remove(subscriber);
        return members.isEmpty() ? null : members;
    }

    @Override
    public int subscriberCount(String topic) {
        Set<ChangeSubscriber> members = topics.get(topic);
        return members == null ? 0 : members.size();
    }
}
