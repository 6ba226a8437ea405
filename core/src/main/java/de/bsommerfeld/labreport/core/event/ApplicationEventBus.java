package de.bsommerfeld.labreport.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thin wrapper around Guava's EventBus for in-process observers. Every
 * {@link ChangeEvent} that the {@link TopicChangeNotifier} delivers to its
 * topic subscribers is also posted here, so components that care about all
 * changes (logging, auditing) do not need to join every topic.
 *
 * <p>
 * Dispatch is synchronous on the posting thread. Exceptions thrown by
 * listeners are logged and do not propagate to the poster.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::logListenerFailure);
    }

    public void post(Object event) {
        LOG.trace("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    private static void logListenerFailure(Throwable cause, SubscriberExceptionContext context) {
        LOG.warn("Listener {} failed on {}", context.getSubscriber().getClass().getName(),
                context.getEvent().getClass().getSimpleName(), cause);
    }
}
