package de.bsommerfeld.labreport.server;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.labreport.core.event.ApplicationEventBus;
import de.bsommerfeld.labreport.core.event.ChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Logs every published change. Registers itself on the event bus.
 */
@Singleton
public class ChangeLogListener {

    private static final Logger LOG = LoggerFactory.getLogger(ChangeLogListener.class);

    private final AtomicLong published = new AtomicLong();

    @Inject
    public ChangeLogListener(ApplicationEventBus eventBus) {
        eventBus.register(this);
    }

    @Subscribe
    public void onChange(ChangeEvent event) {
        long count = published.incrementAndGet();
        LOG.debug("[{}] {} on {} at {}", count, event.eventName(), event.topic(), event.publishedAt());
    }

    public long publishedCount() {
        return published.get();
    }
}
