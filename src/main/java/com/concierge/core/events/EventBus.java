package com.concierge.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Routes progress events to the listeners of the conversation they belong to.
 * <p>
 * Delivery is synchronous on the turn's thread, so listeners must not block.
 * The turn-facing listener is a {@link ProgressChannel} opened through
 * {@link #openChannel}, which queues without blocking and drops when full.
 * A conversation's entry is removed once its last listener unsubscribes.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<ConciergeEvent>>> listeners = new ConcurrentHashMap<>();

    public void publish(ConciergeEvent event) {
        List<Consumer<ConciergeEvent>> subscribers = listeners.get(event.conversationId());
        if (subscribers == null) {
            log.trace("No listeners for {} on conversation {}", event.eventType(), event.conversationId());
            return;
        }
        for (Consumer<ConciergeEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} for conversation {}: {}",
                        event.eventType(), event.conversationId(), e.getMessage(), e);
            }
        }
    }

    /**
     * Registers {@code listener} for one conversation's events.
     *
     * @return a handle that removes the listener again
     */
    public Subscription subscribe(String conversationId, Consumer<ConciergeEvent> listener) {
        listeners.computeIfAbsent(conversationId, id -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> listeners.computeIfPresent(conversationId, (id, subscribers) -> {
            subscribers.remove(listener);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }

    /**
     * Opens a bounded {@link ProgressChannel} on a conversation. Closing the
     * channel unsubscribes it; events queued before that stay readable.
     */
    public ProgressChannel openChannel(String conversationId, int capacity) {
        var channel = new ProgressChannel(capacity);
        channel.onClose(subscribe(conversationId, channel)::unsubscribe);
        return channel;
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
