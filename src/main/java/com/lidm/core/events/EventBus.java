package com.lidm.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for query execution and circuit events.
 * <p>
 * Supports per-query subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-query subscribers keyed by queryId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<LidmEvent>>> querySubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive every event. */
    private final CopyOnWriteArrayList<Consumer<LidmEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (query-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(LidmEvent event) {
        log.debug("Publishing event: {} for query {}", event.eventType(), event.queryId());

        if (event.queryId() != null) {
            List<Consumer<LidmEvent>> querySubs = querySubscribers.get(event.queryId());
            if (querySubs != null) {
                for (Consumer<LidmEvent> subscriber : querySubs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<LidmEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific query.
     *
     * @param queryId  the query to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String queryId, Consumer<LidmEvent> consumer) {
        querySubscribers.computeIfAbsent(queryId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to query {}", queryId);
        return () -> querySubscribers.computeIfPresent(queryId, (id, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Subscribe to every event (global subscription).
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<LidmEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<LidmEvent> subscriber, LidmEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
