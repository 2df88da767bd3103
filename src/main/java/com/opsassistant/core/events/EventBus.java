package com.opsassistant.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for pipeline events.
 * <p>
 * Supports per-query subscriptions and global subscriptions that receive all events.
 * Safe for concurrent publishing from executor worker threads.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<PipelineEvent>>> querySubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<PipelineEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(PipelineEvent event) {
        log.debug("Publishing event: {} for query {}", event.eventType(), event.queryId());

        if (event.queryId() != null) {
            List<Consumer<PipelineEvent>> subs = querySubscribers.get(event.queryId());
            if (subs != null) {
                for (Consumer<PipelineEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }
        for (Consumer<PipelineEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribes to the events of one query. The subscription list is dropped
     * once its last subscriber unsubscribes.
     */
    public Subscription subscribe(String queryId, Consumer<PipelineEvent> consumer) {
        querySubscribers.computeIfAbsent(queryId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> querySubscribers.computeIfPresent(queryId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<PipelineEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PipelineEvent> subscriber, PipelineEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
