package com.hypecycle.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for classification progress events.
 * <p>
 * Supports per-keyword subscriptions and global subscriptions that receive all events.
 * Thread-safe: collectors publish from worker threads.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-keyword subscribers keyed by normalized keyword. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ClassificationEvent>>> keywordSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<ClassificationEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(ClassificationEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());

        List<Consumer<ClassificationEvent>> subscribers = keywordSubscribers.get(event.keyword());
        if (subscribers != null) {
            for (Consumer<ClassificationEvent> subscriber : subscribers) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<ClassificationEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for runs classifying the given keyword.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String keyword, Consumer<ClassificationEvent> consumer) {
        keywordSubscribers.computeIfAbsent(keyword, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<ClassificationEvent>> subs = keywordSubscribers.get(keyword);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<ClassificationEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ClassificationEvent> subscriber, ClassificationEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
