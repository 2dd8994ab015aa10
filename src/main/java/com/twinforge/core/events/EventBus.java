package com.twinforge.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for run transition events.
 * <p>
 * Supports per-run subscriptions and global subscriptions that receive all events.
 * Publishing is synchronous on the caller's thread, so events from one runner reach
 * subscribers in the order they were emitted.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-run subscribers keyed by runId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<RunEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all runs. */
    private final CopyOnWriteArrayList<Consumer<RunEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (global first, then run-specific).
     *
     * @param event the event to publish
     */
    public void publish(RunEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());

        // Global subscribers include the status registry, which must see a transition
        // before any streaming client does
        for (Consumer<RunEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }

        List<Consumer<RunEvent>> runSubs = runSubscribers.get(event.runId());
        if (runSubs != null) {
            for (Consumer<RunEvent> subscriber : runSubs) {
                deliverSafely(subscriber, event);
            }
        }
    }

    /**
     * Subscribe to events for a specific run.
     *
     * @param runId    the run to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<RunEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to run {}", runId);
        return () -> {
            CopyOnWriteArrayList<Consumer<RunEvent>> subs = runSubscribers.get(runId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    runSubscribers.remove(runId, subs);
                }
            }
        };
    }

    /**
     * Subscribe to events from all runs.
     *
     * @param consumer callback invoked for each event regardless of run
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<RunEvent> consumer) {
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

    private void deliverSafely(Consumer<RunEvent> subscriber, RunEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
