package com.conductor.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for job and process events.
 * <p>
 * Supports per-job subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations. A subscriber that
 * throws never prevents delivery to the others.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ConductorEvent>>> jobSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<ConductorEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(ConductorEvent event) {
        log.debug("Publishing event: {} for job {}", event.eventType(), event.jobId());

        if (event.jobId() != null) {
            List<Consumer<ConductorEvent>> subs = jobSubscribers.get(event.jobId());
            if (subs != null) {
                for (Consumer<ConductorEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<ConductorEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific job.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String jobId, Consumer<ConductorEvent> consumer) {
        jobSubscribers.computeIfAbsent(jobId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<ConductorEvent>> subs = jobSubscribers.get(jobId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    jobSubscribers.remove(jobId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<ConductorEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Drops every per-job subscriber of a job, e.g. once its final event was delivered.
     */
    public void unsubscribeJob(String jobId) {
        jobSubscribers.remove(jobId);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ConductorEvent> subscriber, ConductorEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
