package com.meshcontrol.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process fan-out of mesh events.
 * <p>
 * Each subscriber registers an {@link EventFilter}; an event reaches every subscriber whose
 * filter matches it, in subscription order, on the publishing thread. A failing subscriber
 * is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Subscriber> subscribers = new CopyOnWriteArrayList<>();

    private final Map<EventKind, AtomicLong> published = new EnumMap<>(EventKind.class);

    public EventBus() {
        for (EventKind kind : EventKind.values()) {
            published.put(kind, new AtomicLong());
        }
    }

    /** Delivers {@code event} to matching subscribers; returns how many received it. */
    public int publish(MeshEvent event) {
        published.get(event.kind()).incrementAndGet();
        int delivered = 0;
        for (Subscriber subscriber : subscribers) {
            if (subscriber.filter().matches(event) && deliver(subscriber, event)) {
                delivered++;
            }
        }
        log.debug("Event {} for {} delivered to {} subscribers",
                event.eventType(), event.serviceId() == null ? "mesh" : event.serviceId(), delivered);
        return delivered;
    }

    public Subscription subscribe(EventFilter filter, Consumer<MeshEvent> consumer) {
        Subscriber subscriber = new Subscriber(filter, consumer);
        subscribers.add(subscriber);
        log.debug("Subscribed to {}", filter.describe());
        return () -> subscribers.remove(subscriber);
    }

    public Subscription subscribeAll(Consumer<MeshEvent> consumer) {
        return subscribe(EventFilter.ALL, consumer);
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /** Events published since start, per kind, whether or not anyone received them. */
    public long publishedCount(EventKind kind) {
        return published.get(kind).get();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private boolean deliver(Subscriber subscriber, MeshEvent event) {
        try {
            subscriber.consumer().accept(event);
            return true;
        } catch (RuntimeException e) {
            log.warn("Subscriber for {} failed on {}: {}",
                    subscriber.filter().describe(), event.eventType(), e.getMessage(), e);
            return false;
        }
    }

    // identity equality so the same consumer can subscribe twice and unsubscribe once
    private static final class Subscriber {
        private final EventFilter filter;
        private final Consumer<MeshEvent> consumer;

        Subscriber(EventFilter filter, Consumer<MeshEvent> consumer) {
            this.filter = filter;
            this.consumer = consumer;
        }

        EventFilter filter() {
            return filter;
        }

        Consumer<MeshEvent> consumer() {
            return consumer;
        }
    }
}
