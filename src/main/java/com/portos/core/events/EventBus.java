package com.portos.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Synchronous in-process bus for orchestration events.
 * <p>
 * Listeners register with a filter: an event type, a subject (execution, task or provider id),
 * or nothing at all. Delivery happens on the publishing thread in registration order; a
 * listener that may block should sit behind a {@link BufferedEventChannel}.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Deliver an event to every listener whose filter accepts it. Listener failures are
     * logged and never reach the publisher.
     */
    public void publish(PortosEvent event) {
        Objects.requireNonNull(event, "event");
        int delivered = 0;
        for (Listener listener : listeners) {
            if (listener.filter().test(event)) {
                deliverSafely(listener, event);
                delivered++;
            }
        }
        log.debug("Published {} ({}) to {} listener(s)", event.eventType(), event.subjectId(), delivered);
    }

    /** Listen for a single event type, e.g. {@code "tool:stateChange"}. */
    public Subscription subscribe(String eventType, Consumer<PortosEvent> consumer) {
        Objects.requireNonNull(eventType, "eventType");
        return register("type=" + eventType, e -> eventType.equals(e.eventType()), consumer);
    }

    /** Listen for every event about one execution, task or provider. */
    public Subscription subscribeSubject(String subjectId, Consumer<PortosEvent> consumer) {
        Objects.requireNonNull(subjectId, "subjectId");
        return register("subject=" + subjectId, e -> subjectId.equals(e.subjectId()), consumer);
    }

    /** Listen for all events. */
    public Subscription subscribeAll(Consumer<PortosEvent> consumer) {
        return register("all", e -> true, consumer);
    }

    public int listenerCount() {
        return listeners.size();
    }

    /**
     * Handle for cancelling a subscription. Cancelling twice is harmless.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription register(String description, Predicate<PortosEvent> filter,
                                  Consumer<PortosEvent> consumer) {
        Objects.requireNonNull(consumer, "consumer");
        Listener listener = new Listener(description, filter, consumer);
        listeners.add(listener);
        log.debug("Registered listener [{}]", description);
        return () -> {
            if (listeners.remove(listener)) {
                log.debug("Removed listener [{}]", description);
            }
        };
    }

    private void deliverSafely(Listener listener, PortosEvent event) {
        try {
            listener.consumer().accept(event);
        } catch (Exception e) {
            log.warn("Listener [{}] failed on {}: {}", listener.description(), event.eventType(), e.getMessage(), e);
        }
    }

    private record Listener(String description, Predicate<PortosEvent> filter, Consumer<PortosEvent> consumer) {
    }
}
