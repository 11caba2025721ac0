package com.foreman.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of coordinator events to subscribers.
 * <p>
 * Delivery is synchronous on the publishing thread, so subscribers must be quick. A
 * subscriber that throws is logged and skipped; the coordinator never sees the failure.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<ForemanEvent>> subscribers = new CopyOnWriteArrayList<>();

    public void publish(ForemanEvent event) {
        log.debug("Event {} in session {}", event.eventType(), event.sessionId());
        for (Consumer<ForemanEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.warn("Subscriber failed on event {}: {}", event.eventType(), e.getMessage(), e);
            }
        }
    }

    /**
     * Receive every event of every session, in publish order.
     *
     * @return handle to stop delivery
     */
    public Subscription subscribe(Consumer<ForemanEvent> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
