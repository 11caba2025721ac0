package com.foreman.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static ForemanEvent event(String type, String sessionId, String taskId) {
        return new ForemanEvent(type, sessionId, taskId, Map.of(), Instant.now());
    }

    @Test
    @DisplayName("subscribers receive events of every session in publish order")
    void deliversInOrder() {
        List<ForemanEvent> received = new ArrayList<>();
        eventBus.subscribe(received::add);

        eventBus.publish(event("session.created", "S1", null));
        eventBus.publish(event("task.dispatched", "S2", "PLAN-001"));
        eventBus.publish(event("task.accepted", "S1", "PLAN-001"));

        assertEquals(List.of("session.created", "task.dispatched", "task.accepted"),
                received.stream().map(ForemanEvent::eventType).toList());
        assertEquals(List.of("S1", "S2", "S1"), received.stream().map(ForemanEvent::sessionId).toList());
    }

    @Test
    @DisplayName("unsubscribing stops delivery and leaves other subscribers alone")
    void unsubscribe() {
        List<ForemanEvent> first = new ArrayList<>();
        List<ForemanEvent> second = new ArrayList<>();
        EventBus.Subscription subscription = eventBus.subscribe(first::add);
        eventBus.subscribe(second::add);

        subscription.unsubscribe();
        eventBus.publish(event("task.blocked", "S1", "T1"));

        assertTrue(first.isEmpty());
        assertEquals(1, second.size());
    }

    @Test
    @DisplayName("a throwing subscriber does not affect the publisher or other subscribers")
    void failingSubscriberIsIsolated() {
        List<ForemanEvent> received = new ArrayList<>();
        eventBus.subscribe(e -> {
            throw new IllegalStateException("boom");
        });
        eventBus.subscribe(received::add);

        assertDoesNotThrow(() -> eventBus.publish(event("task.rejected", "S1", "T1")));
        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("handles concurrent publishes safely")
    void concurrentPublishes() throws InterruptedException {
        CopyOnWriteArrayList<ForemanEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribe(received::add);

        int threadCount = 8;
        int eventsPerThread = 50;
        CountDownLatch latch = new CountDownLatch(threadCount);
        for (int t = 0; t < threadCount; t++) {
            new Thread(() -> {
                for (int i = 0; i < eventsPerThread; i++) {
                    eventBus.publish(event("task.dispatched", "S1", "T" + i));
                }
                latch.countDown();
            }).start();
        }

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        assertEquals(threadCount * eventsPerThread, received.size());
    }
}
