package com.foreman.core.events;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Audit trail of coordinator events.
 * <p>
 * Writes every event to the {@code foreman.events} logger (publishers set the session
 * MDC) and buffers the most recent ones per session, so a CLI command can show what it caused.
 */
@Component
public class SessionEventLog {

    private static final Logger eventLog = LoggerFactory.getLogger("foreman.events");

    static final int MAX_BUFFERED = 200;

    private final EventBus eventBus;
    private final Map<String, Deque<ForemanEvent>> buffers = new ConcurrentHashMap<>();
    private EventBus.Subscription subscription;

    public SessionEventLog(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @PostConstruct
    public void start() {
        subscription = eventBus.subscribe(this::record);
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    void record(ForemanEvent event) {
        Deque<ForemanEvent> buffer = buffers.computeIfAbsent(event.sessionId(), id -> new ArrayDeque<>());
        synchronized (buffer) {
            if (buffer.size() == MAX_BUFFERED) {
                buffer.removeFirst();
            }
            buffer.addLast(event);
        }
        if (event.taskId() == null) {
            eventLog.info("{} {}", event.eventType(), event.payload());
        } else {
            eventLog.info("{} task={} {}", event.eventType(), event.taskId(), event.payload());
        }
    }

    /**
     * Remove and return the buffered events of a session, oldest first.
     */
    public List<ForemanEvent> drain(String sessionId) {
        Deque<ForemanEvent> buffer = buffers.get(sessionId);
        if (buffer == null) {
            return List.of();
        }
        synchronized (buffer) {
            var events = new ArrayList<>(buffer);
            buffer.clear();
            return events;
        }
    }
}
