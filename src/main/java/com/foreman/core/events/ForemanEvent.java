package com.foreman.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by a session coordinator.
 *
 * @param eventType event type (e.g. "session.created", "task.dispatched", "phase.advanced")
 * @param sessionId the session this event belongs to
 * @param taskId    the task this event relates to (nullable for session-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ForemanEvent(
    String eventType,
    String sessionId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
