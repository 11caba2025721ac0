package com.foreman.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable progress snapshot.
 *
 * @param sessionId      owning session
 * @param timestamp      when the report was taken
 * @param phase          phase at the time of the report
 * @param completedTasks number of completed tasks
 * @param payload        structured detail: blockers, next priorities, recommendations, ...
 */
public record Report(
    String sessionId,
    Instant timestamp,
    Phase phase,
    int completedTasks,
    Map<String, Object> payload
) {

    public Report {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
