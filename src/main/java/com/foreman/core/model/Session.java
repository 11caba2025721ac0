package com.foreman.core.model;

import java.time.Instant;

/**
 * One project run.
 *
 * @param id        sortable, creation-time-derived session identifier
 * @param createdAt when the session was started
 * @param goal      free-text project goal
 * @param phase     current project phase
 * @param paused    true while the session is paused; the phase is kept so resume returns to it
 */
public record Session(
    String id,
    Instant createdAt,
    String goal,
    Phase phase,
    boolean paused
) {

    public Session withPhase(Phase newPhase) {
        return new Session(id, createdAt, goal, newPhase, paused);
    }

    public Session withPaused(boolean newPaused) {
        return new Session(id, createdAt, goal, phase, newPaused);
    }
}
