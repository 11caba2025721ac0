package com.foreman.core.model;

import java.time.Instant;

/**
 * A logical worker bound to a role within one session.
 *
 * @param sessionId owning session
 * @param id        unique within the session, e.g. {@code builder_001}
 * @param role      the role this agent plays
 * @param startedAt when the agent was spawned
 * @param status    active or retired
 * @param retiredAt when the agent was retired; null while active
 */
public record Agent(
    String sessionId,
    String id,
    Role role,
    Instant startedAt,
    AgentStatus status,
    Instant retiredAt
) {

    public boolean isActive() {
        return status == AgentStatus.ACTIVE;
    }

    public Agent retire(Instant at) {
        return new Agent(sessionId, id, role, startedAt, AgentStatus.RETIRED, at);
    }
}
