package com.foreman.core.registry;

import com.foreman.core.error.AlreadyActiveException;
import com.foreman.core.error.NotFoundException;
import com.foreman.core.model.Agent;
import com.foreman.core.model.AgentStatus;
import com.foreman.core.model.Role;
import com.foreman.core.persistence.ProjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tracks the agents of one session and enforces at most one active agent per role.
 * <p>
 * Spawn and retire are synchronized so two callers can never both observe a role as
 * inactive and both spawn. Like the task graph, the registry is a cache over the
 * {@link ProjectStore}: each change is persisted before it is applied.
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final String sessionId;
    private final ProjectStore store;
    private final Clock clock;
    private final Map<String, Agent> agents = new LinkedHashMap<>();

    private AgentRegistry(String sessionId, ProjectStore store, Clock clock) {
        this.sessionId = sessionId;
        this.store = store;
        this.clock = clock;
    }

    public static AgentRegistry load(String sessionId, ProjectStore store, Clock clock) {
        var registry = new AgentRegistry(sessionId, store, clock);
        for (Agent agent : store.listAgents(sessionId)) {
            registry.agents.put(agent.id(), agent);
        }
        return registry;
    }

    /**
     * Start a new agent for the role.
     *
     * @throws AlreadyActiveException if the role already has an active agent
     */
    public synchronized Agent spawn(Role role) {
        Optional<Agent> current = activeFor(role);
        if (current.isPresent()) {
            throw new AlreadyActiveException(role, current.get().id());
        }
        long existing = agents.values().stream().filter(a -> a.role() == role).count();
        String agentId = String.format("%s_%03d", role.key(), existing + 1);
        var agent = new Agent(sessionId, agentId, role, clock.instant(), AgentStatus.ACTIVE, null);
        store.upsertAgent(agent);
        agents.put(agentId, agent);
        log.info("Spawned agent {} for session {}", agentId, sessionId);
        return agent;
    }

    /** The role's active agent, spawning one if there is none. */
    public synchronized Agent ensureActive(Role role) {
        return activeFor(role).orElseGet(() -> spawn(role));
    }

    /**
     * Retire an agent. Retiring an already retired agent returns it unchanged.
     *
     * @throws NotFoundException if the id is unknown in this session
     */
    public synchronized Agent retire(String agentId) {
        Agent agent = agents.get(agentId);
        if (agent == null) {
            throw NotFoundException.agent(agentId);
        }
        if (!agent.isActive()) {
            return agent;
        }
        Agent retired = agent.retire(clock.instant());
        store.upsertAgent(retired);
        agents.put(agentId, retired);
        log.info("Retired agent {}", agentId);
        return retired;
    }

    public synchronized Optional<Agent> activeFor(Role role) {
        return agents.values().stream().filter(a -> a.role() == role && a.isActive()).findFirst();
    }

    public synchronized List<Agent> active() {
        return agents.values().stream().filter(Agent::isActive).toList();
    }

    public synchronized List<Agent> all() {
        return List.copyOf(agents.values());
    }
}
