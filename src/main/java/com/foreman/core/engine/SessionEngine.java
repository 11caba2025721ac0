package com.foreman.core.engine;

import com.foreman.config.ForemanProperties;
import com.foreman.core.error.NotFoundException;
import com.foreman.core.events.EventBus;
import com.foreman.core.events.ForemanEvent;
import com.foreman.core.logging.MdcContext;
import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.model.Phase;
import com.foreman.core.model.Session;
import com.foreman.core.persistence.ProjectStore;
import com.foreman.core.persistence.SessionIdGenerator;
import com.foreman.core.qualitygate.QualityGate;
import com.foreman.core.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates and resumes {@link SessionCoordinator}s and keeps track of the live ones.
 * <p>
 * Sessions are independent: each coordinator has its own lock and caches, so several
 * can run side by side in one process.
 */
@Service
public class SessionEngine {

    private static final Logger log = LoggerFactory.getLogger(SessionEngine.class);

    private final CoordinatorContext context;
    private final SessionIdGenerator idGenerator;
    private final Map<String, SessionCoordinator> live = new ConcurrentHashMap<>();

    @Autowired
    public SessionEngine(ProjectStore store, QualityGate gate, Reporter reporter, AgentExecutor executor,
                         EventBus eventBus, ForemanMetrics metrics, Clock clock,
                         SessionIdGenerator idGenerator, ForemanProperties properties) {
        this(new CoordinatorContext(store, gate, reporter, executor, eventBus, metrics, clock,
                properties.getMaxInFlightPerRole()), idGenerator);
    }

    public SessionEngine(CoordinatorContext context, SessionIdGenerator idGenerator) {
        this.context = context;
        this.idGenerator = idGenerator;
    }

    /**
     * Start a new session in the planning phase.
     *
     * @param goal free-text project goal; null is stored as an empty goal
     */
    public SessionCoordinator start(String goal) {
        String projectGoal = goal == null ? "" : goal.strip();
        String sessionId = idGenerator.next();
        MdcContext.setSession(sessionId);
        try {
            var session = new Session(sessionId, context.clock().instant(), projectGoal, Phase.PLANNING, false);
            context.store().createSession(session);
            log.info("Created session {} for goal: {}", sessionId, projectGoal);
            context.eventBus().publish(new ForemanEvent("session.created", sessionId, null,
                    Map.of("goal", projectGoal), context.clock().instant()));
            SessionCoordinator coordinator = SessionCoordinator.load(sessionId, context);
            live.put(sessionId, coordinator);
            return coordinator;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Rebuild a session's coordinator from the store and resume it. Any coordinator held
     * for the id is replaced; nothing in memory is trusted across a resume.
     *
     * @throws NotFoundException if the id is unknown; no session is created
     */
    public SessionCoordinator resume(String sessionId) {
        SessionCoordinator coordinator = reload(sessionId);
        coordinator.resume();
        return coordinator;
    }

    /**
     * Replace the live coordinator with one freshly built from the store.
     *
     * @throws NotFoundException if the id is unknown
     */
    public SessionCoordinator reload(String sessionId) {
        SessionCoordinator coordinator = SessionCoordinator.load(sessionId, context);
        live.put(sessionId, coordinator);
        return coordinator;
    }

    /**
     * The live coordinator for a session, loading it from the store without resuming
     * if this process does not hold one yet.
     *
     * @throws NotFoundException if the id is unknown
     */
    public SessionCoordinator open(String sessionId) {
        SessionCoordinator existing = live.get(sessionId);
        if (existing != null) {
            return existing;
        }
        return live.computeIfAbsent(sessionId, id -> SessionCoordinator.load(id, context));
    }

    /** The most recently created session, if any. */
    public Optional<Session> latestSession() {
        List<Session> sessions = context.store().listSessions();
        return sessions.isEmpty() ? Optional.empty() : Optional.of(sessions.get(sessions.size() - 1));
    }

    public Optional<SessionCoordinator> find(String sessionId) {
        return Optional.ofNullable(live.get(sessionId));
    }

    /** Drop the live coordinator; its state remains in the store. */
    public void close(String sessionId) {
        live.remove(sessionId);
    }

    public List<String> liveSessionIds() {
        return List.copyOf(live.keySet());
    }
}
