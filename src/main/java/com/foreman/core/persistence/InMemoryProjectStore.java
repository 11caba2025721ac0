package com.foreman.core.persistence;

import com.foreman.core.error.NotFoundException;
import com.foreman.core.error.StoreException;
import com.foreman.core.model.Agent;
import com.foreman.core.model.Report;
import com.foreman.core.model.Role;
import com.foreman.core.model.Session;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Non-durable {@link ProjectStore}. State is lost when the JVM exits, so this is only
 * suitable for tests and throwaway runs; a new {@link com.foreman.core.engine.SessionCoordinator}
 * built over the same instance still behaves like a process restart because all caches
 * are rebuilt from here.
 */
public class InMemoryProjectStore implements ProjectStore {

    private final Map<String, Session> sessions = new LinkedHashMap<>();
    private final Map<String, Map<String, Agent>> agents = new LinkedHashMap<>();
    private final Map<String, Map<String, Task>> tasks = new LinkedHashMap<>();
    private final Map<String, List<Report>> reports = new LinkedHashMap<>();

    @Override
    public synchronized void createSession(Session session) {
        if (sessions.containsKey(session.id())) {
            throw new StoreException("Session already exists: " + session.id());
        }
        sessions.put(session.id(), session);
    }

    @Override
    public synchronized Session loadSession(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            throw NotFoundException.session(sessionId);
        }
        return session;
    }

    @Override
    public synchronized void updateSession(Session session) {
        if (!sessions.containsKey(session.id())) {
            throw NotFoundException.session(session.id());
        }
        sessions.put(session.id(), session);
    }

    @Override
    public synchronized List<Session> listSessions() {
        return List.copyOf(sessions.values());
    }

    @Override
    public synchronized void upsertAgent(Agent agent) {
        requireSession(agent.sessionId());
        agents.computeIfAbsent(agent.sessionId(), k -> new LinkedHashMap<>()).put(agent.id(), agent);
    }

    @Override
    public synchronized List<Agent> listAgents(String sessionId, Role roleFilter) {
        return agents.getOrDefault(sessionId, Map.of()).values().stream()
                .filter(a -> roleFilter == null || a.role() == roleFilter)
                .toList();
    }

    @Override
    public synchronized void upsertTask(Task task) {
        upsertTasks(List.of(task));
    }

    @Override
    public synchronized void upsertTasks(List<Task> batch) {
        for (Task task : batch) {
            requireSession(task.sessionId());
        }
        for (Task task : batch) {
            tasks.computeIfAbsent(task.sessionId(), k -> new LinkedHashMap<>()).put(task.id(), task);
        }
    }

    @Override
    public synchronized List<Task> listTasks(String sessionId, TaskStatus statusFilter) {
        return tasks.getOrDefault(sessionId, Map.of()).values().stream()
                .filter(t -> statusFilter == null || t.status() == statusFilter)
                .toList();
    }

    @Override
    public synchronized void appendReport(Report report) {
        requireSession(report.sessionId());
        reports.computeIfAbsent(report.sessionId(), k -> new ArrayList<>()).add(report);
    }

    @Override
    public synchronized List<Report> listReports(String sessionId) {
        return List.copyOf(reports.getOrDefault(sessionId, List.of()));
    }

    private void requireSession(String sessionId) {
        if (!sessions.containsKey(sessionId)) {
            throw new StoreException("No session " + sessionId + " to attach to");
        }
    }
}
