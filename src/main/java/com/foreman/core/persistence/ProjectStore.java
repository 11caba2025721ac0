package com.foreman.core.persistence;

import com.foreman.core.model.Agent;
import com.foreman.core.model.Report;
import com.foreman.core.model.Role;
import com.foreman.core.model.Session;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskStatus;

import java.util.List;

/**
 * Durable record of sessions, agents, tasks and reports, keyed by session id.
 * <p>
 * This is the only source of truth: the task graph and agent registry are caches
 * rebuilt from it. Every call is one transaction; a failed call leaves nothing
 * half-written and raises {@link com.foreman.core.error.StoreException}.
 * Lists are returned in insertion order.
 */
public interface ProjectStore {

    /**
     * Persists a new session.
     *
     * @throws com.foreman.core.error.StoreException if a session with the same id exists
     */
    void createSession(Session session);

    /**
     * @throws com.foreman.core.error.NotFoundException if the id is unknown
     */
    Session loadSession(String sessionId);

    /** Updates phase and paused flag of an existing session. */
    void updateSession(Session session);

    /** All sessions, oldest first. */
    List<Session> listSessions();

    void upsertAgent(Agent agent);

    /**
     * @param roleFilter only agents of this role; null for all
     */
    List<Agent> listAgents(String sessionId, Role roleFilter);

    default List<Agent> listAgents(String sessionId) {
        return listAgents(sessionId, null);
    }

    void upsertTask(Task task);

    /** Writes all tasks of one session atomically. */
    void upsertTasks(List<Task> tasks);

    /**
     * @param statusFilter only tasks with this status; null for all
     */
    List<Task> listTasks(String sessionId, TaskStatus statusFilter);

    default List<Task> listTasks(String sessionId) {
        return listTasks(sessionId, null);
    }

    void appendReport(Report report);

    List<Report> listReports(String sessionId);
}
