package com.foreman.core.persistence;

import com.foreman.core.model.Agent;
import com.foreman.core.model.Report;
import com.foreman.core.model.Role;
import com.foreman.core.model.Session;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskStatus;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view over the {@link ProjectStore} for the dashboard API and the CLI.
 * Every session-scoped query first resolves the session, so unknown ids surface as
 * {@link com.foreman.core.error.NotFoundException} rather than empty lists.
 */
@Service
public class ProjectQueryService {

    private final ProjectStore store;

    public ProjectQueryService(ProjectStore store) {
        this.store = store;
    }

    public List<Session> listSessions() {
        return store.listSessions();
    }

    public Session getSession(String sessionId) {
        return store.loadSession(sessionId);
    }

    public List<Agent> listAgents(String sessionId, Role roleFilter) {
        store.loadSession(sessionId);
        return store.listAgents(sessionId, roleFilter);
    }

    public List<Agent> listActiveAgents(String sessionId) {
        return listAgents(sessionId, null).stream().filter(Agent::isActive).toList();
    }

    public List<Task> listTasks(String sessionId, TaskStatus statusFilter) {
        store.loadSession(sessionId);
        return store.listTasks(sessionId, statusFilter);
    }

    public List<Report> listReports(String sessionId) {
        store.loadSession(sessionId);
        return store.listReports(sessionId);
    }

    /** Number of tasks per status; every status is present, possibly with zero. */
    public Map<TaskStatus, Integer> taskCounts(String sessionId) {
        var counts = new EnumMap<TaskStatus, Integer>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0);
        }
        for (Task task : listTasks(sessionId, null)) {
            counts.merge(task.status(), 1, Integer::sum);
        }
        return counts;
    }
}
