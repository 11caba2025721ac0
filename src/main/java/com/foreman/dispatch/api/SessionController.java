package com.foreman.dispatch.api;

import com.foreman.core.model.Agent;
import com.foreman.core.model.Report;
import com.foreman.core.model.Role;
import com.foreman.core.model.Session;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskStatus;
import com.foreman.core.persistence.ProjectQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only REST API for dashboards: sessions, agents, tasks and report history.
 * Nothing here mutates state.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private final ProjectQueryService queryService;

    public SessionController(ProjectQueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * GET /api/v1/sessions: all sessions, oldest first.
     */
    @GetMapping
    public List<Session> listSessions() {
        return queryService.listSessions();
    }

    /**
     * GET /api/v1/sessions/{id}: session detail with active agents and task counts.
     */
    @GetMapping("/{sessionId}")
    public Map<String, Object> getSession(@PathVariable String sessionId) {
        Session session = queryService.getSession(sessionId);
        var counts = new LinkedHashMap<String, Integer>();
        queryService.taskCounts(sessionId).forEach((status, count) -> counts.put(status.key(), count));

        var body = new LinkedHashMap<String, Object>();
        body.put("session_id", session.id());
        body.put("created_at", session.createdAt().toString());
        body.put("goal", session.goal());
        body.put("phase", session.phase().key());
        body.put("paused", session.paused());
        body.put("active_agents", queryService.listActiveAgents(sessionId).stream().map(Agent::id).toList());
        body.put("task_counts", counts);
        return body;
    }

    /**
     * GET /api/v1/sessions/{id}/agents?role=builder
     */
    @GetMapping("/{sessionId}/agents")
    public List<Agent> listAgents(@PathVariable String sessionId,
                                  @RequestParam(required = false) String role) {
        return queryService.listAgents(sessionId, role == null ? null : Role.fromKey(role));
    }

    /**
     * GET /api/v1/sessions/{id}/tasks?status=pending
     */
    @GetMapping("/{sessionId}/tasks")
    public List<Task> listTasks(@PathVariable String sessionId,
                                @RequestParam(required = false) String status) {
        return queryService.listTasks(sessionId, status == null ? null : TaskStatus.fromKey(status));
    }

    @GetMapping("/{sessionId}/reports")
    public List<Report> listReports(@PathVariable String sessionId) {
        return queryService.listReports(sessionId);
    }
}
