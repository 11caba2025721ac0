package com.foreman.dispatch.api;

import com.foreman.core.error.NotFoundException;
import com.foreman.core.error.StoreException;
import com.foreman.core.model.Agent;
import com.foreman.core.model.AgentStatus;
import com.foreman.core.model.Phase;
import com.foreman.core.model.Report;
import com.foreman.core.model.Role;
import com.foreman.core.model.Session;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskStatus;
import com.foreman.core.persistence.ProjectQueryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SessionController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SessionControllerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");
    private static final String SESSION_ID = "20260301_090000_000_00";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProjectQueryService queryService;

    private static Session session(Phase phase, boolean paused) {
        return new Session(SESSION_ID, T0, "Build a URL shortener", phase, paused);
    }

    // ── GET /api/v1/sessions ─────────────────────────────────────────

    @Test
    @DisplayName("GET /sessions lists stored sessions")
    void listSessions() throws Exception {
        when(queryService.listSessions()).thenReturn(List.of(session(Phase.IMPLEMENTATION, false)));

        mockMvc.perform(get("/api/v1/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value(SESSION_ID))
                .andExpect(jsonPath("$[0].phase").value("implementation"));
    }

    // ── GET /api/v1/sessions/{id} ────────────────────────────────────

    @Test
    @DisplayName("GET /sessions/{id} returns phase, active agents and task counts")
    void getSession() throws Exception {
        var counts = new EnumMap<TaskStatus, Integer>(TaskStatus.class);
        counts.put(TaskStatus.PENDING, 2);
        counts.put(TaskStatus.IN_PROGRESS, 1);
        counts.put(TaskStatus.COMPLETED, 3);
        counts.put(TaskStatus.BLOCKED, 0);
        when(queryService.getSession(SESSION_ID)).thenReturn(session(Phase.QUALITY_CHECK, true));
        when(queryService.taskCounts(SESSION_ID)).thenReturn(counts);
        when(queryService.listActiveAgents(SESSION_ID)).thenReturn(List.of(
                new Agent(SESSION_ID, "quality_checker_001", Role.QUALITY_CHECKER, T0, AgentStatus.ACTIVE, null)));

        mockMvc.perform(get("/api/v1/sessions/{id}", SESSION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value(SESSION_ID))
                .andExpect(jsonPath("$.phase").value("quality_check"))
                .andExpect(jsonPath("$.paused").value(true))
                .andExpect(jsonPath("$.active_agents[0]").value("quality_checker_001"))
                .andExpect(jsonPath("$.task_counts.completed").value(3))
                .andExpect(jsonPath("$.task_counts.in_progress").value(1));
    }

    @Test
    @DisplayName("GET /sessions/{id} returns 404 for an unknown session")
    void getUnknownSession() throws Exception {
        when(queryService.getSession("nope")).thenThrow(NotFoundException.session("nope"));

        mockMvc.perform(get("/api/v1/sessions/{id}", "nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Session not found: nope"));
    }

    @Test
    @DisplayName("store failures map to 503")
    void storeFailure() throws Exception {
        when(queryService.listSessions()).thenThrow(new StoreException("database is locked"));

        mockMvc.perform(get("/api/v1/sessions"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error", containsString("database is locked")));
    }

    // ── Sub-resources ────────────────────────────────────────────────

    @Test
    @DisplayName("GET /sessions/{id}/tasks filters by status key")
    void listTasksByStatus() throws Exception {
        Task blocked = Task.pending(SESSION_ID, "T1", Role.BUILDER, "build parser", List.of(), 0, T0)
                .blocked("retry ceiling reached after 3 rejection(s): missing validation");
        when(queryService.listTasks(SESSION_ID, TaskStatus.BLOCKED)).thenReturn(List.of(blocked));

        mockMvc.perform(get("/api/v1/sessions/{id}/tasks", SESSION_ID).param("status", "blocked"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("T1"))
                .andExpect(jsonPath("$[0].status").value("blocked"))
                .andExpect(jsonPath("$[0].role").value("builder"))
                .andExpect(jsonPath("$[0].blockedReason", startsWith("retry ceiling reached")));
    }

    @Test
    @DisplayName("unknown status filter is a 400")
    void unknownStatusFilter() throws Exception {
        mockMvc.perform(get("/api/v1/sessions/{id}/tasks", SESSION_ID).param("status", "sleeping"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown task status: sleeping"));
    }

    @Test
    @DisplayName("GET /sessions/{id}/agents filters by role")
    void listAgentsByRole() throws Exception {
        when(queryService.listAgents(SESSION_ID, Role.BUILDER)).thenReturn(List.of(
                new Agent(SESSION_ID, "builder_001", Role.BUILDER, T0, AgentStatus.RETIRED, T0.plusSeconds(600))));

        mockMvc.perform(get("/api/v1/sessions/{id}/agents", SESSION_ID).param("role", "builder"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("builder_001"))
                .andExpect(jsonPath("$[0].status").value("retired"));
    }

    @Test
    @DisplayName("GET /sessions/{id}/reports returns the report history")
    void listReports() throws Exception {
        when(queryService.listReports(SESSION_ID)).thenReturn(List.of(
                new Report(SESSION_ID, T0, Phase.IMPLEMENTATION, 4,
                        Map.of("next_priorities", List.of("T5", "T6")))));

        mockMvc.perform(get("/api/v1/sessions/{id}/reports", SESSION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].completedTasks").value(4))
                .andExpect(jsonPath("$[0].payload.next_priorities", contains("T5", "T6")));
    }
}
