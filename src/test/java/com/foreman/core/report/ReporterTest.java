package com.foreman.core.report;

import com.foreman.core.MutableClock;
import com.foreman.core.model.Agent;
import com.foreman.core.model.AgentStatus;
import com.foreman.core.model.Phase;
import com.foreman.core.model.Report;
import com.foreman.core.model.Role;
import com.foreman.core.model.Session;
import com.foreman.core.model.Task;
import com.foreman.core.persistence.InMemoryProjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReporterTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    private InMemoryProjectStore store;
    private MutableClock clock;
    private Reporter reporter;

    @BeforeEach
    void setUp() {
        store = new InMemoryProjectStore();
        clock = new MutableClock(T0);
        reporter = new Reporter(store, clock, Duration.ofMinutes(30));
        store.createSession(new Session("S1", T0, "goal", Phase.IMPLEMENTATION, false));
    }

    private static Task pending(String id, int priority, String... deps) {
        return Task.pending("S1", id, Role.BUILDER, "task " + id, List.of(deps), priority, T0);
    }

    @SuppressWarnings("unchecked")
    private static <T> T payload(Report report, String key) {
        return (T) report.payload().get(key);
    }

    @Test
    @DisplayName("empty session recommends dispatching")
    void emptySession() {
        Report report = reporter.summarize("S1");

        assertEquals(0, report.completedTasks());
        assertEquals(Phase.IMPLEMENTATION, report.phase());
        assertEquals(List.of("No tasks yet; dispatch to start planning"), payload(report, "recommendations"));
        assertTrue(store.listReports("S1").isEmpty());
    }

    @Test
    @DisplayName("counts tasks by status and lists active agents")
    void countsAndAgents() {
        store.upsertAgent(new Agent("S1", "planner_001", Role.PLANNER, T0, AgentStatus.RETIRED, T0));
        store.upsertAgent(new Agent("S1", "builder_001", Role.BUILDER, T0, AgentStatus.ACTIVE, null));
        store.upsertTasks(List.of(
                pending("A", 0).startedBy("builder_001", T0).completed("done", T0),
                pending("B", 0, "A")));

        Report report = reporter.summarize("S1");

        assertEquals(1, report.completedTasks());
        assertEquals(List.of("builder_001"), payload(report, "active_agents"));
        Map<String, Integer> counts = payload(report, "task_counts");
        assertEquals(Map.of("pending", 1, "in_progress", 0, "completed", 1, "blocked", 0), counts);
        assertEquals(List.of("Continue with phase implementation"), payload(report, "recommendations"));
    }

    @Test
    @DisplayName("next priorities list ready tasks before waiting ones, highest priority first")
    void nextPriorities() {
        store.upsertTasks(List.of(
                pending("LOW", 0),
                pending("HIGH", 5),
                pending("WAITS", 9, "LOW")));

        List<String> next = payload(reporter.summarize("S1"), "next_priorities");

        assertEquals(List.of("HIGH", "LOW", "WAITS"), next);
    }

    @Test
    @DisplayName("next priorities are capped")
    void nextPrioritiesCapped() {
        for (int i = 1; i <= 8; i++) {
            store.upsertTask(pending("T" + i, 0));
        }

        List<String> next = payload(reporter.summarize("S1"), "next_priorities");

        assertEquals(Reporter.MAX_PRIORITIES, next.size());
        assertEquals("T1", next.get(0));
    }

    @Test
    @DisplayName("blocked and stale tasks are reported as blockers without changing state")
    void blockers() {
        store.upsertTasks(List.of(
                pending("STUCK", 0).blocked("retry ceiling reached after 3 rejection(s): tests fail"),
                pending("SLOW", 0).startedBy("builder_001", T0)));
        clock.advance(Duration.ofMinutes(45));

        Report report = reporter.summarize("S1");

        List<Map<String, Object>> blockers = payload(report, "blockers");
        assertEquals(2, blockers.size());
        assertEquals("STUCK", blockers.get(0).get("task_id"));
        assertEquals("blocked", blockers.get(0).get("status"));
        assertEquals("SLOW", blockers.get(1).get("task_id"));
        assertEquals("in progress for 45 min without a completion", blockers.get(1).get("reason"));
        List<String> recommendations = payload(report, "recommendations");
        assertTrue(recommendations.get(0).startsWith("Resolve 1 blocked task(s)"));
        assertTrue(recommendations.get(1).startsWith("Check on 1 long-running task(s)"));
        assertEquals("in_progress", store.listTasks("S1").get(1).status().key());
    }

    @Test
    @DisplayName("recently started tasks are not stale")
    void notYetStale() {
        Task started = pending("A", 0).startedBy("builder_001", T0);
        clock.advance(Duration.ofMinutes(10));

        assertTrue(reporter.staleTasks(List.of(started), clock.instant()).isEmpty());
    }

    @Test
    @DisplayName("paused and finished sessions get their own recommendation")
    void pausedAndDone() {
        store.upsertTask(pending("A", 0));
        store.updateSession(new Session("S1", T0, "goal", Phase.TESTING, true));
        assertTrue(ReporterTest.<List<String>>payload(reporter.summarize("S1"), "recommendations")
                .contains("Session is paused; resume to continue in phase testing"));

        store.updateSession(new Session("S1", T0, "goal", Phase.DONE, false));
        assertEquals(List.of("All phases complete; review the delivered artifacts"),
                payload(reporter.summarize("S1"), "recommendations"));
    }
}
