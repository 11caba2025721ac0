package com.foreman.core.report;

import com.foreman.core.graph.TaskGraph;
import com.foreman.core.model.Agent;
import com.foreman.core.model.Report;
import com.foreman.core.model.Session;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskStatus;
import com.foreman.core.persistence.ProjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Derives progress reports from the {@link ProjectStore}.
 * <p>
 * Read-only: {@link #summarize} builds a {@link Report} without persisting it; the
 * coordinator decides when a report becomes part of the session record.
 */
public class Reporter {

    private static final Logger log = LoggerFactory.getLogger(Reporter.class);

    /** Maximum number of task ids listed under {@code next_priorities}. */
    static final int MAX_PRIORITIES = 5;

    private final ProjectStore store;
    private final Clock clock;
    private final Duration staleAfter;

    public Reporter(ProjectStore store, Clock clock, Duration staleAfter) {
        this.store = store;
        this.clock = clock;
        this.staleAfter = staleAfter;
    }

    public Report summarize(String sessionId) {
        Session session = store.loadSession(sessionId);
        List<Task> tasks = store.listTasks(sessionId);
        List<Agent> agents = store.listAgents(sessionId);
        Instant now = clock.instant();

        Map<String, Task> byId = tasks.stream()
                .collect(Collectors.toMap(Task::id, Function.identity(), (a, b) -> b, LinkedHashMap::new));

        var counts = new LinkedHashMap<String, Integer>();
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status.key(), 0);
        }
        tasks.forEach(t -> counts.merge(t.status().key(), 1, Integer::sum));

        List<String> activeAgents = agents.stream().filter(Agent::isActive).map(Agent::id).toList();

        var blockers = new ArrayList<Map<String, Object>>();
        for (Task task : tasks) {
            if (task.status() == TaskStatus.BLOCKED) {
                blockers.add(blocker(task, task.blockedReason()));
            }
        }
        List<Task> stale = staleTasks(tasks, now);
        for (Task task : stale) {
            long minutes = Duration.between(task.startedAt(), now).toMinutes();
            blockers.add(blocker(task, "in progress for " + minutes + " min without a completion"));
        }

        List<String> nextPriorities = nextPriorities(tasks, byId);

        var payload = new LinkedHashMap<String, Object>();
        payload.put("active_agents", activeAgents);
        payload.put("blockers", blockers);
        payload.put("next_priorities", nextPriorities);
        payload.put("recommendations", recommendations(session, counts, blockers.size() - stale.size(), stale.size()));
        payload.put("task_counts", counts);

        int completed = counts.get(TaskStatus.COMPLETED.key());
        log.debug("Summarized session {}: {} completed, {} blocker(s)", sessionId, completed, blockers.size());
        return new Report(sessionId, now, session.phase(), completed, payload);
    }

    /**
     * In-progress tasks started more than the stale threshold ago. Reported only; the
     * task's status is never changed here.
     */
    public List<Task> staleTasks(List<Task> tasks, Instant now) {
        return tasks.stream()
                .filter(t -> t.status() == TaskStatus.IN_PROGRESS && t.startedAt() != null)
                .filter(t -> Duration.between(t.startedAt(), now).compareTo(staleAfter) > 0)
                .toList();
    }

    private static Map<String, Object> blocker(Task task, String reason) {
        var entry = new LinkedHashMap<String, Object>();
        entry.put("task_id", task.id());
        entry.put("role", task.role().key());
        entry.put("status", task.status().key());
        entry.put("reason", reason);
        return entry;
    }

    /** Ready tasks first, then the remaining pending ones, each in scheduling order. */
    private static List<String> nextPriorities(List<Task> tasks, Map<String, Task> byId) {
        List<Task> ready = TaskGraph.readyTasks(tasks, byId::get);
        var ids = new ArrayList<String>();
        ready.forEach(t -> ids.add(t.id()));
        tasks.stream()
                .filter(t -> t.status() == TaskStatus.PENDING && !ready.contains(t))
                .sorted(TaskGraph.SCHEDULING_ORDER)
                .forEach(t -> ids.add(t.id()));
        return ids.size() > MAX_PRIORITIES ? List.copyOf(ids.subList(0, MAX_PRIORITIES)) : ids;
    }

    private static List<String> recommendations(Session session, Map<String, Integer> counts,
                                                int blocked, int stale) {
        var out = new ArrayList<String>();
        if (session.phase().isTerminal()) {
            out.add("All phases complete; review the delivered artifacts");
            return out;
        }
        if (blocked > 0) {
            out.add("Resolve " + blocked + " blocked task(s) and run unblock to resume them");
        }
        if (stale > 0) {
            out.add("Check on " + stale + " long-running task(s); re-run or report their completion");
        }
        if (session.paused()) {
            out.add("Session is paused; resume to continue in phase " + session.phase().key());
        }
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        if (total == 0) {
            out.add("No tasks yet; dispatch to start planning");
        }
        if (out.isEmpty()) {
            out.add("Continue with phase " + session.phase().key());
        }
        return out;
    }
}
