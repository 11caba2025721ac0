package com.foreman.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A unit of work owned by a role.
 * <p>
 * Relations to other tasks are held as ids only and re-resolved through the
 * task graph, so a task never references another task instance.
 *
 * @param sessionId       owning session
 * @param id              unique within the session (e.g. "T1", "PLAN-001")
 * @param role            owning role
 * @param description     what the task should accomplish
 * @param status          current status
 * @param dependencies    ids of tasks that must be completed before this one may start
 * @param priority        higher runs first among ready tasks
 * @param retryCount      quality gate rejections (and failed executions) so far
 * @param attempt         times the task has been started; completions naming an earlier attempt are stale
 * @param createdAt       insertion time
 * @param startedAt       when the task last moved to in_progress; null otherwise
 * @param completedAt     when the task was accepted; null until then
 * @param assignedAgentId agent holding the task while in_progress
 * @param blockedReason   why the task is blocked; null unless blocked
 * @param history         feedback and audit notes, oldest first
 * @param artifactSummary summary reported by the agent for the accepted result
 */
public record Task(
    String sessionId,
    String id,
    Role role,
    String description,
    TaskStatus status,
    List<String> dependencies,
    int priority,
    int retryCount,
    int attempt,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    String assignedAgentId,
    String blockedReason,
    List<String> history,
    String artifactSummary
) {

    public Task {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        history = history == null ? List.of() : List.copyOf(history);
    }

    /** A fresh pending task. */
    public static Task pending(String sessionId, String id, Role role, String description,
                               List<String> dependencies, int priority, Instant createdAt) {
        return new Task(sessionId, id, role, description, TaskStatus.PENDING, dependencies, priority,
                0, 0, createdAt, null, null, null, null, List.of(), null);
    }

    public Task startedBy(String agentId, Instant at) {
        return new Task(sessionId, id, role, description, TaskStatus.IN_PROGRESS, dependencies, priority,
                retryCount, attempt + 1, createdAt, at, null, agentId, null, history, artifactSummary);
    }

    public Task completed(String summary, Instant at) {
        return new Task(sessionId, id, role, description, TaskStatus.COMPLETED, dependencies, priority,
                retryCount, attempt, createdAt, startedAt, at, assignedAgentId, null, history, summary);
    }

    /** Back to pending after a rejection, with the feedback recorded and the retry counter bumped. */
    public Task rejected(String feedback) {
        return new Task(sessionId, id, role, description, TaskStatus.PENDING, dependencies, priority,
                retryCount + 1, attempt, createdAt, null, null, null, null, append(history, "rejected: " + feedback),
                artifactSummary);
    }

    public Task blocked(String reason) {
        return new Task(sessionId, id, role, description, TaskStatus.BLOCKED, dependencies, priority,
                retryCount, attempt, createdAt, null, null, null, reason, append(history, "blocked: " + reason),
                artifactSummary);
    }

    /** Operator override out of {@link TaskStatus#BLOCKED}: pending again with a clean retry counter. */
    public Task unblocked(String note) {
        return new Task(sessionId, id, role, description, TaskStatus.PENDING, dependencies, priority,
                0, attempt, createdAt, null, null, null, null, append(history, note), artifactSummary);
    }

    private static List<String> append(List<String> list, String entry) {
        var copy = new ArrayList<>(list);
        copy.add(entry);
        return copy;
    }
}
