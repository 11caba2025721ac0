package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Message received from the agent-execution collaborator when an assignment finishes.
 *
 * @param taskId          the task that was executed
 * @param outcome         success or failure of the execution itself
 * @param artifactSummary what the agent claims to have produced; reviewed by the quality gate
 * @param producedTasks   new tasks proposed by a task-producing role (planner); empty otherwise
 * @param attempt         the {@link Assignment#attempt()} this result belongs to; null when the
 *                        sender does not know it, in which case the current attempt is assumed
 */
public record CompletionSignal(
    @JsonProperty("task_id") String taskId,
    Outcome outcome,
    @JsonProperty("artifact_summary") String artifactSummary,
    @JsonProperty("produced_tasks") List<TaskSpec> producedTasks,
    Integer attempt
) {

    public CompletionSignal {
        producedTasks = producedTasks == null ? List.of() : List.copyOf(producedTasks);
    }

    public CompletionSignal(String taskId, Outcome outcome, String artifactSummary, List<TaskSpec> producedTasks) {
        this(taskId, outcome, artifactSummary, producedTasks, null);
    }

    public static CompletionSignal success(String taskId, String artifactSummary) {
        return new CompletionSignal(taskId, Outcome.SUCCESS, artifactSummary, List.of());
    }

    public static CompletionSignal failure(String taskId, String reason) {
        return new CompletionSignal(taskId, Outcome.FAILURE, reason, List.of());
    }

    public static CompletionSignal success(Assignment assignment, String artifactSummary) {
        return success(assignment.taskId(), artifactSummary).forAttempt(assignment.attempt());
    }

    public static CompletionSignal failure(Assignment assignment, String reason) {
        return failure(assignment.taskId(), reason).forAttempt(assignment.attempt());
    }

    public CompletionSignal forAttempt(int attempt) {
        return new CompletionSignal(taskId, outcome, artifactSummary, producedTasks, attempt);
    }
}
