package com.foreman.core.model;

import java.util.List;

/**
 * Message sent to the agent-execution collaborator when a task is dispatched.
 *
 * @param sessionId         owning session
 * @param taskId            the task to execute
 * @param role              role that owns the task
 * @param agentId           agent the task is assigned to
 * @param attempt           the task's start count; echoed back in the {@link CompletionSignal}
 * @param description       task description, including any feedback from earlier rejections
 * @param dependencyContext completed dependencies the agent may build on
 */
public record Assignment(
    String sessionId,
    String taskId,
    Role role,
    String agentId,
    int attempt,
    String description,
    List<DependencyContext> dependencyContext
) {

    public Assignment {
        dependencyContext = dependencyContext == null ? List.of() : List.copyOf(dependencyContext);
    }

    /**
     * @param taskId          dependency task id
     * @param description     dependency description
     * @param artifactSummary accepted artifact summary; only populated for validating roles
     */
    public record DependencyContext(String taskId, String description, String artifactSummary) {}
}
