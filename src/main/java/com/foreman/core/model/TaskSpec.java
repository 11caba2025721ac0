package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A task as proposed by the planner or an operator, before it is inserted into the graph.
 *
 * @param id           requested id; null to have one generated
 * @param role         owning role
 * @param description  what the task should accomplish
 * @param dependencies ids of tasks that must complete first
 * @param priority     higher runs first among ready tasks
 */
public record TaskSpec(
    String id,
    Role role,
    String description,
    @JsonProperty("depends_on") List<String> dependencies,
    int priority
) {

    public TaskSpec {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public TaskSpec(String id, Role role, String description, List<String> dependencies) {
        this(id, role, description, dependencies, 0);
    }
}
