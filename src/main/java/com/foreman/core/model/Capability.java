package com.foreman.core.model;

/**
 * What a {@link Role} is allowed to do inside the coordinator.
 */
public enum Capability {
    /** The role's completion may carry new tasks that are inserted into the graph. */
    PRODUCES_TASKS,
    /** The role receives task assignments. */
    CONSUMES_TASKS,
    /** The role checks artifacts produced by other roles; its assignments carry those artifacts. */
    VALIDATES
}
