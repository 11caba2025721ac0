package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a task within a session.
 */
public enum TaskStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    BLOCKED("blocked");  // terminal until an operator unblocks it

    private final String key;

    TaskStatus(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /** Pending or in progress: work that still holds its phase open. */
    public boolean isOpen() {
        return this == PENDING || this == IN_PROGRESS;
    }

    @JsonCreator
    public static TaskStatus fromKey(String value) {
        for (TaskStatus status : values()) {
            if (status.key.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
