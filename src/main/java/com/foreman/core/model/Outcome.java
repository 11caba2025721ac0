package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the agent-execution collaborator reports for an assignment.
 */
public enum Outcome {
    SUCCESS,
    FAILURE;

    @JsonValue
    public String key() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Outcome fromKey(String value) {
        return Outcome.valueOf(value.trim().toUpperCase());
    }
}
