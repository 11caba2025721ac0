package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * A logical worker specialization. Behavior differences between roles are expressed
 * through {@link Capability} flags rather than by comparing role names.
 */
public enum Role {
    PLANNER("planner", Capability.PRODUCES_TASKS, Capability.CONSUMES_TASKS),
    BUILDER("builder", Capability.CONSUMES_TASKS),
    QUALITY_CHECKER("quality_checker", Capability.CONSUMES_TASKS, Capability.VALIDATES),
    TESTER("tester", Capability.CONSUMES_TASKS, Capability.VALIDATES),
    DOCUMENTER("documenter", Capability.CONSUMES_TASKS);

    private final String key;
    private final Set<Capability> capabilities;

    Role(String key, Capability first, Capability... rest) {
        this.key = key;
        this.capabilities = EnumSet.of(first, rest);
    }

    /** Stable lower-case name used in the store and on the wire. */
    @JsonValue
    public String key() {
        return key;
    }

    public boolean has(Capability capability) {
        return capabilities.contains(capability);
    }

    public boolean producesTasks() {
        return has(Capability.PRODUCES_TASKS);
    }

    public boolean consumesTasks() {
        return has(Capability.CONSUMES_TASKS);
    }

    public boolean validates() {
        return has(Capability.VALIDATES);
    }

    /**
     * Resolves a role from its key or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if no role matches
     */
    @JsonCreator
    public static Role fromKey(String value) {
        if (value != null) {
            for (Role role : values()) {
                if (role.key.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value)) {
                    return role;
                }
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value
                + ". Valid roles: " + Arrays.toString(Arrays.stream(values()).map(Role::key).toArray()));
    }
}
