package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Project-wide stage. Each phase gates which roles are expected to be active.
 * Phases only move forward; pausing is tracked separately on the {@link Session}.
 */
public enum Phase {
    PLANNING("planning", EnumSet.of(Role.PLANNER)),
    IMPLEMENTATION("implementation", EnumSet.of(Role.BUILDER)),
    QUALITY_CHECK("quality_check", EnumSet.of(Role.QUALITY_CHECKER)),
    TESTING("testing", EnumSet.of(Role.TESTER)),
    DOCUMENTATION("documentation", EnumSet.of(Role.DOCUMENTER)),
    DONE("done", EnumSet.noneOf(Role.class));

    private final String key;
    private final Set<Role> roles;

    Phase(String key, Set<Role> roles) {
        this.key = key;
        this.roles = roles;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /** Roles expected to be active while the session is in this phase. */
    public Set<Role> roles() {
        return EnumSet.copyOf(roles);
    }

    public boolean isTerminal() {
        return this == DONE;
    }

    public Phase next() {
        return this == DONE ? DONE : values()[ordinal() + 1];
    }

    /** The phase in which the given role does its work. */
    public static Phase of(Role role) {
        for (Phase phase : values()) {
            if (phase.roles.contains(role)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Role " + role + " belongs to no phase");
    }

    @JsonCreator
    public static Phase fromKey(String value) {
        for (Phase phase : values()) {
            if (phase.key.equalsIgnoreCase(value) || phase.name().equalsIgnoreCase(value)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + value);
    }
}
