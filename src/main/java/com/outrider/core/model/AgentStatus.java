package com.outrider.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle status of a background agent.
 * Transitions are strictly forward: PENDING, RUNNING, then exactly one terminal state.
 */
public enum AgentStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    KILLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == KILLED;
    }

    /** Lower-case wire form, e.g. "running". */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AgentStatus> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(s -> s.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
