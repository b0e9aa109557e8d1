package com.outrider.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Fixed set of roles an agent can be spawned with.
 */
public enum AgentRole {
    ARCHITECT,
    SENIOR,
    DEVELOPER,
    OPS,
    REVIEWER;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AgentRole> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(r -> r.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
