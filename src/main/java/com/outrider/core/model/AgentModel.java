package com.outrider.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Fixed set of model tiers an agent can run on.
 */
public enum AgentModel {
    OPUS,
    SONNET,
    HAIKU;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AgentModel> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(m -> m.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
