package com.outrider.core.model;

/**
 * Optional overrides for a spawn request. Any field may be {@code null}.
 *
 * @param role           explicit role, or null to let the selector decide
 * @param model          explicit model, or null to let the selector decide
 * @param timeoutSeconds explicit deadline in seconds, or null for the configured default
 */
public record SpawnOptions(
    AgentRole role,
    AgentModel model,
    Integer timeoutSeconds
) {

    public static SpawnOptions defaults() {
        return new SpawnOptions(null, null, null);
    }
}
