package com.outrider.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * A background agent lifecycle event.
 *
 * @param eventType one of the {@code agent.*} types below
 * @param agentId   the agent the event belongs to
 * @param payload   event details (role, model, status, failure reason)
 * @param timestamp when the event occurred
 */
public record AgentEvent(
    String eventType,
    String agentId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String SPAWNED = "agent.spawned";
    public static final String STARTED = "agent.started";
    public static final String COMPLETED = "agent.completed";
    public static final String FAILED = "agent.failed";
    public static final String KILLED = "agent.killed";
}
