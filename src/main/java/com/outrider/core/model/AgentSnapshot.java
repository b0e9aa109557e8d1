package com.outrider.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time copy of a background agent's observable state.
 * Taken under the agent's lock; holds no reference back to the agent.
 *
 * @param id            agent identifier
 * @param role          resolved role
 * @param model         resolved model
 * @param task          task description
 * @param status        status at the time of the copy
 * @param createdAt     when the agent was spawned
 * @param startedAt     when execution began (nullable)
 * @param finishedAt    when the terminal transition happened (nullable)
 * @param output        captured output so far
 * @param failureReason reason for FAILED or KILLED (nullable)
 */
public record AgentSnapshot(
    String id,
    AgentRole role,
    AgentModel model,
    String task,
    AgentStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    String output,
    String failureReason
) {

    /**
     * Execution time: zero before start, start-to-finish once terminal,
     * start-to-{@code now} while running.
     */
    public Duration duration(Instant now) {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        Instant end = finishedAt != null ? finishedAt : now;
        return Duration.between(startedAt, end);
    }

    public Duration duration() {
        return duration(Instant.now());
    }
}
