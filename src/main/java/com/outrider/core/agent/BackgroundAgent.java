package com.outrider.core.agent;

import com.outrider.core.model.AgentModel;
import com.outrider.core.model.AgentRole;
import com.outrider.core.model.AgentSnapshot;
import com.outrider.core.model.AgentStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * One spawned task and its state machine.
 *
 * <p>All mutable fields are guarded by this agent's own lock. Terminal transitions are
 * first-write-wins: whichever of {@link #complete}, {@link #fail} or {@link #seal} observes a
 * non-terminal status performs the transition, every later call is a no-op. Readers only ever
 * get an {@link AgentSnapshot}.
 */
public class BackgroundAgent {

    private final Object lock = new Object();

    private final String id;
    private final AgentRole role;
    private final AgentModel model;
    private final String task;
    private final Instant createdAt;
    private final Clock clock;
    private final AgentTransitionListener listener;

    private AgentStatus status = AgentStatus.PENDING;
    private Instant startedAt;
    private Instant finishedAt;
    private final StringBuilder output = new StringBuilder();
    private String failureReason;

    public BackgroundAgent(String id, AgentRole role, AgentModel model, String task,
                           Clock clock, AgentTransitionListener listener) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("agent id required");
        }
        if (task == null || task.isBlank()) {
            throw new IllegalArgumentException("task required");
        }
        this.id = id;
        this.role = Objects.requireNonNull(role, "role");
        this.model = Objects.requireNonNull(model, "model");
        this.task = task;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.listener = listener != null ? listener : AgentTransitionListener.NONE;
        this.createdAt = this.clock.instant();
    }

    public BackgroundAgent(String id, AgentRole role, AgentModel model, String task) {
        this(id, role, model, task, Clock.systemUTC(), AgentTransitionListener.NONE);
    }

    public String getId() {
        return id;
    }

    public AgentRole getRole() {
        return role;
    }

    public AgentModel getModel() {
        return model;
    }

    public String getTask() {
        return task;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public AgentStatus getStatus() {
        synchronized (lock) {
            return status;
        }
    }

    public boolean isTerminal() {
        synchronized (lock) {
            return status.isTerminal();
        }
    }

    /**
     * PENDING to RUNNING.
     *
     * @return false if the agent had already left PENDING (e.g. it was killed first)
     */
    public boolean start() {
        AgentSnapshot after;
        synchronized (lock) {
            if (status != AgentStatus.PENDING) {
                return false;
            }
            status = AgentStatus.RUNNING;
            startedAt = clock.instant();
            after = copy();
        }
        listener.onTransition(AgentStatus.PENDING, after);
        return true;
    }

    /**
     * Appends streamed output. Only accepted while RUNNING; anything arriving after the
     * terminal transition is dropped.
     *
     * @return whether the chunk was kept
     */
    public boolean appendOutput(CharSequence chunk) {
        if (chunk == null || chunk.length() == 0) {
            return false;
        }
        synchronized (lock) {
            if (status != AgentStatus.RUNNING) {
                return false;
            }
            output.append(chunk);
            return true;
        }
    }

    /**
     * Marks the agent COMPLETED, replacing the streamed output with {@code finalOutput}
     * when it is non-null.
     *
     * @return whether this call performed the transition
     */
    public boolean complete(String finalOutput) {
        return finish(AgentStatus.COMPLETED, finalOutput, null);
    }

    /**
     * Marks the agent COMPLETED keeping whatever output was streamed.
     */
    public boolean complete() {
        return finish(AgentStatus.COMPLETED, null, null);
    }

    /**
     * Marks the agent FAILED with the error's message as failure reason.
     */
    public boolean fail(Throwable error) {
        String reason = error == null ? "unknown error"
                : error.getMessage() != null ? error.getMessage()
                : error.getClass().getSimpleName();
        return finish(AgentStatus.FAILED, null, reason);
    }

    /**
     * Forces KILLED unless already terminal. Used for kill, timeout and shutdown.
     */
    boolean seal(String reason) {
        return finish(AgentStatus.KILLED, null, reason);
    }

    public AgentSnapshot snapshot() {
        synchronized (lock) {
            return copy();
        }
    }

    private boolean finish(AgentStatus terminal, String finalOutput, String reason) {
        AgentStatus previous;
        AgentSnapshot after;
        synchronized (lock) {
            if (status.isTerminal()) {
                return false;
            }
            previous = status;
            status = terminal;
            finishedAt = clock.instant();
            if (finalOutput != null) {
                output.setLength(0);
                output.append(finalOutput);
            }
            failureReason = reason;
            after = copy();
        }
        listener.onTransition(previous, after);
        return true;
    }

    // caller holds lock
    private AgentSnapshot copy() {
        return new AgentSnapshot(id, role, model, task, status,
                createdAt, startedAt, finishedAt, output.toString(), failureReason);
    }

    @Override
    public String toString() {
        return "BackgroundAgent[" + id + ", " + role.value() + "/" + model.value() + "]";
    }
}
