package com.outrider.core.agent;

import com.outrider.core.model.AgentModel;
import com.outrider.core.model.AgentRole;

import java.time.Instant;

/**
 * Handle an {@link AgentExecutor} works through: what to run, where to stream output,
 * how to report the outcome, and whether it has been told to stop.
 *
 * <p>Everything reported after the agent was killed or timed out is discarded.
 */
public final class AgentExecution {

    private final BackgroundAgent agent;
    private final AgentExecutionContext context;

    AgentExecution(BackgroundAgent agent, AgentExecutionContext context) {
        this.agent = agent;
        this.context = context;
    }

    public String getAgentId() {
        return agent.getId();
    }

    public String getTask() {
        return agent.getTask();
    }

    public AgentRole getRole() {
        return agent.getRole();
    }

    public AgentModel getModel() {
        return agent.getModel();
    }

    public Instant getDeadline() {
        return context.deadline();
    }

    public boolean isCancelled() {
        return context.isCancelled();
    }

    /** "cancelled", "timeout" or "shutdown"; null while not cancelled. */
    public String getCancellationReason() {
        return context.cancelReason();
    }

    /**
     * Registers work to run when the execution is cancelled, e.g. destroying a child process.
     * Runs immediately if cancellation already happened.
     */
    public void onCancel(Runnable callback) {
        context.onCancel(callback);
    }

    public boolean appendOutput(CharSequence chunk) {
        return agent.appendOutput(chunk);
    }

    public boolean complete(String output) {
        return agent.complete(output);
    }

    public boolean complete() {
        return agent.complete();
    }

    public boolean fail(Throwable error) {
        return agent.fail(error);
    }

    AgentExecutionContext context() {
        return context;
    }
}
