package com.outrider.core.agent;

/**
 * Backend that performs an agent's actual work.
 *
 * <p>Called on the agent's own execution thread after it entered RUNNING. Implementations
 * stream output through {@link AgentExecution#appendOutput}, report exactly one of
 * {@link AgentExecution#complete} or {@link AgentExecution#fail}, and should stop promptly
 * once {@link AgentExecution#isCancelled()} turns true (the thread is also interrupted).
 * A thrown exception is recorded as a failure.
 */
@FunctionalInterface
public interface AgentExecutor {

    void execute(AgentExecution execution) throws Exception;
}
