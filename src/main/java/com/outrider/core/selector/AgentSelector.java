package com.outrider.core.selector;

/**
 * Picks a role and model for a task when the caller left them unset.
 */
public interface AgentSelector {

    Selection select(SelectionRequest request);
}
