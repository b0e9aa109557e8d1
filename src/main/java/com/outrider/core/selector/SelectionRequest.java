package com.outrider.core.selector;

import com.outrider.core.model.AgentModel;
import com.outrider.core.model.AgentRole;

/**
 * Input to an {@link AgentSelector}.
 *
 * @param task         task text to classify
 * @param defaultRole  configured fallback role
 * @param defaultModel configured fallback model
 */
public record SelectionRequest(
    String task,
    AgentRole defaultRole,
    AgentModel defaultModel
) {}
