package com.outrider.core.selector;

import com.outrider.core.model.AgentModel;
import com.outrider.core.model.AgentRole;

/**
 * @param role   chosen role
 * @param model  chosen model
 * @param reason short human-readable explanation, for logs
 */
public record Selection(
    AgentRole role,
    AgentModel model,
    String reason
) {}
