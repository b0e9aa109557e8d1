package com.outrider.core.agent;

import com.outrider.core.model.AgentSnapshot;
import com.outrider.core.model.AgentStatus;

/**
 * Callback fired after an agent changes status. Invoked outside the agent's lock,
 * on whichever thread performed the transition.
 */
@FunctionalInterface
public interface AgentTransitionListener {

    AgentTransitionListener NONE = (previous, snapshot) -> { };

    void onTransition(AgentStatus previous, AgentSnapshot snapshot);
}
