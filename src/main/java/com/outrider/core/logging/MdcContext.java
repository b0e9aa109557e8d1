package com.outrider.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys for agent-scoped logging. Set on an agent's execution thread.
 */
public final class MdcContext {

    public static final String AGENT_ID = "agentId";
    public static final String ROLE = "role";
    public static final String MODEL = "model";

    private MdcContext() {}

    public static void setAgent(String agentId, String role, String model) {
        MDC.put(AGENT_ID, agentId);
        MDC.put(ROLE, role);
        MDC.put(MODEL, model);
    }

    public static void clear() {
        MDC.remove(AGENT_ID);
        MDC.remove(ROLE);
        MDC.remove(MODEL);
    }
}
