package com.outrider.core.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-status agent counts.
 */
public record AgentStats(
    int pending,
    int running,
    int completed,
    int failed,
    int killed
) {

    public int total() {
        return pending + running + completed + failed + killed;
    }

    public int active() {
        return pending + running;
    }

    public Map<AgentStatus, Integer> asMap() {
        var map = new EnumMap<AgentStatus, Integer>(AgentStatus.class);
        map.put(AgentStatus.PENDING, pending);
        map.put(AgentStatus.RUNNING, running);
        map.put(AgentStatus.COMPLETED, completed);
        map.put(AgentStatus.FAILED, failed);
        map.put(AgentStatus.KILLED, killed);
        return map;
    }
}
