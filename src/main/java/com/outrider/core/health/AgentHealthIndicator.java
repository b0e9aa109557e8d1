package com.outrider.core.health;

import com.outrider.core.agent.AgentManager;
import com.outrider.core.agent.AgentProperties;
import com.outrider.core.model.AgentStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health for the agent registry: per-status counts and remaining capacity.
 * Reports DOWN once the manager has shut down.
 */
@Component
public class AgentHealthIndicator implements HealthIndicator {

    private final AgentManager manager;
    private final AgentProperties properties;

    public AgentHealthIndicator(AgentManager manager, AgentProperties properties) {
        this.manager = manager;
        this.properties = properties;
    }

    @Override
    public Health health() {
        AgentStats stats = manager.stats();
        var builder = manager.isShutdown() ? Health.down().withDetail("reason", "shut down") : Health.up();
        stats.asMap().forEach((status, count) -> builder.withDetail(status.value(), count));
        builder.withDetail("total", stats.total());

        int max = properties.getMaxConcurrentAgents();
        if (max > 0) {
            builder.withDetail("capacity", max);
            builder.withDetail("available", Math.max(0, max - stats.active()));
        } else {
            builder.withDetail("capacity", "unlimited");
        }
        return builder.build();
    }
}
