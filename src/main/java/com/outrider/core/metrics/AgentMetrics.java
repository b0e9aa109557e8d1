package com.outrider.core.metrics;

import com.outrider.core.model.AgentRole;
import com.outrider.core.model.AgentStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for background agents.
 */
@Service
public class AgentMetrics {

    private final MeterRegistry registry;

    public AgentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSpawned(AgentRole role) {
        Counter.builder("outrider.agents.spawned")
                .tag("role", role.value())
                .register(registry)
                .increment();
    }

    /**
     * Records a terminal transition and, when the agent had started, its run time.
     */
    public void recordFinished(AgentStatus status, AgentRole role, Duration duration) {
        Counter.builder("outrider.agents.finished")
                .tag("status", status.value())
                .register(registry)
                .increment();
        if (duration != null && !duration.isZero()) {
            Timer.builder("outrider.agents.duration")
                    .tag("role", role.value())
                    .register(registry)
                    .record(duration.toNanos(), TimeUnit.NANOSECONDS);
        }
    }

    public void recordRejected(String reason) {
        Counter.builder("outrider.agents.rejected")
                .description("Spawn requests refused before an agent was created")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
