package com.outrider.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for agent lifecycle events.
 * <p>
 * Supports per-agent subscriptions and global subscriptions that receive every event.
 * Subscribers run on the publishing thread; a throwing subscriber is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AgentEvent>>> agentSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<AgentEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(AgentEvent event) {
        log.debug("Publishing event: {} for agent {}", event.eventType(), event.agentId());

        List<Consumer<AgentEvent>> agentSubs = agentSubscribers.get(event.agentId());
        if (agentSubs != null) {
            for (Consumer<AgentEvent> subscriber : agentSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<AgentEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for one agent.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String agentId, Consumer<AgentEvent> consumer) {
        agentSubscribers.computeIfAbsent(agentId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to agent {}", agentId);
        return () -> agentSubscribers.computeIfPresent(agentId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<AgentEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all agent events");
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<AgentEvent> subscriber, AgentEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
