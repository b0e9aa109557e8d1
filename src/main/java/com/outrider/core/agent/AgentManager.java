package com.outrider.core.agent;

import com.outrider.core.events.AgentEvent;
import com.outrider.core.events.EventBus;
import com.outrider.core.logging.MdcContext;
import com.outrider.core.metrics.AgentMetrics;
import com.outrider.core.model.AgentModel;
import com.outrider.core.model.AgentRole;
import com.outrider.core.model.AgentSnapshot;
import com.outrider.core.model.AgentStats;
import com.outrider.core.model.AgentStatus;
import com.outrider.core.model.SpawnOptions;
import com.outrider.core.selector.AgentSelector;
import com.outrider.core.selector.Selection;
import com.outrider.core.selector.SelectionRequest;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry and lifecycle owner of background agents.
 *
 * <p>Each spawned agent gets one execution unit on the worker pool and one deadline on the
 * scheduler. Kill and timeout seal the agent as KILLED first and only then cancel its
 * execution, so nothing the executor reports afterwards can change the outcome.
 *
 * <p>Locking: {@code registryLock} guards the map, id allocation and the capacity check;
 * each agent guards its own fields. The registry lock may be held while taking an agent's
 * lock, never the other way round. Entries are never removed.
 */
@Service
public class AgentManager {

    private static final Logger log = LoggerFactory.getLogger(AgentManager.class);

    public static final String REASON_CANCELLED = "cancelled";
    public static final String REASON_TIMEOUT = "timeout";
    public static final String REASON_SHUTDOWN = "shutdown";

    private final AgentSelector selector;
    private final AgentExecutor executor;
    private final AgentProperties properties;
    private final AgentMetrics metrics;
    private final EventBus eventBus;
    private final Clock clock;

    private final Object registryLock = new Object();
    private final Map<String, BackgroundAgent> agents = new LinkedHashMap<>();
    private final Map<String, AgentExecutionContext> contexts = new ConcurrentHashMap<>();

    private final ExecutorService workers = Executors.newCachedThreadPool(daemonThreads("agent-"));
    private final ScheduledExecutorService deadlines = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "agent-deadline");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean shutdown;

    @Autowired
    public AgentManager(AgentSelector selector, AgentExecutor executor, AgentProperties properties,
                        @Autowired(required = false) AgentMetrics metrics,
                        @Autowired(required = false) EventBus eventBus) {
        this(selector, executor, properties, metrics, eventBus, Clock.systemUTC());
    }

    AgentManager(AgentSelector selector, AgentExecutor executor, AgentProperties properties,
                 AgentMetrics metrics, EventBus eventBus, Clock clock) {
        this.selector = selector;
        this.executor = executor;
        this.properties = properties;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Creates a PENDING agent, registers it and launches its execution. Returns without
     * waiting for the agent to start.
     *
     * @throws AgentValidationException on a blank task, a non-positive explicit timeout,
     *                                  or when the concurrency cap is reached
     * @throws IllegalStateException    after {@link #shutdown()}
     */
    public BackgroundAgent spawn(String task, SpawnOptions options) {
        if (task == null || task.isBlank()) {
            throw new AgentValidationException("task is required");
        }
        SpawnOptions opts = options != null ? options : SpawnOptions.defaults();
        if (opts.timeoutSeconds() != null && opts.timeoutSeconds() <= 0) {
            throw new AgentValidationException("timeout_seconds must be positive, got " + opts.timeoutSeconds());
        }
        if (shutdown) {
            throw new IllegalStateException("agent manager is shut down");
        }

        Selection selection = resolve(task, opts);
        int timeoutSeconds = opts.timeoutSeconds() != null
                ? opts.timeoutSeconds()
                : properties.getDefaultTimeoutSeconds();

        BackgroundAgent agent;
        AgentExecutionContext context;
        synchronized (registryLock) {
            int max = properties.getMaxConcurrentAgents();
            if (max > 0 && activeCountLocked() >= max) {
                if (metrics != null) {
                    metrics.recordRejected("capacity");
                }
                throw new AgentValidationException(
                        String.format("max concurrent agents (%d) reached", max));
            }
            String id = newId();
            agent = new BackgroundAgent(id, selection.role(), selection.model(), task,
                    clock, this::onTransition);
            context = new AgentExecutionContext(id, agent.getCreatedAt().plusSeconds(timeoutSeconds));
            agents.put(id, agent);
            contexts.put(id, context);
        }

        log.info("Spawned agent {} ({}/{}, timeout {}s): {}", agent.getId(), agent.getRole().value(),
                agent.getModel().value(), timeoutSeconds, abbreviate(task));
        if (metrics != null) {
            metrics.recordSpawned(agent.getRole());
        }
        publish(AgentEvent.SPAWNED, agent.snapshot());

        launch(agent, context, timeoutSeconds);
        return agent;
    }

    /**
     * @throws AgentNotFoundException if no agent has this id
     */
    public BackgroundAgent get(String id) {
        BackgroundAgent agent;
        synchronized (registryLock) {
            agent = id == null ? null : agents.get(id);
        }
        if (agent == null) {
            throw new AgentNotFoundException(id);
        }
        return agent;
    }

    /**
     * Snapshots of every agent, oldest first.
     */
    public List<AgentSnapshot> list() {
        return list(null);
    }

    /**
     * Snapshots of agents in the given status, oldest first; {@code null} means all.
     */
    public List<AgentSnapshot> list(AgentStatus status) {
        List<BackgroundAgent> copy;
        synchronized (registryLock) {
            copy = new ArrayList<>(agents.values());
        }
        List<AgentSnapshot> snapshots = new ArrayList<>(copy.size());
        for (BackgroundAgent agent : copy) {
            AgentSnapshot snapshot = agent.snapshot();
            if (status == null || snapshot.status() == status) {
                snapshots.add(snapshot);
            }
        }
        snapshots.sort(Comparator.comparing(AgentSnapshot::createdAt));
        return snapshots;
    }

    public int count() {
        synchronized (registryLock) {
            return agents.size();
        }
    }

    public int countByStatus(AgentStatus status) {
        return (int) list().stream().filter(s -> s.status() == status).count();
    }

    public AgentStats stats() {
        Map<AgentStatus, Integer> counts = new EnumMap<>(AgentStatus.class);
        for (AgentSnapshot snapshot : list()) {
            counts.merge(snapshot.status(), 1, Integer::sum);
        }
        return new AgentStats(
                counts.getOrDefault(AgentStatus.PENDING, 0),
                counts.getOrDefault(AgentStatus.RUNNING, 0),
                counts.getOrDefault(AgentStatus.COMPLETED, 0),
                counts.getOrDefault(AgentStatus.FAILED, 0),
                counts.getOrDefault(AgentStatus.KILLED, 0));
    }

    /**
     * Kills an agent. Succeeds without effect if it is already terminal. Does not wait for
     * the executor to observe the cancellation.
     *
     * @return the agent's state after the call
     * @throws AgentNotFoundException if no agent has this id
     */
    public AgentSnapshot kill(String id) {
        BackgroundAgent agent = get(id);
        if (agent.seal(REASON_CANCELLED)) {
            cancelExecution(id, REASON_CANCELLED);
        } else {
            log.debug("Kill of agent {} ignored, already {}", id, agent.getStatus().value());
        }
        return agent.snapshot();
    }

    /**
     * Blocks until the agent is terminal or the wait times out.
     *
     * @return the latest snapshot, terminal unless the wait timed out
     */
    public AgentSnapshot awaitTerminal(String id, Duration timeout) throws InterruptedException {
        BackgroundAgent agent = get(id);
        if (agent.isTerminal() || eventBus == null) {
            return agent.isTerminal() ? agent.snapshot() : pollUntilTerminal(agent, timeout);
        }
        CountDownLatch done = new CountDownLatch(1);
        EventBus.Subscription subscription = eventBus.subscribe(id, event -> {
            if (isTerminalEvent(event.eventType())) {
                done.countDown();
            }
        });
        try {
            if (!agent.isTerminal()) {
                done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } finally {
            subscription.unsubscribe();
        }
        return agent.snapshot();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Kills every non-terminal agent with reason "shutdown" and stops the worker pools.
     * Agents stay registered.
     */
    @PreDestroy
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        List<BackgroundAgent> copy;
        synchronized (registryLock) {
            copy = new ArrayList<>(agents.values());
        }
        int sealed = 0;
        for (BackgroundAgent agent : copy) {
            if (agent.seal(REASON_SHUTDOWN)) {
                cancelExecution(agent.getId(), REASON_SHUTDOWN);
                sealed++;
            }
        }
        deadlines.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Agent manager stopped ({} agents killed)", sealed);
    }

    // --- execution ---

    private void launch(BackgroundAgent agent, AgentExecutionContext context, int timeoutSeconds) {
        AgentExecution execution = new AgentExecution(agent, context);
        try {
            Future<?> worker = workers.submit(() -> run(agent, execution));
            context.bindWorker(worker);
            context.bindTimer(deadlines.schedule(() -> expire(agent, context),
                    timeoutSeconds, TimeUnit.SECONDS));
        } catch (RejectedExecutionException e) {
            // pools stopped between the shutdown check and here
            if (agent.seal(REASON_SHUTDOWN)) {
                cancelExecution(agent.getId(), REASON_SHUTDOWN);
            }
        }
    }

    private void run(BackgroundAgent agent, AgentExecution execution) {
        MdcContext.setAgent(agent.getId(), agent.getRole().value(), agent.getModel().value());
        try {
            if (!agent.start()) {
                log.debug("Agent {} left PENDING before its execution started", agent.getId());
                return;
            }
            try {
                executor.execute(execution);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                agent.fail(e);
            } catch (Exception e) {
                if (!execution.isCancelled()) {
                    log.warn("Agent {} executor failed: {}", agent.getId(), e.getMessage(), e);
                }
                agent.fail(e);
            } catch (Error e) {
                log.error("Agent {} executor raised {}", agent.getId(), e.toString(), e);
                agent.fail(e);
                throw e;
            }
            if (agent.fail(new IllegalStateException("executor returned without reporting an outcome"))) {
                log.warn("Agent {} executor returned without completing or failing", agent.getId());
            }
        } finally {
            execution.context().release();
            contexts.remove(agent.getId());
            MdcContext.clear();
        }
    }

    private void expire(BackgroundAgent agent, AgentExecutionContext context) {
        if (agent.seal(REASON_TIMEOUT)) {
            log.warn("Agent {} timed out", agent.getId());
        }
        contexts.remove(agent.getId());
        context.cancel(REASON_TIMEOUT);
    }

    private void cancelExecution(String id, String reason) {
        AgentExecutionContext context = contexts.remove(id);
        if (context != null) {
            context.cancel(reason);
        }
    }

    // --- helpers ---

    private Selection resolve(String task, SpawnOptions opts) {
        AgentRole role = opts.role();
        AgentModel model = opts.model();
        String reason = "explicit";
        if (role == null || model == null) {
            try {
                Selection selected = selector.select(
                        new SelectionRequest(task, properties.getDefaultRole(), properties.getDefaultModel()));
                if (role == null) {
                    role = selected.role();
                }
                if (model == null) {
                    model = selected.model();
                }
                reason = selected.reason();
            } catch (AgentValidationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Agent selection failed, using defaults: {}", e.getMessage(), e);
                reason = "defaults after selector error";
            }
        }
        if (role == null) {
            role = properties.getDefaultRole() != null ? properties.getDefaultRole() : AgentRole.DEVELOPER;
        }
        if (model == null) {
            model = properties.getDefaultModel() != null ? properties.getDefaultModel() : AgentModel.HAIKU;
        }
        return new Selection(role, model, reason);
    }

    // caller holds registryLock
    private int activeCountLocked() {
        int active = 0;
        for (BackgroundAgent agent : agents.values()) {
            if (!agent.isTerminal()) {
                active++;
            }
        }
        return active;
    }

    // caller holds registryLock
    private String newId() {
        String id;
        do {
            id = UUID.randomUUID().toString();
        } while (agents.containsKey(id));
        return id;
    }

    private void onTransition(AgentStatus previous, AgentSnapshot snapshot) {
        switch (snapshot.status()) {
            case RUNNING -> {
                log.info("Agent {} started", snapshot.id());
                publish(AgentEvent.STARTED, snapshot);
            }
            case COMPLETED -> {
                log.info("Agent {} completed in {} ms", snapshot.id(), snapshot.duration().toMillis());
                finished(snapshot, AgentEvent.COMPLETED);
            }
            case FAILED -> {
                log.info("Agent {} failed: {}", snapshot.id(), snapshot.failureReason());
                finished(snapshot, AgentEvent.FAILED);
            }
            case KILLED -> {
                log.info("Agent {} killed ({}) while {}", snapshot.id(), snapshot.failureReason(),
                        previous.value());
                finished(snapshot, AgentEvent.KILLED);
            }
            default -> { }
        }
    }

    private void finished(AgentSnapshot snapshot, String eventType) {
        if (metrics != null) {
            metrics.recordFinished(snapshot.status(), snapshot.role(), snapshot.duration());
        }
        publish(eventType, snapshot);
    }

    private void publish(String eventType, AgentSnapshot snapshot) {
        if (eventBus == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("role", snapshot.role().value());
        payload.put("model", snapshot.model().value());
        payload.put("status", snapshot.status().value());
        if (snapshot.failureReason() != null) {
            payload.put("reason", snapshot.failureReason());
        }
        eventBus.publish(new AgentEvent(eventType, snapshot.id(), payload, Instant.now(clock)));
    }

    private AgentSnapshot pollUntilTerminal(BackgroundAgent agent, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!agent.isTerminal() && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        return agent.snapshot();
    }

    private static boolean isTerminalEvent(String eventType) {
        return AgentEvent.COMPLETED.equals(eventType)
                || AgentEvent.FAILED.equals(eventType)
                || AgentEvent.KILLED.equals(eventType);
    }

    private static String abbreviate(String text) {
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= 80 ? flat : flat.substring(0, 77) + "...";
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
