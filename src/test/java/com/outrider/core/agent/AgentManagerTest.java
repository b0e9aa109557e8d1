package com.outrider.core.agent;

import com.outrider.core.events.AgentEvent;
import com.outrider.core.events.EventBus;
import com.outrider.core.metrics.AgentMetrics;
import com.outrider.core.model.AgentModel;
import com.outrider.core.model.AgentRole;
import com.outrider.core.model.AgentSnapshot;
import com.outrider.core.model.AgentStats;
import com.outrider.core.model.AgentStatus;
import com.outrider.core.model.SpawnOptions;
import com.outrider.core.selector.AgentSelector;
import com.outrider.core.selector.Selection;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AgentManager}, driven by scripted executors.
 */
class AgentManagerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private AgentSelector selector;
    private AgentProperties properties;
    private SimpleMeterRegistry registry;
    private EventBus eventBus;
    private MutableClock clock;
    private final List<AgentManager> managers = new ArrayList<>();

    /** Released by tests to let blocked executors finish. */
    private CountDownLatch release;
    /** Counted down once per executor invocation. */
    private CountDownLatch started;
    private final Set<String> cancelCallbacksRun = ConcurrentHashMap.newKeySet();

    @BeforeEach
    void setUp() {
        selector = mock(AgentSelector.class);
        when(selector.select(any())).thenReturn(new Selection(AgentRole.DEVELOPER, AgentModel.SONNET, "test"));
        properties = new AgentProperties();
        registry = new SimpleMeterRegistry();
        eventBus = new EventBus();
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        release = new CountDownLatch(1);
        started = new CountDownLatch(1);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        managers.forEach(AgentManager::shutdown);
    }

    private AgentManager manager(AgentExecutor executor) {
        var manager = new AgentManager(selector, executor, properties,
                new AgentMetrics(registry), eventBus, clock);
        managers.add(manager);
        return manager;
    }

    /** Streams two lines and completes. */
    private AgentExecutor echo() {
        return execution -> {
            execution.appendOutput("working on: " + execution.getTask() + "\n");
            execution.appendOutput("done\n");
            execution.complete();
        };
    }

    /** Blocks until released or cancelled; then tries to complete. */
    private AgentExecutor blocking() {
        return execution -> {
            execution.onCancel(() -> cancelCallbacksRun.add(execution.getAgentId()));
            execution.appendOutput("started\n");
            started.countDown();
            release.await(10, TimeUnit.SECONDS);
            execution.complete("finished");
        };
    }

    /** Ignores interruption and reports completion after cancellation. */
    private AgentExecutor stubborn(AtomicBoolean reportedLate) {
        return execution -> {
            started.countDown();
            long until = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (!execution.isCancelled() && System.nanoTime() < until) {
                Thread.onSpinWait();
            }
            reportedLate.set(!execution.complete("late result"));
        };
    }

    private void awaitStarted() throws InterruptedException {
        assertTrue(started.await(5, TimeUnit.SECONDS), "executor never started");
    }

    /** Listeners run just after the status flips, so observers poll briefly. */
    private static void eventually(BooleanSupplier condition) throws InterruptedException {
        long until = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > until) {
                fail("condition not met within " + WAIT);
            }
            Thread.sleep(10);
        }
    }

    @Nested
    @DisplayName("spawn")
    class SpawnTests {

        @Test
        @DisplayName("runs the executor and completes with its output")
        void runsExecutorToCompletion() throws Exception {
            var manager = manager(echo());
            BackgroundAgent agent = manager.spawn("write docs", SpawnOptions.defaults());

            AgentSnapshot done = manager.awaitTerminal(agent.getId(), WAIT);
            assertEquals(AgentStatus.COMPLETED, done.status());
            assertEquals("working on: write docs\ndone\n", done.output());
            assertNotNull(done.startedAt());
            assertNotNull(done.finishedAt());
            assertNull(done.failureReason());
        }

        @Test
        @DisplayName("returns without waiting for the executor")
        void returnsImmediately() throws Exception {
            var manager = manager(blocking());
            BackgroundAgent agent = manager.spawn("long task", null);

            assertFalse(agent.isTerminal());
            awaitStarted();
            assertEquals(AgentStatus.RUNNING, agent.getStatus());
            release.countDown();
            assertEquals(AgentStatus.COMPLETED, manager.awaitTerminal(agent.getId(), WAIT).status());
        }

        @Test
        @DisplayName("rejects a blank task without registering anything")
        void rejectsBlankTask() {
            var manager = manager(echo());
            assertThrows(AgentValidationException.class, () -> manager.spawn("   ", null));
            assertThrows(AgentValidationException.class, () -> manager.spawn(null, null));
            assertEquals(0, manager.count());
        }

        @Test
        @DisplayName("rejects non-positive explicit timeouts")
        void rejectsNonPositiveTimeout() {
            var manager = manager(echo());
            assertThrows(AgentValidationException.class,
                    () -> manager.spawn("task", new SpawnOptions(null, null, 0)));
            assertThrows(AgentValidationException.class,
                    () -> manager.spawn("task", new SpawnOptions(null, null, -5)));
            assertEquals(0, manager.count());
        }

        @Test
        @DisplayName("explicit role and model skip the selector")
        void explicitValuesSkipSelector() {
            var manager = manager(echo());
            BackgroundAgent agent = manager.spawn("task",
                    new SpawnOptions(AgentRole.ARCHITECT, AgentModel.OPUS, null));

            assertEquals(AgentRole.ARCHITECT, agent.getRole());
            assertEquals(AgentModel.OPUS, agent.getModel());
            verify(selector, never()).select(any());
        }

        @Test
        @DisplayName("selector fills in whichever value is missing")
        void selectorFillsMissing() {
            var manager = manager(echo());
            BackgroundAgent agent = manager.spawn("task", new SpawnOptions(AgentRole.OPS, null, null));

            assertEquals(AgentRole.OPS, agent.getRole());
            assertEquals(AgentModel.SONNET, agent.getModel());
        }

        @Test
        @DisplayName("falls back to configured defaults when the selector fails")
        void fallsBackWhenSelectorFails() {
            when(selector.select(any())).thenThrow(new IllegalStateException("selector down"));
            properties.setDefaultRole(AgentRole.SENIOR);
            properties.setDefaultModel(AgentModel.HAIKU);
            var manager = manager(echo());

            BackgroundAgent agent = manager.spawn("task", null);
            assertEquals(AgentRole.SENIOR, agent.getRole());
            assertEquals(AgentModel.HAIKU, agent.getModel());
        }

        @Test
        @DisplayName("concurrent spawns get distinct ids")
        void concurrentSpawnsGetDistinctIds() throws Exception {
            var manager = manager(echo());
            int threads = 16;
            int perThread = 25;
            var barrier = new CyclicBarrier(threads);
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            List<Future<List<String>>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    barrier.await();
                    List<String> ids = new ArrayList<>();
                    for (int j = 0; j < perThread; j++) {
                        ids.add(manager.spawn("task " + j, null).getId());
                    }
                    return ids;
                }));
            }
            Set<String> ids = new HashSet<>();
            for (Future<List<String>> f : futures) {
                ids.addAll(f.get(10, TimeUnit.SECONDS));
            }
            pool.shutdown();

            assertEquals(threads * perThread, ids.size());
            assertEquals(threads * perThread, manager.count());
        }
    }

    @Nested
    @DisplayName("executor outcomes")
    class OutcomeTests {

        @Test
        @DisplayName("an executor exception fails the agent with its message")
        void exceptionFailsAgent() throws Exception {
            var manager = manager(execution -> {
                execution.appendOutput("partial\n");
                throw new IllegalStateException("model unavailable");
            });
            String id = manager.spawn("task", null).getId();

            AgentSnapshot done = manager.awaitTerminal(id, WAIT);
            assertEquals(AgentStatus.FAILED, done.status());
            assertEquals("model unavailable", done.failureReason());
            assertEquals("partial\n", done.output());
        }

        @Test
        @DisplayName("an executor Error fails the agent instead of leaving it running")
        void errorFailsAgent() throws Exception {
            var manager = manager(execution -> {
                throw new AssertionError("boom");
            });
            String id = manager.spawn("task", null).getId();

            AgentSnapshot done = manager.awaitTerminal(id, WAIT);
            assertEquals(AgentStatus.FAILED, done.status());
            assertEquals("boom", done.failureReason());
            assertEquals(0, manager.countByStatus(AgentStatus.RUNNING));
        }

        @Test
        @DisplayName("an explicit fail is recorded")
        void explicitFailIsRecorded() throws Exception {
            var manager = manager(execution -> execution.fail(new RuntimeException("bad input")));
            String id = manager.spawn("task", null).getId();
            assertEquals("bad input", manager.awaitTerminal(id, WAIT).failureReason());
        }

        @Test
        @DisplayName("returning without an outcome fails the agent")
        void returningWithoutOutcomeFails() throws Exception {
            var manager = manager(execution -> execution.appendOutput("forgot to complete"));
            String id = manager.spawn("task", null).getId();

            AgentSnapshot done = manager.awaitTerminal(id, WAIT);
            assertEquals(AgentStatus.FAILED, done.status());
            assertEquals("executor returned without reporting an outcome", done.failureReason());
        }

        @Test
        @DisplayName("complete with a final output replaces streamed output")
        void finalOutputReplaces() throws Exception {
            var manager = manager(execution -> {
                execution.appendOutput("draft");
                execution.complete("final");
            });
            String id = manager.spawn("task", null).getId();
            assertEquals("final", manager.awaitTerminal(id, WAIT).output());
        }
    }

    @Nested
    @DisplayName("get and list")
    class ReadTests {

        @Test
        @DisplayName("get throws for an unknown id")
        void getUnknownThrows() {
            var manager = manager(echo());
            var ex = assertThrows(AgentNotFoundException.class, () -> manager.get("nope"));
            assertEquals("nope", ex.getAgentId());
            assertThrows(AgentNotFoundException.class, () -> manager.get(null));
        }

        @Test
        @DisplayName("list is ordered by creation time")
        void listOrderedByCreation() {
            var manager = manager(echo());
            List<String> spawned = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                spawned.add(manager.spawn("task " + i, null).getId());
                clock.advance(Duration.ofSeconds(1));
            }

            List<String> listed = manager.list().stream().map(AgentSnapshot::id).toList();
            assertEquals(spawned, listed);
        }

        @Test
        @DisplayName("agents created at the same instant keep spawn order")
        void sameInstantKeepsSpawnOrder() {
            var manager = manager(echo());
            List<String> spawned = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                spawned.add(manager.spawn("task " + i, null).getId());
            }
            assertEquals(spawned, manager.list().stream().map(AgentSnapshot::id).toList());
        }

        @Test
        @DisplayName("list by status filters snapshots")
        void listByStatus() throws Exception {
            var manager = manager(blocking());
            String running = manager.spawn("blocked", null).getId();
            awaitStarted();
            String killed = manager.spawn("to kill", null).getId();
            manager.kill(killed);

            assertEquals(List.of(killed),
                    manager.list(AgentStatus.KILLED).stream().map(AgentSnapshot::id).toList());
            assertTrue(manager.list(AgentStatus.COMPLETED).isEmpty());
            assertEquals(running, manager.get(running).getId());
            assertEquals(2, manager.list(null).size());
        }

        @Test
        @DisplayName("stats count every status")
        void statsCountEveryStatus() throws Exception {
            var manager = manager(echo());
            String a = manager.spawn("one", null).getId();
            String b = manager.spawn("two", null).getId();
            manager.awaitTerminal(a, WAIT);
            manager.awaitTerminal(b, WAIT);

            AgentStats stats = manager.stats();
            assertEquals(2, stats.completed());
            assertEquals(0, stats.active());
            assertEquals(2, stats.total());
            assertEquals(2, manager.countByStatus(AgentStatus.COMPLETED));
        }
    }

    @Nested
    @DisplayName("kill")
    class KillTests {

        @Test
        @DisplayName("kills a running agent without waiting for the executor")
        void killsRunningAgent() throws Exception {
            var manager = manager(blocking());
            String id = manager.spawn("long task", null).getId();
            awaitStarted();

            AgentSnapshot killed = manager.kill(id);
            assertEquals(AgentStatus.KILLED, killed.status());
            assertEquals(AgentManager.REASON_CANCELLED, killed.failureReason());
            assertNotNull(killed.finishedAt());
            assertEquals("started\n", killed.output());
            assertTrue(cancelCallbacksRun.contains(id));
        }

        @Test
        @DisplayName("a late executor outcome is discarded")
        void lateOutcomeDiscarded() throws Exception {
            var reportedLate = new AtomicBoolean();
            var manager = manager(stubborn(reportedLate));
            String id = manager.spawn("task", null).getId();
            awaitStarted();

            manager.kill(id);
            long until = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!reportedLate.get() && System.nanoTime() < until) {
                Thread.sleep(10);
            }

            assertTrue(reportedLate.get(), "complete after kill must be a no-op");
            AgentSnapshot snap = manager.get(id).snapshot();
            assertEquals(AgentStatus.KILLED, snap.status());
            assertEquals("", snap.output());
        }

        @Test
        @DisplayName("killing a finished agent succeeds without changing it")
        void killFinishedIsNoOp() throws Exception {
            var manager = manager(echo());
            String id = manager.spawn("task", null).getId();
            AgentSnapshot done = manager.awaitTerminal(id, WAIT);

            AgentSnapshot afterKill = manager.kill(id);
            assertEquals(done, afterKill);
            assertEquals(AgentStatus.COMPLETED, afterKill.status());
        }

        @Test
        @DisplayName("killing twice is idempotent")
        void killTwice() throws Exception {
            var manager = manager(blocking());
            String id = manager.spawn("task", null).getId();
            awaitStarted();

            AgentSnapshot first = manager.kill(id);
            AgentSnapshot second = manager.kill(id);
            assertEquals(first, second);
        }

        @Test
        @DisplayName("kill of an unknown id throws")
        void killUnknownThrows() {
            var manager = manager(echo());
            assertThrows(AgentNotFoundException.class, () -> manager.kill("missing"));
        }
    }

    @Nested
    @DisplayName("timeout")
    class TimeoutTests {

        @Test
        @DisplayName("deadline expiry kills the agent with reason timeout")
        void deadlineKillsAgent() throws Exception {
            var manager = manager(blocking());
            String id = manager.spawn("slow", new SpawnOptions(null, null, 1)).getId();

            AgentSnapshot done = manager.awaitTerminal(id, WAIT);
            assertEquals(AgentStatus.KILLED, done.status());
            assertEquals(AgentManager.REASON_TIMEOUT, done.failureReason());
            eventually(() -> cancelCallbacksRun.contains(id));
        }

        @Test
        @DisplayName("default timeout applies when none is given")
        void defaultTimeoutApplies() throws Exception {
            properties.setDefaultTimeoutSeconds(1);
            var manager = manager(blocking());
            String id = manager.spawn("slow", null).getId();

            assertEquals(AgentManager.REASON_TIMEOUT, manager.awaitTerminal(id, WAIT).failureReason());
        }

        @Test
        @DisplayName("agents finishing before the deadline are unaffected")
        void finishedBeforeDeadline() throws Exception {
            var manager = manager(echo());
            String id = manager.spawn("fast", new SpawnOptions(null, null, 1)).getId();
            manager.awaitTerminal(id, WAIT);
            Thread.sleep(1500);
            assertEquals(AgentStatus.COMPLETED, manager.get(id).getStatus());
        }
    }

    @Nested
    @DisplayName("capacity")
    class CapacityTests {

        @Test
        @DisplayName("rejects spawns beyond the concurrency cap")
        void rejectsBeyondCap() throws Exception {
            properties.setMaxConcurrentAgents(2);
            var manager = manager(blocking());
            String first = manager.spawn("one", null).getId();
            manager.spawn("two", null);

            var ex = assertThrows(AgentValidationException.class, () -> manager.spawn("three", null));
            assertTrue(ex.getMessage().contains("max concurrent agents (2)"));
            assertEquals(2, manager.count());
            assertEquals(1.0, registry.find("outrider.agents.rejected").counter().count());

            manager.kill(first);
            assertNotNull(manager.spawn("three", null));
        }

        @Test
        @DisplayName("concurrent spawns never exceed the cap")
        void concurrentSpawnsRespectCap() throws Exception {
            properties.setMaxConcurrentAgents(5);
            var manager = manager(blocking());
            int threads = 20;
            var barrier = new CyclicBarrier(threads);
            var accepted = new AtomicInteger();
            var rejected = new AtomicInteger();
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    barrier.await();
                    try {
                        manager.spawn("task", null);
                        accepted.incrementAndGet();
                    } catch (AgentValidationException e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
            pool.shutdown();

            assertEquals(5, accepted.get());
            assertEquals(15, rejected.get());
        }

        @Test
        @DisplayName("zero means unlimited")
        void zeroMeansUnlimited() {
            properties.setMaxConcurrentAgents(0);
            var manager = manager(blocking());
            for (int i = 0; i < 30; i++) {
                manager.spawn("task " + i, null);
            }
            assertEquals(30, manager.count());
        }
    }

    @Nested
    @DisplayName("shutdown")
    class ShutdownTests {

        @Test
        @DisplayName("kills active agents and keeps them registered")
        void killsActiveAgents() throws Exception {
            var manager = manager(blocking());
            String id = manager.spawn("task", null).getId();
            awaitStarted();

            manager.shutdown();

            AgentSnapshot snap = manager.get(id).snapshot();
            assertEquals(AgentStatus.KILLED, snap.status());
            assertEquals(AgentManager.REASON_SHUTDOWN, snap.failureReason());
            assertEquals(1, manager.count());
            assertTrue(manager.isShutdown());
        }

        @Test
        @DisplayName("rejects spawns afterwards")
        void rejectsSpawnsAfterShutdown() {
            var manager = manager(echo());
            manager.shutdown();
            assertThrows(IllegalStateException.class, () -> manager.spawn("task", null));
        }
    }

    @Nested
    @DisplayName("events and metrics")
    class ObservabilityTests {

        @Test
        @DisplayName("publishes lifecycle events in order")
        void publishesLifecycleEvents() throws Exception {
            List<AgentEvent> events = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(events::add);
            var manager = manager(echo());

            String id = manager.spawn("task", null).getId();
            manager.awaitTerminal(id, WAIT);
            eventually(() -> events.size() == 3);

            assertEquals(List.of(AgentEvent.SPAWNED, AgentEvent.STARTED, AgentEvent.COMPLETED),
                    events.stream().map(AgentEvent::eventType).toList());
            assertTrue(events.stream().allMatch(e -> id.equals(e.agentId())));
        }

        @Test
        @DisplayName("killed event carries the reason")
        void killedEventCarriesReason() throws Exception {
            List<AgentEvent> events = new CopyOnWriteArrayList<>();
            var manager = manager(blocking());
            String id = manager.spawn("task", null).getId();
            eventBus.subscribe(id, events::add);
            awaitStarted();

            manager.kill(id);

            AgentEvent last = events.get(events.size() - 1);
            assertEquals(AgentEvent.KILLED, last.eventType());
            assertEquals("cancelled", last.payload().get("reason"));
        }

        @Test
        @DisplayName("records spawn and finish counters")
        void recordsMetrics() throws Exception {
            var manager = manager(echo());
            String id = manager.spawn("task", null).getId();
            manager.awaitTerminal(id, WAIT);
            eventually(() -> registry.find("outrider.agents.finished").counter() != null);

            assertEquals(1.0, registry.find("outrider.agents.spawned").counter().count());
            assertEquals(1.0, registry.find("outrider.agents.finished")
                    .tag("status", "completed").counter().count());
        }
    }
}
