package com.outrider.core.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;

/**
 * Cancellation scope of one agent's execution unit: a deadline, a cancelled flag with its
 * reason, and the handles to interrupt when it fires.
 *
 * <p>Cancellation happens at most once. Callbacks registered after cancellation run
 * immediately on the registering thread.
 */
final class AgentExecutionContext {

    private static final Logger log = LoggerFactory.getLogger(AgentExecutionContext.class);

    private final String agentId;
    private final Instant deadline;

    private final List<Runnable> callbacks = new ArrayList<>();
    private String cancelReason;
    private Future<?> worker;
    private Future<?> timer;
    private boolean released;

    AgentExecutionContext(String agentId, Instant deadline) {
        this.agentId = agentId;
        this.deadline = deadline;
    }

    Instant deadline() {
        return deadline;
    }

    synchronized boolean isCancelled() {
        return cancelReason != null;
    }

    synchronized String cancelReason() {
        return cancelReason;
    }

    void bindWorker(Future<?> future) {
        boolean cancelled;
        synchronized (this) {
            worker = future;
            cancelled = cancelReason != null;
        }
        if (cancelled) {
            future.cancel(true);
        }
    }

    void bindTimer(Future<?> future) {
        boolean done;
        synchronized (this) {
            timer = future;
            done = cancelReason != null || released;
        }
        if (done) {
            future.cancel(false);
        }
    }

    void onCancel(Runnable callback) {
        synchronized (this) {
            if (cancelReason == null) {
                callbacks.add(callback);
                return;
            }
        }
        runSafely(callback);
    }

    /**
     * Cancels the scope: runs cancel callbacks, interrupts the worker and drops the timer.
     *
     * @return false if it was already cancelled
     */
    boolean cancel(String reason) {
        List<Runnable> toRun;
        Future<?> workerToInterrupt;
        Future<?> timerToDrop;
        synchronized (this) {
            if (cancelReason != null) {
                return false;
            }
            cancelReason = reason;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
            workerToInterrupt = worker;
            timerToDrop = timer;
        }
        log.debug("Cancelling execution of agent {} ({})", agentId, reason);
        toRun.forEach(this::runSafely);
        if (workerToInterrupt != null) {
            workerToInterrupt.cancel(true);
        }
        if (timerToDrop != null) {
            timerToDrop.cancel(false);
        }
        return true;
    }

    /**
     * Releases the deadline timer once the execution unit has finished on its own.
     * A timer bound afterwards is dropped on binding.
     */
    void release() {
        Future<?> timerToDrop;
        synchronized (this) {
            released = true;
            timerToDrop = timer;
            callbacks.clear();
        }
        if (timerToDrop != null) {
            timerToDrop.cancel(false);
        }
    }

    private void runSafely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancel callback for agent {} threw: {}", agentId, e.getMessage(), e);
        }
    }
}
