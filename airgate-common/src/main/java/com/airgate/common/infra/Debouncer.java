package com.airgate.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Coalesces bursts of requests into one run of an action after a quiet delay.
 * {@link #flush()} runs the action synchronously and drops any pending run.
 */
@Slf4j
public class Debouncer implements AutoCloseable {

    private final String name;
    private final long delayMs;
    private final Runnable action;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pending;

    public Debouncer(String name, long delayMs, Runnable action) {
        this.name = name;
        this.delayMs = Math.max(0, delayMs);
        this.action = action;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Request a run. Does nothing if a run is already pending.
     */
    public synchronized void request() {
        if (pending != null && !pending.isDone()) {
            return;
        }
        pending = scheduler.schedule(this::runSafely, delayMs, TimeUnit.MILLISECONDS);
    }

    public synchronized boolean isPending() {
        return pending != null && !pending.isDone();
    }

    /**
     * Cancel any pending run and run the action now on the calling thread.
     */
    public void flush() {
        synchronized (this) {
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
        runSafely();
    }

    private void runSafely() {
        try {
            action.run();
        } catch (Exception e) {
            log.error("{} failed: {}", name, e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
