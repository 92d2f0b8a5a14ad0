package com.airgate.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs an action on a fixed delay from a single daemon thread.
 * A failing action is logged and never stops the loop; stopping cancels the
 * pending tick cooperatively.
 */
@Slf4j
public class IntervalRunner implements AutoCloseable {

    private final String name;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final long intervalMs;
    private final Consumer<String> action;
    private ScheduledFuture<?> scheduledTask;

    /**
     * @param name       thread name, also used in log lines
     * @param intervalMs delay between runs in milliseconds (minimum 1 second)
     * @param action     action to invoke on each run (receives the reason)
     */
    public IntervalRunner(String name, long intervalMs, Consumer<String> action) {
        this.name = name;
        this.intervalMs = Math.max(1000, intervalMs);
        this.action = action;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("{} already running", name);
            return;
        }
        scheduleNext();
        log.info("{} started (interval: {}ms)", name, intervalMs);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        synchronized (this) {
            if (scheduledTask != null) {
                scheduledTask.cancel(true);
            }
        }
        log.info("{} stopped", name);
    }

    public boolean isRunning() {
        return running.get();
    }

    private synchronized void scheduleNext() {
        scheduledTask = scheduler.schedule(this::tick, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void tick() {
        if (!running.get())
            return;
        try {
            action.accept("scheduled");
        } catch (Exception e) {
            log.error("{} action failed: {}", name, e.getMessage(), e);
        }
        if (running.get()) {
            scheduleNext();
        }
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }
}
