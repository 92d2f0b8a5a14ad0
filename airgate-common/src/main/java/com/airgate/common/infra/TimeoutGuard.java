package com.airgate.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs collaborator calls on a separate pool with a hard deadline.
 * Timeouts and failures come back as {@link Optional#empty()} after being
 * logged, so callers always reach their "no action" branch instead of hanging.
 */
@Slf4j
public class TimeoutGuard implements AutoCloseable {

    private final ExecutorService executor;

    public TimeoutGuard(String name) {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Call with a deadline.
     *
     * @param label   short description for log lines
     * @param call    the collaborator call
     * @param timeout maximum wait
     * @return the result, or empty on timeout, failure or a null result
     */
    public <T> Optional<T> call(String label, Callable<T> call, Duration timeout) {
        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (Exception e) {
            log.warn("{} could not be scheduled: {}", label, e.getMessage());
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} timed out after {}ms", label, timeout.toMillis());
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("{} failed: {}", label, cause.getMessage(), cause);
            return Optional.empty();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("{} interrupted", label);
            return Optional.empty();
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
