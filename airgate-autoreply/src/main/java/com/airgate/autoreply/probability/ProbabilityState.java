package com.airgate.autoreply.probability;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Temporary per-session overrides of the base reply probability.
 * An entry lives until {@code boostedUntil} and is dropped on the first read
 * after that.
 */
@Slf4j
public class ProbabilityState {

    private record Entry(double probability, long boostedUntil) {
    }

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Entry> entries = new HashMap<>();

    public ProbabilityState(Clock clock) {
        this.clock = clock;
    }

    /** The boosted value while the boost is live, else {@code initial}. */
    public double getCurrent(String session, double initial) {
        lock.lock();
        try {
            Entry entry = entries.get(session);
            if (entry == null) {
                return initial;
            }
            if (clock.millis() < entry.boostedUntil()) {
                return entry.probability();
            }
            entries.remove(session);
            log.debug("Probability boost expired for {}", session);
            return initial;
        } finally {
            lock.unlock();
        }
    }

    /** Overwrite the session's entry. */
    public void boost(String session, double value, int durationSeconds) {
        lock.lock();
        try {
            entries.put(session, new Entry(value, clock.millis() + durationSeconds * 1000L));
        } finally {
            lock.unlock();
        }
        log.info("Probability for {} boosted to {} for {}s", session, value, durationSeconds);
    }

    public void reset(String session) {
        lock.lock();
        try {
            entries.remove(session);
        } finally {
            lock.unlock();
        }
    }

    /** Whether a live or stale entry is stored; stale entries go on the next read. */
    public boolean hasEntry(String session) {
        lock.lock();
        try {
            return entries.containsKey(session);
        } finally {
            lock.unlock();
        }
    }
}
