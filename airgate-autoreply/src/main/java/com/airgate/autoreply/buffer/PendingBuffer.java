package com.airgate.autoreply.buffer;

import com.airgate.common.config.AirGateConfig.BufferConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns seen since the last successful commit, per session.
 * <p>
 * Insertion-ordered, bounded by TTL and by count (oldest dropped first).
 * Only user turns count towards the size cap and only they are trimmed; a
 * reply kept after a failed commit stays until it expires or is committed.
 * Entries only leave through expiry, trimming or an explicit clear after a
 * verified commit.
 */
@Slf4j
public class PendingBuffer {

    private final BufferConfig config;
    private final Clock clock;
    private final Map<String, Deque<BufferedTurn>> buffers = new HashMap<>();

    public PendingBuffer(BufferConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public synchronized void append(String session, BufferedTurn turn) {
        Deque<BufferedTurn> buffer = buffers.computeIfAbsent(session, k -> new ArrayDeque<>());
        purgeExpired(buffer);
        buffer.addLast(turn);
        int max = Math.max(1, config.getMaxSize());
        int excess = (int) buffer.stream().filter(BufferedTurn::isUser).count() - max;
        int dropped = 0;
        Iterator<BufferedTurn> it = buffer.iterator();
        while (excess > 0 && it.hasNext()) {
            if (it.next().isUser()) {
                it.remove();
                excess--;
                dropped++;
            }
        }
        if (dropped > 0) {
            log.debug("Pending buffer for {} trimmed {} oldest turn(s)", session, dropped);
        }
    }

    /**
     * Place {@code turn} right behind {@code anchor}, or at the end when the
     * anchor is gone. Used for replies, so no trimming happens.
     */
    public synchronized void insertAfter(String session, BufferedTurn anchor, BufferedTurn turn) {
        Deque<BufferedTurn> buffer = buffers.computeIfAbsent(session, k -> new ArrayDeque<>());
        purgeExpired(buffer);
        List<BufferedTurn> turns = new ArrayList<>(buffer);
        int at = turns.indexOf(anchor);
        turns.add(at < 0 ? turns.size() : at + 1, turn);
        buffer.clear();
        buffer.addAll(turns);
    }

    /** Live turns, oldest first. Expired entries are purged first. */
    public synchronized List<BufferedTurn> snapshot(String session) {
        Deque<BufferedTurn> buffer = buffers.get(session);
        if (buffer == null) {
            return List.of();
        }
        purgeExpired(buffer);
        return List.copyOf(buffer);
    }

    public synchronized int size(String session) {
        Deque<BufferedTurn> buffer = buffers.get(session);
        if (buffer == null) {
            return 0;
        }
        purgeExpired(buffer);
        return buffer.size();
    }

    public synchronized void clear(String session) {
        buffers.remove(session);
    }

    /**
     * Remove exactly the given turns, keeping anything appended while a
     * commit was in flight.
     */
    public synchronized void removeAll(String session, List<BufferedTurn> committed) {
        Deque<BufferedTurn> buffer = buffers.get(session);
        if (buffer == null || committed.isEmpty()) {
            return;
        }
        List<BufferedTurn> remaining = new ArrayList<>(committed);
        Iterator<BufferedTurn> it = buffer.iterator();
        while (it.hasNext() && !remaining.isEmpty()) {
            if (remaining.remove(it.next())) {
                it.remove();
            }
        }
        if (buffer.isEmpty()) {
            buffers.remove(session);
        }
    }

    public synchronized Set<String> sessions() {
        return new TreeSet<>(buffers.keySet());
    }

    private void purgeExpired(Deque<BufferedTurn> buffer) {
        long cutoff = clock.millis() - config.getTtlSeconds() * 1000L;
        while (!buffer.isEmpty() && buffer.peekFirst().timestamp() < cutoff) {
            buffer.removeFirst();
        }
    }
}
