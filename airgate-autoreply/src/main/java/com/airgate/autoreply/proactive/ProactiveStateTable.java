package com.airgate.autoreply.proactive;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Proactive state for every known session, guarded by one lock.
 */
@Slf4j
public class ProactiveStateTable {

    static final long RETENTION_MS = 7L * 24 * 3600 * 1000;

    private final Map<String, ProactiveSessionState> states = new LinkedHashMap<>();

    /** Run {@code action} on the session's state under the table lock, creating it if needed. */
    public synchronized <T> T withState(String session, Function<ProactiveSessionState, T> action) {
        return action.apply(states.computeIfAbsent(session, k -> new ProactiveSessionState()));
    }

    public synchronized List<String> sessions() {
        return List.copyOf(states.keySet());
    }

    public synchronized boolean contains(String session) {
        return states.containsKey(session);
    }

    /** Copies of all states, dropping any idle longer than seven days. */
    public synchronized Map<String, ProactiveSessionState> snapshot(long nowMs) {
        states.values().removeIf(s -> nowMs - s.lastActivity() > RETENTION_MS);
        Map<String, ProactiveSessionState> out = new LinkedHashMap<>();
        states.forEach((k, v) -> out.put(k, v.copy()));
        return out;
    }

    public synchronized void restore(Map<String, ProactiveSessionState> persisted) {
        states.clear();
        if (persisted == null) {
            return;
        }
        persisted.forEach((session, state) -> {
            if (session != null && state != null) {
                ProactiveSessionState c = state.copy();
                c.setConsecutiveFailures(Math.max(0, c.getConsecutiveFailures()));
                c.setUserMessageCount(Math.max(0, c.getUserMessageCount()));
                states.put(session, c);
            }
        });
        log.info("Restored proactive state for {} session(s)", states.size());
    }
}
