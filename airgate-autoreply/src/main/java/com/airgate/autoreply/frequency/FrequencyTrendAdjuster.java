package com.airgate.autoreply.frequency;

import com.airgate.common.config.AirGateConfig.FrequencyConfig;
import com.airgate.common.infra.Decay;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Periodically nudges a session's base probability up or down depending on
 * whether the responder has been too chatty or too quiet.
 * <p>
 * A sample is due once both the check interval has passed and enough
 * messages have arrived since the last one. The adjusted base is remembered
 * per session and used in place of the configured initial probability.
 */
@Slf4j
public class FrequencyTrendAdjuster {

    private static final class CheckState {
        long lastCheckTime;
        int messageCount;

        CheckState(long now) {
            this.lastCheckTime = now;
        }
    }

    private final FrequencyConfig config;
    private final Clock clock;
    private final Map<String, CheckState> checks = new HashMap<>();
    private final Map<String, Double> adjustedBase = new HashMap<>();

    public FrequencyTrendAdjuster(FrequencyConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    public synchronized void recordMessage(String session) {
        checks.computeIfAbsent(session, k -> new CheckState(clock.millis())).messageCount++;
    }

    public synchronized int messageCount(String session) {
        CheckState state = checks.get(session);
        return state == null ? 0 : state.messageCount;
    }

    /** Sample decision using the internally counted messages. */
    public synchronized boolean shouldSample(String session) {
        CheckState state = checks.get(session);
        return shouldSample(session, state == null ? 0 : state.messageCount);
    }

    /**
     * True iff more than {@code checkIntervalSeconds} have passed since the
     * last sample and at least {@code minMessageCount} messages arrived.
     * First sight of a session starts its clock and returns false.
     */
    public synchronized boolean shouldSample(String session, int messagesSinceLastCheck) {
        long now = clock.millis();
        CheckState state = checks.get(session);
        if (state == null) {
            checks.put(session, new CheckState(now));
            return false;
        }
        return now - state.lastCheckTime > config.getCheckIntervalSeconds() * 1000L
                && messagesSinceLastCheck >= config.getMinMessageCount();
    }

    /** Scale by the judgment's factor and clamp to the configured band. */
    public double adjust(double current, FrequencyJudgment judgment) {
        double next = switch (judgment) {
            case TOO_FREQUENT -> current * config.getDecreaseFactor();
            case TOO_QUIET -> current * config.getIncreaseFactor();
            case NORMAL -> current;
        };
        return Decay.clamp(next, config.getMinProbability(), config.getMaxProbability());
    }

    /**
     * Adjust the session's current base and remember it.
     *
     * @return the new base
     */
    public synchronized double applyJudgment(String session, double initial, FrequencyJudgment judgment) {
        double current = adjustedBase.getOrDefault(session, initial);
        double next = adjust(current, judgment);
        adjustedBase.put(session, next);
        if (next != current) {
            log.info("Frequency {} for {}: base {} -> {}", judgment, session,
                    String.format("%.3f", current), String.format("%.3f", next));
        }
        return next;
    }

    /** The remembered base, or {@code initial} when none was set or the loop is disabled. */
    public synchronized double effectiveBase(String session, double initial) {
        if (!config.isEnabled()) {
            return initial;
        }
        return adjustedBase.getOrDefault(session, initial);
    }

    /** Restart the interval and message count; called after every sample. */
    public synchronized void completeSample(String session) {
        CheckState state = checks.computeIfAbsent(session, k -> new CheckState(clock.millis()));
        state.lastCheckTime = clock.millis();
        state.messageCount = 0;
    }
}
