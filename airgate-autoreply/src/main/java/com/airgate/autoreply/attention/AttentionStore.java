package com.airgate.autoreply.attention;

import com.airgate.common.config.AirGateConfig.AttentionConfig;
import com.airgate.common.infra.Decay;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-session, per-user attention and emotion profiles.
 * <p>
 * Replying to a user raises their attention and slightly lowers everyone
 * else's in the same session, so the responder keeps following the person it
 * is talking to. Scores decay lazily with independent half-lives for
 * attention and emotion. All access is serialized on the store.
 */
@Slf4j
public class AttentionStore {

    /** Attention at or below this counts as "not focused". */
    static final double FOCUS_THRESHOLD = 0.1;
    static final double EMOTION_WEIGHT = 0.3;
    static final double CEILING = 0.98;
    static final double LOW_ATTENTION_FACTOR = 0.8;
    static final double EVICT_ATTENTION_BELOW = 0.01;

    private final AttentionConfig config;
    private final Clock clock;
    private final Map<String, Map<String, AttentionProfile>> sessions = new HashMap<>();

    public AttentionStore(AttentionConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    // =========================================================================
    // Mutation
    // =========================================================================

    /** Record that the responder engaged {@code userId}, using the configured steps. */
    public void recordInteraction(String session, String userId, String userName, String messagePreview) {
        recordInteraction(session, userId, userName, messagePreview,
                config.getBoostStep(), config.getDecayStepForOthers(), config.getEmotionStep());
    }

    /**
     * Record a reply to {@code userId}. The emotion step is signed by the
     * keyword tone of the message that was answered; neutral text leaves
     * emotion where decay puts it.
     */
    public void recordReply(String session, String userId, String userName, String message) {
        int tone = EmotionLexicon.tone(message, config.getPositiveKeywords(), config.getNegativeKeywords());
        recordInteraction(session, userId, userName, message,
                config.getBoostStep(), config.getDecayStepForOthers(), tone * config.getEmotionStep());
    }

    public synchronized void recordInteraction(String session, String userId, String userName,
            String messagePreview, double boostStep, double decayStepForOthers, double emotionStep) {
        if (session == null || userId == null) {
            return;
        }
        long now = clock.millis();
        Map<String, AttentionProfile> profiles = sessions.computeIfAbsent(session, k -> new LinkedHashMap<>());

        AttentionProfile target = profiles.computeIfAbsent(userId, id -> new AttentionProfile(id, userName, now));
        decay(target, now);
        target.setAttentionScore(Decay.clamp(target.getAttentionScore() + boostStep, 0.0, 1.0));
        target.setEmotion(Decay.clamp(target.getEmotion() + emotionStep, -1.0, 1.0));
        target.setInteractionCount(target.getInteractionCount() + 1);
        target.setLastInteraction(now);
        if (userName != null && !userName.isBlank()) {
            target.setUserName(userName);
        }
        target.setLastMessagePreview(preview(messagePreview));

        for (AttentionProfile other : profiles.values()) {
            if (other == target) {
                continue;
            }
            decay(other, now);
            other.setAttentionScore(Decay.clamp(other.getAttentionScore() - decayStepForOthers, 0.0, 1.0));
        }

        evict(session, profiles, now);
        log.debug("Attention {} / {} -> {} (emotion {})", session, userId,
                String.format("%.3f", target.getAttentionScore()), String.format("%.3f", target.getEmotion()));
    }

    /** Drop all profiles of a session. */
    public synchronized void clearSession(String session) {
        if (sessions.remove(session) != null) {
            log.debug("Attention cleared for {}", session);
        }
    }

    // =========================================================================
    // Queries
    // =========================================================================

    /** Adjust with the configured max boost and floor. */
    public double computeAdjustedProbability(String session, String userId, double baseProbability) {
        return computeAdjustedProbability(session, userId, baseProbability, config.getMaxBoost(), config.getMinFloor());
    }

    /**
     * Bias the base probability by the user's attention and emotion.
     * <ul>
     * <li>disabled or unknown user: {@code base} unchanged</li>
     * <li>attention above 0.1: interpolate toward {@code maxBoost}, scale by
     * {@code 1 + 0.3 * emotion}, cap at 0.98, floor at {@code minFloor}</li>
     * <li>otherwise: {@code max(base * 0.8, minFloor)}</li>
     * </ul>
     * The result is always in [0,1]. Decay is applied to the stored profile.
     */
    public synchronized double computeAdjustedProbability(String session, String userId, double baseProbability,
            double maxBoost, double minFloor) {
        if (!config.isEnabled()) {
            return baseProbability;
        }
        Map<String, AttentionProfile> profiles = sessions.get(session);
        AttentionProfile profile = profiles != null ? profiles.get(userId) : null;
        if (profile == null) {
            return baseProbability;
        }
        decay(profile, clock.millis());
        return adjust(profile.getAttentionScore(), profile.getEmotion(), baseProbability, maxBoost, minFloor);
    }

    /** The pure adjustment formula. */
    public static double adjust(double attention, double emotion, double base, double maxBoost, double minFloor) {
        double p;
        if (attention > FOCUS_THRESHOLD) {
            p = base + (maxBoost - base) * attention;
            p *= 1.0 + EMOTION_WEIGHT * emotion;
            p = Math.min(CEILING, p);
            p = Math.max(minFloor, p);
        } else {
            p = Math.max(base * LOW_ATTENTION_FACTOR, minFloor);
        }
        return Decay.clamp(p, 0.0, 1.0);
    }

    /** Copy of a profile, for diagnostics. */
    public synchronized Optional<AttentionProfile> profile(String session, String userId) {
        Map<String, AttentionProfile> profiles = sessions.get(session);
        if (profiles == null || !profiles.containsKey(userId)) {
            return Optional.empty();
        }
        return Optional.of(profiles.get(userId).copy());
    }

    public synchronized int profileCount(String session) {
        Map<String, AttentionProfile> profiles = sessions.get(session);
        return profiles == null ? 0 : profiles.size();
    }

    // =========================================================================
    // Persistence
    // =========================================================================

    /** Deep copy of every session's profiles. */
    public synchronized Map<String, List<AttentionProfile>> snapshot() {
        Map<String, List<AttentionProfile>> out = new LinkedHashMap<>();
        sessions.forEach((session, profiles) -> {
            List<AttentionProfile> copies = new ArrayList<>(profiles.size());
            profiles.values().forEach(p -> copies.add(p.copy()));
            out.put(session, copies);
        });
        return out;
    }

    /**
     * Replace all state with persisted profiles. Out-of-range values are
     * clamped and the population cap is applied.
     */
    public synchronized void restore(Map<String, List<AttentionProfile>> persisted) {
        sessions.clear();
        if (persisted == null) {
            return;
        }
        long now = clock.millis();
        persisted.forEach((session, list) -> {
            if (session == null || list == null) {
                return;
            }
            Map<String, AttentionProfile> profiles = new LinkedHashMap<>();
            for (AttentionProfile p : list) {
                if (p == null || p.getUserId() == null) {
                    continue;
                }
                AttentionProfile c = p.copy();
                c.setAttentionScore(Decay.clamp(c.getAttentionScore(), 0.0, 1.0));
                c.setEmotion(Decay.clamp(c.getEmotion(), -1.0, 1.0));
                c.setInteractionCount(Math.max(0, c.getInteractionCount()));
                if (c.getLastDecayAt() <= 0) {
                    c.setLastDecayAt(c.getLastInteraction());
                }
                profiles.put(c.getUserId(), c);
            }
            evict(session, profiles, now);
            if (!profiles.isEmpty()) {
                sessions.put(session, profiles);
            }
        });
        log.info("Restored attention for {} session(s)", sessions.size());
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private void decay(AttentionProfile p, long now) {
        long elapsed = now - p.getLastDecayAt();
        if (elapsed <= 0) {
            return;
        }
        p.setAttentionScore(Decay.apply(p.getAttentionScore(), elapsed, config.getAttentionHalfLifeSeconds() * 1000L));
        p.setEmotion(Decay.apply(p.getEmotion(), elapsed, config.getEmotionHalfLifeSeconds() * 1000L));
        p.setLastDecayAt(now);
    }

    private void evict(String session, Map<String, AttentionProfile> profiles, long now) {
        long idleMs = config.getIdleEvictSeconds() * 1000L;
        profiles.values().removeIf(p -> now - p.getLastInteraction() > idleMs
                && p.getAttentionScore() < EVICT_ATTENTION_BELOW);

        int cap = Math.max(1, config.getMaxProfilesPerSession());
        if (profiles.size() <= cap) {
            return;
        }
        List<AttentionProfile> ranked = new ArrayList<>(profiles.values());
        ranked.sort(Comparator.comparingDouble(AttentionProfile::getAttentionScore)
                .thenComparingLong(AttentionProfile::getLastInteraction));
        int excess = profiles.size() - cap;
        for (int i = 0; i < excess; i++) {
            profiles.remove(ranked.get(i).getUserId());
        }
        log.debug("Evicted {} attention profile(s) from {}", excess, session);
    }

    private String preview(String text) {
        if (text == null) {
            return "";
        }
        int max = Math.max(0, config.getPreviewMaxChars());
        return text.length() <= max ? text : text.substring(0, max);
    }
}
