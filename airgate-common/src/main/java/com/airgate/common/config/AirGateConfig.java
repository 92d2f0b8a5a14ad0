package com.airgate.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration type for AirGate.
 * Bound from {@code airgate.json} by {@link ConfigService}; every section has
 * working defaults so an empty file is a valid configuration.
 */
@Data
public class AirGateConfig {

    /** Sessions the responder listens to (conversation ids or full keys); empty = all. */
    private List<String> enabledSessions = new ArrayList<>();

    /** Read-the-room probability gate. */
    private ProbabilityConfig probability;

    /** Per-user attention and emotion bias. */
    private AttentionConfig attention;

    /** Frequency trend feedback loop. */
    private FrequencyConfig frequency;

    /** Pending (not yet committed) message buffer. */
    private BufferConfig buffer;

    /** Explicit triggers that bypass the probability gate. */
    private TriggerConfig triggers;

    /** Metadata prefix added to buffered user turns. */
    private MessageConfig message;

    /** Secondary engagement judge applied after a probabilistic accept. */
    private JudgeConfig judge;

    /** Timeouts for external collaborator calls. */
    private TimeoutConfig timeouts;

    /** Proactive origination during silence. */
    private ProactiveConfig proactive;

    /** Persisted engine state. */
    private StateConfig state;

    // --- Nested config types ---

    @Data
    public static class ProbabilityConfig {
        /** Base probability of engaging when nothing is boosted. */
        private double initial = 0.1;
        /** Probability used right after the responder replied. */
        private double afterReply = 0.8;
        /** How long the after-reply probability lasts. */
        private int boostDurationSeconds = 300;
    }

    @Data
    public static class AttentionConfig {
        private boolean enabled = true;
        private double maxBoost = 0.8;
        private double minFloor = 0.05;
        private double boostStep = 0.4;
        private double decayStepForOthers = 0.1;
        private double emotionStep = 0.1;
        private int attentionHalfLifeSeconds = 300;
        private int emotionHalfLifeSeconds = 3600;
        private int maxProfilesPerSession = 10;
        private int idleEvictSeconds = 1800;
        private int previewMaxChars = 50;
        /** Words that move a replied user's emotion up by {@code emotionStep}. */
        private List<String> positiveKeywords = new ArrayList<>(List.of(
                "haha", "lol", "thanks", "thank you", "great", "awesome", "nice", "love", "cool",
                "👍", "😄", "😂", "🎉", "哈哈", "棒", "赞", "厉害", "太好了"));
        /** Words that move it down by the same step. */
        private List<String> negativeKeywords = new ArrayList<>(List.of(
                "hate", "annoying", "shut up", "stupid", "angry", "sad", "ugh",
                "😡", "😠", "😢", "😭", "难过", "伤心", "生气", "烦", "讨厌", "无语"));
    }

    @Data
    public static class FrequencyConfig {
        private boolean enabled = false;
        private int checkIntervalSeconds = 180;
        private int minMessageCount = 8;
        private double decreaseFactor = 0.85;
        private double increaseFactor = 1.15;
        private double minProbability = 0.05;
        private double maxProbability = 0.95;
        /** Number of durable turns shown to the traffic judge. */
        private int transcriptTurns = 20;
    }

    @Data
    public static class BufferConfig {
        private int ttlSeconds = 1800;
        private int maxSize = 10;
        /** Lines kept per session in the local append-only history. */
        private int localHistoryMaxLines = 200;
    }

    @Data
    public static class TriggerConfig {
        /** Phrases that force a reply when present in the message text. */
        private List<String> keywords = new ArrayList<>();
    }

    @Data
    public static class MessageConfig {
        private boolean includeTimestamp = true;
        private boolean includeSenderInfo = true;
        /** Durable turns included in the generation context. */
        private int maxContextTurns = 20;
    }

    @Data
    public static class JudgeConfig {
        private boolean enabled = false;
    }

    @Data
    public static class TimeoutConfig {
        private int generationSeconds = 60;
        private int judgeSeconds = 20;
        private int deliverySeconds = 15;
        private int storeSeconds = 15;
    }

    @Data
    public static class ProactiveConfig {
        private boolean enabled = false;
        private int checkIntervalSeconds = 60;
        private int silenceThresholdSeconds = 600;
        private boolean requireUserActivity = true;
        private int minUserMessages = 3;
        private int userActivityWindowSeconds = 300;
        private double probability = 0.3;
        private int maxFailures = 3;
        private int cooldownSeconds = 1800;
        private double tempBoostProbability = 0.5;
        private int tempBoostDurationSeconds = 120;
        /** Conversation ids (or full keys) allowed to originate; empty = all. */
        private List<String> enabledSessions = new ArrayList<>();
        private String prompt = "You have been quiet for a while. Start a new topic naturally, "
                + "or follow up on something from the earlier conversation. "
                + "Keep your usual persona and tone, avoid low-effort openers, "
                + "and never mention that you were prompted to speak.";
        private QuietHoursConfig quietHours;
        private TimePeriodsConfig timePeriods;
    }

    @Data
    public static class QuietHoursConfig {
        private boolean enabled = false;
        /** Start of the quiet window, {@code HH:mm}. */
        private String start = "23:00";
        /** End of the quiet window, {@code HH:mm}. */
        private String end = "07:00";
        private int transitionMinutes = 30;
    }

    @Data
    public static class TimePeriodsConfig {
        private boolean enabled = false;
        private List<TimePeriod> periods = new ArrayList<>();
        private int transitionMinutes = 45;
        private double minFactor = 0.0;
        private double maxFactor = 2.0;
        private boolean useSmoothCurve = true;
    }

    @Data
    public static class TimePeriod {
        private String start;
        private String end;
        private double factor = 1.0;
    }

    @Data
    public static class StateConfig {
        /** State directory; blank resolves to {@code ~/.airgate}. */
        private String dir;
        private int saveDebounceSeconds = 30;
    }
}
