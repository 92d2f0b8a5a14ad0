package com.airgate.autoreply.frequency;

import java.util.Locale;
import java.util.Optional;

/**
 * Verdict on how often the responder has been speaking.
 */
public enum FrequencyJudgment {
    NORMAL, TOO_FREQUENT, TOO_QUIET;

    /** Longer free-text answers without a known keyword are treated as unusable. */
    static final int MAX_FREE_TEXT = 20;

    /**
     * Map a judge's free-text answer to a verdict.
     * Exact labels win; otherwise short answers are scanned for keywords.
     */
    public static Optional<FrequencyJudgment> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String value = text.trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        switch (value) {
            case "normal", "正常":
                return Optional.of(NORMAL);
            case "too frequent", "too_frequent", "过于频繁":
                return Optional.of(TOO_FREQUENT);
            case "too quiet", "too_quiet", "过少":
                return Optional.of(TOO_QUIET);
            default:
                break;
        }
        if (value.length() > MAX_FREE_TEXT) {
            return Optional.empty();
        }
        if (value.contains("frequent") || value.contains("频繁")) {
            return Optional.of(TOO_FREQUENT);
        }
        if (value.contains("quiet") || value.contains("过少") || value.contains("太少")) {
            return Optional.of(TOO_QUIET);
        }
        if (value.contains("normal") || value.contains("正常")) {
            return Optional.of(NORMAL);
        }
        return Optional.empty();
    }
}
