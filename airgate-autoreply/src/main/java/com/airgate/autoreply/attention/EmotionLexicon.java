package com.airgate.autoreply.attention;

import java.util.List;
import java.util.Locale;

/**
 * Keyword tone of a message: +1 when positive keywords outnumber negative
 * ones, -1 for the reverse, 0 otherwise.
 */
final class EmotionLexicon {

    private EmotionLexicon() {
    }

    static int tone(String text, List<String> positive, List<String> negative) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return Integer.signum(hits(lower, positive) - hits(lower, negative));
    }

    private static int hits(String lower, List<String> keywords) {
        if (keywords == null) {
            return 0;
        }
        int n = 0;
        for (String k : keywords) {
            if (k != null && !k.isBlank() && lower.contains(k.toLowerCase(Locale.ROOT))) {
                n++;
            }
        }
        return n;
    }
}
