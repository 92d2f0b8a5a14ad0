package com.airgate.autoreply.admission;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Case-insensitive substring match against configured trigger phrases.
 */
public final class TriggerMatcher {

    private final List<String> phrases;

    public TriggerMatcher(List<String> phrases) {
        this.phrases = phrases == null ? List.of()
                : phrases.stream()
                        .filter(p -> p != null && !p.isBlank())
                        .map(p -> p.trim().toLowerCase(Locale.ROOT))
                        .toList();
    }

    /** The first phrase found in {@code text}. */
    public Optional<String> match(String text) {
        if (text == null || text.isEmpty() || phrases.isEmpty()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String phrase : phrases) {
            if (lower.contains(phrase)) {
                return Optional.of(phrase);
            }
        }
        return Optional.empty();
    }
}
