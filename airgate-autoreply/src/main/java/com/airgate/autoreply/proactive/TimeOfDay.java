package com.airgate.autoreply.proactive;

import lombok.extern.slf4j.Slf4j;

/**
 * Minute-of-day helpers for {@code HH:mm} windows.
 */
@Slf4j
final class TimeOfDay {

    private TimeOfDay() {
    }

    /** Minutes since midnight of {@code HH:mm}; unparseable input is 0. */
    static double parseMinutes(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            String[] parts = value.trim().split(":");
            int hour = Integer.parseInt(parts[0].trim());
            int minute = parts.length > 1 ? Integer.parseInt(parts[1].trim()) : 0;
            return Math.floorMod(hour * 60 + minute, (int) QuietHours.DAY_MINUTES);
        } catch (NumberFormatException e) {
            log.warn("Cannot parse time '{}', using 00:00", value);
            return 0;
        }
    }

    /** Minutes going forward from {@code from} to {@code to}, in [0, 1440). */
    static double forward(double from, double to) {
        double d = (to - from) % QuietHours.DAY_MINUTES;
        return d < 0 ? d + QuietHours.DAY_MINUTES : d;
    }
}
