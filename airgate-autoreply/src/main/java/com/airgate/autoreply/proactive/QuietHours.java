package com.airgate.autoreply.proactive;

import com.airgate.common.config.AirGateConfig.QuietHoursConfig;

import java.time.LocalTime;

/**
 * Time-of-day multiplier that is 0 inside a quiet window and ramps linearly
 * to 1 across a transition band on each side. Windows may cross midnight.
 */
public final class QuietHours {

    static final double DAY_MINUTES = 24 * 60;

    private final boolean enabled;
    private final double start;
    private final double end;
    private final double transition;

    public QuietHours(QuietHoursConfig config) {
        this(config.isEnabled(), TimeOfDay.parseMinutes(config.getStart()), TimeOfDay.parseMinutes(config.getEnd()),
                config.getTransitionMinutes());
    }

    QuietHours(boolean enabled, double startMinute, double endMinute, double transitionMinutes) {
        this.enabled = enabled;
        this.start = startMinute;
        this.end = endMinute;
        this.transition = Math.max(0, transitionMinutes);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public double factor(LocalTime time) {
        if (!enabled || start == end) {
            return 1.0;
        }
        double now = time.toSecondOfDay() / 60.0;
        double length = TimeOfDay.forward(start, end);
        if (TimeOfDay.forward(start, now) < length) {
            return 0.0;
        }
        if (transition <= 0) {
            return 1.0;
        }
        double untilStart = TimeOfDay.forward(now, start);
        if (untilStart <= transition) {
            return untilStart / transition;
        }
        double sinceEnd = TimeOfDay.forward(end, now);
        if (sinceEnd < transition) {
            return sinceEnd / transition;
        }
        return 1.0;
    }
}
