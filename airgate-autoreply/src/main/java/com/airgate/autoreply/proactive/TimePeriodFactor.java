package com.airgate.autoreply.proactive;

import com.airgate.common.config.AirGateConfig.TimePeriod;
import com.airgate.common.config.AirGateConfig.TimePeriodsConfig;
import com.airgate.common.infra.Decay;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Smooth time-of-day multiplier for proactive probability.
 * <p>
 * Inside a configured period the period's factor applies. Within
 * {@code transitionMinutes} outside either edge the value moves between 1
 * and the factor, along a cosine curve when smoothing is on. Elsewhere 1.
 * The first period that matches wins.
 */
public final class TimePeriodFactor {

    private record Period(double start, double end, double factor) {
    }

    private final boolean enabled;
    private final List<Period> periods;
    private final double transition;
    private final double min;
    private final double max;
    private final boolean smooth;

    public TimePeriodFactor(TimePeriodsConfig config) {
        this.enabled = config.isEnabled();
        this.transition = Math.max(0, config.getTransitionMinutes());
        this.min = config.getMinFactor();
        this.max = config.getMaxFactor();
        this.smooth = config.isUseSmoothCurve();
        List<Period> parsed = new ArrayList<>();
        if (config.getPeriods() != null) {
            for (TimePeriod p : config.getPeriods()) {
                if (p == null || p.getStart() == null || p.getEnd() == null) {
                    continue;
                }
                parsed.add(new Period(TimeOfDay.parseMinutes(p.getStart()), TimeOfDay.parseMinutes(p.getEnd()),
                        p.getFactor()));
            }
        }
        this.periods = List.copyOf(parsed);
    }

    public double factor(LocalTime time) {
        if (!enabled || periods.isEmpty()) {
            return 1.0;
        }
        double now = time.toSecondOfDay() / 60.0;

        for (Period p : periods) {
            if (p.start() != p.end() && TimeOfDay.forward(p.start(), now) < TimeOfDay.forward(p.start(), p.end())) {
                return clamp(p.factor());
            }
        }
        if (transition > 0) {
            for (Period p : periods) {
                double untilStart = TimeOfDay.forward(now, p.start());
                if (untilStart > 0 && untilStart <= transition) {
                    return clamp(blend(p.factor(), 1.0 - untilStart / transition));
                }
                double sinceEnd = TimeOfDay.forward(p.end(), now);
                if (sinceEnd < transition) {
                    return clamp(blend(p.factor(), 1.0 - sinceEnd / transition));
                }
            }
        }
        return clamp(1.0);
    }

    /** Move from 1 toward {@code target} by {@code progress} in [0,1]. */
    private double blend(double target, double progress) {
        double t = smooth ? (1 - Math.cos(Math.PI * progress)) / 2 : progress;
        return 1.0 + (target - 1.0) * t;
    }

    private double clamp(double v) {
        return Decay.clamp(v, min, max);
    }
}
