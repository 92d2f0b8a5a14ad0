package com.airgate.common.infra;

/**
 * Exponential half-life decay shared by the attention and emotion scores.
 */
public final class Decay {

    private Decay() {
    }

    /**
     * Multiplicative decay factor {@code 0.5^(elapsed/halfLife)}.
     * Non-positive elapsed time yields 1.0; a non-positive half-life decays
     * everything to 0 as soon as any time has passed.
     */
    public static double factor(long elapsedMs, long halfLifeMs) {
        if (elapsedMs <= 0)
            return 1.0;
        if (halfLifeMs <= 0)
            return 0.0;
        return Math.pow(0.5, (double) elapsedMs / (double) halfLifeMs);
    }

    /** Apply decay to a value. */
    public static double apply(double value, long elapsedMs, long halfLifeMs) {
        return value * factor(elapsedMs, halfLifeMs);
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value))
            return min;
        return Math.max(min, Math.min(max, value));
    }
}
