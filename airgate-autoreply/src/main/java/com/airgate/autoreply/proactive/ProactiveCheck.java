package com.airgate.autoreply.proactive;

/**
 * Result of one proactive evaluation.
 *
 * @param trigger     originate now
 * @param reason      which step decided
 * @param probability effective probability, NaN when no draw was made
 */
public record ProactiveCheck(boolean trigger, Reason reason, double probability) {

    public enum Reason {
        NOT_ALLOWED, COOLDOWN, SILENCE, INACTIVE, QUIET_HOURS, PROBABILITY_MISS, TRIGGERED
    }

    static ProactiveCheck skip(Reason reason) {
        return new ProactiveCheck(false, reason, Double.NaN);
    }
}
