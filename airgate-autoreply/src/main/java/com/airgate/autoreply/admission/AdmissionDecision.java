package com.airgate.autoreply.admission;

/**
 * Result of the admission gate.
 *
 * @param outcome     accept or reject
 * @param reason      which rule decided
 * @param probability effective probability, or NaN when no draw was needed
 * @param roll        the draw, or NaN when no draw was needed
 */
public record AdmissionDecision(Outcome outcome, Reason reason, double probability, double roll) {

    public enum Outcome {
        ACCEPT, REJECT
    }

    public enum Reason {
        DIRECT_ADDRESS, TRIGGER_PHRASE, PROBABILITY, PROBABILITY_REJECT, ALREADY_HANDLED
    }

    public boolean accepted() {
        return outcome == Outcome.ACCEPT;
    }

    /** Accepted by the random draw rather than an explicit trigger. */
    public boolean probabilistic() {
        return reason == Reason.PROBABILITY;
    }

    static AdmissionDecision explicit(Outcome outcome, Reason reason) {
        return new AdmissionDecision(outcome, reason, Double.NaN, Double.NaN);
    }
}
