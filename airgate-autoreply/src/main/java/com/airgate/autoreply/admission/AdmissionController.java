package com.airgate.autoreply.admission;

import com.airgate.autoreply.attention.AttentionStore;
import com.airgate.autoreply.frequency.FrequencyTrendAdjuster;
import com.airgate.autoreply.probability.ProbabilityState;
import com.airgate.common.config.AirGateConfig.ProbabilityConfig;
import com.airgate.common.infra.Decay;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.function.DoubleSupplier;
import java.util.function.ToDoubleFunction;

import static com.airgate.autoreply.admission.AdmissionDecision.Outcome.ACCEPT;
import static com.airgate.autoreply.admission.AdmissionDecision.Outcome.REJECT;

/**
 * Decides whether the responder should answer an inbound message.
 * <p>
 * Direct address and trigger phrases accept outright. Everything else is one
 * random draw against a probability composed from the session's boost state,
 * its frequency-adjusted base, the sender's attention profile and any
 * proactive temporary boost. A rejection changes no state.
 */
@Slf4j
public class AdmissionController {

    private final ProbabilityConfig config;
    private final ProbabilityState probability;
    private final AttentionStore attention;
    private final FrequencyTrendAdjuster frequency;
    private final TriggerMatcher triggers;
    private final ToDoubleFunction<String> tempBoost;
    private final DoubleSupplier random;

    /**
     * @param tempBoost additive bonus per session key, 0 when none is armed
     * @param random    uniform draws in [0,1)
     */
    public AdmissionController(ProbabilityConfig config, ProbabilityState probability, AttentionStore attention,
            FrequencyTrendAdjuster frequency, TriggerMatcher triggers, ToDoubleFunction<String> tempBoost,
            DoubleSupplier random) {
        this.config = config;
        this.probability = probability;
        this.attention = attention;
        this.frequency = frequency;
        this.triggers = triggers;
        this.tempBoost = tempBoost;
        this.random = random;
    }

    public AdmissionDecision evaluate(AdmissionRequest request) {
        String session = request.session().id();

        if (request.directAddress()) {
            if (request.alreadyHandled()) {
                log.debug("Direct address in {} already handled elsewhere", session);
                return AdmissionDecision.explicit(REJECT, AdmissionDecision.Reason.ALREADY_HANDLED);
            }
            return AdmissionDecision.explicit(ACCEPT, AdmissionDecision.Reason.DIRECT_ADDRESS);
        }

        Optional<String> phrase = triggers.match(request.text());
        if (phrase.isPresent()) {
            log.debug("Trigger phrase '{}' in {}", phrase.get(), session);
            return AdmissionDecision.explicit(ACCEPT, AdmissionDecision.Reason.TRIGGER_PHRASE);
        }

        double p = effectiveProbability(session, request.senderId());
        double roll = random.getAsDouble();
        boolean accept = roll < p;
        log.debug("Roll {} in {}: {} vs p={}", accept ? "hit" : "miss", session,
                String.format("%.3f", roll), String.format("%.3f", p));
        return new AdmissionDecision(accept ? ACCEPT : REJECT,
                accept ? AdmissionDecision.Reason.PROBABILITY : AdmissionDecision.Reason.PROBABILITY_REJECT, p, roll);
    }

    /** The probability a non-triggered message from {@code senderId} would be drawn against. */
    public double effectiveProbability(String session, String senderId) {
        double base = frequency.effectiveBase(session, config.getInitial());
        double p = probability.getCurrent(session, base);
        p = attention.computeAdjustedProbability(session, senderId, p);
        p += tempBoost.applyAsDouble(session);
        return Decay.clamp(p, 0.0, 1.0);
    }

    /** Called once a reply was delivered: boost the session, focus on the sender and track its tone. */
    public void onReplied(String session, String userId, String userName, String preview) {
        probability.boost(session, config.getAfterReply(), config.getBoostDurationSeconds());
        if (attention.isEnabled()) {
            attention.recordReply(session, userId, userName, preview);
        }
    }
}
