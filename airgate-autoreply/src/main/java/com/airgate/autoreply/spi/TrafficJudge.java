package com.airgate.autoreply.spi;

import com.airgate.autoreply.frequency.FrequencyJudgment;

/**
 * Classifies how chatty the responder has been in a recent transcript.
 */
@FunctionalInterface
public interface TrafficJudge {

    FrequencyJudgment judge(String recentTranscript) throws Exception;
}
