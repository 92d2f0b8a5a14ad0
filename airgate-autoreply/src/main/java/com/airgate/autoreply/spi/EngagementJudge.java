package com.airgate.autoreply.spi;

/**
 * Secondary veto applied after a probabilistic accept.
 */
@FunctionalInterface
public interface EngagementJudge {

    /** @return true to let the reply go ahead */
    boolean decide(String context) throws Exception;
}
