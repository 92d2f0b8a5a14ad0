package com.airgate.autoreply.spi;

/**
 * Produces the responder's reply text. Callers bound every call with a timeout.
 */
@FunctionalInterface
public interface ReplyGenerator {

    /**
     * @param context conversation context, oldest first
     * @param hints   the turn to answer, or an instruction for proactive turns
     * @return reply text; null or blank means "nothing to say"
     */
    String generate(String context, String hints) throws Exception;
}
