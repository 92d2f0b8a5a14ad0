package com.airgate.autoreply.spi;

/**
 * Outbound delivery to the chat platform.
 */
@FunctionalInterface
public interface DeliveryTransport {

    /** @return true once the platform accepted the message */
    boolean send(String session, String content) throws Exception;
}
