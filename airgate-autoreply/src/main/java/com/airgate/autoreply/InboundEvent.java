package com.airgate.autoreply;

import lombok.Builder;

/**
 * One inbound chat message as seen by the engine.
 *
 * @param session          where it arrived
 * @param senderId         platform user id
 * @param senderName       display name
 * @param text             message text
 * @param timestamp        epoch ms
 * @param directAddress    mentions or replies to the responder
 * @param alreadyHandled   another handler already answered it
 * @param fromSelf         sent by the responder's own account
 * @param mediaDescription text description of attached media, or null
 */
@Builder
public record InboundEvent(SessionKey session, String senderId, String senderName, String text, long timestamp,
        boolean directAddress, boolean alreadyHandled, boolean fromSelf, String mediaDescription) {
}
