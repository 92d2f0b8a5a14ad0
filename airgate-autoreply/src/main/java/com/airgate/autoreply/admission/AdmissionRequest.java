package com.airgate.autoreply.admission;

import com.airgate.autoreply.SessionKey;

/**
 * Input to one admission decision.
 *
 * @param session        where the message arrived
 * @param senderId       who sent it
 * @param text           raw message text, without metadata prefix
 * @param directAddress  the message mentions or replies to the responder
 * @param alreadyHandled another handler already answered this event
 */
public record AdmissionRequest(SessionKey session, String senderId, String text, boolean directAddress,
        boolean alreadyHandled) {
}
