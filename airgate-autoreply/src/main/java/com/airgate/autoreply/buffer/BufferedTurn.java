package com.airgate.autoreply.buffer;

import com.airgate.autoreply.spi.ConversationTurn;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A turn waiting in the pending buffer.
 *
 * @param role             {@code user}, or {@code assistant} for a reply whose commit failed
 * @param content          formatted text, metadata prefix included
 * @param timestamp        epoch ms when it was buffered
 * @param senderId         platform user id
 * @param senderName       display name
 * @param mediaDescription text description of attached media, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BufferedTurn(String role, String content, long timestamp, String senderId, String senderName,
        String mediaDescription) {

    public static BufferedTurn user(String content, long timestamp, String senderId, String senderName) {
        return new BufferedTurn("user", content, timestamp, senderId, senderName, null);
    }

    /** Anything but a retained reply. */
    @JsonIgnore
    public boolean isUser() {
        return !ConversationTurn.ASSISTANT.equals(role);
    }

    public BufferedTurn withMediaDescription(String description) {
        return new BufferedTurn(role, content, timestamp, senderId, senderName, description);
    }

    /** Content as it should enter the durable record. */
    public String effectiveContent() {
        if (mediaDescription == null || mediaDescription.isBlank()) {
            return content;
        }
        return MediaSplice.apply(content, mediaDescription);
    }
}
