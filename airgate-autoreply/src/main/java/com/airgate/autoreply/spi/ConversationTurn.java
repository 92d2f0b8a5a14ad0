package com.airgate.autoreply.spi;

/**
 * One turn of the durable conversation record.
 *
 * @param role    {@code user} or {@code assistant}
 * @param content turn text
 */
public record ConversationTurn(String role, String content) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public static ConversationTurn user(String content) {
        return new ConversationTurn(USER, content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(ASSISTANT, content);
    }
}
