package com.airgate.autoreply.spi;

import java.util.List;
import java.util.Optional;

/**
 * Durable conversation record owned by the host.
 * <p>
 * The store is not expected to deduplicate; the commit protocol does that
 * before calling {@link #update}.
 */
public interface ConversationStore {

    /** Current conversation id of the session, if one exists. */
    Optional<String> currentId(String session) throws Exception;

    /** Create a conversation and make it current; returns its id. */
    String create(String session, String title) throws Exception;

    /** All turns of a conversation, oldest first; empty when it has none. */
    List<ConversationTurn> read(String session, String conversationId) throws Exception;

    /** Replace the conversation content. Returns false when the write was not applied. */
    boolean update(String session, String conversationId, List<ConversationTurn> turns) throws Exception;
}
