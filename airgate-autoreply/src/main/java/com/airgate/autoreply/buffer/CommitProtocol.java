package com.airgate.autoreply.buffer;

import com.airgate.autoreply.SessionKey;
import com.airgate.autoreply.spi.ConversationStore;
import com.airgate.autoreply.spi.ConversationTurn;
import com.airgate.common.infra.TimeoutGuard;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Moves pending turns into the durable conversation record.
 * <p>
 * Buffered turns are merged with exact-content dedup against the stored
 * record, then the current exchange is appended. The buffer is cleared only
 * after the store confirms the write; on any failure it stays as it was (plus
 * the unsaved reply, which does not count against the buffer's size cap) so
 * the next commit picks everything up.
 */
@Slf4j
public class CommitProtocol {

    private final ConversationStore store;
    private final PendingBuffer buffer;
    private final TimeoutGuard guard;
    private final Duration timeout;
    private final Clock clock;

    public CommitProtocol(ConversationStore store, PendingBuffer buffer, TimeoutGuard guard, Duration timeout,
            Clock clock) {
        this.store = store;
        this.buffer = buffer;
        this.guard = guard;
        this.timeout = timeout;
        this.clock = clock;
    }

    /**
     * Commit the buffer plus the current exchange.
     *
     * @param currentUserTurn the turn being answered; written once even when later turns were buffered after it
     * @param reply           reply text that was delivered
     */
    public CommitResult commit(SessionKey session, BufferedTurn currentUserTurn, String reply) {
        List<BufferedTurn> pending = buffer.snapshot(session.id());
        // Turns buffered while the reply was produced follow the current one;
        // they stay pending for the next commit.
        int at = pending.indexOf(currentUserTurn);
        List<BufferedTurn> earlier = at < 0 ? pending : pending.subList(0, at);
        List<BufferedTurn> committed = at < 0 ? pending : pending.subList(0, at + 1);

        CommitResult result = write(session, earlier,
                List.of(ConversationTurn.user(currentUserTurn.effectiveContent()), ConversationTurn.assistant(reply)));
        if (result.committed()) {
            buffer.removeAll(session.id(), committed);
            log.info("Committed exchange for {}: merged {}, skipped {} duplicate(s), {} turn(s) total", session,
                    result.mergedCount(), result.skippedDuplicates(), result.totalTurns());
        } else {
            // Keep the delivered reply so the retry records it too.
            buffer.insertAfter(session.id(), currentUserTurn,
                    new BufferedTurn(ConversationTurn.ASSISTANT, reply, clock.millis(), null, null, null));
            log.warn("Commit failed for {} ({}); {} turn(s) kept for retry", session, result.error(),
                    buffer.size(session.id()));
        }
        return result;
    }

    /**
     * Commit a proactive exchange. Pending turns are merged with the same
     * dedup rules but the buffer is left untouched.
     */
    public CommitResult commitProactive(SessionKey session, String syntheticTurn, String reply) {
        List<BufferedTurn> pending = buffer.snapshot(session.id());
        CommitResult result = write(session, pending,
                List.of(ConversationTurn.user(syntheticTurn), ConversationTurn.assistant(reply)));
        if (result.committed()) {
            log.info("Committed proactive exchange for {}: merged {}, {} turn(s) total", session,
                    result.mergedCount(), result.totalTurns());
        } else {
            log.warn("Proactive commit failed for {}: {}", session, result.error());
        }
        return result;
    }

    /** Read the current record for context. Empty on any failure. */
    public List<ConversationTurn> readCurrent(SessionKey session) {
        String key = session.id();
        Optional<Optional<String>> id = guard.call("store.currentId " + key, () -> store.currentId(key), timeout);
        if (id.isEmpty() || id.get().isEmpty()) {
            return List.of();
        }
        String conversationId = id.get().get();
        return guard.call("store.read " + key, () -> store.read(key, conversationId), timeout).orElse(List.of());
    }

    private CommitResult write(SessionKey session, List<BufferedTurn> toMerge, List<ConversationTurn> tail) {
        String key = session.id();

        Optional<Optional<String>> current = guard.call("store.currentId " + key, () -> store.currentId(key),
                timeout);
        if (current.isEmpty()) {
            return CommitResult.failed("conversation lookup failed");
        }
        String conversationId = current.get().orElse(null);
        if (conversationId == null || conversationId.isBlank()) {
            conversationId = guard.call("store.create " + key, () -> store.create(key, title(session)), timeout)
                    .orElse(null);
            if (conversationId == null || conversationId.isBlank()) {
                return CommitResult.failed("no conversation id after create");
            }
            log.info("Created conversation {} for {}", conversationId, session);
        }

        String cid = conversationId;
        Optional<List<ConversationTurn>> existing = guard.call("store.read " + key, () -> store.read(key, cid),
                timeout);
        if (existing.isEmpty()) {
            return CommitResult.failed("conversation read failed");
        }

        List<ConversationTurn> turns = new ArrayList<>(existing.get());
        Set<String> seen = new HashSet<>();
        for (ConversationTurn t : turns) {
            seen.add(t.content());
        }

        int merged = 0;
        int skipped = 0;
        for (BufferedTurn b : toMerge) {
            String content = b.effectiveContent();
            if (content == null || !seen.add(content)) {
                skipped++;
                continue;
            }
            String role = ConversationTurn.ASSISTANT.equals(b.role()) ? ConversationTurn.ASSISTANT
                    : ConversationTurn.USER;
            turns.add(new ConversationTurn(role, content));
            merged++;
        }
        turns.addAll(tail);

        boolean ok = guard.call("store.update " + key, () -> store.update(key, cid, List.copyOf(turns)), timeout)
                .orElse(false);
        if (!ok) {
            return CommitResult.failed("store update not confirmed");
        }
        return new CommitResult(true, merged, skipped, turns.size(), null);
    }

    static String title(SessionKey session) {
        return (session.isGroup() ? "Group " : "Private ") + session.conversationId();
    }
}
