package com.airgate.autoreply.buffer;

import com.airgate.autoreply.InMemoryConversationStore;
import com.airgate.autoreply.MutableClock;
import com.airgate.autoreply.SessionKey;
import com.airgate.autoreply.spi.ConversationTurn;
import com.airgate.common.config.AirGateConfig.BufferConfig;
import com.airgate.common.infra.TimeoutGuard;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommitProtocolTest {

    private static final SessionKey SESSION = SessionKey.group("qq", "100");
    private static final String KEY = SESSION.id();

    private MutableClock clock;
    private InMemoryConversationStore store;
    private PendingBuffer buffer;
    private TimeoutGuard guard;
    private CommitProtocol commits;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSeconds(50_000);
        store = new InMemoryConversationStore();
        buffer = new PendingBuffer(new BufferConfig(), clock);
        guard = new TimeoutGuard("test-store");
        commits = new CommitProtocol(store, buffer, guard, Duration.ofSeconds(2), clock);
    }

    @AfterEach
    void tearDown() {
        guard.close();
    }

    private BufferedTurn buffered(String text) {
        BufferedTurn turn = BufferedTurn.user(text, clock.millis(), "u1", "User");
        buffer.append(KEY, turn);
        clock.advanceSeconds(1);
        return turn;
    }

    @Nested
    class Commit {

        @Test
        void firstCommit_createsConversationAndMerges() {
            buffered("hello");
            buffered("anyone?");
            BufferedTurn current = buffered("bot, what's up");

            CommitResult result = commits.commit(SESSION, current, "not much");

            assertTrue(result.committed());
            assertEquals(2, result.mergedCount());
            assertEquals(4, result.totalTurns());
            assertEquals(List.of("hello", "anyone?", "bot, what's up", "not much"), store.contents(KEY));
            assertEquals("Group 100", store.titles.get(store.currentIds.get(KEY)));
            assertEquals(0, buffer.size(KEY));
        }

        @Test
        void privateSessionTitle() {
            assertEquals("Private 42", CommitProtocol.title(SessionKey.direct("qq", "42")));
        }

        @Test
        void alreadyPresentTurnsAreSkipped() {
            String id = store.create(KEY, "Group 100");
            store.conversations.get(id).add(ConversationTurn.user("hello"));
            buffered("hello");
            BufferedTurn current = buffered("question");

            CommitResult result = commits.commit(SESSION, current, "answer");

            assertEquals(1, result.skippedDuplicates());
            assertEquals(List.of("hello", "question", "answer"), store.contents(KEY));
        }

        @Test
        void duplicateWithinBuffer_mergedOnce() {
            buffered("same");
            buffered("same");
            BufferedTurn current = buffered("q");
            commits.commit(SESSION, current, "a");
            assertEquals(List.of("same", "q", "a"), store.contents(KEY));
        }

        @Test
        void mediaDescriptionIsSpliced() {
            buffer.append(KEY, BufferedTurn.user("[time: t] [sender: s]\n[image]", clock.millis(), "u", "U")
                    .withMediaDescription("a photo of a dog"));
            clock.advanceSeconds(1);
            BufferedTurn current = buffered("[time: t2] [sender: s]\nlook");

            commits.commit(SESSION, current, "cute");

            assertEquals("[time: t] [sender: s]\na photo of a dog", store.contents(KEY).get(0));
        }
    }

    @Nested
    class LaterTurns {

        @Test
        void turnBufferedAfterCurrent_currentWrittenOnce() {
            BufferedTurn first = buffered("m1");
            buffered("m2");

            CommitResult result = commits.commit(SESSION, first, "r1");

            assertTrue(result.committed());
            assertEquals(List.of("m1", "r1"), store.contents(KEY));
            assertEquals(List.of("m2"), buffer.snapshot(KEY).stream().map(BufferedTurn::content).toList());
        }

        @Test
        void laterTurnCommittedWithItsOwnExchange() {
            BufferedTurn first = buffered("m1");
            BufferedTurn second = buffered("m2");
            commits.commit(SESSION, first, "r1");

            commits.commit(SESSION, second, "r2");

            assertEquals(List.of("m1", "r1", "m2", "r2"), store.contents(KEY));
            assertEquals(0, buffer.size(KEY));
        }

        @Test
        void failedCommit_keepsReplyBehindItsTurn() {
            BufferedTurn first = buffered("m1");
            BufferedTurn second = buffered("m2");
            store.failUpdates = true;
            commits.commit(SESSION, first, "r1");

            assertEquals(List.of("m1", "r1", "m2"),
                    buffer.snapshot(KEY).stream().map(BufferedTurn::content).toList());

            store.failUpdates = false;
            commits.commit(SESSION, second, "r2");
            assertEquals(List.of("m1", "r1", "m2", "r2"), store.contents(KEY));
        }
    }

    @Nested
    class Failure {

        @Test
        void failedWrite_atCapacity_keepsEveryUserTurn() {
            BufferedTurn current = null;
            for (int i = 0; i < 10; i++) {
                current = buffered("m" + i);
            }
            store.failUpdates = true;

            commits.commit(SESSION, current, "reply");

            List<String> kept = buffer.snapshot(KEY).stream().map(BufferedTurn::content).toList();
            assertEquals(11, kept.size());
            assertEquals("m0", kept.get(0));
            assertEquals("reply", kept.get(10));

            store.failUpdates = false;
            BufferedTurn next = buffered("m10");
            commits.commit(SESSION, next, "reply-2");
            List<String> contents = store.contents(KEY);
            assertEquals("m1", contents.get(0));
            assertTrue(contents.contains("reply"));
            assertEquals(12, contents.size());
        }

        @Test
        void failedWrite_keepsBuffer() {
            buffered("a");
            BufferedTurn current = buffered("b");
            store.failUpdates = true;

            CommitResult result = commits.commit(SESSION, current, "reply-1");

            assertFalse(result.committed());
            assertNotNull(result.error());
            assertEquals(List.of("a", "b", "reply-1"),
                    buffer.snapshot(KEY).stream().map(BufferedTurn::content).toList());
        }

        @Test
        void rejectedWrite_keepsBuffer() {
            BufferedTurn current = buffered("b");
            store.rejectUpdates = true;
            assertFalse(commits.commit(SESSION, current, "r").committed());
            assertEquals(2, buffer.size(KEY));
        }

        @Test
        void retryAfterFailure_losesNothing() {
            buffered("a");
            BufferedTurn first = buffered("b");
            store.failUpdates = true;
            commits.commit(SESSION, first, "reply-1");

            store.failUpdates = false;
            BufferedTurn second = buffered("c");
            CommitResult result = commits.commit(SESSION, second, "reply-2");

            assertTrue(result.committed());
            assertEquals(List.of("a", "b", "reply-1", "c", "reply-2"), store.contents(KEY));
            assertEquals(ConversationTurn.ASSISTANT, store.turns(KEY).get(2).role());
            assertEquals(0, buffer.size(KEY));
        }

        @Test
        void commitRetry_neverDuplicates() {
            buffered("a");
            BufferedTurn current = buffered("b");
            commits.commit(SESSION, current, "r");

            // Simulate a retry of the same buffered set against the already-updated store.
            buffer.append(KEY, BufferedTurn.user("a", clock.millis(), "u1", "User"));
            clock.advanceSeconds(1);
            BufferedTurn again = buffered("c");
            commits.commit(SESSION, again, "r2");

            assertEquals(List.of("a", "b", "r", "c", "r2"), store.contents(KEY));
        }
    }

    @Test
    void commitProactive_mergesButLeavesBuffer() {
        buffered("pending one");

        CommitResult result = commits.commitProactive(SESSION, "[Proactive topic]\nsay hi", "hi all");

        assertTrue(result.committed());
        assertEquals(List.of("pending one", "[Proactive topic]\nsay hi", "hi all"), store.contents(KEY));
        assertEquals(1, buffer.size(KEY));
    }
}
