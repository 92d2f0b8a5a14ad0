package com.airgate.autoreply;

import com.airgate.autoreply.admission.AdmissionController;
import com.airgate.autoreply.admission.TriggerMatcher;
import com.airgate.autoreply.attention.AttentionStore;
import com.airgate.autoreply.buffer.BufferedTurn;
import com.airgate.autoreply.buffer.CommitProtocol;
import com.airgate.autoreply.buffer.LocalHistoryLog;
import com.airgate.autoreply.buffer.PendingBuffer;
import com.airgate.autoreply.frequency.FrequencyJudgment;
import com.airgate.autoreply.frequency.FrequencyTrendAdjuster;
import com.airgate.autoreply.probability.ProbabilityState;
import com.airgate.autoreply.proactive.ProactiveScheduler;
import com.airgate.autoreply.proactive.ProactiveStateTable;
import com.airgate.common.config.AirGateConfig;
import com.airgate.common.config.ConfigService;
import com.airgate.common.infra.TimeoutGuard;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InboundPipelineTest {

    private static final SessionKey SESSION = SessionKey.group("qq", "321");
    private static final String KEY = SESSION.id();

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private AirGateConfig config;
    private InMemoryConversationStore store;
    private PendingBuffer buffer;
    private LocalHistoryLog history;
    private ProbabilityState probability;
    private AttentionStore attention;
    private FrequencyTrendAdjuster frequency;
    private ProactiveScheduler proactive;
    private TimeoutGuard guard;

    private double roll = 0.99;
    private String reply = "sure thing";
    private boolean delivered = true;
    private boolean judgeSays = true;
    private int generatorCalls;
    private String lastHints;
    private final List<String> sent = new ArrayList<>();
    private final List<String> judgedTranscripts = new ArrayList<>();
    private int stateChanges;
    private Runnable duringGeneration;

    private InboundPipeline pipeline;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        config = ConfigService.applyDefaults(new AirGateConfig());
        config.getTriggers().setKeywords(List.of("airgate"));
        config.getTimeouts().setGenerationSeconds(1);
        store = new InMemoryConversationStore();
        buffer = new PendingBuffer(config.getBuffer(), clock);
        history = new LocalHistoryLog(tempDir, 200);
        probability = new ProbabilityState(clock);
        attention = new AttentionStore(config.getAttention(), clock);
        frequency = new FrequencyTrendAdjuster(config.getFrequency(), clock);
        proactive = new ProactiveScheduler(config.getProactive(), new ProactiveStateTable(), clock, () -> 0.99,
                () -> {
                });
        guard = new TimeoutGuard("test-pipeline");
        build();
    }

    private void build() {
        AdmissionController admission = new AdmissionController(config.getProbability(), probability, attention,
                frequency, new TriggerMatcher(config.getTriggers().getKeywords()), proactive::tempBoost,
                () -> roll);
        pipeline = InboundPipeline.builder()
                .config(config)
                .admission(admission)
                .buffer(buffer)
                .commits(new CommitProtocol(store, buffer, guard, Duration.ofSeconds(2), clock))
                .history(history)
                .frequency(frequency)
                .proactive(proactive)
                .formatter(new MessageFormatter(config.getMessage(), ZoneOffset.UTC))
                .generator((context, hints) -> {
                    generatorCalls++;
                    lastHints = hints;
                    Runnable hook = duringGeneration;
                    duringGeneration = null;
                    if (hook != null) {
                        hook.run();
                    }
                    return reply;
                })
                .transport((session, content) -> {
                    sent.add(content);
                    return delivered;
                })
                .judge(context -> judgeSays)
                .trafficJudge(transcript -> {
                    judgedTranscripts.add(transcript);
                    return FrequencyJudgment.TOO_FREQUENT;
                })
                .guard(guard)
                .clock(clock)
                .stateChanged(() -> stateChanges++)
                .build();
    }

    @AfterEach
    void tearDown() {
        guard.close();
    }

    private InboundEvent message(String sender, String text) {
        clock.advanceSeconds(5);
        return InboundEvent.builder()
                .session(SESSION)
                .senderId(sender)
                .senderName(sender.toUpperCase())
                .text(text)
                .timestamp(clock.millis())
                .build();
    }

    @Nested
    class Rejection {

        @Test
        void rejectedMessage_isBufferedAndLoggedLocally() {
            assertEquals(PipelineOutcome.REJECTED, pipeline.handle(message("ann", "just chatting")));

            assertEquals(1, buffer.size(KEY));
            assertEquals(1, history.read(KEY, 10).size());
            assertEquals(0, generatorCalls);
            assertFalse(probability.hasEntry(KEY));
            assertTrue(store.contents(KEY).isEmpty());
        }

        @Test
        void ownMessagesAndDisabledSessionsAreIgnored() {
            InboundEvent own = InboundEvent.builder().session(SESSION).senderId("bot").text("hi").fromSelf(true)
                    .build();
            assertEquals(PipelineOutcome.IGNORED, pipeline.handle(own));

            config.setEnabledSessions(List.of("other"));
            assertEquals(PipelineOutcome.IGNORED, pipeline.handle(message("ann", "hello")));
            assertEquals(0, buffer.size(KEY));
        }
    }

    @Nested
    class Reply {

        @Test
        void trigger_repliesAndCommitsEverythingBuffered() {
            pipeline.handle(message("ann", "morning all"));
            pipeline.handle(message("ben", "hey ann"));

            PipelineOutcome outcome = pipeline.handle(message("ann", "AirGate, what's the weather?"));

            assertEquals(PipelineOutcome.REPLIED, outcome);
            assertEquals(List.of("sure thing"), sent);
            List<String> contents = store.contents(KEY);
            assertEquals(4, contents.size());
            assertTrue(contents.get(0).startsWith("[time: 2024-05-01 10:00:05] [sender: ANN (id: ann)]\n"));
            assertTrue(contents.get(0).endsWith("morning all"));
            assertTrue(lastHints.endsWith("AirGate, what's the weather?"));
            assertEquals("sure thing", contents.get(3));
            assertEquals(0, buffer.size(KEY));
            assertEquals(0.8, probability.getCurrent(KEY, 0.1));
            assertTrue(attention.profile(KEY, "ann").isPresent());
            assertTrue(stateChanges > 0);
        }

        @Test
        void directAddress_replies() {
            InboundEvent event = InboundEvent.builder().session(SESSION).senderId("ann").senderName("Ann")
                    .text("you there?").timestamp(clock.millis()).directAddress(true).build();
            assertEquals(PipelineOutcome.REPLIED, pipeline.handle(event));
        }

        @Test
        void mediaDescription_reachesDurableRecord() {
            InboundEvent event = InboundEvent.builder().session(SESSION).senderId("ann").senderName("Ann")
                    .text("[image] airgate look").timestamp(clock.millis()).mediaDescription("a sunset")
                    .build();
            pipeline.handle(event);
            assertTrue(store.contents(KEY).get(0).endsWith("\na sunset"));
        }

        @Test
        void probabilisticAccept_canBeVetoed() {
            roll = 0.0;
            judgeSays = false;
            config.getJudge().setEnabled(true);

            assertEquals(PipelineOutcome.VETOED, pipeline.handle(message("ann", "hmm")));
            assertEquals(0, generatorCalls);
            assertEquals(1, buffer.size(KEY));
        }

        @Test
        void judgeIsNotConsultedForTriggers() {
            judgeSays = false;
            config.getJudge().setEnabled(true);
            assertEquals(PipelineOutcome.REPLIED, pipeline.handle(message("ann", "airgate?")));
        }
    }

    @Nested
    class Degraded {

        @Test
        void emptyReply_noBoostBufferKept() {
            reply = "";
            assertEquals(PipelineOutcome.NO_REPLY, pipeline.handle(message("ann", "airgate hi")));
            assertFalse(probability.hasEntry(KEY));
            assertEquals(1, buffer.size(KEY));
        }

        @Test
        void generatorTimeout_isNoReply() {
            pipeline = InboundPipeline.builder()
                    .config(config)
                    .admission(new AdmissionController(config.getProbability(), probability, attention, frequency,
                            new TriggerMatcher(List.of("airgate")), s -> 0.0, () -> 0.99))
                    .buffer(buffer)
                    .commits(new CommitProtocol(store, buffer, guard, Duration.ofSeconds(2), clock))
                    .history(history)
                    .frequency(frequency)
                    .proactive(proactive)
                    .formatter(new MessageFormatter(config.getMessage(), ZoneOffset.UTC))
                    .generator((context, hints) -> {
                        Thread.sleep(5_000);
                        return "too late";
                    })
                    .transport((session, content) -> true)
                    .guard(guard)
                    .clock(clock)
                    .build();

            assertEquals(PipelineOutcome.NO_REPLY, pipeline.handle(message("ann", "airgate hi")));
            assertEquals(1, buffer.size(KEY));
        }

        @Test
        void deliveryFailure_isNoReply() {
            delivered = false;
            assertEquals(PipelineOutcome.NO_REPLY, pipeline.handle(message("ann", "airgate hi")));
            assertFalse(probability.hasEntry(KEY));
            assertTrue(store.contents(KEY).isEmpty());
        }

        @Test
        void storeFailure_stillReplied_turnsKeptForNextCommit() {
            store.failUpdates = true;
            assertEquals(PipelineOutcome.REPLIED, pipeline.handle(message("ann", "airgate one")));
            assertEquals(2, buffer.size(KEY));

            store.failUpdates = false;
            pipeline.handle(message("ann", "airgate two"));

            List<String> contents = store.contents(KEY);
            assertEquals(4, contents.size());
            assertTrue(contents.get(0).endsWith("airgate one"));
            assertEquals("sure thing", contents.get(1));
            assertTrue(contents.get(2).endsWith("airgate two"));
        }
    }

    @Nested
    class Overlap {

        @Test
        void messageDuringGeneration_currentTurnWrittenOnce() {
            duringGeneration = () -> pipeline.handle(message("bob", "meanwhile"));

            assertEquals(PipelineOutcome.REPLIED, pipeline.handle(message("ann", "airgate hello")));

            List<String> contents = store.contents(KEY);
            assertEquals(1, contents.stream().filter(c -> c.endsWith("airgate hello")).count());
            assertEquals(2, contents.size());
            assertEquals("sure thing", contents.get(1));
            assertEquals(1, buffer.size(KEY));
            assertTrue(buffer.snapshot(KEY).get(0).content().endsWith("meanwhile"));
        }

        @Test
        void turnBufferedDuringGeneration_followsInNextCommit() {
            duringGeneration = () -> pipeline.handle(message("bob", "meanwhile"));
            pipeline.handle(message("ann", "airgate hello"));

            pipeline.handle(message("ann", "airgate again"));

            List<String> contents = store.contents(KEY);
            assertEquals(5, contents.size());
            assertTrue(contents.get(0).endsWith("airgate hello"));
            assertTrue(contents.get(2).endsWith("meanwhile"));
            assertTrue(contents.get(3).endsWith("airgate again"));
        }

        @Test
        void mediaTurnAnswered_whileAnotherArrives() {
            duringGeneration = () -> pipeline.handle(message("bob", "meanwhile"));
            InboundEvent event = InboundEvent.builder().session(SESSION).senderId("ann").senderName("Ann")
                    .text("[image] airgate look").timestamp(clock.millis()).mediaDescription("a sunset")
                    .build();

            assertEquals(PipelineOutcome.REPLIED, pipeline.handle(event));
            assertTrue(store.contents(KEY).get(0).endsWith("\na sunset"));
            assertEquals(2, store.contents(KEY).size());
        }
    }

    @Test
    void proactiveBoost_appliesToFirstReplyingMessage() {
        proactive.onOriginated(SESSION);
        roll = 0.55;

        assertEquals(PipelineOutcome.REPLIED, pipeline.handle(message("ann", "oh hi")));
        assertEquals(1, generatorCalls);
        assertEquals(0.0, proactive.tempBoost(KEY));
    }

    @Test
    void userMessage_disarmsProactiveBoost() {
        proactive.onOriginated(SESSION);
        assertEquals(0.5, proactive.tempBoost(KEY));
        pipeline.handle(message("ann", "oh hi"));
        assertEquals(0.0, proactive.tempBoost(KEY));
    }

    @Test
    void frequencySample_adjustsBase() {
        config.getFrequency().setEnabled(true);
        pipeline.handle(message("ann", "first"));
        clock.advanceSeconds(200);
        // Seven more brings the count since the last check to eight.
        for (int i = 0; i < 7; i++) {
            pipeline.handle(message("ann", "msg " + i));
        }
        assertEquals(1, judgedTranscripts.size());
        assertEquals(0.085, frequency.effectiveBase(KEY, 0.1), 1e-9);
        assertEquals(0, frequency.messageCount(KEY));
    }

    @Test
    void bufferedTurnsCarrySender() {
        pipeline.handle(message("ann", "hello"));
        BufferedTurn turn = buffer.snapshot(KEY).get(0);
        assertEquals("ann", turn.senderId());
        assertEquals("ANN", turn.senderName());
    }
}
