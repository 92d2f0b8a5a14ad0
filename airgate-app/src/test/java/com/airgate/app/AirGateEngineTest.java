package com.airgate.app;

import com.airgate.autoreply.InboundEvent;
import com.airgate.autoreply.PipelineOutcome;
import com.airgate.autoreply.SessionKey;
import com.airgate.autoreply.admission.AdmissionController;
import com.airgate.autoreply.spi.ConversationStore;
import com.airgate.autoreply.spi.ConversationTurn;
import com.airgate.autoreply.spi.DeliveryTransport;
import com.airgate.autoreply.spi.ReplyGenerator;
import com.airgate.autoreply.state.EngineStateStore;
import com.airgate.autoreply.state.StateSaver;
import com.airgate.common.config.AirGateConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the application context with in-memory host collaborators and
 * drives messages through the wired engine.
 */
@SpringBootTest(classes = AirGateApplication.class)
class AirGateEngineTest {

    private static final SessionKey SESSION = SessionKey.group("qq", "777");
    private static Path stateDir;

    @Autowired
    private AirGateEngine engine;

    @Autowired
    private AirGateConfig config;

    @Autowired
    private AdmissionController admission;

    @Autowired
    private StateSaver saver;

    @Autowired
    private MapStore store;

    @Autowired
    private SentMessages sent;

    @DynamicPropertySource
    static void airgateProperties(DynamicPropertyRegistry registry) {
        try {
            Path root = Files.createTempDirectory("airgate-app-test");
            stateDir = root.resolve("state");
            Path configFile = root.resolve("airgate.json");
            Files.writeString(configFile, "{\"state\": {\"dir\": \""
                    + stateDir.toString().replace("\\", "\\\\") + "\"}}");
            registry.add("airgate.config-path", configFile::toString);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @TestConfiguration
    static class HostCollaborators {

        @Bean
        MapStore conversationStore() {
            return new MapStore();
        }

        @Bean
        SentMessages sentMessages() {
            return new SentMessages();
        }

        @Bean
        ReplyGenerator replyGenerator() {
            return (context, hints) -> "hello from airgate";
        }

        @Bean
        DeliveryTransport deliveryTransport(SentMessages sentMessages) {
            return (session, content) -> sentMessages.contents.add(content);
        }
    }

    @Test
    void contextLoadsWithDefaults() {
        assertTrue(engine.isWired());
        assertEquals(0.1, config.getProbability().getInitial(), 1e-9);
        assertEquals(stateDir.toAbsolutePath(), Path.of(config.getState().getDir()).toAbsolutePath());
    }

    @Test
    void directAddressIsAnsweredAndCommitted() {
        InboundEvent event = InboundEvent.builder()
                .session(SESSION)
                .senderId("u1")
                .senderName("Ann")
                .text("are you there?")
                .timestamp(System.currentTimeMillis())
                .directAddress(true)
                .build();

        assertEquals(PipelineOutcome.REPLIED, engine.handle(event));
        assertTrue(sent.contents.contains("hello from airgate"));

        List<ConversationTurn> turns = store.turns(SESSION.id());
        assertEquals(ConversationTurn.ASSISTANT, turns.get(turns.size() - 1).role());
        assertEquals("hello from airgate", turns.get(turns.size() - 1).content());
        assertTrue(turns.get(turns.size() - 2).content().contains("are you there?"));

        // the reply raises the baseline for the follow-up window
        assertTrue(admission.effectiveProbability(SESSION.id(), "u1") > 0.1);
    }

    @Test
    void flushWritesStateFiles() {
        saver.flush();
        assertTrue(Files.exists(stateDir.resolve(EngineStateStore.ATTENTION_FILE)));
        assertTrue(Files.exists(stateDir.resolve(EngineStateStore.PROACTIVE_FILE)));
    }

    static class SentMessages {
        final List<String> contents = new CopyOnWriteArrayList<>();
    }

    static class MapStore implements ConversationStore {

        private final Map<String, String> current = new HashMap<>();
        private final Map<String, List<ConversationTurn>> conversations = new HashMap<>();

        @Override
        public synchronized Optional<String> currentId(String session) {
            return Optional.ofNullable(current.get(session));
        }

        @Override
        public synchronized String create(String session, String title) {
            String id = session + "-" + (conversations.size() + 1);
            current.put(session, id);
            conversations.put(id, new ArrayList<>());
            return id;
        }

        @Override
        public synchronized List<ConversationTurn> read(String session, String conversationId) {
            return new ArrayList<>(conversations.getOrDefault(conversationId, List.of()));
        }

        @Override
        public synchronized boolean update(String session, String conversationId, List<ConversationTurn> turns) {
            conversations.put(conversationId, new ArrayList<>(turns));
            return true;
        }

        synchronized List<ConversationTurn> turns(String session) {
            String id = current.get(session);
            return id == null ? List.of() : List.copyOf(conversations.get(id));
        }
    }
}
