package com.airgate.autoreply.proactive;

import com.airgate.autoreply.MessageFormatter;
import com.airgate.autoreply.SessionKey;
import com.airgate.autoreply.buffer.BufferedTurn;
import com.airgate.autoreply.buffer.CommitProtocol;
import com.airgate.autoreply.buffer.LocalHistoryLog;
import com.airgate.autoreply.buffer.PendingBuffer;
import com.airgate.autoreply.spi.ConversationTurn;
import com.airgate.autoreply.spi.DeliveryTransport;
import com.airgate.autoreply.spi.ReplyGenerator;
import com.airgate.common.infra.TimeoutGuard;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Produces, delivers and records one proactive turn.
 */
@Slf4j
public class ProactiveOriginator {

    static final String TOPIC_MARKER = "[Proactive topic]\n";

    private final ReplyGenerator generator;
    private final DeliveryTransport transport;
    private final CommitProtocol commits;
    private final PendingBuffer buffer;
    private final LocalHistoryLog history;
    private final MessageFormatter formatter;
    private final TimeoutGuard guard;
    private final Duration generationTimeout;
    private final Duration deliveryTimeout;
    private final Clock clock;

    public ProactiveOriginator(ReplyGenerator generator, DeliveryTransport transport, CommitProtocol commits,
            PendingBuffer buffer, LocalHistoryLog history, MessageFormatter formatter, TimeoutGuard guard,
            Duration generationTimeout, Duration deliveryTimeout, Clock clock) {
        this.generator = generator;
        this.transport = transport;
        this.commits = commits;
        this.buffer = buffer;
        this.history = history;
        this.formatter = formatter;
        this.guard = guard;
        this.generationTimeout = generationTimeout;
        this.deliveryTimeout = deliveryTimeout;
        this.clock = clock;
    }

    /**
     * Try to start a topic.
     *
     * @return true once a reply was delivered
     */
    public boolean originate(SessionKey session, String prompt) {
        String key = session.id();
        String synthetic = TOPIC_MARKER + prompt;

        List<ConversationTurn> durable = commits.readCurrent(session);
        if (durable.isEmpty()) {
            durable = history.read(key, Integer.MAX_VALUE).stream()
                    .map(t -> new ConversationTurn(t.role(), t.effectiveContent()))
                    .toList();
        }
        String context = MessageFormatter.render(formatter.mergeContext(durable, buffer.snapshot(key)));

        String reply = guard.call("proactive generate " + key, () -> generator.generate(context, synthetic),
                generationTimeout).orElse(null);
        if (reply == null || reply.isBlank()) {
            log.info("Proactive generation produced nothing for {}", session);
            return false;
        }
        boolean sent = guard.call("proactive send " + key, () -> transport.send(key, reply), deliveryTimeout)
                .orElse(false);
        if (!sent) {
            log.warn("Proactive delivery failed for {}", session);
            return false;
        }

        commits.commitProactive(session, synthetic, reply);
        history.append(key, new BufferedTurn(ConversationTurn.ASSISTANT, reply, clock.millis(), null, null, null));
        return true;
    }
}
