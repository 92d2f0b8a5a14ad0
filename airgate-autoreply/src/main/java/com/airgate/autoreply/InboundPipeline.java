package com.airgate.autoreply;

import com.airgate.autoreply.admission.AdmissionController;
import com.airgate.autoreply.admission.AdmissionDecision;
import com.airgate.autoreply.admission.AdmissionRequest;
import com.airgate.autoreply.buffer.BufferedTurn;
import com.airgate.autoreply.buffer.CommitProtocol;
import com.airgate.autoreply.buffer.LocalHistoryLog;
import com.airgate.autoreply.buffer.PendingBuffer;
import com.airgate.autoreply.frequency.FrequencyTrendAdjuster;
import com.airgate.autoreply.proactive.ProactiveScheduler;
import com.airgate.autoreply.spi.ConversationTurn;
import com.airgate.autoreply.spi.DeliveryTransport;
import com.airgate.autoreply.spi.EngagementJudge;
import com.airgate.autoreply.spi.ReplyGenerator;
import com.airgate.autoreply.spi.TrafficJudge;
import com.airgate.common.config.AirGateConfig;
import com.airgate.common.infra.TimeoutGuard;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Event-driven path: buffer every message, decide whether to answer, and
 * when a reply goes out, commit it together with everything buffered.
 * <p>
 * {@link #handle} never throws; every failure ends in a defined outcome.
 */
@Slf4j
public class InboundPipeline {

    private final AirGateConfig config;
    private final AdmissionController admission;
    private final PendingBuffer buffer;
    private final CommitProtocol commits;
    private final LocalHistoryLog history;
    private final FrequencyTrendAdjuster frequency;
    private final ProactiveScheduler proactive;
    private final MessageFormatter formatter;
    private final ReplyGenerator generator;
    private final DeliveryTransport transport;
    private final EngagementJudge judge;
    private final TrafficJudge trafficJudge;
    private final TimeoutGuard guard;
    private final Clock clock;
    private final Runnable stateChanged;

    /**
     * @param judge        optional secondary veto, may be null
     * @param trafficJudge optional frequency classifier, may be null
     * @param stateChanged called after state worth persisting changed, may be null
     */
    @Builder
    public InboundPipeline(@NonNull AirGateConfig config, @NonNull AdmissionController admission,
            @NonNull PendingBuffer buffer, @NonNull CommitProtocol commits, @NonNull LocalHistoryLog history,
            @NonNull FrequencyTrendAdjuster frequency, @NonNull ProactiveScheduler proactive,
            @NonNull MessageFormatter formatter, @NonNull ReplyGenerator generator,
            @NonNull DeliveryTransport transport, EngagementJudge judge, TrafficJudge trafficJudge,
            @NonNull TimeoutGuard guard, @NonNull Clock clock, Runnable stateChanged) {
        this.config = config;
        this.admission = admission;
        this.buffer = buffer;
        this.commits = commits;
        this.history = history;
        this.frequency = frequency;
        this.proactive = proactive;
        this.formatter = formatter;
        this.generator = generator;
        this.transport = transport;
        this.judge = judge;
        this.trafficJudge = trafficJudge;
        this.guard = guard;
        this.clock = clock;
        this.stateChanged = stateChanged != null ? stateChanged : () -> {
        };
    }

    public PipelineOutcome handle(InboundEvent event) {
        try {
            if (event.fromSelf() || !event.session().isListedIn(config.getEnabledSessions())) {
                return PipelineOutcome.IGNORED;
            }
            PipelineOutcome outcome = process(event);
            sampleFrequency(event.session());
            stateChanged.run();
            return outcome;
        } catch (Exception e) {
            log.error("Unexpected error handling message in {}: {}", event.session(), e.getMessage(), e);
            return PipelineOutcome.NO_REPLY;
        }
    }

    private PipelineOutcome process(InboundEvent event) {
        SessionKey session = event.session();
        String key = session.id();
        var timeouts = config.getTimeouts();

        frequency.recordMessage(key);

        BufferedTurn current = BufferedTurn.user(formatter.format(event), clock.millis(), event.senderId(),
                event.senderName());
        if (event.mediaDescription() != null && !event.mediaDescription().isBlank()) {
            current = current.withMediaDescription(event.mediaDescription());
        }
        buffer.append(key, current);

        // Admission still sees a proactive temporary boost; the user event disarms it afterwards.
        AdmissionDecision decision = admission.evaluate(new AdmissionRequest(session, event.senderId(), event.text(),
                event.directAddress(), event.alreadyHandled()));
        proactive.onUserMessage(session);
        if (!decision.accepted()) {
            history.append(key, current);
            return PipelineOutcome.REJECTED;
        }
        log.info("Accepted message from {} in {} ({})", event.senderId(), session, decision.reason());

        List<BufferedTurn> pending = new ArrayList<>(buffer.snapshot(key));
        pending.remove(current);
        List<ConversationTurn> context = formatter.mergeContext(commits.readCurrent(session), pending);
        String contextText = MessageFormatter.render(context);
        String userContent = current.effectiveContent();

        if (decision.probabilistic() && judge != null && config.getJudge().isEnabled()) {
            String judged = contextText.isEmpty() ? userContent : contextText + "\n\nuser: " + userContent;
            boolean go = guard.call("judge " + key, () -> judge.decide(judged),
                    Duration.ofSeconds(timeouts.getJudgeSeconds())).orElse(false);
            if (!go) {
                log.info("Engagement judge vetoed reply in {}", session);
                history.append(key, current);
                return PipelineOutcome.VETOED;
            }
        }

        String reply = guard.call("generate " + key, () -> generator.generate(contextText, userContent),
                Duration.ofSeconds(timeouts.getGenerationSeconds())).orElse(null);
        if (reply == null || reply.isBlank()) {
            log.info("No reply generated in {}", session);
            return PipelineOutcome.NO_REPLY;
        }
        boolean sent = guard.call("send " + key, () -> transport.send(key, reply),
                Duration.ofSeconds(timeouts.getDeliverySeconds())).orElse(false);
        if (!sent) {
            log.warn("Reply delivery failed in {}", session);
            return PipelineOutcome.NO_REPLY;
        }

        commits.commit(session, current, reply);
        admission.onReplied(key, event.senderId(), event.senderName(), event.text());
        proactive.recordBotReply(session, false);
        history.append(key, List.of(current,
                new BufferedTurn(ConversationTurn.ASSISTANT, reply, clock.millis(), null, null, null)));
        return PipelineOutcome.REPLIED;
    }

    private void sampleFrequency(SessionKey session) {
        String key = session.id();
        if (!frequency.isEnabled() || trafficJudge == null || !frequency.shouldSample(key)) {
            return;
        }
        List<ConversationTurn> durable = commits.readCurrent(session);
        int n = Math.max(1, config.getFrequency().getTranscriptTurns());
        String transcript = MessageFormatter.render(
                durable.size() <= n ? durable : durable.subList(durable.size() - n, durable.size()));
        guard.call("traffic judge " + key, () -> trafficJudge.judge(transcript),
                Duration.ofSeconds(config.getTimeouts().getJudgeSeconds()))
                .ifPresent(j -> frequency.applyJudgment(key, config.getProbability().getInitial(), j));
        frequency.completeSample(key);
    }
}
