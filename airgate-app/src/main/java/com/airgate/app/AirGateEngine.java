package com.airgate.app;

import com.airgate.autoreply.InboundEvent;
import com.airgate.autoreply.InboundPipeline;
import com.airgate.autoreply.MessageFormatter;
import com.airgate.autoreply.PipelineOutcome;
import com.airgate.autoreply.admission.AdmissionController;
import com.airgate.autoreply.buffer.CommitProtocol;
import com.airgate.autoreply.buffer.LocalHistoryLog;
import com.airgate.autoreply.buffer.PendingBuffer;
import com.airgate.autoreply.frequency.FrequencyTrendAdjuster;
import com.airgate.autoreply.proactive.ProactiveOriginator;
import com.airgate.autoreply.proactive.ProactiveScheduler;
import com.airgate.autoreply.spi.ConversationStore;
import com.airgate.autoreply.spi.DeliveryTransport;
import com.airgate.autoreply.spi.EngagementJudge;
import com.airgate.autoreply.spi.ReplyGenerator;
import com.airgate.autoreply.spi.TrafficJudge;
import com.airgate.autoreply.state.EngineStateStore;
import com.airgate.autoreply.state.StateSaver;
import com.airgate.common.config.AirGateConfig;
import com.airgate.common.infra.TimeoutGuard;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Engine lifecycle: restores persisted state on startup, wires the inbound
 * pipeline and the proactive originator once the host's collaborators are
 * known, starts the proactive loop when the application is ready, and
 * flushes state on shutdown.
 * <p>
 * The pipeline is only assembled when a {@link ConversationStore},
 * {@link ReplyGenerator} and {@link DeliveryTransport} are all available.
 * Without them {@link #handle} ignores every event.
 */
@Slf4j
@Component
public class AirGateEngine {

    private final AirGateConfig config;
    private final EngineStateStore stateStore;
    private final StateSaver saver;
    private final ProactiveScheduler scheduler;
    private final TimeoutGuard guard;
    private final InboundPipeline pipeline;

    public AirGateEngine(AirGateConfig config, AdmissionController admission, PendingBuffer buffer,
            LocalHistoryLog history, FrequencyTrendAdjuster frequency, ProactiveScheduler scheduler,
            MessageFormatter formatter, EngineStateStore stateStore, StateSaver saver, TimeoutGuard guard,
            Clock clock, ObjectProvider<ConversationStore> stores, ObjectProvider<ReplyGenerator> generators,
            ObjectProvider<DeliveryTransport> transports, ObjectProvider<EngagementJudge> judges,
            ObjectProvider<TrafficJudge> trafficJudges) {
        this.config = config;
        this.stateStore = stateStore;
        this.saver = saver;
        this.scheduler = scheduler;
        this.guard = guard;

        ConversationStore store = stores.getIfAvailable();
        ReplyGenerator generator = generators.getIfAvailable();
        DeliveryTransport transport = transports.getIfAvailable();
        if (store == null || generator == null || transport == null) {
            log.warn("Engine not wired: conversation store={}, reply generator={}, transport={}",
                    store != null, generator != null, transport != null);
            this.pipeline = null;
            return;
        }

        AirGateConfig.TimeoutConfig timeouts = config.getTimeouts();
        CommitProtocol commits = new CommitProtocol(store, buffer, guard,
                Duration.ofSeconds(timeouts.getStoreSeconds()), clock);
        this.pipeline = InboundPipeline.builder()
                .config(config)
                .admission(admission)
                .buffer(buffer)
                .commits(commits)
                .history(history)
                .frequency(frequency)
                .proactive(scheduler)
                .formatter(formatter)
                .generator(generator)
                .transport(transport)
                .judge(judges.getIfAvailable())
                .trafficJudge(trafficJudges.getIfAvailable())
                .guard(guard)
                .clock(clock)
                .stateChanged(saver::requestSave)
                .build();
        scheduler.setOriginator(new ProactiveOriginator(generator, transport, commits, buffer, history,
                formatter, guard, Duration.ofSeconds(timeouts.getGenerationSeconds()),
                Duration.ofSeconds(timeouts.getDeliverySeconds()), clock));
    }

    @PostConstruct
    public void init() {
        stateStore.load();
        log.info("Engine state loaded from {}", stateStore.getDir());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (scheduler.start()) {
            log.info("Proactive loop started (every {}s)", config.getProactive().getCheckIntervalSeconds());
        } else {
            log.info("Proactive loop not started");
        }
    }

    public boolean isWired() {
        return pipeline != null;
    }

    /**
     * Process one inbound message. Never throws.
     */
    public PipelineOutcome handle(InboundEvent event) {
        if (pipeline == null) {
            return PipelineOutcome.IGNORED;
        }
        return pipeline.handle(event);
    }

    @PreDestroy
    public void shutdown() {
        scheduler.close();
        saver.close();
        guard.close();
        log.info("Engine stopped, state saved to {}", stateStore.getDir());
    }
}
