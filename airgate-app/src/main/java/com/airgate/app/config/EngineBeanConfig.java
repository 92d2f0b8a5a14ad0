package com.airgate.app.config;

import com.airgate.autoreply.MessageFormatter;
import com.airgate.autoreply.admission.AdmissionController;
import com.airgate.autoreply.admission.TriggerMatcher;
import com.airgate.autoreply.attention.AttentionStore;
import com.airgate.autoreply.buffer.LocalHistoryLog;
import com.airgate.autoreply.buffer.PendingBuffer;
import com.airgate.autoreply.frequency.FrequencyTrendAdjuster;
import com.airgate.autoreply.proactive.ProactiveScheduler;
import com.airgate.autoreply.proactive.ProactiveStateTable;
import com.airgate.autoreply.probability.ProbabilityState;
import com.airgate.autoreply.state.EngineStateStore;
import com.airgate.autoreply.state.StateSaver;
import com.airgate.common.config.AirGateConfig;
import com.airgate.common.config.ConfigPaths;
import com.airgate.common.config.ConfigService;
import com.airgate.common.infra.TimeoutGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Spring configuration for the engagement engine's stateful components.
 * <p>
 * Host collaborators (conversation store, reply generator, transport and
 * the optional judges) are not declared here; the embedding application
 * contributes them as beans.
 */
@Slf4j
@Configuration
public class EngineBeanConfig {

    @Bean
    public ConfigService configService(@Value("${airgate.config-path:}") String configPath) {
        Path path = configPath.isBlank() ? ConfigPaths.resolveConfigPath() : Path.of(configPath);
        log.info("Using config file {}", path);
        return new ConfigService(path);
    }

    @Bean
    public AirGateConfig airGateConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(destroyMethod = "")
    public TimeoutGuard timeoutGuard() {
        return new TimeoutGuard("airgate-io");
    }

    // =========================================================================
    // Engagement state
    // =========================================================================

    @Bean
    public AttentionStore attentionStore(AirGateConfig config, Clock clock) {
        return new AttentionStore(config.getAttention(), clock);
    }

    @Bean
    public ProbabilityState probabilityState(Clock clock) {
        return new ProbabilityState(clock);
    }

    @Bean
    public FrequencyTrendAdjuster frequencyTrendAdjuster(AirGateConfig config, Clock clock) {
        return new FrequencyTrendAdjuster(config.getFrequency(), clock);
    }

    @Bean
    public PendingBuffer pendingBuffer(AirGateConfig config, Clock clock) {
        return new PendingBuffer(config.getBuffer(), clock);
    }

    @Bean
    public ProactiveStateTable proactiveStateTable() {
        return new ProactiveStateTable();
    }

    // =========================================================================
    // Persistence
    // =========================================================================

    @Bean
    public Path stateDir(AirGateConfig config) {
        return ConfigPaths.resolveStateDir(config);
    }

    @Bean
    public LocalHistoryLog localHistoryLog(AirGateConfig config, Path stateDir) {
        return new LocalHistoryLog(stateDir.resolve("history"), config.getBuffer().getLocalHistoryMaxLines());
    }

    @Bean
    public EngineStateStore engineStateStore(Path stateDir, AttentionStore attentionStore,
            ProactiveStateTable proactiveStateTable, Clock clock) {
        return new EngineStateStore(stateDir, attentionStore, proactiveStateTable, clock);
    }

    @Bean(destroyMethod = "")
    public StateSaver stateSaver(AirGateConfig config, EngineStateStore engineStateStore) {
        return new StateSaver(engineStateStore, config.getState().getSaveDebounceSeconds());
    }

    // =========================================================================
    // Decision components
    // =========================================================================

    @Bean(destroyMethod = "")
    public ProactiveScheduler proactiveScheduler(AirGateConfig config, ProactiveStateTable proactiveStateTable,
            Clock clock, StateSaver stateSaver) {
        return new ProactiveScheduler(config.getProactive(), proactiveStateTable, clock,
                () -> ThreadLocalRandom.current().nextDouble(), stateSaver::requestSave);
    }

    @Bean
    public MessageFormatter messageFormatter(AirGateConfig config, Clock clock) {
        return new MessageFormatter(config.getMessage(), clock.getZone());
    }

    @Bean
    public AdmissionController admissionController(AirGateConfig config, ProbabilityState probabilityState,
            AttentionStore attentionStore, FrequencyTrendAdjuster frequencyTrendAdjuster,
            ProactiveScheduler proactiveScheduler) {
        TriggerMatcher triggers = new TriggerMatcher(config.getTriggers().getKeywords());
        return new AdmissionController(config.getProbability(), probabilityState, attentionStore,
                frequencyTrendAdjuster, triggers, proactiveScheduler::tempBoost,
                () -> ThreadLocalRandom.current().nextDouble());
    }
}
