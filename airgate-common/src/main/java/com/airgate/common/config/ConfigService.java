package com.airgate.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches AirGate configuration.
 * A missing or unreadable file yields the defaults; it never fails startup.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, AirGateConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System.getenv());
    }

    public ConfigService(Path configPath, Duration cacheTtl, Map<String, String> env) {
        // Expand ~ to user home directory
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public AirGateConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    private AirGateConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new AirGateConfig());
        }
        try {
            String raw = Files.readString(configPath);
            raw = substituteEnvVars(raw);
            AirGateConfig config = objectMapper.readValue(raw, AirGateConfig.class);
            if (config == null) {
                config = new AirGateConfig();
            }
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}, using defaults", configPath, e);
            return applyDefaults(new AirGateConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Fill in every section left out of the file.
     */
    public static AirGateConfig applyDefaults(AirGateConfig config) {
        if (config.getEnabledSessions() == null) {
            config.setEnabledSessions(new ArrayList<>());
        }
        if (config.getProbability() == null) {
            config.setProbability(new AirGateConfig.ProbabilityConfig());
        }
        if (config.getAttention() == null) {
            config.setAttention(new AirGateConfig.AttentionConfig());
        }
        if (config.getFrequency() == null) {
            config.setFrequency(new AirGateConfig.FrequencyConfig());
        }
        if (config.getBuffer() == null) {
            config.setBuffer(new AirGateConfig.BufferConfig());
        }
        if (config.getTriggers() == null) {
            config.setTriggers(new AirGateConfig.TriggerConfig());
        }
        if (config.getMessage() == null) {
            config.setMessage(new AirGateConfig.MessageConfig());
        }
        if (config.getJudge() == null) {
            config.setJudge(new AirGateConfig.JudgeConfig());
        }
        if (config.getTimeouts() == null) {
            config.setTimeouts(new AirGateConfig.TimeoutConfig());
        }
        if (config.getProactive() == null) {
            config.setProactive(new AirGateConfig.ProactiveConfig());
        }
        AirGateConfig.ProactiveConfig proactive = config.getProactive();
        if (proactive.getEnabledSessions() == null) {
            proactive.setEnabledSessions(new ArrayList<>());
        }
        if (proactive.getQuietHours() == null) {
            proactive.setQuietHours(new AirGateConfig.QuietHoursConfig());
        }
        if (proactive.getTimePeriods() == null) {
            proactive.setTimePeriods(new AirGateConfig.TimePeriodsConfig());
        }
        if (config.getState() == null) {
            config.setState(new AirGateConfig.StateConfig());
        }
        return config;
    }
}
