package com.airgate.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("airgate.json");
    }

    @Test
    void loadConfig_validJson_overridesDefaults() throws IOException {
        String json = """
                {
                  "probability": { "initial": 0.2, "afterReply": 0.9 },
                  "proactive": {
                    "enabled": true,
                    "quietHours": { "enabled": true, "start": "22:30" }
                  },
                  "someFutureSection": { "ignored": true }
                }
                """;
        Files.writeString(configPath, json);

        AirGateConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(0.2, config.getProbability().getInitial());
        assertEquals(0.9, config.getProbability().getAfterReply());
        assertEquals(300, config.getProbability().getBoostDurationSeconds());
        assertTrue(config.getProactive().isEnabled());
        assertEquals("22:30", config.getProactive().getQuietHours().getStart());
        assertEquals("07:00", config.getProactive().getQuietHours().getEnd());
        assertNotNull(config.getProactive().getTimePeriods());
        assertNotNull(config.getAttention());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        AirGateConfig config = new ConfigService(tempDir.resolve("nonexistent.json")).loadConfig();

        assertNotNull(config);
        assertEquals(0.1, config.getProbability().getInitial());
        assertEquals(10, config.getBuffer().getMaxSize());
        assertEquals(1800, config.getBuffer().getTtlSeconds());
    }

    @Test
    void loadConfig_malformedFile_returnsDefaults() throws IOException {
        Files.writeString(configPath, "{ \"probability\": ");
        AirGateConfig config = new ConfigService(configPath).loadConfig();
        assertEquals(0.1, config.getProbability().getInitial());
    }

    @Test
    void substituteEnvVars_usesEnvThenDefault() throws IOException {
        Files.writeString(configPath, """
                { "state": { "dir": "${AIRGATE_TEST_DIR}" },
                  "proactive": { "prompt": "${__UNLIKELY_VAR_XYZ:-fallback}" } }
                """);
        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200),
                Map.of("AIRGATE_TEST_DIR", "/tmp/airgate"));
        AirGateConfig config = service.loadConfig();
        assertEquals("/tmp/airgate", config.getState().getDir());
        assertEquals("fallback", config.getProactive().getPrompt());
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, "{ \"buffer\": { \"maxSize\": 5 } }");

        ConfigService service = new ConfigService(configPath);
        AirGateConfig first = service.loadConfig();
        AirGateConfig second = service.loadConfig();

        assertSame(first, second);
    }

    @Test
    void configPaths_envOverrides() {
        Path stateDir = ConfigPaths.resolveStateDir(Map.of("AIRGATE_STATE_DIR", "~/custom"), "/home/u");
        assertEquals(Path.of("/home/u/custom"), stateDir);
        assertEquals(Path.of("/home/u/.airgate"), ConfigPaths.resolveStateDir(Map.of(), "/home/u"));
        assertEquals(stateDir.resolve("airgate.json"),
                ConfigPaths.resolveConfigPath(Map.of(), stateDir, "/home/u"));
    }
}
