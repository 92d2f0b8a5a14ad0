package com.airgate.autoreply.state;

import com.airgate.autoreply.attention.AttentionProfile;
import com.airgate.autoreply.attention.AttentionStore;
import com.airgate.autoreply.proactive.ProactiveSessionState;
import com.airgate.autoreply.proactive.ProactiveStateTable;
import com.airgate.common.infra.JsonFile;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Loads and saves the engine tables that survive restarts:
 * {@code attention.json} and {@code proactive.json} under the state directory.
 * <p>
 * A missing file is a cold start. A malformed file is logged and treated as
 * empty so startup never fails on bad state.
 */
@Slf4j
public class EngineStateStore {

    public static final String ATTENTION_FILE = "attention.json";
    public static final String PROACTIVE_FILE = "proactive.json";

    private static final TypeReference<Map<String, List<AttentionProfile>>> ATTENTION_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, ProactiveSessionState>> PROACTIVE_TYPE = new TypeReference<>() {
    };

    private final Path dir;
    private final AttentionStore attention;
    private final ProactiveStateTable proactive;
    private final Clock clock;

    public EngineStateStore(Path dir, AttentionStore attention, ProactiveStateTable proactive, Clock clock) {
        this.dir = dir;
        this.attention = attention;
        this.proactive = proactive;
        this.clock = clock;
    }

    public Path getDir() {
        return dir;
    }

    public void load() {
        Path attentionFile = dir.resolve(ATTENTION_FILE);
        try {
            attention.restore(read(attentionFile, ATTENTION_TYPE));
        } catch (RuntimeException e) {
            log.warn("Ignoring unusable attention state {}: {}", attentionFile, e.toString());
            attention.restore(null);
        }
        Path proactiveFile = dir.resolve(PROACTIVE_FILE);
        try {
            proactive.restore(read(proactiveFile, PROACTIVE_TYPE));
        } catch (RuntimeException e) {
            log.warn("Ignoring unusable proactive state {}: {}", proactiveFile, e.toString());
            proactive.restore(null);
        }
    }

    /** Write both tables. Failures are logged; the in-memory state stays authoritative. */
    public void save() {
        write(dir.resolve(ATTENTION_FILE), attention.snapshot());
        write(dir.resolve(PROACTIVE_FILE), proactive.snapshot(clock.millis()));
    }

    private <T> T read(Path file, TypeReference<T> type) {
        try {
            T value = JsonFile.load(file, type);
            if (value == null) {
                log.debug("No persisted state at {}", file);
            }
            return value;
        } catch (IOException e) {
            log.warn("Ignoring malformed state file {}: {}", file, e.getMessage());
            return null;
        }
    }

    private void write(Path file, Object value) {
        try {
            JsonFile.save(file, value);
        } catch (IOException e) {
            log.warn("Failed to save state to {}: {}", file, e.getMessage());
        }
    }
}
