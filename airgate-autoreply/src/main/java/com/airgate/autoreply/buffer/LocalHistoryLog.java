package com.airgate.autoreply.buffer;

import com.airgate.common.infra.JsonFile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only JSON-lines history per session, kept outside the durable
 * conversation record.
 * <p>
 * Best effort: I/O problems are logged and never thrown. Files are trimmed to
 * the newest {@code maxLines} lines.
 */
@Slf4j
public class LocalHistoryLog {

    private final Path dir;
    private final int maxLines;
    private final ObjectMapper mapper = JsonFile.mapper().copy()
            .disable(SerializationFeature.INDENT_OUTPUT);

    public LocalHistoryLog(Path dir, int maxLines) {
        this.dir = dir;
        this.maxLines = Math.max(1, maxLines);
    }

    public synchronized void append(String session, BufferedTurn turn) {
        append(session, List.of(turn));
    }

    public synchronized void append(String session, List<BufferedTurn> turns) {
        if (turns.isEmpty()) {
            return;
        }
        Path file = fileFor(session);
        try {
            Files.createDirectories(dir);
            StringBuilder sb = new StringBuilder();
            for (BufferedTurn turn : turns) {
                sb.append(mapper.writeValueAsString(turn)).append('\n');
            }
            Files.writeString(file, sb, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            trim(file);
        } catch (IOException e) {
            log.warn("Local history append failed for {}: {}", session, e.getMessage());
        }
    }

    /** Newest {@code limit} entries, oldest first. Unreadable lines are skipped. */
    public synchronized List<BufferedTurn> read(String session, int limit) {
        Path file = fileFor(session);
        if (!Files.exists(file)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Local history read failed for {}: {}", session, e.getMessage());
            return List.of();
        }
        int from = Math.max(0, lines.size() - Math.min(limit, maxLines));
        List<BufferedTurn> out = new ArrayList<>();
        for (String line : lines.subList(from, lines.size())) {
            if (line.isBlank()) {
                continue;
            }
            try {
                out.add(mapper.readValue(line, BufferedTurn.class));
            } catch (JsonProcessingException e) {
                log.debug("Skipping unreadable history line for {}", session);
            }
        }
        return out;
    }

    Path fileFor(String session) {
        return dir.resolve(session.replaceAll("[^A-Za-z0-9._-]", "_") + ".jsonl");
    }

    private void trim(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        if (lines.size() <= maxLines) {
            return;
        }
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.write(tmp, lines.subList(lines.size() - maxLines, lines.size()), StandardCharsets.UTF_8);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
