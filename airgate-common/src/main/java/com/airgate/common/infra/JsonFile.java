package com.airgate.common.infra;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.UUID;

/**
 * JSON file load/save with owner-only permissions and atomic replace.
 */
public final class JsonFile {

    private JsonFile() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Load and parse a JSON file.
     *
     * @return the parsed value, or null if the file does not exist
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static <T> T load(Path path, TypeReference<T> type) throws IOException {
        if (!Files.exists(path))
            return null;
        String raw = Files.readString(path, StandardCharsets.UTF_8);
        return MAPPER.readValue(raw, type);
    }

    /**
     * Save data as a JSON file. The content is written to a temp file in the
     * same directory and moved over the target, so readers never see a partial
     * document.
     */
    public static void save(Path path, Object data) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        String json = MAPPER.writeValueAsString(data) + "\n";
        Path tmp = dir != null
                ? dir.resolve(path.getFileName() + "." + UUID.randomUUID() + ".tmp")
                : Path.of(path.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.writeString(tmp, json, StandardCharsets.UTF_8);

        try {
            Set<PosixFilePermission> perms = PosixFilePermissions.fromString("rw-------");
            Files.setPosixFilePermissions(tmp, perms);
        } catch (UnsupportedOperationException ignored) {
            // Non-POSIX (e.g. Windows)
        }
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
