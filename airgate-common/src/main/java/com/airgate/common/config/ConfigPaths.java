package com.airgate.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration paths: state directory and config file.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    private static final String STATE_DIRNAME = ".airgate";
    private static final String CONFIG_FILENAME = "airgate.json";

    /**
     * State directory for persisted engine state and local history.
     * Can be overridden via AIRGATE_STATE_DIR.
     * Default: ~/.airgate
     */
    public static Path resolveStateDir() {
        return resolveStateDir(System.getenv(), homeDir());
    }

    public static Path resolveStateDir(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, "AIRGATE_STATE_DIR");
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return Path.of(homedir, STATE_DIRNAME);
    }

    /**
     * State directory from config, falling back to the environment/default.
     */
    public static Path resolveStateDir(AirGateConfig config) {
        if (config != null && config.getState() != null) {
            String dir = config.getState().getDir();
            if (dir != null && !dir.isBlank()) {
                return resolveUserPath(dir.trim(), homeDir());
            }
        }
        return resolveStateDir();
    }

    /**
     * Config file path. AIRGATE_CONFIG_PATH wins over the state directory.
     */
    public static Path resolveConfigPath() {
        Map<String, String> env = System.getenv();
        String homedir = homeDir();
        return resolveConfigPath(env, resolveStateDir(env, homedir), homedir);
    }

    public static Path resolveConfigPath(Map<String, String> env, Path stateDir, String homedir) {
        String override = envTrimmed(env, "AIRGATE_CONFIG_PATH");
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return stateDir.resolve(CONFIG_FILENAME);
    }

    static Path resolveUserPath(String raw, String homedir) {
        if (raw.startsWith("~")) {
            return Path.of(homedir + raw.substring(1));
        }
        return Path.of(raw).toAbsolutePath();
    }

    private static String envTrimmed(Map<String, String> env, String key) {
        String value = env.get(key);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String homeDir() {
        return System.getProperty("user.home");
    }
}
