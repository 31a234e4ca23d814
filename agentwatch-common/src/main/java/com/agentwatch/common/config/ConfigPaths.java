package com.agentwatch.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration paths: state directory, config file and the registry store.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    private static final String STATE_DIRNAME = ".agentwatch";
    private static final String CONFIG_FILENAME = "agentwatch.json";
    private static final String REGISTRY_FILENAME = "resume-sessions.json";

    // =========================================================================
    // State directory
    // =========================================================================

    /**
     * State directory for mutable data (registry store, caches).
     * Can be overridden via AGENTWATCH_STATE_DIR.
     * Default: ~/.agentwatch
     */
    public static Path resolveStateDir() {
        return resolveStateDir(System.getenv(), homeDir());
    }

    public static Path resolveStateDir(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, "AGENTWATCH_STATE_DIR");
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return Path.of(homedir, STATE_DIRNAME);
    }

    // =========================================================================
    // Config file path
    // =========================================================================

    /**
     * Config file path. AGENTWATCH_CONFIG_PATH wins over the state directory.
     */
    public static Path resolveConfigPath() {
        return resolveConfigPath(System.getenv(), homeDir());
    }

    public static Path resolveConfigPath(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, "AGENTWATCH_CONFIG_PATH");
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return resolveStateDir(env, homedir).resolve(CONFIG_FILENAME);
    }

    // =========================================================================
    // Registry store
    // =========================================================================

    /**
     * Resolve the registry store file: the configured path if present,
     * otherwise {@code <stateDir>/resume-sessions.json}.
     */
    public static Path resolveRegistryStorePath(String configured) {
        if (configured != null && !configured.isBlank()) {
            return resolveUserPath(configured.trim(), homeDir());
        }
        return resolveStateDir().resolve(REGISTRY_FILENAME);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /**
     * Expand a leading {@code ~} to the given home directory.
     */
    public static Path resolveUserPath(String input, String homedir) {
        String trimmed = input.trim();
        if (trimmed.equals("~")) {
            return Path.of(homedir);
        }
        if (trimmed.startsWith("~/")) {
            return Path.of(homedir, trimmed.substring(2));
        }
        return Path.of(trimmed).toAbsolutePath().normalize();
    }

    private static String homeDir() {
        return System.getProperty("user.home");
    }

    private static String envTrimmed(Map<String, String> env, String key) {
        String value = env.get(key);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
