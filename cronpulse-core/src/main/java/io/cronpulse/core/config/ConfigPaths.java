package io.cronpulse.core.config;

import java.nio.file.Path;
import java.util.Map;

public final class ConfigPaths {
    static final String CONFIG_ENV = "CRONPULSE_CONFIG";
    static final String DB_PATH_ENV = "CRONPULSE_DB_PATH";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return defaultConfigPath(System.getenv());
    }

    public static Path defaultConfigPath(Map<String, String> env) {
        String raw = env(env, CONFIG_ENV);
        if (raw == null) {
            return Path.of(System.getProperty("user.home"), ".cronpulse", "config.json");
        }
        return expand(raw);
    }

    public static Path resolveDatabase(String configuredPath) {
        return resolveDatabase(configuredPath, System.getenv());
    }

    // CRONPULSE_DB_PATH wins over the configured path.
    public static Path resolveDatabase(String configuredPath, Map<String, String> env) {
        String raw = env(env, DB_PATH_ENV);
        if (raw != null) {
            return expand(raw);
        }
        if (configuredPath == null || configuredPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".cronpulse", "cronpulse.db");
        }
        return expand(configuredPath.trim());
    }

    static Path expand(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    private static String env(Map<String, String> env, String key) {
        String value = env.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
