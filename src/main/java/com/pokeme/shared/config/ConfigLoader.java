package com.pokeme.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".pokeme", "config.yaml"
    );

    public static PokemeConfig load() {
        return load(DEFAULT_PATH);
    }

    /** Loads from {@code location}, or from the default path when it is null or blank. */
    public static PokemeConfig load(String location) {
        return location == null || location.isBlank() ? load() : load(Path.of(location));
    }

    @SuppressWarnings("unchecked")
    public static PokemeConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var watchdog = (Map<String, Object>) raw.getOrDefault("watchdog", Map.of());
        var limits = (Map<String, Object>) raw.getOrDefault("limits", Map.of());

        return new PokemeConfig(
            Integer.parseInt(envOrDefault("POKEME_PORT",
                String.valueOf(server.getOrDefault("port", PokemeConfig.DEFAULT_PORT)))),
            parseWatchdogConfig(watchdog),
            parseStoreLimits(limits)
        );
    }

    private static WatchdogConfig parseWatchdogConfig(Map<String, Object> watchdog) {
        var defaults = WatchdogConfig.defaults();
        var idle = envOrDefault("POKEME_IDLE_TIMEOUT",
            String.valueOf(watchdog.getOrDefault("idle-timeout", defaults.idleTimeout().toSeconds())));
        return new WatchdogConfig(
            positive("watchdog.interval", seconds(watchdog.getOrDefault("interval", defaults.interval().toSeconds()))),
            positive("watchdog.idle-timeout", seconds(idle))
        );
    }

    private static StoreLimits parseStoreLimits(Map<String, Object> limits) {
        var def = StoreLimits.defaults();
        return new StoreLimits(
            intValue(limits.getOrDefault("max-body-bytes", def.maxBodyBytes())),
            intValue(limits.getOrDefault("max-question", def.maxQuestion())),
            intValue(limits.getOrDefault("max-context", def.maxContext())),
            intValue(limits.getOrDefault("max-agent", def.maxAgent())),
            intValue(limits.getOrDefault("max-task", def.maxTask())),
            intValue(limits.getOrDefault("max-command", def.maxCommand())),
            intValue(limits.getOrDefault("max-answer", def.maxAnswer())),
            intValue(limits.getOrDefault("max-pending", def.maxPending())),
            seconds(limits.getOrDefault("answered-ttl", def.answeredTtl().toSeconds()))
        );
    }

    private static int intValue(Object value) {
        return Integer.parseInt(String.valueOf(value));
    }

    private static Duration seconds(Object value) {
        return Duration.ofSeconds(Long.parseLong(String.valueOf(value)));
    }

    private static Duration positive(String key, Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(key + " must be a positive number of seconds: " + value.toSeconds());
        }
        return value;
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
