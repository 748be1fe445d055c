package com.pokeme.shared.config;

public record PokemeConfig(
    int serverPort,
    WatchdogConfig watchdog,
    StoreLimits limits
) {
    public static final int DEFAULT_PORT = 9131;

    public static PokemeConfig defaults() {
        return new PokemeConfig(DEFAULT_PORT, WatchdogConfig.defaults(), StoreLimits.defaults());
    }
}
