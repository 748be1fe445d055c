package com.pokeme.shared.config;

import java.time.Duration;

public record WatchdogConfig(Duration interval, Duration idleTimeout) {
    public static WatchdogConfig defaults() {
        return new WatchdogConfig(Duration.ofSeconds(30), Duration.ofSeconds(600));
    }
}
