package com.pokeme.shared.config;

import java.time.Duration;

public record StoreLimits(
    int maxBodyBytes,
    int maxQuestion,
    int maxContext,
    int maxAgent,
    int maxTask,
    int maxCommand,
    int maxAnswer,
    int maxPending,
    Duration answeredTtl
) {
    public static StoreLimits defaults() {
        return new StoreLimits(64 * 1024, 2000, 5000, 100, 200, 2000, 10_000, 100, Duration.ofSeconds(300));
    }
}
