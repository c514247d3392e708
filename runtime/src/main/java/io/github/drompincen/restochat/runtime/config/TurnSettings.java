package io.github.drompincen.restochat.runtime.config;

import java.time.Duration;

public record TurnSettings(
        int historyWindow,
        int maxSteps,
        Duration lockTimeout,
        Duration modelTimeout,
        Duration toolTimeout,
        boolean suggestionsEnabled,
        boolean memoryToolsEnabled
) {
    public static TurnSettings defaults() {
        return new TurnSettings(20, 16, Duration.ofSeconds(120), Duration.ofSeconds(60),
                Duration.ofSeconds(30), true, true);
    }
}
