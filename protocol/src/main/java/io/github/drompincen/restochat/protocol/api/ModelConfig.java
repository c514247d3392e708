package io.github.drompincen.restochat.protocol.api;

import java.time.Duration;

/**
 * Per-call model settings. Internal staff get near-deterministic answers,
 * customers a little more variety.
 */
public record ModelConfig(
        double temperature,
        Duration timeout
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    public static ModelConfig defaults() {
        return new ModelConfig(0.1, DEFAULT_TIMEOUT);
    }

    public static ModelConfig forPersona(Persona persona) {
        return switch (persona) {
            case INTERNAL -> new ModelConfig(0.1, DEFAULT_TIMEOUT);
            case EXTERNAL -> new ModelConfig(0.3, DEFAULT_TIMEOUT);
        };
    }

    public ModelConfig withTemperature(double temperature) {
        return new ModelConfig(temperature, timeout);
    }
}
