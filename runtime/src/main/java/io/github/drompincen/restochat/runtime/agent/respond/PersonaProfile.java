package io.github.drompincen.restochat.runtime.agent.respond;

import io.github.drompincen.restochat.protocol.api.ModelConfig;
import io.github.drompincen.restochat.protocol.api.Persona;

import java.util.Set;

/** Prompt, model settings and tool whitelist for one persona. */
public record PersonaProfile(
        Persona persona,
        String systemPrompt,
        ModelConfig modelConfig,
        Set<String> toolWhitelist
) {
    public PersonaProfile {
        toolWhitelist = Set.copyOf(toolWhitelist);
    }
}
