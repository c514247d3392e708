package io.github.drompincen.restochat.runtime.tools;

import io.github.drompincen.restochat.protocol.api.Persona;

public record ToolContext(
        String threadId,
        Persona persona
) {}
