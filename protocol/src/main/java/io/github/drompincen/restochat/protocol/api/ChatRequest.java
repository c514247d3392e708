package io.github.drompincen.restochat.protocol.api;

public record ChatRequest(
        String text,
        String threadId,
        String persona
) {}
