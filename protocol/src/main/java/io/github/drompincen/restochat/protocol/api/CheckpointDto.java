package io.github.drompincen.restochat.protocol.api;

import java.util.List;

public record CheckpointDto(
        String threadId,
        Persona persona,
        List<ChatMessage> messages,
        String summary
) {}
