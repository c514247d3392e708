package io.github.drompincen.restochat.protocol.api;

public record ChatReply(
        String threadId,
        String reply
) {}
