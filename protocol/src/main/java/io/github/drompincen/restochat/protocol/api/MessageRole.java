package io.github.drompincen.restochat.protocol.api;

public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM,
    TOOL
}
