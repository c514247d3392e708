package io.github.drompincen.restochat.protocol.api;

/** Who produced a memory record. */
public enum MemorySource {
    USER,
    ASSISTANT,
    TOOL
}
