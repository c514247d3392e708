package io.github.drompincen.restochat.protocol.api;

public enum Intent {
    CONVERSATIONAL,
    DB_QUERY
}
