package io.github.drompincen.restochat.protocol.api;

import java.util.Locale;

/**
 * Caller role of a conversation thread. Fixes the tool whitelist and the prompt behavior,
 * and never changes for the life of a thread.
 */
public enum Persona {
    INTERNAL("internal_staff_session"),
    EXTERNAL("customer_session");

    private final String defaultThreadId;

    Persona(String defaultThreadId) {
        this.defaultThreadId = defaultThreadId;
    }

    public String defaultThreadId() {
        return defaultThreadId;
    }

    /**
     * Lenient parse used by the REST layer: accepts the enum name in any case
     * plus the "staff" / "customer" aliases.
     */
    public static Persona parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("persona is required");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "internal", "staff" -> INTERNAL;
            case "external", "customer" -> EXTERNAL;
            default -> throw new IllegalArgumentException("Unknown persona: " + value);
        };
    }
}
