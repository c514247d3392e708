package io.github.drompincen.restochat.runtime.memory;

public record ExtractedFact(
        String key,
        String value,
        int importance
) {
    public String content() {
        return key + ":" + value;
    }
}
