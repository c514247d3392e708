package io.github.drompincen.restochat.persistence.memory;

import io.github.drompincen.restochat.protocol.api.MemoryDto;
import io.github.drompincen.restochat.protocol.api.MemorySource;

import java.time.Instant;
import java.util.List;

/**
 * One durable fact. {@code content} is {@code key:value}; records are never updated, a later
 * record with the same key supersedes an older one.
 */
public record MemoryRecord(
        String id,
        String threadId,
        String content,
        List<String> tags,
        int importance,
        MemorySource source,
        Instant createdAt,
        Instant updatedAt
) {
    public MemoryRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /** Part before the first colon, or empty for free-form content. */
    public String key() {
        int idx = content.indexOf(':');
        return idx > 0 ? content.substring(0, idx).trim() : "";
    }

    public String value() {
        int idx = content.indexOf(':');
        return idx > 0 ? content.substring(idx + 1).trim() : content.trim();
    }

    public MemoryDto toDto() {
        return new MemoryDto(id, threadId, content, tags, importance, source, createdAt, updatedAt);
    }
}
