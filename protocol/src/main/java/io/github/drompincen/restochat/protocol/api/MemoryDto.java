package io.github.drompincen.restochat.protocol.api;

import java.time.Instant;
import java.util.List;

public record MemoryDto(
        String id,
        String threadId,
        String content,
        List<String> tags,
        int importance,
        MemorySource source,
        Instant createdAt,
        Instant updatedAt
) {}
