package io.github.drompincen.restochat.gateway.controller;

import io.github.drompincen.restochat.persistence.memory.MemoryRecord;
import io.github.drompincen.restochat.persistence.memory.MemoryRepository;
import io.github.drompincen.restochat.protocol.api.MemoryDto;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/threads/{threadId}/memories")
public class MemoryController {

    private final MemoryRepository memoryRepository;

    public MemoryController(MemoryRepository memoryRepository) {
        this.memoryRepository = memoryRepository;
    }

    @GetMapping
    public List<MemoryDto> list(@PathVariable String threadId,
                                @RequestParam(required = false) String query,
                                @RequestParam(defaultValue = "0") int limit) {
        List<MemoryRecord> records = query != null && !query.isBlank()
                ? memoryRepository.search(threadId, query, limit)
                : memoryRepository.list(threadId, limit);
        return records.stream().map(MemoryRecord::toDto).toList();
    }

    @DeleteMapping("/{memoryId}")
    public ResponseEntity<?> delete(@PathVariable String threadId, @PathVariable String memoryId) {
        return memoryRepository.delete(threadId, memoryId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
