package io.github.drompincen.restochat.gateway.controller;

import io.github.drompincen.restochat.persistence.checkpoint.CheckpointStore;
import io.github.drompincen.restochat.protocol.api.CheckpointDto;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/threads/{threadId}/checkpoint")
public class CheckpointController {

    private final CheckpointStore checkpointStore;

    public CheckpointController(CheckpointStore checkpointStore) {
        this.checkpointStore = checkpointStore;
    }

    @GetMapping
    public ResponseEntity<CheckpointDto> get(@PathVariable String threadId) {
        return checkpointStore.get(threadId)
                .map(s -> ResponseEntity.ok(new CheckpointDto(threadId, s.persona(), s.messages(), s.summary())))
                .orElse(ResponseEntity.notFound().build());
    }
}
