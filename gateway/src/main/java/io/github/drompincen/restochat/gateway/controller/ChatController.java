package io.github.drompincen.restochat.gateway.controller;

import io.github.drompincen.restochat.protocol.api.ChatReply;
import io.github.drompincen.restochat.protocol.api.ChatRequest;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.agent.ChatService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/chat")
public class ChatController {

    private final ChatService chatService;

    public ChatController(ChatService chatService) {
        this.chatService = chatService;
    }

    @PostMapping
    public ResponseEntity<?> chat(@RequestBody ChatRequest request) {
        if (request.text() == null || request.text().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "text is required"));
        }
        Persona persona;
        try {
            persona = Persona.parse(request.persona());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        String threadId = ChatService.resolveThreadId(request.threadId(), persona);
        String reply = chatService.processTurn(request.text(), threadId, persona);
        return ResponseEntity.ok(new ChatReply(threadId, reply));
    }

    /** Starts an isolated conversation; the previous thread is left untouched. */
    @PostMapping("/sessions")
    public ResponseEntity<?> newSession(@RequestParam String persona) {
        try {
            Persona p = Persona.parse(persona);
            return ResponseEntity.ok(Map.of("threadId", ChatService.newSessionId(p), "persona", p.name().toLowerCase()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
