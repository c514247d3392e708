package io.github.drompincen.restochat.gateway.controller;

import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.protocol.api.ToolDescriptor;
import io.github.drompincen.restochat.runtime.agent.respond.PersonaProfile;
import io.github.drompincen.restochat.runtime.agent.respond.PersonaProfiles;
import io.github.drompincen.restochat.runtime.tools.ToolRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/tools")
public class ToolController {

    private final ToolRegistry toolRegistry;
    private final PersonaProfiles personaProfiles;

    public ToolController(ToolRegistry toolRegistry, PersonaProfiles personaProfiles) {
        this.toolRegistry = toolRegistry;
        this.personaProfiles = personaProfiles;
    }

    /** All registered tools, or only those a persona's conversations may call. */
    @GetMapping
    public ResponseEntity<?> list(@RequestParam(required = false) String persona) {
        if (persona == null || persona.isBlank()) {
            return ResponseEntity.ok(toolRegistry.descriptors());
        }
        try {
            PersonaProfile profile = personaProfiles.get(Persona.parse(persona));
            return ResponseEntity.ok(toolRegistry.forPersona(profile.persona(), profile.toolWhitelist()).stream()
                    .map(ToolRegistry::describe)
                    .toList());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/{name}")
    public ResponseEntity<ToolDescriptor> describe(@PathVariable String name) {
        return toolRegistry.get(name)
                .map(t -> ResponseEntity.ok(ToolRegistry.describe(t)))
                .orElse(ResponseEntity.notFound().build());
    }
}
