package io.github.drompincen.restochat.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.restochat.protocol.api.Persona;

import java.util.Set;

public interface Tool {

    String name();

    String description();

    JsonNode inputSchema();

    /** Personas allowed to see this tool at all. */
    Set<Persona> visibility();

    ToolResult execute(ToolContext ctx, JsonNode input);
}
