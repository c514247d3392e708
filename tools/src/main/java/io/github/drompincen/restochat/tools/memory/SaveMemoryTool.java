package io.github.drompincen.restochat.tools.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.restochat.protocol.api.MemorySource;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.tools.ToolResult;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public class SaveMemoryTool extends MemoryToolSupport {

    @Override public String name() { return "save_memory"; }

    @Override
    public String description() {
        return "Remember a fact about this conversation's guest or user. Use 'key: value' content, e.g. 'preference: window seats'.";
    }

    @Override
    public JsonNode inputSchema() {
        ObjectNode schema = schema();
        props(schema).putObject("content").put("type", "string").put("description", "The fact to remember");
        props(schema).putObject("tags").put("type", "string").put("description", "Comma-separated tags");
        props(schema).putObject("importance").put("type", "integer").put("description", "1 (trivia) to 5 (critical), default 1");
        schema.putArray("required").add("content");
        return schema;
    }

    @Override public Set<Persona> visibility() { return Set.of(Persona.INTERNAL, Persona.EXTERNAL); }

    @Override
    protected ToolResult run(String threadId, JsonNode input) {
        String content = input.path("content").asText("").trim();
        if (content.isEmpty()) {
            return ToolResult.failure("content is required");
        }
        List<String> tags = Arrays.stream(input.path("tags").asText("").split(","))
                .map(String::trim).filter(t -> !t.isEmpty()).toList();
        int importance = intArg(input, "importance", 1);

        Optional<String> id = memoryRepository.add(threadId, content, tags, importance, MemorySource.TOOL);
        if (id.isEmpty()) {
            return ToolResult.failure("memory could not be saved");
        }
        return ToolResult.success(MAPPER.createObjectNode().put("id", id.get()).put("status", "saved"));
    }
}
