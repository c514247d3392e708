package io.github.drompincen.restochat.tools.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.tools.ToolResult;

import java.util.Set;

public class DeleteMemoryTool extends MemoryToolSupport {

    @Override public String name() { return "delete_memory"; }

    @Override
    public String description() {
        return "Forget one memory of this conversation by id.";
    }

    @Override
    public JsonNode inputSchema() {
        ObjectNode schema = schema();
        props(schema).putObject("memory_id").put("type", "string").put("description", "Id returned by save_memory or list_memories");
        schema.putArray("required").add("memory_id");
        return schema;
    }

    @Override public Set<Persona> visibility() { return Set.of(Persona.INTERNAL); }

    @Override
    protected ToolResult run(String threadId, JsonNode input) {
        String id = input.path("memory_id").asText("").trim();
        if (id.isEmpty()) {
            return ToolResult.failure("memory_id is required");
        }
        return ToolResult.success(TextNode.valueOf(memoryRepository.delete(threadId, id) ? "Deleted." : "Not found."));
    }
}
