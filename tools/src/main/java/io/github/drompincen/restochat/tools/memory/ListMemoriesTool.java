package io.github.drompincen.restochat.tools.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.tools.ToolResult;

import java.util.Set;

public class ListMemoriesTool extends MemoryToolSupport {

    static final int DEFAULT_LIMIT = 20;

    @Override public String name() { return "list_memories"; }

    @Override
    public String description() {
        return "List the most recently updated memories of this conversation.";
    }

    @Override
    public JsonNode inputSchema() {
        ObjectNode schema = schema();
        props(schema).putObject("limit").put("type", "integer").put("description", "Maximum entries, default " + DEFAULT_LIMIT);
        return schema;
    }

    @Override public Set<Persona> visibility() { return Set.of(Persona.INTERNAL); }

    @Override
    protected ToolResult run(String threadId, JsonNode input) {
        int limit = Math.max(1, intArg(input, "limit", DEFAULT_LIMIT));
        return ToolResult.success(listing(memoryRepository.list(threadId, limit)));
    }
}
