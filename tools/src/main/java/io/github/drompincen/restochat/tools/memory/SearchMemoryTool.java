package io.github.drompincen.restochat.tools.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.restochat.persistence.memory.MemoryRepository;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.tools.ToolResult;

import java.util.Set;

public class SearchMemoryTool extends MemoryToolSupport {

    @Override public String name() { return "search_memory"; }

    @Override
    public String description() {
        return "Find memories of this conversation whose content contains the query (case-insensitive).";
    }

    @Override
    public JsonNode inputSchema() {
        ObjectNode schema = schema();
        props(schema).putObject("query").put("type", "string").put("description", "Text to look for");
        props(schema).putObject("limit").put("type", "integer")
                .put("description", "Maximum entries, default " + MemoryRepository.DEFAULT_SEARCH_LIMIT);
        schema.putArray("required").add("query");
        return schema;
    }

    @Override public Set<Persona> visibility() { return Set.of(Persona.INTERNAL, Persona.EXTERNAL); }

    @Override
    protected ToolResult run(String threadId, JsonNode input) {
        String query = input.path("query").asText("").trim();
        if (query.isEmpty()) {
            return ToolResult.failure("query is required");
        }
        int limit = Math.max(1, intArg(input, "limit", MemoryRepository.DEFAULT_SEARCH_LIMIT));
        return ToolResult.success(listing(memoryRepository.search(threadId, query, limit)));
    }
}
