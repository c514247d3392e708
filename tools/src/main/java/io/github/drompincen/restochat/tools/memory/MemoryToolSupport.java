package io.github.drompincen.restochat.tools.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.restochat.persistence.memory.MemoryRecord;
import io.github.drompincen.restochat.persistence.memory.MemoryRepository;
import io.github.drompincen.restochat.runtime.tools.Tool;
import io.github.drompincen.restochat.runtime.tools.ToolContext;
import io.github.drompincen.restochat.runtime.tools.ToolResult;

import java.util.List;

/**
 * Memory tools always act on the conversation they are called from; the thread id comes
 * from the {@link ToolContext}, never from model-supplied arguments.
 */
public abstract class MemoryToolSupport implements Tool {

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    protected MemoryRepository memoryRepository;

    public void setMemoryRepository(MemoryRepository memoryRepository) {
        this.memoryRepository = memoryRepository;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (memoryRepository == null) {
            return ToolResult.failure("Memory repository not available");
        }
        return run(ctx.threadId(), input != null ? input : MAPPER.createObjectNode());
    }

    protected abstract ToolResult run(String threadId, JsonNode input);

    protected static ObjectNode schema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        return schema;
    }

    protected static ObjectNode props(ObjectNode schema) {
        return (ObjectNode) schema.get("properties");
    }

    protected static int intArg(JsonNode input, String field, int fallback) {
        JsonNode node = input.get(field);
        if (node == null || node.isNull()) return fallback;
        if (node.canConvertToInt()) return node.asInt();
        try {
            return Integer.parseInt(node.asText().trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    protected static ObjectNode listing(List<MemoryRecord> records) {
        ObjectNode out = MAPPER.createObjectNode();
        out.put("count", records.size());
        ArrayNode items = out.putArray("memories");
        for (MemoryRecord r : records) {
            ObjectNode item = items.addObject();
            item.put("id", r.id());
            item.put("content", r.content());
            ArrayNode tags = item.putArray("tags");
            r.tags().forEach(tags::add);
            item.put("importance", r.importance());
            item.put("source", r.source().name().toLowerCase());
            item.put("updated_at", r.updatedAt().toString());
        }
        return out;
    }
}
