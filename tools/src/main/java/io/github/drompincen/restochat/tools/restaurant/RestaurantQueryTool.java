package io.github.drompincen.restochat.tools.restaurant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.restochat.runtime.tools.ReactiveTool;
import io.github.drompincen.restochat.runtime.tools.ToolContext;
import io.github.drompincen.restochat.runtime.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Shared plumbing for the read-only restaurant lookups: argument helpers, row to JSON
 * conversion, and the structured/text output switch. JDBC work runs on the bounded-elastic
 * scheduler when called through {@link #executeReactive}.
 */
public abstract class RestaurantQueryTool implements ReactiveTool {

    private static final Logger log = LoggerFactory.getLogger(RestaurantQueryTool.class);
    protected static final ObjectMapper MAPPER = new ObjectMapper();

    protected JdbcTemplate jdbcTemplate;

    public void setJdbcTemplate(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (jdbcTemplate == null) {
            return ToolResult.failure("Restaurant database not available");
        }
        JsonNode args = input != null ? input : MAPPER.createObjectNode();
        try {
            return query(args, structured(args));
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage());
        } catch (DataAccessException e) {
            log.error("{} query failed", name(), e);
            return ToolResult.failure("database query failed: " + e.getMostSpecificCause().getMessage());
        }
    }

    @Override
    public Mono<ToolResult> executeReactive(ToolContext ctx, JsonNode input) {
        return Mono.fromCallable(() -> execute(ctx, input)).subscribeOn(Schedulers.boundedElastic());
    }

    protected abstract ToolResult query(JsonNode args, boolean structured);

    // --- argument helpers ---

    static boolean structured(JsonNode args) {
        String format = args.path("output_format").asText("structured").toLowerCase(Locale.ROOT);
        return !"text".equals(format);
    }

    protected static String text(JsonNode args, String field) {
        JsonNode node = args.get(field);
        if (node == null || node.isNull()) return null;
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    protected static Double number(JsonNode args, String field) {
        JsonNode node = args.get(field);
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) return node.asDouble();
        String raw = node.asText().trim();
        if (raw.isEmpty()) return null;
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " must be a number, got '" + raw + "'");
        }
    }

    protected static boolean flag(JsonNode args, String field) {
        JsonNode node = args.get(field);
        if (node == null || node.isNull()) return false;
        if (node.isBoolean()) return node.asBoolean();
        String raw = node.asText().trim().toLowerCase(Locale.ROOT);
        return raw.equals("true") || raw.equals("yes") || raw.equals("1");
    }

    protected static String like(String value) {
        return "%" + value.toLowerCase(Locale.ROOT) + "%";
    }

    // --- schema helpers ---

    protected static ObjectNode objectSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        return schema;
    }

    protected static void property(ObjectNode schema, String name, String type, String description) {
        ((ObjectNode) schema.get("properties")).putObject(name).put("type", type).put("description", description);
    }

    protected static void outputFormatProperty(ObjectNode schema) {
        property(schema, "output_format", "string", "'structured' (default) for JSON rows or 'text' for a readable list");
    }

    // --- row helpers ---

    protected List<ObjectNode> rows(String sql, Object... params) {
        List<Map<String, Object>> raw = jdbcTemplate.queryForList(sql, params);
        return raw.stream().map(RestaurantQueryTool::toJson).toList();
    }

    /** Column names lower-cased; dates as ISO strings; decimals kept exact. */
    static ObjectNode toJson(Map<String, Object> row) {
        ObjectNode node = MAPPER.createObjectNode();
        row.forEach((column, value) -> {
            String key = column.toLowerCase(Locale.ROOT);
            if (value == null) node.putNull(key);
            else if (value instanceof BigDecimal d) node.put(key, d);
            else if (value instanceof Number n) node.put(key, n.doubleValue() == n.longValue() ? n.longValue() : n.doubleValue());
            else if (value instanceof Boolean b) node.put(key, b);
            else if (value instanceof Date d) node.put(key, d.toLocalDate().toString());
            else if (value instanceof Timestamp t) node.put(key, t.toInstant().toString());
            else node.put(key, value.toString());
        });
        return node;
    }

    /**
     * Wraps rows as {@code {"count": n, "items": [...]}} or renders them with {@code line}
     * under {@code title}.
     */
    protected ToolResult listResult(boolean structured, String title, String emptyMessage,
                                    List<ObjectNode> items, Function<ObjectNode, String> line) {
        if (structured) {
            ObjectNode out = MAPPER.createObjectNode();
            out.put("count", items.size());
            ArrayNode array = out.putArray("items");
            items.forEach(array::add);
            if (items.isEmpty()) out.put("message", emptyMessage);
            return ToolResult.success(out);
        }
        if (items.isEmpty()) return ToolResult.success(TextNode.valueOf(emptyMessage));
        StringBuilder sb = new StringBuilder(title);
        for (ObjectNode item : items) {
            sb.append("\n").append(line.apply(item));
        }
        return ToolResult.success(TextNode.valueOf(sb.toString()));
    }
}
