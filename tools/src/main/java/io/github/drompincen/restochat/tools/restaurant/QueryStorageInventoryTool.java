package io.github.drompincen.restochat.tools.restaurant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.tools.ToolResult;

import java.sql.Date;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static io.github.drompincen.restochat.tools.restaurant.QueryEmployeesTool.appendLike;

public class QueryStorageInventoryTool extends RestaurantQueryTool {

    private final Clock clock;

    public QueryStorageInventoryTool() {
        this(Clock.systemDefaultZone());
    }

    QueryStorageInventoryTool(Clock clock) {
        this.clock = clock;
    }

    @Override public String name() { return "query_storage_inventory"; }

    @Override
    public String description() {
        return "Search storage inventory by item, category or location; optionally only low-stock or expired items.";
    }

    @Override
    public JsonNode inputSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "item_name_filter", "string", "Part of the item name");
        property(schema, "category_filter", "string", "Category, e.g. 'produce' or 'dairy'");
        property(schema, "location_filter", "string", "Storage location, e.g. 'freezer'");
        property(schema, "low_stock_only", "boolean", "Only items flagged as low stock");
        property(schema, "expired_items_only", "boolean", "Only items past their expiry date");
        outputFormatProperty(schema);
        return schema;
    }

    @Override public Set<Persona> visibility() { return Set.of(Persona.INTERNAL); }

    @Override
    protected ToolResult query(JsonNode args, boolean structured) {
        StringBuilder sql = new StringBuilder("""
                SELECT item_id, item_name, category, current_stock, unit, minimum_stock, maximum_stock,
                       cost_per_unit, supplier, storage_location, expiry_date, last_restocked, is_low_stock
                FROM storage_items WHERE 1=1""");
        List<Object> params = new ArrayList<>();
        appendLike(sql, params, "item_name", text(args, "item_name_filter"));
        appendLike(sql, params, "category", text(args, "category_filter"));
        appendLike(sql, params, "storage_location", text(args, "location_filter"));
        if (flag(args, "low_stock_only")) {
            sql.append(" AND is_low_stock = TRUE");
        }
        if (flag(args, "expired_items_only")) {
            sql.append(" AND expiry_date IS NOT NULL AND expiry_date < ?");
            params.add(Date.valueOf(LocalDate.now(clock)));
        }
        sql.append(" ORDER BY category, item_name");

        List<ObjectNode> items = rows(sql.toString(), params.toArray());
        return listResult(structured, "Found " + items.size() + " inventory item(s):",
                "No inventory items found matching the criteria.", items,
                i -> String.format("- %s (%s, %s): %s %s (min %s)%s%s",
                        i.path("item_name").asText(), i.path("category").asText(),
                        i.path("storage_location").asText(), i.path("current_stock").asText(),
                        i.path("unit").asText(), i.path("minimum_stock").asText(),
                        i.path("is_low_stock").asBoolean() ? " LOW STOCK" : "",
                        i.hasNonNull("expiry_date") ? " expires " + i.path("expiry_date").asText() : ""));
    }
}
