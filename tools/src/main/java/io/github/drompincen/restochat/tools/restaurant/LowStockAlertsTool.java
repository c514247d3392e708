package io.github.drompincen.restochat.tools.restaurant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.tools.ToolResult;

import java.util.List;
import java.util.Set;

public class LowStockAlertsTool extends RestaurantQueryTool {

    @Override public String name() { return "get_low_stock_alerts"; }

    @Override
    public String description() {
        return "List every item flagged as low stock with the shortage against its minimum level and the supplier to reorder from.";
    }

    @Override
    public JsonNode inputSchema() {
        ObjectNode schema = objectSchema();
        outputFormatProperty(schema);
        return schema;
    }

    @Override public Set<Persona> visibility() { return Set.of(Persona.INTERNAL); }

    @Override
    protected ToolResult query(JsonNode args, boolean structured) {
        List<ObjectNode> items = rows("""
                SELECT item_id, item_name, category, current_stock, minimum_stock,
                       minimum_stock - current_stock AS shortage, unit, supplier, storage_location
                FROM storage_items WHERE is_low_stock = TRUE
                ORDER BY minimum_stock - current_stock DESC, item_name""");
        return listResult(structured, "Low stock alerts (" + items.size() + "):",
                "No low stock alerts. All items are adequately stocked.", items,
                i -> String.format("- %s: %s %s left, minimum %s (short %s), supplier %s",
                        i.path("item_name").asText(), i.path("current_stock").asText(),
                        i.path("unit").asText(), i.path("minimum_stock").asText(),
                        i.path("shortage").asText(), i.path("supplier").asText()));
    }
}
