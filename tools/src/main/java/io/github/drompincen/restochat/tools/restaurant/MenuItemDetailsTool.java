package io.github.drompincen.restochat.tools.restaurant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.tools.ToolResult;

import java.sql.Date;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

public class MenuItemDetailsTool extends RestaurantQueryTool {

    private final Clock clock;

    public MenuItemDetailsTool() {
        this(Clock.systemDefaultZone());
    }

    MenuItemDetailsTool(Clock clock) {
        this.clock = clock;
    }

    @Override public String name() { return "get_menu_item_details"; }

    @Override
    public String description() {
        return "Details of one dish on the day's menu: description, price, availability, dietary information and prep time.";
    }

    @Override
    public JsonNode inputSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "dish_name", "string", "Name of the dish");
        property(schema, "menu_date", "string", "Date in YYYY-MM-DD format (defaults to today)");
        outputFormatProperty(schema);
        return schema;
    }

    @Override public Set<Persona> visibility() { return Set.of(Persona.INTERNAL, Persona.EXTERNAL); }

    @Override
    protected ToolResult query(JsonNode args, boolean structured) {
        String dishName = text(args, "dish_name");
        if (dishName == null) {
            throw new IllegalArgumentException("dish_name is required");
        }
        LocalDate date = MenuDates.resolve(text(args, "menu_date"), clock);

        List<ObjectNode> found = rows("""
                SELECT i.dish_name, i.description, i.category, i.price, i.status, i.estimated_prep_time,
                       i.available_quantity, i.spicy_level, i.is_vegetarian, i.is_vegan, i.is_gluten_free,
                       i.calories, m.restaurant_location, m.menu_date
                FROM daily_menu_items i JOIN daily_menus m ON i.menu_id = m.menu_id
                WHERE m.menu_date = ? AND LOWER(i.dish_name) LIKE ?
                ORDER BY CASE WHEN LOWER(i.dish_name) = ? THEN 0 ELSE 1 END, i.dish_name""",
                Date.valueOf(date), like(dishName), dishName.toLowerCase());
        if (found.isEmpty()) {
            return ToolResult.failure("'" + dishName + "' is not on the menu for " + date);
        }

        ObjectNode item = found.get(0);
        if (structured) {
            return ToolResult.success(item);
        }
        StringBuilder sb = new StringBuilder(item.path("dish_name").asText())
                .append(" (").append(item.path("restaurant_location").asText()).append(", ")
                .append(item.path("menu_date").asText()).append(")")
                .append("\n").append(item.path("description").asText())
                .append("\nPrice: $").append(item.path("price").asText())
                .append("\nCategory: ").append(item.path("category").asText())
                .append("\nStatus: ").append(item.path("status").asText())
                .append("\nPrep time: ").append(item.path("estimated_prep_time").asText()).append(" min");
        String tags = QueryDailyMenuTool.dietaryTags(item);
        if (!tags.isEmpty()) sb.append("\nDietary: ").append(tags);
        if (item.path("spicy_level").asInt() > 0) sb.append("\nSpice level: ").append(item.path("spicy_level").asText()).append("/5");
        if (item.hasNonNull("calories")) sb.append("\nCalories: ").append(item.path("calories").asText());
        if (item.path("available_quantity").asInt() > 0) {
            sb.append("\nLimited quantity available: ").append(item.path("available_quantity").asText());
        }
        return ToolResult.success(TextNode.valueOf(sb.toString()));
    }
}
