package io.github.drompincen.restochat.tools.restaurant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.tools.ToolResult;

import java.math.BigDecimal;
import java.sql.Date;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static io.github.drompincen.restochat.tools.restaurant.QueryEmployeesTool.appendLike;

/**
 * The menu served on one day, grouped per location. Visible to guests, so no cost or
 * recipe internals are returned.
 */
public class QueryDailyMenuTool extends RestaurantQueryTool {

    private final Clock clock;

    public QueryDailyMenuTool() {
        this(Clock.systemDefaultZone());
    }

    QueryDailyMenuTool(Clock clock) {
        this.clock = clock;
    }

    @Override public String name() { return "query_daily_menu"; }

    @Override
    public String description() {
        return "Today's (or a given day's) menu, optionally narrowed by location, category, price range or dietary needs.";
    }

    @Override
    public JsonNode inputSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "menu_date", "string", "Date in YYYY-MM-DD format (defaults to today)");
        property(schema, "location", "string", "Restaurant location");
        property(schema, "category_filter", "string", "Category, e.g. 'appetizer', 'main', 'dessert'");
        property(schema, "price_range", "string", "Price range like '10-20'");
        property(schema, "dietary_restrictions", "string", "vegetarian, vegan and/or gluten_free");
        outputFormatProperty(schema);
        return schema;
    }

    @Override public Set<Persona> visibility() { return Set.of(Persona.INTERNAL, Persona.EXTERNAL); }

    @Override
    protected ToolResult query(JsonNode args, boolean structured) {
        LocalDate date = MenuDates.resolve(text(args, "menu_date"), clock);

        StringBuilder sql = new StringBuilder("""
                SELECT m.restaurant_location, m.special_offers, m.chef_recommendation,
                       i.menu_item_id, i.dish_name, i.description, i.category, i.price, i.status,
                       i.estimated_prep_time, i.available_quantity, i.spicy_level,
                       i.is_vegetarian, i.is_vegan, i.is_gluten_free, i.calories
                FROM daily_menus m JOIN daily_menu_items i ON i.menu_id = m.menu_id
                WHERE m.menu_date = ?""");
        List<Object> params = new ArrayList<>();
        params.add(Date.valueOf(date));
        appendLike(sql, params, "m.restaurant_location", text(args, "location"));
        appendLike(sql, params, "i.category", text(args, "category_filter"));

        String priceRange = text(args, "price_range");
        if (priceRange != null) {
            BigDecimal[] bounds = parsePriceRange(priceRange);
            sql.append(" AND i.price BETWEEN ? AND ?");
            params.add(bounds[0]);
            params.add(bounds[1]);
        }
        String dietary = text(args, "dietary_restrictions");
        if (dietary != null) {
            String d = dietary.toLowerCase(Locale.ROOT);
            if (d.contains("vegetarian")) sql.append(" AND i.is_vegetarian = TRUE");
            if (d.contains("vegan")) sql.append(" AND i.is_vegan = TRUE");
            if (d.contains("gluten")) sql.append(" AND i.is_gluten_free = TRUE");
        }
        sql.append(" ORDER BY m.restaurant_location, i.category, i.dish_name");

        List<ObjectNode> items = rows(sql.toString(), params.toArray());
        if (items.isEmpty()) {
            String message = "No menu items found for " + date + " with the given filters.";
            return structured
                    ? ToolResult.success(MAPPER.createObjectNode().put("menu_date", date.toString())
                            .put("count", 0).put("message", message))
                    : ToolResult.success(TextNode.valueOf(message));
        }
        return structured ? structuredMenu(date, items) : textMenu(date, items);
    }

    private static ToolResult structuredMenu(LocalDate date, List<ObjectNode> items) {
        ObjectNode out = MAPPER.createObjectNode();
        out.put("menu_date", date.toString());
        out.put("count", items.size());
        ArrayNode locations = out.putArray("locations");
        ObjectNode current = null;
        for (ObjectNode item : items) {
            String location = item.path("restaurant_location").asText();
            if (current == null || !current.path("restaurant_location").asText().equals(location)) {
                current = locations.addObject();
                current.put("restaurant_location", location);
                current.set("special_offers", item.get("special_offers"));
                current.set("chef_recommendation", item.get("chef_recommendation"));
                current.putArray("items");
            }
            ObjectNode copy = item.deepCopy();
            copy.remove(List.of("restaurant_location", "special_offers", "chef_recommendation"));
            ((ArrayNode) current.get("items")).add(copy);
        }
        return ToolResult.success(out);
    }

    private static ToolResult textMenu(LocalDate date, List<ObjectNode> items) {
        StringBuilder sb = new StringBuilder("Menu for ").append(date).append(":");
        String location = null;
        for (ObjectNode item : items) {
            String itemLocation = item.path("restaurant_location").asText();
            if (!itemLocation.equals(location)) {
                location = itemLocation;
                sb.append("\n").append(location);
                if (item.hasNonNull("chef_recommendation")) {
                    sb.append(" (chef recommends ").append(item.path("chef_recommendation").asText()).append(")");
                }
                if (item.hasNonNull("special_offers")) {
                    sb.append("\n  Specials: ").append(item.path("special_offers").asText());
                }
            }
            sb.append("\n- ").append(item.path("dish_name").asText())
                    .append(" $").append(item.path("price").asText())
                    .append(" [").append(item.path("category").asText()).append(", ")
                    .append(item.path("status").asText()).append("]");
            String tags = dietaryTags(item);
            if (!tags.isEmpty()) sb.append(" ").append(tags);
            sb.append("\n  ").append(item.path("description").asText());
        }
        return ToolResult.success(TextNode.valueOf(sb.toString()));
    }

    static String dietaryTags(ObjectNode item) {
        List<String> tags = new ArrayList<>();
        if (item.path("is_vegetarian").asBoolean()) tags.add("vegetarian");
        if (item.path("is_vegan").asBoolean()) tags.add("vegan");
        if (item.path("is_gluten_free").asBoolean()) tags.add("gluten-free");
        return tags.isEmpty() ? "" : "(" + String.join(", ", tags) + ")";
    }

    static BigDecimal[] parsePriceRange(String raw) {
        String[] parts = raw.replace("$", "").split("-");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid price range '" + raw + "'. Use a format like 10-20");
        }
        try {
            BigDecimal min = new BigDecimal(parts[0].trim());
            BigDecimal max = new BigDecimal(parts[1].trim());
            if (min.compareTo(max) > 0) {
                throw new IllegalArgumentException("Invalid price range '" + raw + "': minimum exceeds maximum");
            }
            return new BigDecimal[]{min, max};
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid price range '" + raw + "'. Use a format like 10-20");
        }
    }
}
