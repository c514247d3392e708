package io.github.drompincen.restochat.tools.restaurant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.tools.ToolResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static io.github.drompincen.restochat.tools.restaurant.QueryEmployeesTool.appendLike;

public class QueryRecipesTool extends RestaurantQueryTool {

    @Override public String name() { return "query_recipes"; }

    @Override
    public String description() {
        return "Search recipes by dish name, category, cuisine, maximum prep time or difficulty level.";
    }

    @Override
    public JsonNode inputSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "dish_name_filter", "string", "Part of the dish name");
        property(schema, "category_filter", "string", "Category, e.g. 'main' or 'dessert'");
        property(schema, "cuisine_filter", "string", "Cuisine, e.g. 'Italian'");
        property(schema, "max_prep_time", "integer", "Maximum preparation time in minutes");
        property(schema, "difficulty_level", "integer", "Exact difficulty level (1-5)");
        outputFormatProperty(schema);
        return schema;
    }

    @Override public Set<Persona> visibility() { return Set.of(Persona.INTERNAL); }

    @Override
    protected ToolResult query(JsonNode args, boolean structured) {
        StringBuilder sql = new StringBuilder("""
                SELECT recipe_id, dish_name, category, cuisine_type, difficulty_level, prep_time_minutes,
                       cook_time_minutes, serving_size, allergens, cost_per_serving
                FROM recipes WHERE 1=1""");
        List<Object> params = new ArrayList<>();
        appendLike(sql, params, "dish_name", text(args, "dish_name_filter"));
        appendLike(sql, params, "category", text(args, "category_filter"));
        appendLike(sql, params, "cuisine_type", text(args, "cuisine_filter"));
        Double maxPrep = number(args, "max_prep_time");
        if (maxPrep != null) {
            sql.append(" AND prep_time_minutes <= ?");
            params.add(maxPrep.intValue());
        }
        Double difficulty = number(args, "difficulty_level");
        if (difficulty != null) {
            sql.append(" AND difficulty_level = ?");
            params.add(difficulty.intValue());
        }
        sql.append(" ORDER BY dish_name");

        List<ObjectNode> recipes = rows(sql.toString(), params.toArray());
        return listResult(structured, "Found " + recipes.size() + " recipe(s):",
                "No recipes found matching the criteria.", recipes,
                r -> String.format("- %s [%s] (%s, %s) prep %s min, cook %s min, difficulty %s/5",
                        r.path("dish_name").asText(), r.path("recipe_id").asText(),
                        r.path("category").asText(), r.path("cuisine_type").asText(),
                        r.path("prep_time_minutes").asText(), r.path("cook_time_minutes").asText(),
                        r.path("difficulty_level").asText()));
    }
}
