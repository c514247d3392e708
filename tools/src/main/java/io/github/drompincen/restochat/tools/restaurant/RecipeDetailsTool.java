package io.github.drompincen.restochat.tools.restaurant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.tools.ToolResult;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Full recipe with ingredients and numbered steps. Accepts a recipe id or, failing that,
 * a dish name; an exact name match wins over a partial one.
 */
public class RecipeDetailsTool extends RestaurantQueryTool {

    private static final String RECIPE_COLUMNS = """
            SELECT recipe_id, dish_name, category, cuisine_type, difficulty_level, prep_time_minutes,
                   cook_time_minutes, serving_size, instructions, allergens, cost_per_serving
            FROM recipes""";

    @Override public String name() { return "get_recipe_details"; }

    @Override
    public String description() {
        return "Complete recipe for one dish: ingredients with quantities, step-by-step instructions and allergens.";
    }

    @Override
    public JsonNode inputSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "recipe_id", "string", "Recipe identifier");
        property(schema, "dish_name", "string", "Dish name, used when no recipe_id is known");
        outputFormatProperty(schema);
        return schema;
    }

    @Override public Set<Persona> visibility() { return Set.of(Persona.INTERNAL); }

    @Override
    protected ToolResult query(JsonNode args, boolean structured) {
        String recipeId = text(args, "recipe_id");
        String dishName = text(args, "dish_name");
        List<ObjectNode> found;
        if (recipeId != null) {
            found = rows(RECIPE_COLUMNS + " WHERE recipe_id = ?", recipeId);
        } else if (dishName != null) {
            found = rows(RECIPE_COLUMNS + " WHERE LOWER(dish_name) LIKE ?"
                    + " ORDER BY CASE WHEN LOWER(dish_name) = ? THEN 0 ELSE 1 END, dish_name",
                    like(dishName), dishName.toLowerCase());
        } else {
            throw new IllegalArgumentException("recipe_id or dish_name is required");
        }
        if (found.isEmpty()) {
            return ToolResult.failure("Recipe '" + (recipeId != null ? recipeId : dishName) + "' not found");
        }

        ObjectNode recipe = found.get(0);
        List<ObjectNode> ingredients = rows("""
                SELECT ingredient_name, quantity, unit, timing, notes
                FROM recipe_ingredients WHERE recipe_id = ? ORDER BY ingredient_name""",
                recipe.path("recipe_id").asText());
        List<String> steps = splitLines(recipe.path("instructions").asText(""));
        List<String> allergens = splitCsv(recipe.path("allergens").asText(""));

        if (structured) {
            ObjectNode out = recipe.deepCopy();
            out.remove("instructions");
            out.remove("allergens");
            ArrayNode ingredientArray = out.putArray("ingredients");
            ingredients.forEach(ingredientArray::add);
            ArrayNode stepArray = out.putArray("instructions");
            steps.forEach(stepArray::add);
            ArrayNode allergenArray = out.putArray("allergens");
            allergens.forEach(allergenArray::add);
            return ToolResult.success(out);
        }

        StringBuilder sb = new StringBuilder("Recipe: ").append(recipe.path("dish_name").asText())
                .append(" (").append(recipe.path("cuisine_type").asText()).append(", ")
                .append(recipe.path("category").asText()).append(")")
                .append("\nPrep ").append(recipe.path("prep_time_minutes").asText())
                .append(" min, cook ").append(recipe.path("cook_time_minutes").asText())
                .append(" min, serves ").append(recipe.path("serving_size").asText())
                .append(", difficulty ").append(recipe.path("difficulty_level").asText()).append("/5")
                .append("\nIngredients:");
        for (ObjectNode i : ingredients) {
            sb.append("\n- ").append(i.path("quantity").asText()).append(" ").append(i.path("unit").asText())
                    .append(" ").append(i.path("ingredient_name").asText());
            if (i.hasNonNull("notes")) sb.append(" (").append(i.path("notes").asText()).append(")");
        }
        sb.append("\nInstructions:");
        for (int n = 0; n < steps.size(); n++) {
            sb.append("\n").append(n + 1).append(". ").append(steps.get(n));
        }
        if (!allergens.isEmpty()) {
            sb.append("\nAllergens: ").append(String.join(", ", allergens));
        }
        return ToolResult.success(TextNode.valueOf(sb.toString()));
    }

    static List<String> splitLines(String raw) {
        return Arrays.stream(raw.split("\\R")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    static List<String> splitCsv(String raw) {
        return Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }
}
