package io.github.drompincen.restochat.tools.restaurant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.tools.ToolContext;
import io.github.drompincen.restochat.runtime.tools.ToolResult;
import io.github.drompincen.restochat.tools.RestaurantTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.assertj.core.api.Assertions.assertThat;

class RecipeToolsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ToolContext CTX = new ToolContext("internal_staff_session", Persona.INTERNAL);

    private QueryRecipesTool recipes;
    private RecipeDetailsTool details;

    @BeforeEach
    void setUp() {
        JdbcTemplate jdbc = RestaurantTestData.seededDatabase();
        recipes = new QueryRecipesTool();
        recipes.setJdbcTemplate(jdbc);
        details = new RecipeDetailsTool();
        details.setJdbcTemplate(jdbc);
    }

    @Test
    void filtersByCuisinePrepTimeAndDifficulty() {
        assertThat(recipes.execute(CTX, MAPPER.createObjectNode().put("cuisine_filter", "italian"))
                .output().path("count").asInt()).isEqualTo(2);

        JsonNode quick = recipes.execute(CTX, MAPPER.createObjectNode().put("max_prep_time", 30)).output();
        assertThat(quick.path("count").asInt()).isEqualTo(1);
        assertThat(quick.path("items").get(0).path("dish_name").asText()).isEqualTo("Margherita Pizza");

        JsonNode hard = recipes.execute(CTX, MAPPER.createObjectNode().put("difficulty_level", "3")).output();
        assertThat(hard.path("items").get(0).path("dish_name").asText()).isEqualTo("Tiramisu");
    }

    @Test
    void detailsByIdIncludeIngredientsStepsAndAllergens() {
        ToolResult result = details.execute(CTX, MAPPER.createObjectNode().put("recipe_id", "r1"));

        assertThat(result.success()).isTrue();
        JsonNode out = result.output();
        assertThat(out.path("dish_name").asText()).isEqualTo("Margherita Pizza");
        assertThat(out.path("ingredients")).hasSize(2);
        assertThat(out.path("instructions")).hasSize(3);
        assertThat(out.path("allergens").get(0).asText()).isEqualTo("gluten");
        assertThat(out.path("allergens").get(1).asText()).isEqualTo("dairy");
    }

    @Test
    void detailsByDishNameWhenNoIdGiven() {
        ToolResult result = details.execute(CTX, MAPPER.createObjectNode().put("dish_name", "tiramisu"));

        assertThat(result.output().path("recipe_id").asText()).isEqualTo("r2");
        assertThat(result.output().path("ingredients")).isEmpty();
    }

    @Test
    void detailsNeedIdOrName() {
        ToolResult result = details.execute(CTX, MAPPER.createObjectNode());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("recipe_id or dish_name is required");
    }

    @Test
    void unknownRecipeIsAFailure() {
        ToolResult result = details.execute(CTX, MAPPER.createObjectNode().put("recipe_id", "r99"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Recipe 'r99' not found");
    }

    @Test
    void textDetailsNumberTheSteps() {
        ToolResult result = details.execute(CTX, MAPPER.createObjectNode()
                .put("recipe_id", "r1").put("output_format", "text"));

        assertThat(result.outputText())
                .startsWith("Recipe: Margherita Pizza (Italian, main)")
                .contains("1. Stretch the dough")
                .contains("3. Bake at 450C")
                .contains("Mozzarella (fresh)")
                .contains("Allergens: gluten, dairy");
    }
}
