package io.github.drompincen.restochat.runtime.agent.planning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClarificationPolicyTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final ClarificationPolicy policy = new ClarificationPolicy();

    private static QueryPlan plan(String tool, ObjectNode args) {
        return new QueryPlan(tool, args.put("output_format", "structured"));
    }

    @Test
    void singleDishLookupNeedsDishOrId() {
        assertThat(policy.clarify(plan("get_menu_item_details", MAPPER.createObjectNode())))
                .contains("Which dish would you like details for?");
        assertThat(policy.clarify(plan("get_menu_item_details", MAPPER.createObjectNode().put("dish_name", " "))))
                .isPresent();
        assertThat(policy.clarify(plan("get_menu_item_details", MAPPER.createObjectNode().put("dish_name", "Tiramisu"))))
                .isEmpty();
    }

    @Test
    void recipeDetailsAcceptIdOrDishName() {
        assertThat(policy.clarify(plan("get_recipe_details", MAPPER.createObjectNode()))).isPresent();
        assertThat(policy.clarify(plan("get_recipe_details", MAPPER.createObjectNode().put("recipe_id", "r1")))).isEmpty();
        assertThat(policy.clarify(plan("get_recipe_details", MAPPER.createObjectNode().put("dish_name", "Pizza")))).isEmpty();
    }

    @Test
    void menuQueryNeedsOneNarrowingArgument() {
        assertThat(policy.clarify(plan("query_daily_menu", MAPPER.createObjectNode()))).isPresent();
        assertThat(policy.clarify(plan("query_daily_menu", MAPPER.createObjectNode().put("location", "Downtown")))).isEmpty();
        assertThat(policy.clarify(plan("query_daily_menu", MAPPER.createObjectNode().put("category_filter", "dessert")))).isEmpty();
        assertThat(policy.clarify(plan("query_daily_menu", MAPPER.createObjectNode().put("menu_date", "2025-03-14")))).isEmpty();
    }

    @Test
    void otherToolsNeverAsk() {
        assertThat(policy.clarify(plan("get_low_stock_alerts", MAPPER.createObjectNode()))).isEmpty();
        assertThat(policy.clarify(plan("query_employees", MAPPER.createObjectNode()))).isEmpty();
        assertThat(policy.clarify(null)).isEmpty();
    }
}
