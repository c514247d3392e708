package io.github.drompincen.restochat.runtime.agent.planning;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a plan is missing an identifying argument. Pure function of the plan;
 * returns at most one question.
 */
public class ClarificationPolicy {

    static final List<String> MENU_NARROWING_ARGS =
            List.of("menu_date", "location", "category_filter", "price_range", "dietary_restrictions");

    public Optional<String> clarify(QueryPlan plan) {
        if (plan == null) return Optional.empty();
        return switch (plan.toolName()) {
            case "get_menu_item_details" -> plan.hasArg("dish_name") || plan.hasArg("recipe_id")
                    ? Optional.empty()
                    : Optional.of("Which dish would you like details for?");
            case "get_recipe_details" -> plan.hasArg("recipe_id") || plan.hasArg("dish_name")
                    ? Optional.empty()
                    : Optional.of("Which recipe would you like details for? A dish name is enough.");
            case "query_daily_menu" -> plan.hasAnyArg(MENU_NARROWING_ARGS)
                    ? Optional.empty()
                    : Optional.of("Which menu would you like to see? Tell me a date, a location, "
                            + "or the kind of dish you have in mind.");
            default -> Optional.empty();
        };
    }
}
