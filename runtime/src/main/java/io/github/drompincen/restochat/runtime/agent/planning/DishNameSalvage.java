package io.github.drompincen.restochat.runtime.agent.planning;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Post-processing step for single-dish lookups: when the planner left out the dish, take it
 * from a trailing "for ..." / "about ..." clause of the utterance.
 */
public class DishNameSalvage {

    public static final String SINGLE_DISH_TOOL = "get_menu_item_details";

    private static final Pattern TRAILING_CLAUSE =
            Pattern.compile("\\b(?:for|about)\\s+(?:the\\s+)?([^?.!]+?)\\s*[?.!]*\\s*$", Pattern.CASE_INSENSITIVE);

    public QueryPlan apply(QueryPlan plan, String utterance) {
        if (!SINGLE_DISH_TOOL.equals(plan.toolName())) return plan;
        if (plan.hasArg("dish_name") || plan.hasArg("recipe_id")) return plan;
        extractDishName(utterance).ifPresent(name -> plan.args().put("dish_name", name));
        return plan;
    }

    static Optional<String> extractDishName(String utterance) {
        if (utterance == null) return Optional.empty();
        Matcher m = TRAILING_CLAUSE.matcher(utterance.trim());
        if (!m.find()) return Optional.empty();
        String name = m.group(1).trim();
        return name.isEmpty() ? Optional.empty() : Optional.of(name);
    }
}
