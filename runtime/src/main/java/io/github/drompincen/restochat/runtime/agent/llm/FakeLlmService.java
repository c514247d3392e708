package io.github.drompincen.restochat.runtime.agent.llm;

import io.github.drompincen.restochat.protocol.api.ChatMessage;
import io.github.drompincen.restochat.protocol.api.MessageRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based model stand-in for local runs without an API key. Answers every pipeline step
 * with something the parsers accept, driven by keywords in the user's message.
 *
 * Activate with: RESTOCHAT_LLM_PROVIDER=fake
 */
@Service
@ConditionalOnProperty(name = "restochat.llm.provider", havingValue = "fake")
public class FakeLlmService implements LlmService {

    private static final Logger log = LoggerFactory.getLogger(FakeLlmService.class);

    private static final Pattern AT_LOCATION = Pattern.compile("\\bat\\s+([A-Z][\\w-]*(?:\\s+[A-Z][\\w-]*)*)");
    private static final Pattern CATEGORY = Pattern.compile(
            "\\b(dessert|appetizer|main|salad|soup|drink|beverage|side)s?\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public String blockingResponse(LlmRequest request) {
        String user = request.lastUserMessage();
        String response = switch (request.purpose()) {
            case CLASSIFY -> classify(user);
            case PLAN -> plan(user);
            case RESPOND -> respond(request, user);
            case SUMMARIZE -> summarize(request);
        };
        log.debug("[FAKE LLM] purpose={}, response length={}", request.purpose(), response.length());
        return response;
    }

    private String classify(String user) {
        String lower = user.toLowerCase(Locale.ROOT);
        if (lower.matches(".*\\b(menu|dish|dishes|dessert|desserts|recipe|recipes|employee|employees|staff"
                + "|stock|inventory|performance|vegan|vegetarian|gluten|price)\\b.*")) {
            return "db_query";
        }
        return "conversational";
    }

    private String plan(String user) {
        String lower = user.toLowerCase(Locale.ROOT);
        if (lower.contains("recipe detail")) {
            return "{\"tool\": \"get_recipe_details\", \"args\": {}}";
        }
        if (lower.contains("recipe")) {
            return "{\"tool\": \"query_recipes\", \"args\": {}}";
        }
        if (lower.contains("low stock")) {
            return "{\"tool\": \"get_low_stock_alerts\", \"args\": {}}";
        }
        if (lower.contains("stock") || lower.contains("inventory")) {
            return "{\"tool\": \"query_storage_inventory\", \"args\": {}}";
        }
        if (lower.contains("performance")) {
            return "{\"tool\": \"get_employee_performance_stats\", \"args\": {}}";
        }
        if (lower.contains("employee") || lower.contains("staff")) {
            return "{\"tool\": \"query_employees\", \"args\": {}}";
        }
        if (lower.contains("tell me more") || lower.contains("details")) {
            return "{\"tool\": \"get_menu_item_details\", \"args\": {}}";
        }
        StringBuilder args = new StringBuilder();
        Matcher location = AT_LOCATION.matcher(user);
        if (location.find()) {
            appendArg(args, "location", location.group(1));
        }
        Matcher category = CATEGORY.matcher(user);
        if (category.find()) {
            appendArg(args, "category_filter", category.group(1).toLowerCase(Locale.ROOT));
        }
        if (lower.contains("vegan")) {
            appendArg(args, "dietary_restrictions", "vegan");
        } else if (lower.contains("vegetarian")) {
            appendArg(args, "dietary_restrictions", "vegetarian");
        } else if (lower.contains("gluten")) {
            appendArg(args, "dietary_restrictions", "gluten_free");
        }
        return "{\"tool\": \"query_daily_menu\", \"args\": {" + args + "}}";
    }

    private String respond(LlmRequest request, String user) {
        String toolResult = null;
        for (ChatMessage m : request.messages()) {
            if (m.role() == MessageRole.SYSTEM && m.content() != null && m.content().startsWith("Tool result")) {
                toolResult = m.content();
            }
        }
        if (toolResult != null) {
            return "Here is what I found.\n" + toolResult.substring(toolResult.indexOf('\n') + 1);
        }
        return "Thanks for your message! You said: " + truncate(user, 200);
    }

    private String summarize(LlmRequest request) {
        return "The guest and assistant discussed: " + truncate(request.lastUserMessage(), 200);
    }

    private static void appendArg(StringBuilder args, String key, String value) {
        if (args.length() > 0) args.append(", ");
        args.append('"').append(key).append("\": \"").append(value.replace("\"", "")).append('"');
    }

    private static String truncate(String s, int maxLen) {
        if (s == null) return "";
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
