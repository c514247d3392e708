package io.github.drompincen.restochat.runtime.agent.respond;

import io.github.drompincen.restochat.protocol.api.ModelConfig;
import io.github.drompincen.restochat.protocol.api.Persona;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

public class PersonaProfiles {

    public static final Set<String> INTERNAL_DATA_TOOLS = Set.of(
            "query_employees", "get_employee_performance_stats",
            "query_storage_inventory", "get_low_stock_alerts",
            "query_recipes", "get_recipe_details",
            "query_daily_menu", "get_menu_item_details");

    public static final Set<String> EXTERNAL_DATA_TOOLS = Set.of("query_daily_menu", "get_menu_item_details");

    public static final Set<String> INTERNAL_MEMORY_TOOLS =
            Set.of("save_memory", "search_memory", "list_memories", "delete_memory");

    public static final Set<String> EXTERNAL_MEMORY_TOOLS = Set.of("save_memory", "search_memory");

    static final String INTERNAL_PROMPT = """
            You are the operations assistant of a restaurant. You help staff (managers, chefs, waiters) \
            with employees, recipes, inventory and the daily menu.
            Refer to employees by name, never by id. Call out low stock with item names and quantities. \
            Be specific with data and professional in tone. Use the tool result you are given as the \
            source of truth; if it reports an error, say so plainly.""";

    static final String EXTERNAL_PROMPT = """
            You are a friendly assistant for our restaurant guests. You help them discover today's menu, \
            prices, dietary options and dish details.
            Be warm and appetizing, always mention prices, and never share internal details such as \
            costs, suppliers or staff information. Use the tool result you are given as the source of \
            truth; if it reports an error, apologize briefly and offer an alternative.""";

    private final Map<Persona, PersonaProfile> profiles = new EnumMap<>(Persona.class);

    public PersonaProfiles(boolean memoryToolsEnabled, double internalTemperature, double externalTemperature,
                           Duration modelTimeout) {
        profiles.put(Persona.INTERNAL, new PersonaProfile(Persona.INTERNAL, INTERNAL_PROMPT,
                new ModelConfig(internalTemperature, modelTimeout),
                whitelist(INTERNAL_DATA_TOOLS, INTERNAL_MEMORY_TOOLS, memoryToolsEnabled)));
        profiles.put(Persona.EXTERNAL, new PersonaProfile(Persona.EXTERNAL, EXTERNAL_PROMPT,
                new ModelConfig(externalTemperature, modelTimeout),
                whitelist(EXTERNAL_DATA_TOOLS, EXTERNAL_MEMORY_TOOLS, memoryToolsEnabled)));
    }

    public static PersonaProfiles defaults() {
        return new PersonaProfiles(true,
                ModelConfig.forPersona(Persona.INTERNAL).temperature(),
                ModelConfig.forPersona(Persona.EXTERNAL).temperature(),
                ModelConfig.DEFAULT_TIMEOUT);
    }

    public PersonaProfile get(Persona persona) {
        return profiles.get(persona);
    }

    private static Set<String> whitelist(Set<String> data, Set<String> memory, boolean memoryToolsEnabled) {
        Set<String> names = new LinkedHashSet<>(data);
        if (memoryToolsEnabled) names.addAll(memory);
        return names;
    }
}
