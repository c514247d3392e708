package io.github.drompincen.restochat.runtime.agent.planning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.restochat.protocol.api.ChatMessage;
import io.github.drompincen.restochat.protocol.api.ModelConfig;
import io.github.drompincen.restochat.runtime.agent.llm.LlmPurpose;
import io.github.drompincen.restochat.runtime.agent.llm.LlmRequest;
import io.github.drompincen.restochat.runtime.agent.llm.TimedLlmCaller;
import io.github.drompincen.restochat.runtime.tools.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maps a data question to exactly one whitelisted tool and a flat argument object.
 * Model failures propagate; malformed or disallowed plans come back empty.
 */
public class QueryPlanner {

    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    public static final String OUTPUT_FORMAT = "output_format";
    public static final String STRUCTURED = "structured";

    private final TimedLlmCaller llm;
    private final PlanParser parser;
    private final DishNameSalvage salvage;

    public QueryPlanner(TimedLlmCaller llm, PlanParser parser, DishNameSalvage salvage) {
        this.llm = llm;
        this.parser = parser;
        this.salvage = salvage;
    }

    public Optional<QueryPlan> plan(String utterance, List<Tool> whitelist, ModelConfig model) {
        String raw = llm.call(new LlmRequest(LlmPurpose.PLAN,
                List.of(ChatMessage.system(instructions(whitelist)), ChatMessage.user(utterance)),
                model.temperature()), model.timeout());
        Optional<JsonNode> json = parser.parse(raw);
        if (json.isEmpty()) {
            log.warn("Planner output was not JSON, falling back to conversation");
            return Optional.empty();
        }
        try {
            QueryPlan plan = validate(json.get(), whitelist);
            return Optional.of(salvage.apply(plan, utterance));
        } catch (PlanValidationException e) {
            log.warn("Discarding plan: {}", e.getMessage());
            return Optional.empty();
        }
    }

    QueryPlan validate(JsonNode node, List<Tool> whitelist) {
        String toolName = node.path("tool").asText("");
        boolean allowed = whitelist.stream().anyMatch(t -> t.name().equals(toolName));
        if (!allowed) {
            throw new PlanValidationException("tool '" + toolName + "' is not in the whitelist");
        }
        JsonNode argsNode = node.get("args");
        ObjectNode args;
        if (argsNode == null || argsNode.isNull()) {
            args = ((ObjectNode) node).objectNode();
        } else if (argsNode.isObject()) {
            args = ((ObjectNode) argsNode).deepCopy();
        } else {
            throw new PlanValidationException("args for '" + toolName + "' is not an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = args.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isContainerNode()) {
                throw new PlanValidationException("argument '" + field.getKey() + "' is not a flat value");
            }
        }
        args.remove("limit");
        if (!args.hasNonNull(OUTPUT_FORMAT)) {
            args.put(OUTPUT_FORMAT, STRUCTURED);
        }
        return new QueryPlan(toolName, args);
    }

    static String instructions(List<Tool> whitelist) {
        String names = whitelist.stream().map(Tool::name).collect(Collectors.joining(", "));
        String catalog = whitelist.stream()
                .map(t -> "- " + t.name() + ": " + t.description() + " Arguments: " + t.inputSchema())
                .collect(Collectors.joining("\n"));
        return """
                You are a restaurant CRM query planner. Map the user request to exactly one database tool and arguments.
                Return strict JSON with keys: tool (one of: %s) and args (a flat object of simple values).
                Do NOT include any 'limit' argument; fetch full results unless the user explicitly asks for a sample.
                If information is missing (e.g. date or location), keep args minimal and avoid restrictive filters.
                Available tools:
                %s""".formatted(names, catalog);
    }
}
