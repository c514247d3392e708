package io.github.drompincen.restochat.runtime.agent.planning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Lenient JSON reader for planner output: a direct parse first, then the first balanced
 * {@code {...}} block found in the text (which also covers code fences and chatter).
 */
public class PlanParser {

    private static final Logger log = LoggerFactory.getLogger(PlanParser.class);

    private final ObjectMapper objectMapper;

    public PlanParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<JsonNode> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        Optional<JsonNode> direct = readObject(raw.trim());
        if (direct.isPresent()) return direct;
        String block = firstBalancedObject(raw);
        if (block == null) {
            log.debug("No JSON object in planner output: {}", raw);
            return Optional.empty();
        }
        return readObject(block);
    }

    private Optional<JsonNode> readObject(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    /** First {...} with matched braces, ignoring braces inside JSON strings. */
    static String firstBalancedObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int depth = 0;
            boolean inString = false;
            boolean escaped = false;
            for (int i = start; i < text.length(); i++) {
                char c = text.charAt(i);
                if (inString) {
                    if (escaped) escaped = false;
                    else if (c == '\\') escaped = true;
                    else if (c == '"') inString = false;
                    continue;
                }
                if (c == '"') inString = true;
                else if (c == '{') depth++;
                else if (c == '}' && --depth == 0) return text.substring(start, i + 1);
            }
            start = text.indexOf('{', start + 1);
        }
        return null;
    }
}
