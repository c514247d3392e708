package io.github.drompincen.restochat.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolResult(
        boolean success,
        JsonNode output,
        String error
) {
    public static ToolResult success(JsonNode output) {
        return new ToolResult(true, output, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error);
    }

    /** Text form handed to the responder: plain text as-is, structured output as JSON. */
    public String outputText() {
        if (output == null || output.isNull()) return "";
        return output.isTextual() ? output.asText() : output.toPrettyString();
    }
}
