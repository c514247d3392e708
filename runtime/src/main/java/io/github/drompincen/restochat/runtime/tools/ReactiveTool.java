package io.github.drompincen.restochat.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * A tool with a non-blocking invocation path. {@link ToolExecutor} prefers it over
 * {@link #execute}.
 */
public interface ReactiveTool extends Tool {

    Mono<ToolResult> executeReactive(ToolContext ctx, JsonNode input);
}
