package io.github.drompincen.restochat.runtime.tools;

import io.github.drompincen.restochat.runtime.agent.planning.QueryPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Runs a validated plan against the tools visible to the current persona. Never throws:
 * failures come back as text the responder can explain to the user.
 */
public class ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutor.class);
    static final int LOG_RESULT_LIMIT = 2000;

    private final Duration timeout;

    public ToolExecutor(Duration timeout) {
        this.timeout = timeout;
    }

    public String execute(QueryPlan plan, List<Tool> available, ToolContext ctx) {
        log.info("Executing tool {} with args {}", plan.toolName(), plan.args());
        Optional<Tool> match = available.stream().filter(t -> t.name().equals(plan.toolName())).findFirst();
        if (match.isEmpty()) {
            log.error("Planned tool {} is not registered for {}", plan.toolName(), ctx.persona());
            return "Tool " + plan.toolName() + " is not available for this conversation.";
        }
        Tool tool = match.get();
        try {
            ToolResult result = invoke(tool, ctx, plan);
            if (result == null) {
                return "Tool " + tool.name() + " returned no result.";
            }
            if (!result.success()) {
                log.warn("Tool {} reported failure: {}", tool.name(), result.error());
                return "Tool " + tool.name() + " failed: " + result.error();
            }
            String text = result.outputText();
            log.info("Tool {} result: {}", tool.name(), truncate(text, LOG_RESULT_LIMIT));
            return text;
        } catch (Exception e) {
            Throwable cause = Exceptions.unwrap(e);
            log.error("Tool {} threw", tool.name(), cause);
            return "Tool " + tool.name() + " failed: " + describe(cause);
        }
    }

    private ToolResult invoke(Tool tool, ToolContext ctx, QueryPlan plan) {
        if (tool instanceof ReactiveTool reactive) {
            return reactive.executeReactive(ctx, plan.args()).timeout(timeout).block();
        }
        return tool.execute(ctx, plan.args());
    }

    private static String describe(Throwable e) {
        if (e instanceof java.util.concurrent.TimeoutException) return "timed out";
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    static String truncate(String s, int maxLen) {
        if (s == null) return "";
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
