package io.github.drompincen.restochat.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.agent.planning.QueryPlan;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ToolExecutorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ToolContext CTX = new ToolContext("customer_session", Persona.EXTERNAL);

    private final ToolExecutor executor = new ToolExecutor(Duration.ofMillis(300));

    private static QueryPlan plan(String tool) {
        return new QueryPlan(tool, MAPPER.createObjectNode().put("output_format", "structured"));
    }

    @Test
    void returnsTextOutputAsIs() {
        StubTool menu = StubTool.returning("query_daily_menu", StubTool.BOTH, "Tiramisu $8.00");

        assertThat(executor.execute(plan("query_daily_menu"), List.of(menu), CTX)).isEqualTo("Tiramisu $8.00");
        assertThat(menu.calls()).hasSize(1);
    }

    @Test
    void structuredOutputBecomesJsonText() {
        ObjectNode out = MAPPER.createObjectNode().put("count", 1);
        StubTool menu = new StubTool("query_daily_menu", StubTool.BOTH, args -> ToolResult.success(out));

        String result = executor.execute(plan("query_daily_menu"), List.of(menu), CTX);

        assertThat(result).contains("\"count\"").contains("1");
    }

    @Test
    void toolOutsideAvailableListIsNotRun() {
        StubTool employees = StubTool.returning("query_employees", StubTool.STAFF, "x");

        String result = executor.execute(plan("query_employees"), List.of(), CTX);

        assertThat(result).isEqualTo("Tool query_employees is not available for this conversation.");
        assertThat(employees.calls()).isEmpty();
    }

    @Test
    void failureResultIsDescribed() {
        StubTool menu = new StubTool("query_daily_menu", StubTool.BOTH,
                args -> ToolResult.failure("Invalid date format 'soon'. Use YYYY-MM-DD"));

        assertThat(executor.execute(plan("query_daily_menu"), List.of(menu), CTX))
                .isEqualTo("Tool query_daily_menu failed: Invalid date format 'soon'. Use YYYY-MM-DD");
    }

    @Test
    void exceptionIsContained() {
        StubTool menu = StubTool.throwing("query_daily_menu", StubTool.BOTH, new IllegalStateException("db down"));

        assertThat(executor.execute(plan("query_daily_menu"), List.of(menu), CTX))
                .isEqualTo("Tool query_daily_menu failed: db down");
    }

    @Test
    void nullResultIsDescribed() {
        StubTool menu = new StubTool("query_daily_menu", StubTool.BOTH, args -> null);

        assertThat(executor.execute(plan("query_daily_menu"), List.of(menu), CTX))
                .isEqualTo("Tool query_daily_menu returned no result.");
    }

    @Test
    void reactiveToolIsPreferredAndTimedOut() {
        ReactiveTool slow = new ReactiveTool() {
            @Override public String name() { return "query_daily_menu"; }
            @Override public String description() { return "slow"; }
            @Override public JsonNode inputSchema() { return null; }
            @Override public Set<Persona> visibility() { return StubTool.BOTH; }
            @Override public ToolResult execute(ToolContext ctx, JsonNode input) {
                return ToolResult.failure("blocking path used");
            }
            @Override public Mono<ToolResult> executeReactive(ToolContext ctx, JsonNode input) {
                return Mono.never();
            }
        };

        assertThat(executor.execute(plan("query_daily_menu"), List.of(slow), CTX))
                .isEqualTo("Tool query_daily_menu failed: timed out");
    }

    @Test
    void reactiveToolResultIsUsed() {
        ReactiveTool fast = new ReactiveTool() {
            @Override public String name() { return "query_daily_menu"; }
            @Override public String description() { return "fast"; }
            @Override public JsonNode inputSchema() { return null; }
            @Override public Set<Persona> visibility() { return StubTool.BOTH; }
            @Override public ToolResult execute(ToolContext ctx, JsonNode input) {
                return ToolResult.failure("blocking path used");
            }
            @Override public Mono<ToolResult> executeReactive(ToolContext ctx, JsonNode input) {
                return Mono.just(ToolResult.success(MAPPER.getNodeFactory().textNode("reactive")));
            }
        };

        assertThat(executor.execute(plan("query_daily_menu"), List.of(fast), CTX)).isEqualTo("reactive");
    }

    @Test
    void truncateKeepsShortTextAndClipsLongText() {
        assertThat(ToolExecutor.truncate("abc", 5)).isEqualTo("abc");
        assertThat(ToolExecutor.truncate("abcdef", 3)).isEqualTo("abc...");
        assertThat(ToolExecutor.truncate(null, 3)).isEmpty();
    }
}
