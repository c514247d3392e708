package io.github.drompincen.restochat.runtime.tools;

import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.protocol.api.ToolDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.ApplicationContext;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class ToolRegistryTest {

    private ToolRegistry registry;
    private ApplicationContext mockContext;

    @BeforeEach
    void setUp() {
        mockContext = mock(ApplicationContext.class);
        // Default: no beans available
        when(mockContext.getBean(any(Class.class))).thenThrow(new NoSuchBeanDefinitionException("none"));
        registry = new ToolRegistry(mockContext);
    }

    @Test
    void registerAndRetrieveTool() {
        registry.register(StubTool.returning("test_tool", StubTool.BOTH, "ok"));

        assertThat(registry.get("test_tool")).isPresent();
        assertThat(registry.get("test_tool").get().name()).isEqualTo("test_tool");
        assertThat(registry.get("nonexistent")).isEmpty();
    }

    @Test
    void registeringSameNameReplacesTool() {
        registry.register(StubTool.returning("menu", StubTool.BOTH, "old"));
        StubTool replacement = StubTool.returning("menu", StubTool.BOTH, "new");
        registry.register(replacement);

        assertThat(registry.all()).hasSize(1);
        assertThat(registry.get("menu")).containsSame(replacement);
    }

    @Test
    void forPersonaNeedsWhitelistAndVisibility() {
        registry.register(StubTool.returning("query_daily_menu", StubTool.BOTH, ""));
        registry.register(StubTool.returning("query_employees", StubTool.STAFF, ""));
        registry.register(StubTool.returning("get_low_stock_alerts", StubTool.STAFF, ""));
        Set<String> whitelist = Set.of("query_employees", "query_daily_menu");

        List<Tool> staff = registry.forPersona(Persona.INTERNAL, whitelist);
        List<Tool> guests = registry.forPersona(Persona.EXTERNAL, whitelist);

        assertThat(staff).extracting(Tool::name).containsExactly("query_daily_menu", "query_employees");
        assertThat(guests).extracting(Tool::name).containsExactly("query_daily_menu");
    }

    @Test
    void descriptorsCarryVisibility() {
        registry.register(StubTool.returning("query_employees", StubTool.STAFF, ""));

        List<ToolDescriptor> descriptors = registry.descriptors();

        assertThat(descriptors).hasSize(1);
        assertThat(descriptors.get(0).name()).isEqualTo("query_employees");
        assertThat(descriptors.get(0).visibility()).containsExactly(Persona.INTERNAL);
        assertThat(descriptors.get(0).inputSchema().path("type").asText()).isEqualTo("object");
    }

    @Test
    void loadToolsUsesServiceLoaderAndInjectsBeans() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-14T12:00:00Z"), ZoneOffset.UTC);
        doReturn(clock).when(mockContext).getBean(Clock.class);

        registry.loadTools();

        ClockAwareTool tool = (ClockAwareTool) registry.get("current_time").orElseThrow();
        assertThat(tool.clock()).isSameAs(clock);
    }

    @Test
    void missingBeanLeavesToolUnwired() {
        registry.loadTools();

        ClockAwareTool tool = (ClockAwareTool) registry.get("current_time").orElseThrow();
        assertThat(tool.clock()).isNull();
        assertThat(tool.execute(new ToolContext("t", Persona.INTERNAL), null).error()).isEqualTo("no clock");
    }
}
