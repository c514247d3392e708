package io.github.drompincen.restochat.tools.restaurant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.tools.ToolContext;
import io.github.drompincen.restochat.runtime.tools.ToolResult;
import io.github.drompincen.restochat.tools.RestaurantTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryEmployeesToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ToolContext CTX = new ToolContext("internal_staff_session", Persona.INTERNAL);

    private QueryEmployeesTool tool;

    @BeforeEach
    void setUp() {
        tool = new QueryEmployeesTool();
        tool.setJdbcTemplate(RestaurantTestData.seededDatabase());
    }

    @Test
    void internalOnly() {
        assertThat(tool.visibility()).containsExactly(Persona.INTERNAL);
    }

    @Test
    void filtersByDepartmentOrderedByFirstName() {
        JsonNode out = tool.execute(CTX, MAPPER.createObjectNode().put("department_filter", "Kitchen")).output();

        assertThat(out.path("count").asInt()).isEqualTo(2);
        assertThat(out.path("items").get(0).path("first_name").asText()).isEqualTo("Alice");
        assertThat(out.path("items").get(1).path("first_name").asText()).isEqualTo("Carla");
        assertThat(out.path("items").get(0).path("hire_date").asText()).isEqualTo("2022-03-01");
    }

    @Test
    void filtersByNameAndPerformance() {
        JsonNode byName = tool.execute(CTX, MAPPER.createObjectNode().put("name_filter", "stone")).output();
        assertThat(byName.path("items").get(0).path("first_name").asText()).isEqualTo("Bob");

        JsonNode byRating = tool.execute(CTX, MAPPER.createObjectNode().put("min_performance", "4.5")).output();
        assertThat(byRating.path("count").asInt()).isEqualTo(1);
        assertThat(byRating.path("items").get(0).path("last_name").asText()).isEqualTo("Martin");
    }

    @Test
    void nonNumericRatingIsAFailure() {
        ToolResult result = tool.execute(CTX, MAPPER.createObjectNode().put("min_performance", "great"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("min_performance must be a number");
    }

    @Test
    void noMatchesReportsMessage() {
        ToolResult result = tool.execute(CTX, MAPPER.createObjectNode()
                .put("position_filter", "sommelier").put("output_format", "text"));

        assertThat(result.outputText()).isEqualTo("No employees found matching the criteria.");
    }

    @Test
    void textOutputListsEmployees() {
        ToolResult result = tool.execute(CTX, MAPPER.createObjectNode()
                .put("shift_filter", "evening").put("output_format", "text"));

        assertThat(result.outputText())
                .startsWith("Found 2 employee(s):")
                .contains("- Bob Stone (Server, front_of_house)")
                .contains("status=on_leave");
    }
}
