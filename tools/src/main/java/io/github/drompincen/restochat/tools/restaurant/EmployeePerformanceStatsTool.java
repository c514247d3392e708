package io.github.drompincen.restochat.tools.restaurant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.tools.ToolResult;

import java.util.List;
import java.util.Set;

/** Aggregate ratings and tenure for active staff, overall and per department. */
public class EmployeePerformanceStatsTool extends RestaurantQueryTool {

    static final double HIGH_PERFORMER = 4.0;
    static final double LOW_PERFORMER = 3.0;

    @Override public String name() { return "get_employee_performance_stats"; }

    @Override
    public String description() {
        return "Performance statistics for active employees: averages, high and low performer counts, per-department breakdown.";
    }

    @Override
    public JsonNode inputSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "department", "string", "Restrict the statistics to one department");
        outputFormatProperty(schema);
        return schema;
    }

    @Override public Set<Persona> visibility() { return Set.of(Persona.INTERNAL); }

    @Override
    protected ToolResult query(JsonNode args, boolean structured) {
        String department = text(args, "department");
        String where = "WHERE status = 'active'" + (department != null ? " AND LOWER(department) LIKE ?" : "");
        Object[] params = department != null ? new Object[]{like(department)} : new Object[0];

        List<ObjectNode> totals = rows("""
                SELECT COUNT(*) AS total_employees,
                       ROUND(AVG(performance_rating), 2) AS avg_performance,
                       ROUND(AVG(tenure_months), 1) AS avg_tenure_months,
                       SUM(CASE WHEN performance_rating >= %s THEN 1 ELSE 0 END) AS high_performers,
                       SUM(CASE WHEN performance_rating < %s THEN 1 ELSE 0 END) AS low_performers
                FROM employees %s""".formatted(HIGH_PERFORMER, LOW_PERFORMER, where), params);
        ObjectNode overall = totals.get(0);
        if (overall.path("total_employees").asLong() == 0) {
            String message = "No active employees found" + (department != null ? " in " + department : "") + ".";
            return structured
                    ? ToolResult.success(MAPPER.createObjectNode().put("total_employees", 0).put("message", message))
                    : ToolResult.success(TextNode.valueOf(message));
        }

        List<ObjectNode> byDepartment = rows("""
                SELECT department, COUNT(*) AS employees, ROUND(AVG(performance_rating), 2) AS avg_performance
                FROM employees %s GROUP BY department ORDER BY department""".formatted(where), params);

        if (structured) {
            ObjectNode out = overall.deepCopy();
            ArrayNode departments = out.putArray("departments");
            byDepartment.forEach(departments::add);
            return ToolResult.success(out);
        }
        StringBuilder sb = new StringBuilder("Employee performance")
                .append(department != null ? " (" + department + ")" : "").append(":")
                .append("\n- Active employees: ").append(overall.path("total_employees").asText())
                .append("\n- Average rating: ").append(overall.path("avg_performance").asText())
                .append("\n- Average tenure: ").append(overall.path("avg_tenure_months").asText()).append(" months")
                .append("\n- High performers (>= ").append(HIGH_PERFORMER).append("): ")
                .append(overall.path("high_performers").asText())
                .append("\n- Low performers (< ").append(LOW_PERFORMER).append("): ")
                .append(overall.path("low_performers").asText());
        sb.append("\nBy department:");
        for (ObjectNode d : byDepartment) {
            sb.append("\n- ").append(d.path("department").asText()).append(": ")
                    .append(d.path("employees").asText()).append(" employee(s), avg ")
                    .append(d.path("avg_performance").asText());
        }
        return ToolResult.success(TextNode.valueOf(sb.toString()));
    }
}
