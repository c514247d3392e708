package io.github.drompincen.restochat.tools.restaurant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.restochat.protocol.api.Persona;
import io.github.drompincen.restochat.runtime.tools.ToolResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class QueryEmployeesTool extends RestaurantQueryTool {

    @Override public String name() { return "query_employees"; }

    @Override
    public String description() {
        return "Look up staff members by name, position, department, shift, status or minimum performance rating.";
    }

    @Override
    public JsonNode inputSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "name_filter", "string", "Part of the first or last name");
        property(schema, "position_filter", "string", "Position, e.g. 'chef' or 'server'");
        property(schema, "department_filter", "string", "Department, e.g. 'kitchen'");
        property(schema, "shift_filter", "string", "morning, evening, night or split");
        property(schema, "status_filter", "string", "active, inactive or on_leave");
        property(schema, "min_performance", "number", "Minimum performance rating (1.0-5.0)");
        outputFormatProperty(schema);
        return schema;
    }

    @Override public Set<Persona> visibility() { return Set.of(Persona.INTERNAL); }

    @Override
    protected ToolResult query(JsonNode args, boolean structured) {
        StringBuilder sql = new StringBuilder("""
                SELECT employee_id, first_name, last_name, email, phone, position, department,
                       hire_date, tenure_months, performance_rating, shift_type, status
                FROM employees WHERE 1=1""");
        List<Object> params = new ArrayList<>();

        String name = text(args, "name_filter");
        if (name != null) {
            sql.append(" AND (LOWER(first_name) LIKE ? OR LOWER(last_name) LIKE ?"
                    + " OR LOWER(first_name || ' ' || last_name) LIKE ?)");
            params.add(like(name));
            params.add(like(name));
            params.add(like(name));
        }
        appendLike(sql, params, "position", text(args, "position_filter"));
        appendLike(sql, params, "department", text(args, "department_filter"));
        appendLike(sql, params, "shift_type", text(args, "shift_filter"));
        appendLike(sql, params, "status", text(args, "status_filter"));
        Double minPerformance = number(args, "min_performance");
        if (minPerformance != null) {
            sql.append(" AND performance_rating >= ?");
            params.add(minPerformance);
        }
        sql.append(" ORDER BY first_name, last_name");

        List<ObjectNode> employees = rows(sql.toString(), params.toArray());
        return listResult(structured, "Found " + employees.size() + " employee(s):",
                "No employees found matching the criteria.", employees,
                e -> String.format("- %s %s (%s, %s) shift=%s rating=%s tenure=%s months status=%s",
                        e.path("first_name").asText(), e.path("last_name").asText(),
                        e.path("position").asText(), e.path("department").asText(),
                        e.path("shift_type").asText(), e.path("performance_rating").asText(),
                        e.path("tenure_months").asText(), e.path("status").asText()));
    }

    static void appendLike(StringBuilder sql, List<Object> params, String column, String value) {
        if (value == null) return;
        sql.append(" AND LOWER(").append(column).append(") LIKE ?");
        params.add(like(value));
    }
}
