package org.carball.cubeql.model.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Either an explicit {@code [start, end]} pair or a single expression such as {@code "last 7 days"}
 * or {@code "2024-03-01"}. Resolved to concrete instants at compile time.
 */
public record DateRange(String start, String end, String expression) {

    public static DateRange between(String start, String end) {
        return new DateRange(start, end, null);
    }

    public static DateRange expression(String expression) {
        return new DateRange(null, null, expression);
    }

    public boolean isExpression() {
        return expression != null;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DateRange fromJson(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return expression(node.asText());
        }
        if (node.isArray()) {
            if (node.size() == 1) {
                return expression(node.get(0).asText());
            }
            if (node.size() == 2) {
                return between(node.get(0).asText(), node.get(1).asText());
            }
        }
        throw new IllegalArgumentException("dateRange must be a string or a [start, end] array: " + node);
    }

    @JsonValue
    public Object toJson() {
        return isExpression() ? expression : List.of(start, end);
    }
}
