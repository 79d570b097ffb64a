package org.carball.cubeql.model.query;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * AND/OR group. Serialized in the server form {@code {"and": [...]}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LogicalFilter implements Filter {

    public enum Type {
        AND,
        OR;

        public String value() {
            return name().toLowerCase();
        }
    }

    private Type type;
    private List<Filter> filters;

    public static LogicalFilter and(Filter... filters) {
        return new LogicalFilter(Type.AND, List.of(filters));
    }

    public static LogicalFilter or(Filter... filters) {
        return new LogicalFilter(Type.OR, List.of(filters));
    }

    @Override
    public void forEachCondition(Consumer<FilterCondition> action) {
        filters.forEach(f -> f.forEachCondition(action));
    }

    @JsonValue
    public Map<String, List<Filter>> toJson() {
        return Map.of(type.value(), filters);
    }
}
