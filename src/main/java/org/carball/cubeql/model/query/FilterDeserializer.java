package org.carball.cubeql.model.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a filter node in either the server form ({@code {"and": [...]}}, {@code {"or": [...]}})
 * or the client group form ({@code {"type": "and", "filters": [...]}}); anything else is a
 * member condition.
 */
public class FilterDeserializer extends JsonDeserializer<Filter> {

    @Override
    public Filter deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        ObjectMapper mapper = (ObjectMapper) parser.getCodec();
        JsonNode node = mapper.readTree(parser);
        return toFilter(node, mapper);
    }

    static Filter toFilter(JsonNode node, ObjectMapper mapper) throws IOException {
        if (node.has("and") && node.get("and").isArray()) {
            return new LogicalFilter(LogicalFilter.Type.AND, children(node.get("and"), mapper));
        }
        if (node.has("or") && node.get("or").isArray()) {
            return new LogicalFilter(LogicalFilter.Type.OR, children(node.get("or"), mapper));
        }
        if (node.has("type") && node.has("filters") && node.get("filters").isArray()) {
            String type = node.get("type").asText();
            LogicalFilter.Type logicalType = "or".equalsIgnoreCase(type) ? LogicalFilter.Type.OR : LogicalFilter.Type.AND;
            return new LogicalFilter(logicalType, children(node.get("filters"), mapper));
        }
        return mapper.treeToValue(node, FilterCondition.class);
    }

    private static List<Filter> children(JsonNode array, ObjectMapper mapper) throws IOException {
        List<Filter> filters = new ArrayList<>();
        for (JsonNode child : array) {
            if (child != null && !child.isNull()) {
                filters.add(toFilter(child, mapper));
            }
        }
        return filters;
    }
}
