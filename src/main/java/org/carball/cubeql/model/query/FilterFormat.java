package org.carball.cubeql.model.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts filter trees between the client group form {@code {"type": "and", "filters": [...]}}
 * and the server form {@code {"and": [...]}}. Member conditions pass through unchanged.
 */
public final class FilterFormat {

    private FilterFormat() {
    }

    public static JsonNode toServer(JsonNode filter) {
        if (filter == null || filter.isNull()) {
            return filter;
        }
        if (filter.isArray()) {
            ArrayNode converted = JsonNodeFactory.instance.arrayNode();
            filter.forEach(child -> converted.add(toServer(child)));
            return converted;
        }
        if (filter.has("type") && filter.path("filters").isArray()) {
            String type = "or".equalsIgnoreCase(filter.get("type").asText()) ? "or" : "and";
            ObjectNode group = JsonNodeFactory.instance.objectNode();
            group.set(type, toServer(filter.get("filters")));
            return group;
        }
        return filter;
    }

    public static JsonNode toClient(JsonNode filter) {
        if (filter == null || filter.isNull()) {
            return filter;
        }
        if (filter.isArray()) {
            ArrayNode converted = JsonNodeFactory.instance.arrayNode();
            filter.forEach(child -> converted.add(toClient(child)));
            return converted;
        }
        for (String type : new String[]{"and", "or"}) {
            if (filter.path(type).isArray() && filter.size() == 1) {
                ObjectNode group = JsonNodeFactory.instance.objectNode();
                group.put("type", type);
                group.set("filters", toClient(filter.get(type)));
                return group;
            }
        }
        return filter;
    }
}
