package org.carball.cubeql.model.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Accepts both {@code [["Cube.a", "desc"], ...]} and the object form {@code {"Cube.a": "desc"}};
 * the object form keeps the key order of the document.
 */
public class OrderListDeserializer extends JsonDeserializer<List<OrderBy>> {

    @Override
    public List<OrderBy> deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        List<OrderBy> order = new ArrayList<>();

        if (node.isArray()) {
            for (JsonNode pair : node) {
                if (!pair.isArray() || pair.size() == 0) {
                    context.reportInputMismatch(List.class, "order entries must be [field, direction] pairs");
                }
                String direction = pair.size() > 1 ? pair.get(1).asText() : "asc";
                order.add(new OrderBy(pair.get(0).asText(), SortDirection.fromValue(direction)));
            }
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                order.add(new OrderBy(entry.getKey(), SortDirection.fromValue(entry.getValue().asText())));
            }
        } else if (!node.isNull()) {
            context.reportInputMismatch(List.class, "order must be an array of pairs or an object");
        }
        return order;
    }
}
