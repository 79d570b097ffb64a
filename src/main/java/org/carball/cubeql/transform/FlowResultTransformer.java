package org.carball.cubeql.transform;

import org.carball.cubeql.model.result.FlowLink;
import org.carball.cubeql.model.result.FlowNode;
import org.carball.cubeql.model.result.FlowResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Splits {@code final_result} rows into nodes and links by their {@code record_type}.
 */
public class FlowResultTransformer {

    public FlowResult transform(List<Map<String, Object>> rows) {
        List<FlowNode> nodes = new ArrayList<>();
        List<FlowLink> links = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            String type = Rows.stringValue(row, "record_type");
            if ("node".equals(type)) {
                nodes.add(new FlowNode(
                        Rows.stringValue(row, "id"),
                        Rows.stringValue(row, "name"),
                        (int) Rows.longValue(row, "layer"),
                        Rows.longValue(row, "value")));
            } else if ("link".equals(type)) {
                links.add(new FlowLink(
                        Rows.stringValue(row, "source_id"),
                        Rows.stringValue(row, "target_id"),
                        Rows.longValue(row, "value")));
            } else {
                throw new IllegalArgumentException("Unknown flow record type: " + type);
            }
        }
        nodes.sort(Comparator.comparingInt(FlowNode::layer).thenComparing(FlowNode::id));
        return new FlowResult(List.copyOf(nodes), List.copyOf(links));
    }
}
