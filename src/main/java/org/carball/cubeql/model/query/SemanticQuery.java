package org.carball.cubeql.model.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.cubeql.exception.IncompleteSpecException;

import java.util.ArrayList;
import java.util.List;

/**
 * A declarative analytics request. The compiler reads it and never changes it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SemanticQuery {
    @Builder.Default
    private List<String> measures = new ArrayList<>();
    @Builder.Default
    private List<String> dimensions = new ArrayList<>();
    @Builder.Default
    private List<TimeDimension> timeDimensions = new ArrayList<>();
    @Builder.Default
    private List<Filter> filters = new ArrayList<>();
    @JsonDeserialize(using = OrderListDeserializer.class)
    @Builder.Default
    private List<OrderBy> order = new ArrayList<>();
    private Integer limit;
    private Integer offset;
    /**
     * Measure value for rows added by gap filling; 0 when unset.
     */
    private Number fillMissingDatesValue;

    private FunnelSpec funnel;
    private FlowSpec flow;
    private RetentionSpec retention;

    /**
     * The single analysis mode this query asks for.
     *
     * @throws IncompleteSpecException when more than one of funnel, flow and retention is set
     */
    @JsonIgnore
    public QueryMode getMode() {
        int specs = (funnel != null ? 1 : 0) + (flow != null ? 1 : 0) + (retention != null ? 1 : 0);
        if (specs > 1) {
            throw new IncompleteSpecException("A query may carry only one of funnel, flow or retention");
        }
        if (funnel != null) {
            return QueryMode.FUNNEL;
        }
        if (flow != null) {
            return QueryMode.FLOW;
        }
        if (retention != null) {
            return QueryMode.RETENTION;
        }
        return QueryMode.QUERY;
    }

    /**
     * Dimensions plus time dimensions, in request order.
     */
    @JsonIgnore
    public List<String> getAllDimensionNames() {
        List<String> names = new ArrayList<>(dimensions == null ? List.of() : dimensions);
        if (timeDimensions != null) {
            timeDimensions.forEach(td -> names.add(td.getDimension()));
        }
        return names;
    }
}
