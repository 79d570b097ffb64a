package org.carball.cubeql.model.query;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One sort key. Serialized as a {@code [field, direction]} pair.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"field", "direction"})
public record OrderBy(String field, SortDirection direction) {

    public static OrderBy asc(String field) {
        return new OrderBy(field, SortDirection.ASC);
    }

    public static OrderBy desc(String field) {
        return new OrderBy(field, SortDirection.DESC);
    }
}
