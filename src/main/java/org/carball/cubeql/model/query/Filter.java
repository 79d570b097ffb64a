package org.carball.cubeql.model.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.function.Consumer;

/**
 * A node of a filter tree: either a {@link FilterCondition} on one member or a
 * {@link LogicalFilter} combining other nodes with AND/OR.
 */
@JsonDeserialize(using = FilterDeserializer.class)
public interface Filter {

    /**
     * Visits every {@link FilterCondition} in this subtree, depth first.
     */
    void forEachCondition(Consumer<FilterCondition> action);
}
