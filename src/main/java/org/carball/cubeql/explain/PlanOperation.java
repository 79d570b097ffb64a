package org.carball.cubeql.explain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One node of a query plan, normalized across engines.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PlanOperation(
    String type,
    String table,
    String index,
    Long estimatedRows,
    Double estimatedCost,
    Long actualRows,
    String filter,
    List<String> details,
    List<PlanOperation> children
) {}
