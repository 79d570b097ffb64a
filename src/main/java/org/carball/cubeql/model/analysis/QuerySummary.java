package org.carball.cubeql.model.analysis;

public record QuerySummary(
    QueryType queryType,
    int joinCount,
    int cteCount,
    boolean hasPreAggregation
) {}
