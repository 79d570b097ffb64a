package org.carball.cubeql.explain;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.carball.cubeql.sql.DatabaseEngine;

import java.util.List;

/**
 * Times are in milliseconds. MySQL reports neither time and uses summed row estimates as cost.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExplainSummary(
    DatabaseEngine database,
    boolean hasSequentialScans,
    List<String> usedIndexes,
    Double planningTime,
    Double executionTime,
    Double totalCost
) {}
