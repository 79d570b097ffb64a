package org.carball.cubeql.model.result;

import java.util.List;
import java.util.Map;

/**
 * Retention rows plus the same numbers pivoted into cohort rows and period columns. Cohorts are
 * labelled by their breakdown values, or {@code "All"} when the query has no breakdown.
 */
public record RetentionResult(
    List<RetentionRow> rows,
    int periods,
    Map<String, List<Double>> matrix
) {}
