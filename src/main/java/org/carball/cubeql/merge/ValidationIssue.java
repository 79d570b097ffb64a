package org.carball.cubeql.merge;

import java.util.List;

/**
 * A problem found across the queries of a multi-query request. Errors block a merge; warnings
 * are reported alongside the compiled output.
 */
public record ValidationIssue(Severity severity, Type type, List<Integer> queryIndices, String message,
                              String field) {

    public enum Severity {
        ERROR,
        WARNING
    }

    public enum Type {
        MISSING_TIME_DIMENSION,
        GRANULARITY_MISMATCH,
        MISSING_MERGE_KEY,
        EXTRA_DIMENSION,
        MEASURE_COLLISION,
        ASYMMETRIC_DATE_RANGE
    }

    static ValidationIssue error(Type type, int queryIndex, String message, String field) {
        return new ValidationIssue(Severity.ERROR, type, List.of(queryIndex), message, field);
    }

    static ValidationIssue warning(Type type, List<Integer> queryIndices, String message) {
        return new ValidationIssue(Severity.WARNING, type, List.copyOf(queryIndices), message, null);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
