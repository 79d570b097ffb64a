package org.carball.cubeql.merge;

import org.carball.cubeql.merge.ValidationIssue.Type;
import org.carball.cubeql.model.query.MergeStrategy;
import org.carball.cubeql.model.query.SemanticQuery;
import org.carball.cubeql.model.query.TimeDimension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks that the queries of a multi-query request line up. Merging needs the same dimensions
 * and granularities everywhere; measure collisions and differing date ranges only warn.
 */
public class MultiQueryValidator {

    public List<ValidationIssue> validate(List<SemanticQuery> queries, MergeStrategy strategy, List<String> mergeKeys) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (queries.size() < 2) {
            return issues;
        }
        issues.addAll(measureCollisions(queries));
        issues.addAll(asymmetricDateRanges(queries));
        if (strategy == MergeStrategy.MERGE) {
            issues.addAll(dimensionAlignment(queries));
            issues.addAll(timeDimensionAlignment(queries));
            if (mergeKeys != null && !mergeKeys.isEmpty()) {
                issues.addAll(missingMergeKeys(queries, mergeKeys));
            }
        }
        return issues;
    }

    /**
     * A later query may not group by a dimension the first query lacks; its rows could not be
     * aligned with the first query's.
     */
    List<ValidationIssue> dimensionAlignment(List<SemanticQuery> queries) {
        List<ValidationIssue> errors = new ArrayList<>();
        Set<String> reference = new LinkedHashSet<>(queries.get(0).getAllDimensionNames());
        for (int i = 1; i < queries.size(); i++) {
            for (String dimension : queries.get(i).getAllDimensionNames()) {
                if (!reference.contains(dimension)) {
                    errors.add(ValidationIssue.error(Type.EXTRA_DIMENSION, i,
                            "Query " + (i + 1) + " groups by \"" + dimension + "\" which Query 1 does not", dimension));
                }
            }
        }
        return errors;
    }

    List<ValidationIssue> timeDimensionAlignment(List<SemanticQuery> queries) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<TimeDimension> reference = timeDimensions(queries.get(0));
        if (reference.isEmpty()) {
            return errors;
        }
        for (int i = 1; i < queries.size(); i++) {
            List<TimeDimension> current = timeDimensions(queries.get(i));
            if (current.isEmpty()) {
                String field = reference.get(0).getDimension();
                errors.add(ValidationIssue.error(Type.MISSING_TIME_DIMENSION, i,
                        "Query " + (i + 1) + " is missing time dimension \"" + field + "\"", field));
                continue;
            }
            for (TimeDimension expected : reference) {
                Optional<TimeDimension> match = current.stream()
                        .filter(td -> Objects.equals(td.getDimension(), expected.getDimension()))
                        .findFirst();
                if (match.isPresent() && match.get().getGranularity() != expected.getGranularity()) {
                    errors.add(ValidationIssue.error(Type.GRANULARITY_MISMATCH, i,
                            "Query " + (i + 1) + " uses \"" + granularity(match.get()) + "\" granularity but Query 1 uses \""
                                    + granularity(expected) + "\"", expected.getDimension()));
                }
            }
        }
        return errors;
    }

    List<ValidationIssue> missingMergeKeys(List<SemanticQuery> queries, List<String> mergeKeys) {
        List<ValidationIssue> errors = new ArrayList<>();
        for (int i = 0; i < queries.size(); i++) {
            Set<String> fields = new LinkedHashSet<>(queries.get(i).getAllDimensionNames());
            for (String key : mergeKeys) {
                if (!fields.contains(key)) {
                    errors.add(ValidationIssue.error(Type.MISSING_MERGE_KEY, i,
                            "Query " + (i + 1) + " is missing merge dimension \"" + key + "\"", key));
                }
            }
        }
        return errors;
    }

    List<ValidationIssue> measureCollisions(List<SemanticQuery> queries) {
        Map<String, List<Integer>> owners = new LinkedHashMap<>();
        for (int i = 0; i < queries.size(); i++) {
            List<String> measures = queries.get(i).getMeasures() == null ? List.of() : queries.get(i).getMeasures();
            for (String measure : new LinkedHashSet<>(measures)) {
                owners.computeIfAbsent(measure, m -> new ArrayList<>()).add(i);
            }
        }
        List<String> collisions = new ArrayList<>();
        Set<Integer> indices = new TreeSet<>();
        owners.forEach((measure, queryIndices) -> {
            if (queryIndices.size() > 1) {
                collisions.add(measure);
                indices.addAll(queryIndices);
            }
        });
        if (collisions.isEmpty()) {
            return List.of();
        }
        String message = collisions.size() == 1
                ? "Measure \"" + collisions.get(0) + "\" appears in multiple queries - first value will be used"
                : "Measures \"" + String.join("\", \"", collisions) + "\" appear in multiple queries - first value will be used";
        return List.of(ValidationIssue.warning(Type.MEASURE_COLLISION, new ArrayList<>(indices), message));
    }

    List<ValidationIssue> asymmetricDateRanges(List<SemanticQuery> queries) {
        Set<Object> ranges = new LinkedHashSet<>();
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < queries.size(); i++) {
            List<TimeDimension> timeDimensions = timeDimensions(queries.get(i));
            ranges.add(timeDimensions.isEmpty() || timeDimensions.get(0).getDateRange() == null
                    ? "none" : timeDimensions.get(0).getDateRange());
            indices.add(i);
        }
        if (ranges.size() <= 1) {
            return List.of();
        }
        return List.of(ValidationIssue.warning(Type.ASYMMETRIC_DATE_RANGE, indices,
                "Queries have different date ranges - some data points may be missing in merged results"));
    }

    private static List<TimeDimension> timeDimensions(SemanticQuery query) {
        return query.getTimeDimensions() == null ? List.of() : query.getTimeDimensions();
    }

    private static String granularity(TimeDimension timeDimension) {
        return timeDimension.getGranularity() == null ? "none" : timeDimension.getGranularity().value();
    }
}
