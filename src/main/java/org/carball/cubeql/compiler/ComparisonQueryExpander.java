package org.carball.cubeql.compiler;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.model.query.DateRange;
import org.carball.cubeql.model.query.SemanticQuery;
import org.carball.cubeql.model.query.TimeDimension;
import org.carball.cubeql.sql.DateRangeResolver;
import org.carball.cubeql.sql.DateRangeResolver.Bounds;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a query whose time dimension carries {@code compareDateRange} into one query per
 * period, each with a concrete date range. Unparseable periods are skipped.
 */
@Slf4j
public class ComparisonQueryExpander {

    /**
     * One period's query. Index 0 is the first period listed, usually the current one.
     */
    public record PeriodQuery(int index, String label, Bounds bounds, SemanticQuery query) {}

    private final DateRangeResolver dates;

    public ComparisonQueryExpander(DateRangeResolver dates) {
        this.dates = dates;
    }

    public static boolean hasComparison(SemanticQuery query) {
        return comparisonDimension(query).isPresent();
    }

    public List<PeriodQuery> expand(SemanticQuery query) {
        TimeDimension compared = comparisonDimension(query)
                .orElseThrow(() -> new IllegalArgumentException("Query has no time dimension with compareDateRange"));

        List<PeriodQuery> periods = new ArrayList<>();
        List<DateRange> ranges = compared.getCompareDateRange();
        for (int i = 0; i < ranges.size(); i++) {
            DateRange range = ranges.get(i);
            Bounds bounds;
            try {
                bounds = dates.resolve(range);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping comparison period {} ({}): {}", i, range == null ? null : range.toJson(), e.getMessage());
                continue;
            }
            periods.add(new PeriodQuery(i, label(range), bounds, periodQuery(query, compared, bounds)));
        }
        return periods;
    }

    private static SemanticQuery periodQuery(SemanticQuery query, TimeDimension compared, Bounds bounds) {
        List<TimeDimension> timeDimensions = new ArrayList<>();
        for (TimeDimension timeDimension : query.getTimeDimensions()) {
            if (timeDimension == compared) {
                timeDimensions.add(timeDimension.toBuilder()
                        .dateRange(DateRange.between(bounds.start().toString(), bounds.end().toString()))
                        .compareDateRange(null)
                        .build());
            } else {
                timeDimensions.add(timeDimension);
            }
        }
        return query.toBuilder().timeDimensions(timeDimensions).build();
    }

    private static String label(DateRange range) {
        return range.isExpression() ? range.expression() : range.start() + " - " + range.end();
    }

    private static Optional<TimeDimension> comparisonDimension(SemanticQuery query) {
        if (query.getTimeDimensions() == null) {
            return Optional.empty();
        }
        return query.getTimeDimensions().stream().filter(TimeDimension::hasComparison).findFirst();
    }
}
