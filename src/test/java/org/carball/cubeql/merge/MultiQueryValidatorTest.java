package org.carball.cubeql.merge;

import org.carball.cubeql.model.query.DateRange;
import org.carball.cubeql.model.query.MergeStrategy;
import org.carball.cubeql.model.query.SemanticQuery;
import org.carball.cubeql.model.query.TimeDimension;
import org.carball.cubeql.model.query.TimeGranularity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class MultiQueryValidatorTest {

    private final MultiQueryValidator validator = new MultiQueryValidator();

    @Test
    public void shouldAcceptAlignedQueries() {
        List<ValidationIssue> issues = validator.validate(
                List.of(byStatus("Orders.count"), byStatus("Orders.totalAmount")), MergeStrategy.MERGE, List.of());

        assertThat(issues).isEmpty();
    }

    @Test
    public void shouldRejectExtraDimensionOnMerge() {
        // Given
        SemanticQuery first = byStatus("Orders.count");
        SemanticQuery second = SemanticQuery.builder()
                .measures(List.of("Orders.totalAmount"))
                .dimensions(List.of("Orders.status", "Customers.city"))
                .build();

        // When
        List<ValidationIssue> issues = validator.validate(List.of(first, second), MergeStrategy.MERGE, List.of());

        // Then
        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.isError()).isTrue();
            assertThat(issue.type()).isEqualTo(ValidationIssue.Type.EXTRA_DIMENSION);
            assertThat(issue.queryIndices()).containsExactly(1);
            assertThat(issue.message()).isEqualTo("Query 2 groups by \"Customers.city\" which Query 1 does not");
        });
    }

    @Test
    public void shouldOnlyCheckAlignmentWhenMerging() {
        SemanticQuery second = SemanticQuery.builder()
                .measures(List.of("Orders.totalAmount"))
                .dimensions(List.of("Customers.city"))
                .build();

        assertThat(validator.validate(List.of(byStatus("Orders.count"), second), MergeStrategy.CONCAT, List.of()))
                .isEmpty();
    }

    @Test
    public void shouldReportGranularityMismatchAndMissingTimeDimension() {
        // Given
        SemanticQuery monthly = monthly("Orders.count", TimeGranularity.MONTH);
        SemanticQuery weekly = monthly("Orders.totalAmount", TimeGranularity.WEEK);
        SemanticQuery untimed = SemanticQuery.builder().measures(List.of("Orders.avgAmount")).build();

        // When
        List<ValidationIssue> issues = validator.timeDimensionAlignment(List.of(monthly, weekly, untimed));

        // Then
        assertThat(issues).extracting(ValidationIssue::message).containsExactly(
                "Query 2 uses \"week\" granularity but Query 1 uses \"month\"",
                "Query 3 is missing time dimension \"Orders.createdAt\"");
    }

    @Test
    public void shouldRequireMergeKeysInEveryQuery() {
        List<ValidationIssue> issues = validator.validate(
                List.of(byStatus("Orders.count"), SemanticQuery.builder().measures(List.of("Orders.totalAmount")).build()),
                MergeStrategy.MERGE, List.of("Orders.status"));

        assertThat(issues)
                .filteredOn(issue -> issue.type() == ValidationIssue.Type.MISSING_MERGE_KEY)
                .extracting(ValidationIssue::message)
                .containsExactly("Query 2 is missing merge dimension \"Orders.status\"");
    }

    @Test
    public void shouldWarnOnMeasureCollisionsAndDifferentDateRanges() {
        // Given
        SemanticQuery first = monthly("Orders.count", TimeGranularity.MONTH);
        SemanticQuery second = first.toBuilder()
                .timeDimensions(List.of(TimeDimension.builder()
                        .dimension("Orders.createdAt")
                        .granularity(TimeGranularity.MONTH)
                        .dateRange(DateRange.expression("last year"))
                        .build()))
                .build();

        // When
        List<ValidationIssue> issues = validator.validate(List.of(first, second), MergeStrategy.CONCAT, List.of());

        // Then
        assertThat(issues).allMatch(issue -> !issue.isError());
        assertThat(issues).extracting(ValidationIssue::message).containsExactly(
                "Measure \"Orders.count\" appears in multiple queries - first value will be used",
                "Queries have different date ranges - some data points may be missing in merged results");
        assertThat(issues.get(0).queryIndices()).containsExactly(0, 1);
    }

    private static SemanticQuery byStatus(String measure) {
        return SemanticQuery.builder()
                .measures(List.of(measure))
                .dimensions(List.of("Orders.status"))
                .build();
    }

    private static SemanticQuery monthly(String measure, TimeGranularity granularity) {
        return SemanticQuery.builder()
                .measures(List.of(measure))
                .timeDimensions(List.of(TimeDimension.builder()
                        .dimension("Orders.createdAt")
                        .granularity(granularity)
                        .dateRange(DateRange.expression("this year"))
                        .build()))
                .build();
    }
}
