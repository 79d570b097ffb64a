package org.carball.cubeql.sql;

import org.carball.cubeql.TestSchemas;
import org.carball.cubeql.compiler.CompilationContext;
import org.carball.cubeql.config.CompilerConfig;
import org.carball.cubeql.exception.InvalidFilterException;
import org.carball.cubeql.model.query.DateRange;
import org.carball.cubeql.model.query.Filter;
import org.carball.cubeql.model.query.FilterCondition;
import org.carball.cubeql.model.query.FilterOperator;
import org.carball.cubeql.model.query.LogicalFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

public class FilterSqlBuilderTest {

    private CompilationContext context;
    private FilterSqlBuilder filters;

    @BeforeEach
    void setUp() {
        context = new CompilationContext(TestSchemas.ecommerce(), CompilerConfig.defaults(), TestSchemas.FIXED_CLOCK);
        filters = context.getFilters();
    }

    @Test
    public void shouldBindSingleEqualsValueAsParameter() {
        // When
        RenderedSql sql = render(FilterCondition.of("Orders.status", FilterOperator.EQUALS, "completed"));

        // Then
        assertThat(sql.sql()).isEqualTo("orders.status = $1");
        assertThat(sql.params()).containsExactly("completed");
    }

    @Test
    public void shouldUseInListForSeveralEqualsValues() {
        RenderedSql sql = render(FilterCondition.of("Orders.status", FilterOperator.EQUALS, "completed", "shipped"));

        assertThat(sql.sql()).isEqualTo("orders.status IN ($1, $2)");
        assertThat(sql.params()).containsExactly("completed", "shipped");
    }

    @Test
    public void shouldMatchNothingWhenEqualsHasNoValues() {
        // Given
        FilterCondition condition = FilterCondition.builder()
                .member("Orders.status")
                .operator(FilterOperator.EQUALS)
                .values(List.of())
                .build();

        // When
        RenderedSql sql = render(condition);

        // Then
        assertThat(sql.sql()).isEqualTo("FALSE");
        assertThat(sql.params()).isEmpty();
    }

    @Test
    public void shouldDropNullsAndEmptyStringsFromValues() {
        // Given
        FilterCondition condition = FilterCondition.builder()
                .member("Orders.status")
                .operator(FilterOperator.EQUALS)
                .values(Arrays.<Object>asList(null, "", "bad\u0000value", "paid"))
                .build();

        // When
        RenderedSql sql = render(condition);

        // Then
        assertThat(sql.sql()).isEqualTo("orders.status = $1");
        assertThat(sql.params()).containsExactly("paid");
    }

    @Test
    public void shouldCoerceNumericValues() {
        RenderedSql sql = render(FilterCondition.of("Orders.amount", FilterOperator.GT, "100.50"));

        assertThat(sql.sql()).isEqualTo("orders.amount > $1");
        assertThat(sql.params()).containsExactly(new BigDecimal("100.50"));
    }

    @Test
    public void shouldRejectNonNumericValueForNumberMember() {
        assertThatThrownBy(() -> render(FilterCondition.of("Orders.amount", FilterOperator.GT, "lots")))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageContaining("'lots' is not a number");
    }

    @Test
    public void shouldWrapContainsPatternWithWildcards() {
        RenderedSql sql = render(FilterCondition.of("Customers.name", FilterOperator.CONTAINS, "smith"));

        assertThat(sql.sql()).isEqualTo("customers.name ILIKE $1");
        assertThat(sql.params()).containsExactly("%smith%");
    }

    @Test
    public void shouldRenderBetweenAsInclusiveBounds() {
        RenderedSql sql = render(FilterCondition.of("Orders.amount", FilterOperator.BETWEEN, 10, 20));

        assertThat(sql.sql()).isEqualTo("(orders.amount >= $1 AND orders.amount <= $2)");
        assertThat(sql.params()).containsExactly(10, 20);
    }

    @Test
    public void shouldResolveDateRangeIntoTimestampBounds() {
        // Given
        FilterCondition condition = FilterCondition.builder()
                .member("Orders.createdAt")
                .operator(FilterOperator.IN_DATE_RANGE)
                .dateRange(DateRange.expression("yesterday"))
                .build();

        // When
        RenderedSql sql = render(condition);

        // Then
        assertThat(sql.sql()).isEqualTo("(orders.created_at >= $1 AND orders.created_at <= $2)");
        assertThat(sql.params()).containsExactly(
                LocalDateTime.of(2024, 3, 12, 0, 0),
                LocalDateTime.of(2024, 3, 12, 23, 59, 59, 999_000_000));
    }

    @Test
    public void shouldParenthesizeOrGroups() {
        // Given
        Filter filter = LogicalFilter.or(
                FilterCondition.of("Orders.status", FilterOperator.EQUALS, "completed"),
                FilterCondition.of("Orders.amount", FilterOperator.GTE, 500));

        // When
        RenderedSql sql = render(filter);

        // Then
        assertThat(sql.sql()).isEqualTo("(orders.status = $1 OR orders.amount >= $2)");
    }

    @Test
    public void shouldNotParenthesizeSingleChildGroups() {
        Filter filter = LogicalFilter.and(FilterCondition.of("Orders.status", FilterOperator.SET));

        assertThat(render(filter).sql()).isEqualTo("orders.status IS NOT NULL");
    }

    @Test
    public void shouldAndTopLevelFilters() {
        // Given
        List<Filter> list = List.of(
                FilterCondition.of("Orders.status", FilterOperator.NOT_EQUALS, "cancelled"),
                FilterCondition.of("Customers.city", FilterOperator.NOT_SET));

        // When
        RenderedSql sql = filters.build(list, context.getMembers()::dimension).render(context.getDialect());

        // Then
        assertThat(sql.sql()).isEqualTo("orders.status <> $1 AND customers.city IS NULL");
    }

    @Test
    public void shouldRejectTextOperatorOnNumberMember() {
        // When
        InvalidFilterException error = catchThrowableOfType(
                () -> render(FilterCondition.of("Orders.amount", FilterOperator.CONTAINS, "1")),
                InvalidFilterException.class);

        // Then
        assertThat(error).hasMessage("Operator 'contains' is not supported for number member 'Orders.amount'");
        assertThat(error.getMember()).isEqualTo("Orders.amount");
        assertThat(error.getOperator()).isEqualTo("contains");
        assertThat(error.getErrorCode()).isEqualTo("invalid_filter");
    }

    @Test
    public void shouldRejectUnknownMember() {
        assertThatThrownBy(() -> filters.validate(FilterCondition.of("Orders.nope", FilterOperator.EQUALS, "x")))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageContaining("unknown member 'Orders.nope'");
    }

    @Test
    public void shouldRejectDateRangeOnNonTimeMember() {
        FilterCondition condition = FilterCondition.builder()
                .member("Orders.status")
                .operator(FilterOperator.IN_DATE_RANGE)
                .dateRange(DateRange.expression("today"))
                .build();

        assertThatThrownBy(() -> filters.validate(condition))
                .isInstanceOf(InvalidFilterException.class);
    }

    @Test
    public void shouldAcceptMeasuresAsNumbers() {
        FilterCondition condition = FilterCondition.of("Orders.count", FilterOperator.GT, 5);

        assertThat(filters.validate(condition).getValue()).isEqualTo("number");
    }

    @Test
    public void shouldRejectArrayOperatorsOnMySql() {
        // Given
        CompilationContext mysql = new CompilationContext(TestSchemas.ecommerce(),
                CompilerConfig.builder().engine(DatabaseEngine.MYSQL).build(), TestSchemas.FIXED_CLOCK);

        // When / Then
        assertThatThrownBy(() -> mysql.getFilters().validate(
                FilterCondition.of("Tags.label", FilterOperator.ARRAY_CONTAINS, "vip")))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageContaining("requires array support");
    }

    @Test
    public void shouldRejectArrayOperatorsOnSqlite() {
        CompilationContext sqlite = new CompilationContext(TestSchemas.ecommerce(),
                CompilerConfig.builder().engine(DatabaseEngine.SQLITE).build(), TestSchemas.FIXED_CLOCK);

        assertThatThrownBy(() -> sqlite.getFilters().validate(
                FilterCondition.of("Tags.label", FilterOperator.ARRAY_OVERLAPS, "vip", "new")))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageContaining("which sqlite does not have");
    }

    @Test
    public void shouldNormalizeBeforeDateValue() {
        RenderedSql sql = render(FilterCondition.of("Orders.createdAt", FilterOperator.BEFORE_DATE, "2024-01-01"));

        assertThat(sql.sql()).isEqualTo("orders.created_at < $1");
        assertThat(sql.params()).containsExactly(LocalDateTime.of(2024, 1, 1, 0, 0));
    }

    private RenderedSql render(Filter filter) {
        return filters.build(filter, context.getMembers()::dimension).render(context.getDialect());
    }
}
