package org.carball.cubeql.compiler;

import org.carball.cubeql.TestSchemas;
import org.carball.cubeql.config.CompilerConfig;
import org.carball.cubeql.exception.IncompleteSpecException;
import org.carball.cubeql.exception.InvalidFilterException;
import org.carball.cubeql.exception.PathNotFoundException;
import org.carball.cubeql.model.analysis.QueryAnalysis;
import org.carball.cubeql.model.analysis.QueryType;
import org.carball.cubeql.model.query.DateRange;
import org.carball.cubeql.model.query.FilterCondition;
import org.carball.cubeql.model.query.FilterOperator;
import org.carball.cubeql.model.query.LogicalFilter;
import org.carball.cubeql.model.query.OrderBy;
import org.carball.cubeql.model.query.SemanticQuery;
import org.carball.cubeql.model.query.TimeDimension;
import org.carball.cubeql.model.query.TimeGranularity;
import org.carball.cubeql.model.result.CompiledQuery;
import org.carball.cubeql.sql.DatabaseEngine;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

public class StandardQueryCompilerTest {

    private final StandardQueryCompiler postgres = compiler(CompilerConfig.defaults());

    @Test
    public void shouldCompileSingleCubeQuery() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count"))
                .dimensions(List.of("Orders.status"))
                .build();

        // When
        CompiledQuery compiled = postgres.compile(query);

        // Then
        assertThat(compiled.getSql()).isEqualTo(
                "SELECT orders.status AS \"Orders.status\", COUNT(orders.id) AS \"Orders.count\"\n"
                        + "FROM orders AS orders\n"
                        + "GROUP BY orders.status");
        assertThat(compiled.getParams()).isEmpty();
        assertThat(compiled.getSchemaVersion()).isEqualTo(1);
        assertThat(compiled.getAnalysis().querySummary().queryType()).isEqualTo(QueryType.SINGLE_CUBE);
    }

    @Test
    public void shouldPreAggregateHasManyMeasuresInCte() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count"))
                .dimensions(List.of("Customers.city"))
                .build();

        // When
        CompiledQuery compiled = postgres.compile(query);

        // Then
        assertThat(compiled.getSql()).isEqualTo(
                "WITH orders_agg AS (\n"
                        + "  SELECT orders.customer_id AS customer_id, COUNT(orders.id) AS \"Orders.count\"\n"
                        + "  FROM orders AS orders\n"
                        + "  GROUP BY orders.customer_id\n"
                        + ")\n"
                        + "SELECT customers.city AS \"Customers.city\", SUM(orders_agg.\"Orders.count\") AS \"Orders.count\"\n"
                        + "FROM customers AS customers\n"
                        + "LEFT JOIN orders_agg ON customers.id = orders_agg.customer_id\n"
                        + "GROUP BY customers.city");

        QueryAnalysis analysis = compiled.getAnalysis();
        assertThat(analysis.querySummary().queryType()).isEqualTo(QueryType.MULTI_CUBE_CTE);
        assertThat(analysis.querySummary().cteCount()).isEqualTo(1);
        assertThat(analysis.querySummary().joinCount()).isEqualTo(1);
        assertThat(analysis.preAggregations().get(0).joinKeys())
                .containsExactly("customers.id = orders_agg.customer_id");
    }

    @Test
    public void shouldAggregateWholeSubtreeBehindFanOutHop() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count", "Products.count"))
                .dimensions(List.of("Orders.status"))
                .build();

        // When
        CompiledQuery compiled = postgres.compile(query);

        // Then
        assertThat(compiled.getSql()).isEqualTo(
                "WITH lineitems_agg AS (\n"
                        + "  SELECT lineitems.order_id AS order_id, COUNT(products.id) AS \"Products.count\"\n"
                        + "  FROM line_items AS lineitems\n"
                        + "  INNER JOIN products AS products ON lineitems.product_id = products.id\n"
                        + "  GROUP BY lineitems.order_id\n"
                        + ")\n"
                        + "SELECT orders.status AS \"Orders.status\", COUNT(orders.id) AS \"Orders.count\", "
                        + "SUM(lineitems_agg.\"Products.count\") AS \"Products.count\"\n"
                        + "FROM orders AS orders\n"
                        + "LEFT JOIN lineitems_agg ON orders.id = lineitems_agg.order_id\n"
                        + "GROUP BY orders.status");
        assertThat(compiled.getWarnings()).isEmpty();
        assertThat(compiled.getAnalysis().preAggregations()).singleElement().satisfies(cte -> {
            assertThat(cte.cubeName()).isEqualTo("LineItems");
            assertThat(cte.measures()).containsExactly("Products.count");
        });
    }

    @Test
    public void shouldNestCteForFanOutBehindIntermediateMeasureCube() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Customers.count", "Orders.count", "LineItems.count"))
                .dimensions(List.of("Customers.city"))
                .build();

        // When
        CompiledQuery compiled = postgres.compile(query);

        // Then
        assertThat(compiled.getSql()).isEqualTo(
                "WITH lineitems_agg AS (\n"
                        + "  SELECT lineitems.order_id AS order_id, COUNT(lineitems.id) AS \"LineItems.count\"\n"
                        + "  FROM line_items AS lineitems\n"
                        + "  GROUP BY lineitems.order_id\n"
                        + "),\n"
                        + "orders_agg AS (\n"
                        + "  SELECT orders.customer_id AS customer_id, COUNT(orders.id) AS \"Orders.count\", "
                        + "SUM(lineitems_agg.\"LineItems.count\") AS \"LineItems.count\"\n"
                        + "  FROM orders AS orders\n"
                        + "  LEFT JOIN lineitems_agg ON orders.id = lineitems_agg.order_id\n"
                        + "  GROUP BY orders.customer_id\n"
                        + ")\n"
                        + "SELECT customers.city AS \"Customers.city\", COUNT(customers.id) AS \"Customers.count\", "
                        + "SUM(orders_agg.\"Orders.count\") AS \"Orders.count\", "
                        + "SUM(orders_agg.\"LineItems.count\") AS \"LineItems.count\"\n"
                        + "FROM customers AS customers\n"
                        + "LEFT JOIN orders_agg ON customers.id = orders_agg.customer_id\n"
                        + "GROUP BY customers.city");

        QueryAnalysis analysis = compiled.getAnalysis();
        assertThat(analysis.querySummary().cteCount()).isEqualTo(2);
        assertThat(analysis.querySummary().joinCount()).isEqualTo(1);
        assertThat(analysis.preAggregations()).extracting(cte -> cte.joinKeys().get(0))
                .containsExactly("orders.id = lineitems_agg.order_id", "customers.id = orders_agg.customer_id");
        assertThat(compiled.getWarnings()).isEmpty();
    }

    @Test
    public void shouldCarryNestedCteDimensionsAndFiltersUpward() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count", "LineItems.totalQuantity"))
                .dimensions(List.of("Customers.city", "Customers.name", "LineItems.quantity"))
                .filters(List.of(FilterCondition.of("LineItems.quantity", FilterOperator.GT, 1)))
                .build();

        // When
        String sql = postgres.compile(query).getSql();

        // Then
        assertThat(sql)
                .contains("  SELECT lineitems.order_id AS order_id, lineitems.quantity AS \"LineItems.quantity\", "
                        + "SUM(lineitems.quantity) AS \"LineItems.totalQuantity\"\n"
                        + "  FROM line_items AS lineitems\n"
                        + "  WHERE lineitems.quantity > $1\n"
                        + "  GROUP BY lineitems.order_id, lineitems.quantity\n")
                .contains("  SELECT orders.customer_id AS customer_id, "
                        + "lineitems_agg.\"LineItems.quantity\" AS \"LineItems.quantity\", "
                        + "COUNT(orders.id) AS \"Orders.count\", "
                        + "SUM(lineitems_agg.\"LineItems.totalQuantity\") AS \"LineItems.totalQuantity\"\n")
                .contains("  GROUP BY orders.customer_id, lineitems_agg.\"LineItems.quantity\"\n")
                .contains("orders_agg.\"LineItems.quantity\" AS \"LineItems.quantity\"")
                .doesNotContain("\nWHERE");
    }

    @Test
    public void shouldJoinBelongsToDirectlyWithInnerJoin() {
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Customers.count"))
                .dimensions(List.of("Orders.status"))
                .build();

        CompiledQuery compiled = postgres.compile(query);

        assertThat(compiled.getSql()).isEqualTo(
                "SELECT orders.status AS \"Orders.status\", COUNT(customers.id) AS \"Customers.count\"\n"
                        + "FROM orders AS orders\n"
                        + "INNER JOIN customers AS customers ON orders.customer_id = customers.id\n"
                        + "GROUP BY orders.status");
        assertThat(compiled.getAnalysis().querySummary().queryType()).isEqualTo(QueryType.MULTI_CUBE_JOIN);
    }

    @Test
    public void shouldJoinManyToManyThroughJunctionTable() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .dimensions(List.of("Orders.status", "Tags.label"))
                .build();

        // When
        CompiledQuery compiled = postgres.compile(query);

        // Then
        assertThat(compiled.getSql()).isEqualTo(
                "SELECT orders.status AS \"Orders.status\", tags.label AS \"Tags.label\"\n"
                        + "FROM orders AS orders\n"
                        + "LEFT JOIN order_tags AS junction_tags ON orders.id = junction_tags.order_id\n"
                        + "LEFT JOIN tags AS tags ON junction_tags.tag_id = tags.id");
        assertThat(compiled.getAnalysis().querySummary().joinCount()).isEqualTo(2);
    }

    @Test
    public void shouldTruncateTimeDimensionAndFilterItsDateRange() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count"))
                .timeDimensions(List.of(TimeDimension.builder()
                        .dimension("Orders.createdAt")
                        .granularity(TimeGranularity.MONTH)
                        .dateRange(DateRange.between("2024-01-01", "2024-03-31"))
                        .build()))
                .build();

        // When
        CompiledQuery compiled = postgres.compile(query);

        // Then
        String month = "DATE_TRUNC('month', orders.created_at::timestamp)";
        assertThat(compiled.getSql()).isEqualTo(
                "SELECT " + month + " AS \"Orders.createdAt\", COUNT(orders.id) AS \"Orders.count\"\n"
                        + "FROM orders AS orders\n"
                        + "WHERE (orders.created_at >= $1 AND orders.created_at <= $2)\n"
                        + "GROUP BY " + month + "\n"
                        + "ORDER BY \"Orders.createdAt\" ASC");
        assertThat(compiled.getParams()).containsExactly(
                LocalDateTime.of(2024, 1, 1, 0, 0),
                LocalDateTime.of(2024, 3, 31, 23, 59, 59, 999_000_000));
    }

    @Test
    public void shouldPlaceMeasureFiltersInHaving() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count"))
                .dimensions(List.of("Orders.status"))
                .filters(List.of(
                        FilterCondition.of("Orders.status", FilterOperator.NOT_EQUALS, "cancelled"),
                        FilterCondition.of("Orders.count", FilterOperator.GT, 5)))
                .order(List.of(OrderBy.desc("Orders.count")))
                .build();

        // When
        CompiledQuery compiled = postgres.compile(query);

        // Then
        assertThat(compiled.getSql()).endsWith(
                "WHERE orders.status <> $1\n"
                        + "GROUP BY orders.status\n"
                        + "HAVING COUNT(orders.id) > $2\n"
                        + "ORDER BY \"Orders.count\" DESC");
        assertThat(compiled.getParams()).containsExactly("cancelled", 5);
    }

    @Test
    public void shouldRejectGroupMixingMeasuresAndDimensions() {
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count"))
                .dimensions(List.of("Orders.status"))
                .filters(List.of(LogicalFilter.or(
                        FilterCondition.of("Orders.count", FilterOperator.GT, 5),
                        FilterCondition.of("Orders.status", FilterOperator.EQUALS, "paid"))))
                .build();

        assertThatThrownBy(() -> postgres.compile(query))
                .isInstanceOf(InvalidFilterException.class)
                .hasMessageContaining("cannot mix measures");
    }

    @Test
    public void shouldPropagateSourceCubeFiltersIntoCte() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count", "LineItems.totalQuantity"))
                .dimensions(List.of("Orders.status"))
                .filters(List.of(FilterCondition.of("Orders.status", FilterOperator.EQUALS, "completed")))
                .build();

        // When
        CompiledQuery compiled = postgres.compile(query);

        // Then
        assertThat(compiled.getSql())
                .startsWith("WITH lineitems_agg AS (\n"
                        + "  SELECT lineitems.order_id AS order_id, SUM(lineitems.quantity) AS \"LineItems.totalQuantity\"\n"
                        + "  FROM line_items AS lineitems\n"
                        + "  WHERE lineitems.order_id IN (SELECT orders.id FROM orders AS orders WHERE orders.status = $1)\n"
                        + "  GROUP BY lineitems.order_id\n"
                        + ")\n")
                .contains("LEFT JOIN lineitems_agg ON orders.id = lineitems_agg.order_id")
                .contains("SUM(lineitems_agg.\"LineItems.totalQuantity\") AS \"LineItems.totalQuantity\"")
                .contains("\nWHERE orders.status = $2\n");
        assertThat(compiled.getParams()).containsExactly("completed", "completed");
    }

    @Test
    public void shouldApplyFiltersOnPreAggregatedCubeInsideCte() {
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("LineItems.totalQuantity"))
                .dimensions(List.of("Orders.status"))
                .filters(List.of(FilterCondition.of("LineItems.quantity", FilterOperator.GTE, 2)))
                .build();

        String sql = postgres.compile(query).getSql();

        assertThat(sql).contains("  WHERE lineitems.quantity >= $1\n");
        assertThat(sql).doesNotContain("\nWHERE");
    }

    @Test
    public void shouldClampLimitAndWarn() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count"))
                .limit(50_000)
                .build();

        // When
        CompiledQuery compiled = postgres.compile(query);

        // Then
        assertThat(compiled.getSql()).endsWith("\nLIMIT $1");
        assertThat(compiled.getParams()).containsExactly(10_000);
        assertThat(compiled.getWarnings()).containsExactly("Limit 50000 exceeds the maximum of 10000 and was clamped");
    }

    @Test
    public void shouldAddLimitForOffsetOnMySql() {
        // Given
        StandardQueryCompiler mysql = compiler(CompilerConfig.builder().engine(DatabaseEngine.MYSQL).build());
        SemanticQuery query = SemanticQuery.builder()
                .dimensions(List.of("Orders.status"))
                .offset(20)
                .build();

        // When
        CompiledQuery compiled = mysql.compile(query);

        // Then
        assertThat(compiled.getSql()).isEqualTo(
                "SELECT orders.status AS `Orders.status`\n"
                        + "FROM orders AS orders\n"
                        + "LIMIT ?\n"
                        + "OFFSET ?");
        assertThat(compiled.getParams()).containsExactly(10_000, 20);
    }

    @Test
    public void shouldCompileTimeSeriesForSqlite() {
        // Given
        StandardQueryCompiler sqlite = compiler(CompilerConfig.builder().engine(DatabaseEngine.SQLITE).build());
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count"))
                .timeDimensions(List.of(TimeDimension.builder()
                        .dimension("Orders.createdAt")
                        .granularity(TimeGranularity.MONTH)
                        .dateRange(DateRange.between("2024-01-01", "2024-03-31"))
                        .build()))
                .offset(20)
                .build();

        // When
        CompiledQuery compiled = sqlite.compile(query);

        // Then
        String month = "datetime(orders.created_at, 'start of month')";
        assertThat(compiled.getSql()).isEqualTo(
                "SELECT " + month + " AS \"Orders.createdAt\", COUNT(orders.id) AS \"Orders.count\"\n"
                        + "FROM orders AS orders\n"
                        + "WHERE (orders.created_at >= ? AND orders.created_at <= ?)\n"
                        + "GROUP BY " + month + "\n"
                        + "ORDER BY \"Orders.createdAt\" ASC\n"
                        + "LIMIT ?\n"
                        + "OFFSET ?");
        assertThat(compiled.getParams()).containsExactly(
                LocalDateTime.of(2024, 1, 1, 0, 0),
                LocalDateTime.of(2024, 3, 31, 23, 59, 59, 999_000_000),
                10_000,
                20);
    }

    @Test
    public void shouldUseOnlyFirstComparisonPeriodWithWarning() {
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count"))
                .timeDimensions(List.of(TimeDimension.builder()
                        .dimension("Orders.createdAt")
                        .compareDateRange(List.of(DateRange.expression("this month"), DateRange.expression("last month")))
                        .build()))
                .build();

        CompiledQuery compiled = postgres.compile(query);

        assertThat(compiled.getParams()).first().isEqualTo(LocalDateTime.of(2024, 3, 1, 0, 0));
        assertThat(compiled.getWarnings()).anyMatch(w -> w.contains("first period only"));
    }

    @Test
    public void shouldCollectEveryValidationProblem() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.nope", "Orders.status"))
                .dimensions(List.of("Ghost.name"))
                .order(List.of(OrderBy.asc("Customers.city")))
                .limit(-1)
                .build();

        // When
        IncompleteSpecException error = catchThrowableOfType(() -> postgres.compile(query),
                IncompleteSpecException.class);

        // Then
        assertThat(error.getErrorCode()).isEqualTo("incomplete_spec");
        assertThat(error.getProblems()).containsExactly(
                "Unknown measure 'Orders.nope'",
                "'Orders.status' is a dimension and cannot be used as a measure",
                "Unknown dimension 'Ghost.name'",
                "Limit must not be negative",
                "Cannot order by 'Customers.city' because it is not selected");
    }

    @Test
    public void shouldRejectEmptyQuery() {
        assertThatThrownBy(() -> postgres.compile(SemanticQuery.builder().build()))
                .isInstanceOf(IncompleteSpecException.class)
                .hasMessage("Query must request at least one measure, dimension or time dimension");
    }

    @Test
    public void shouldFailWhenCubesCannotBeJoined() {
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count", "Events.count"))
                .build();

        assertThatThrownBy(() -> postgres.compile(query)).isInstanceOf(PathNotFoundException.class);
    }

    @Test
    public void shouldReportMissingPathsInAnalysisWithoutFailing() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count", "Events.count"))
                .build();

        // When
        QueryAnalysis analysis = postgres.analyze(query);

        // Then
        assertThat(analysis.primaryCube().selectedCube()).isEqualTo("Events");
        assertThat(analysis.joinPaths()).singleElement().satisfies(path -> {
            assertThat(path.targetCube()).isEqualTo("Orders");
            assertThat(path.pathFound()).isFalse();
            assertThat(path.visitedCubes()).containsExactly("Events");
            assertThat(path.error()).startsWith("No join path found from 'Events' to 'Orders'");
        });
    }

    @Test
    public void shouldProduceIdenticalSqlForIdenticalQueries() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count", "LineItems.totalQuantity", "Customers.count"))
                .dimensions(List.of("Orders.status", "Tags.label"))
                .filters(List.of(FilterCondition.of("Customers.city", FilterOperator.EQUALS, "Paris")))
                .build();

        // When
        CompiledQuery first = postgres.compile(query);
        CompiledQuery second = compiler(CompilerConfig.defaults()).compile(query);

        // Then
        assertThat(second.getSql()).isEqualTo(first.getSql());
        assertThat(second.getParams()).isEqualTo(first.getParams());
    }

    private static StandardQueryCompiler compiler(CompilerConfig config) {
        return new StandardQueryCompiler(new CompilationContext(TestSchemas.ecommerce(), config, TestSchemas.FIXED_CLOCK));
    }
}
