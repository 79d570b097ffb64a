package org.carball.cubeql.compiler;

import org.carball.cubeql.TestSchemas;
import org.carball.cubeql.config.CompilerConfig;
import org.carball.cubeql.exception.IncompleteSpecException;
import org.carball.cubeql.model.query.FilterCondition;
import org.carball.cubeql.model.query.FilterOperator;
import org.carball.cubeql.model.query.FunnelSpec;
import org.carball.cubeql.model.query.FunnelStep;
import org.carball.cubeql.model.query.MemberMapping;
import org.carball.cubeql.model.query.QueryMode;
import org.carball.cubeql.model.result.CompiledQuery;
import org.carball.cubeql.model.result.FunnelMetadata;
import org.carball.cubeql.sql.DatabaseEngine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

public class FunnelQueryCompilerTest {

    private final FunnelQueryCompiler postgres = compiler(DatabaseEngine.POSTGRES);

    @Test
    public void shouldChainStepsWithConversionWindow() {
        // Given
        FunnelSpec funnel = viewThenPurchase("P1D", false);

        // When
        CompiledQuery compiled = postgres.compile(funnel);

        // Then
        assertThat(compiled.getMode()).isEqualTo(QueryMode.FUNNEL);
        assertThat(compiled.getSql()).isEqualTo(
                "WITH step_0 AS (\n"
                        + "  SELECT events.user_id AS binding_key, MIN(events.occurred_at) AS step_time\n"
                        + "  FROM events AS events\n"
                        + "  WHERE events.event_name = $1\n"
                        + "  GROUP BY events.user_id\n"
                        + "),\n"
                        + "step_1 AS (\n"
                        + "  SELECT events.user_id AS binding_key, MIN(events.occurred_at) AS step_time\n"
                        + "  FROM events AS events\n"
                        + "  INNER JOIN step_0 ON events.user_id = step_0.binding_key\n"
                        + "  WHERE events.event_name = $2 AND events.occurred_at > step_0.step_time"
                        + " AND events.occurred_at <= (step_0.step_time + INTERVAL '1 days')\n"
                        + "  GROUP BY events.user_id\n"
                        + "),\n"
                        + "funnel_joined AS (\n"
                        + "  SELECT s0.binding_key AS binding_key, s0.step_time AS step_0_time, s1.step_time AS step_1_time\n"
                        + "  FROM step_0 s0\n"
                        + "  LEFT JOIN step_1 s1 ON s0.binding_key = s1.binding_key\n"
                        + "),\n"
                        + "funnel_metrics AS (\n"
                        + "  SELECT COUNT(*) AS step_0_count, COUNT(step_1_time) AS step_1_count\n"
                        + "  FROM funnel_joined\n"
                        + ")\n"
                        + "SELECT * FROM funnel_metrics");
        assertThat(compiled.getParams()).containsExactly("view", "purchase");
    }

    @Test
    public void shouldOmitUpperBoundWithoutWindow() {
        CompiledQuery compiled = postgres.compile(viewThenPurchase(null, false));

        assertThat(compiled.getSql())
                .contains("events.occurred_at > step_0.step_time")
                .doesNotContain("INTERVAL");
    }

    @Test
    public void shouldDescribeEachStepInMetadata() {
        // When
        FunnelMetadata metadata = postgres.compile(viewThenPurchase("PT2H", false)).getFunnelMetadata();

        // Then
        assertThat(metadata.bindingKey()).isEqualTo("Events.userId");
        assertThat(metadata.steps()).hasSize(2);
        FunnelMetadata.FunnelStepMetadata purchase = metadata.steps().get(1);
        assertThat(purchase.name()).isEqualTo("Purchase");
        assertThat(purchase.cube()).isEqualTo("Events");
        assertThat(purchase.timeToConvert()).isEqualTo("PT2H");
        assertThat(purchase.debugSql()).isEqualTo(
                "SELECT events.user_id AS binding_key, MIN(events.occurred_at) AS step_time FROM events AS events"
                        + " WHERE events.event_name = $1 AND events.user_id IN (SELECT binding_key FROM step_0)"
                        + " GROUP BY events.user_id");
        assertThat(purchase.debugParams()).containsExactly("purchase");
    }

    @Test
    public void shouldComputeTimeToConvertMetricsOnPostgres() {
        // When
        CompiledQuery compiled = postgres.compile(viewThenPurchase("P1D", true));

        // Then
        assertThat(compiled.getSql())
                .contains("AVG(EXTRACT(EPOCH FROM (step_1_time - step_0_time))) FILTER (WHERE step_1_time IS NOT NULL)"
                        + " AS step_1_avg_seconds")
                .contains(" AS step_1_min_seconds")
                .contains(" AS step_1_max_seconds")
                .contains("(SELECT PERCENTILE_CONT(0.5) WITHIN GROUP (ORDER BY EXTRACT(EPOCH FROM (step_1_time - step_0_time)))"
                        + " FROM funnel_joined WHERE step_1_time IS NOT NULL) AS step_1_median_seconds")
                .contains(" AS step_1_p90_seconds");
        assertThat(compiled.getWarnings()).isEmpty();
    }

    @Test
    public void shouldSkipPercentilesAndWarnOnMySql() {
        // When
        CompiledQuery compiled = compiler(DatabaseEngine.MYSQL).compile(viewThenPurchase("P1D", true));

        // Then
        assertThat(compiled.getSql())
                .contains(" AS step_1_avg_seconds")
                .doesNotContain("median_seconds");
        assertThat(compiled.getWarnings()).containsExactly("Median and p90 time to convert are not available on mysql");
    }

    @Test
    public void shouldJoinCubesReferencedByStepFilters() {
        // Given
        FunnelSpec funnel = FunnelSpec.builder()
                .bindingKey(MemberMapping.of("Orders.id"))
                .timeDimension(MemberMapping.of("Orders.createdAt"))
                .steps(List.of(
                        FunnelStep.builder()
                                .name("Placed in Paris")
                                .filters(List.of(FilterCondition.of("Customers.city", FilterOperator.EQUALS, "Paris")))
                                .build(),
                        FunnelStep.builder()
                                .name("Completed")
                                .filters(List.of(FilterCondition.of("Orders.status", FilterOperator.EQUALS, "completed")))
                                .build()))
                .build();

        // When
        String sql = postgres.compile(funnel).getSql();

        // Then
        assertThat(sql).startsWith("WITH step_0 AS (\n"
                + "  SELECT orders.id AS binding_key, MIN(orders.created_at) AS step_time\n"
                + "  FROM orders AS orders\n"
                + "  INNER JOIN customers AS customers ON orders.customer_id = customers.id\n"
                + "  WHERE customers.city = $1\n");
    }

    @Test
    public void shouldRequireAtLeastTwoSteps() {
        FunnelSpec funnel = viewThenPurchase(null, false).toBuilder()
                .steps(List.of(step("View", "view", null)))
                .build();

        assertThatThrownBy(() -> postgres.compile(funnel))
                .isInstanceOf(IncompleteSpecException.class)
                .hasMessageContaining("Funnel requires at least 2 steps");
    }

    @Test
    public void shouldReportEveryInvalidStep() {
        // Given
        FunnelSpec funnel = viewThenPurchase(null, false).toBuilder()
                .steps(List.of(
                        step("View", "view", "P1D"),
                        step("Purchase", "purchase", "7 days"),
                        FunnelStep.builder().name("Elsewhere").cube("Nowhere").build(),
                        FunnelStep.builder()
                                .name("Busy")
                                .filters(List.of(FilterCondition.of("Events.count", FilterOperator.GT, 3)))
                                .build()))
                .build();

        // When
        IncompleteSpecException error = catchThrowableOfType(() -> postgres.compile(funnel),
                IncompleteSpecException.class);

        // Then
        assertThat(error.getProblems()).containsExactly(
                "The first funnel step cannot have a timeToConvert",
                "Funnel step 'Purchase' has an invalid timeToConvert '7 days'; expected an ISO-8601 duration such as P7D or PT1H",
                "Funnel step 'Elsewhere' uses unknown cube 'Nowhere'",
                "Funnel step 'Busy' filters on measure 'Events.count'; step filters may only use dimensions");
    }

    @Test
    public void shouldRequireBindingKeyMappedForEveryStepCube() {
        FunnelSpec funnel = viewThenPurchase(null, false).toBuilder()
                .steps(List.of(step("View", "view", null), FunnelStep.builder().name("Order").cube("Orders").build()))
                .build();

        assertThatThrownBy(() -> postgres.compile(funnel))
                .isInstanceOf(IncompleteSpecException.class)
                .hasMessageContaining("No binding key mapped for cube 'Orders' used by funnel step 'Order'");
    }

    private static FunnelSpec viewThenPurchase(String window, boolean timeMetrics) {
        return FunnelSpec.builder()
                .bindingKey(MemberMapping.of("Events.userId"))
                .timeDimension(MemberMapping.of("Events.timestamp"))
                .steps(List.of(step("View", "view", null), step("Purchase", "purchase", window)))
                .includeTimeMetrics(timeMetrics)
                .build();
    }

    private static FunnelStep step(String name, String event, String window) {
        return FunnelStep.builder()
                .name(name)
                .filters(List.of(FilterCondition.of("Events.eventName", FilterOperator.EQUALS, event)))
                .timeToConvert(window)
                .build();
    }

    private static FunnelQueryCompiler compiler(DatabaseEngine engine) {
        CompilerConfig config = CompilerConfig.builder().engine(engine).build();
        return new FunnelQueryCompiler(new CompilationContext(TestSchemas.ecommerce(), config, TestSchemas.FIXED_CLOCK));
    }
}
