package org.carball.cubeql.compiler;

import org.carball.cubeql.TestSchemas;
import org.carball.cubeql.config.CompilerConfig;
import org.carball.cubeql.exception.IncompleteSpecException;
import org.carball.cubeql.model.query.FilterCondition;
import org.carball.cubeql.model.query.FilterOperator;
import org.carball.cubeql.model.query.FlowJoinStrategy;
import org.carball.cubeql.model.query.FlowOutputMode;
import org.carball.cubeql.model.query.FlowSpec;
import org.carball.cubeql.model.query.FlowStartingStep;
import org.carball.cubeql.model.query.MemberMapping;
import org.carball.cubeql.model.query.QueryMode;
import org.carball.cubeql.model.result.CompiledQuery;
import org.carball.cubeql.model.result.FlowMetadata;
import org.carball.cubeql.sql.DatabaseEngine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

public class FlowQueryCompilerTest {

    private final FlowQueryCompiler postgres = compiler(DatabaseEngine.POSTGRES);

    @Test
    public void shouldSelectStartingEntitiesWithFirstMatchingEvent() {
        // When
        CompiledQuery compiled = postgres.compile(checkoutFlow(1, 2));

        // Then
        assertThat(compiled.getMode()).isEqualTo(QueryMode.FLOW);
        assertThat(compiled.getSql()).startsWith("WITH starting_entities AS (\n"
                + "  SELECT events.user_id AS binding_key, MIN(events.occurred_at) AS start_time,"
                + " events.event_name AS event_type, CAST(events.event_name AS TEXT) AS event_path\n"
                + "  FROM events AS events\n"
                + "  WHERE events.event_name = $1\n"
                + "  GROUP BY events.user_id, events.event_name\n"
                + "),\n");
        assertThat(compiled.getSql()).endsWith("\nSELECT * FROM final_result");
        assertThat(compiled.getParams()).containsExactly("checkout");
    }

    @Test
    public void shouldWalkLayersWithLateralJoinsOnPostgres() {
        // When
        String sql = postgres.compile(checkoutFlow(1, 2)).getSql();

        // Then
        assertThat(sql).contains("after_step_1 AS (\n"
                + "  SELECT e.binding_key, e.step_time, e.event_type, e.event_path\n"
                + "  FROM starting_entities\n"
                + "  CROSS JOIN LATERAL (\n"
                + "    SELECT events.user_id AS binding_key, events.occurred_at AS step_time,"
                + " events.event_name AS event_type, CAST(events.event_name AS TEXT) AS event_path\n"
                + "    FROM events AS events\n"
                + "    WHERE events.user_id = starting_entities.binding_key"
                + " AND events.occurred_at > starting_entities.start_time\n"
                + "    ORDER BY events.occurred_at ASC\n"
                + "    LIMIT 1\n"
                + "  ) e\n"
                + ")");
        assertThat(sql).contains("WHERE events.user_id = after_step_1.binding_key"
                + " AND events.occurred_at > after_step_1.step_time");
        assertThat(sql).contains("AND events.occurred_at < starting_entities.start_time\n"
                + "    ORDER BY events.occurred_at DESC");
    }

    @Test
    public void shouldUseRowNumberWindowOnMySql() {
        // When
        CompiledQuery compiled = compiler(DatabaseEngine.MYSQL).compile(checkoutFlow(1, 0));

        // Then
        assertThat(compiled.getSql()).contains("before_step_1 AS (\n"
                + "  SELECT binding_key, step_time, event_type, event_path\n"
                + "  FROM (\n"
                + "    SELECT events.user_id AS binding_key, events.occurred_at AS step_time,"
                + " events.event_name AS event_type, CAST(events.event_name AS CHAR) AS event_path,"
                + " ROW_NUMBER() OVER (PARTITION BY events.user_id ORDER BY events.occurred_at DESC) AS rn\n"
                + "    FROM events AS events\n"
                + "    INNER JOIN starting_entities ON events.user_id = starting_entities.binding_key\n"
                + "    WHERE events.occurred_at < starting_entities.start_time\n"
                + "  ) ranked\n"
                + "  WHERE rn = 1\n"
                + ")");
        assertThat(compiled.getFlowMetadata().joinStrategy()).isEqualTo(FlowJoinStrategy.WINDOW);
    }

    @Test
    public void shouldAggregateNodesAndLinksPerLayer() {
        // When
        String sql = postgres.compile(checkoutFlow(1, 1)).getSql();

        // Then
        assertThat(sql)
                .contains("SELECT 'start_' || CAST(event_type AS TEXT) AS node_id, CAST(event_type AS TEXT) AS name,"
                        + " 0 AS layer, COUNT(*) AS value FROM starting_entities GROUP BY event_type")
                .contains("SELECT 'before_1_' || CAST(event_type AS TEXT) AS node_id, CAST(event_type AS TEXT) AS name,"
                        + " -1 AS layer, COUNT(*) AS value FROM before_step_1 GROUP BY event_type")
                .contains("SELECT 'start_' || CAST(s.event_type AS TEXT) AS source_id,"
                        + " 'after_1_' || CAST(a.event_type AS TEXT) AS target_id, COUNT(*) AS value"
                        + " FROM starting_entities s INNER JOIN after_step_1 a ON s.binding_key = a.binding_key"
                        + " GROUP BY s.event_type, a.event_type")
                .contains("SELECT 'before_1_' || CAST(b.event_type AS TEXT) AS source_id,"
                        + " 'start_' || CAST(s.event_type AS TEXT) AS target_id");
    }

    @Test
    public void shouldReturnEmptyLinksWithoutSurroundingSteps() {
        String sql = postgres.compile(checkoutFlow(0, 0)).getSql();

        assertThat(sql).contains("links_agg AS (\n  SELECT NULL AS source_id, NULL AS target_id, 0 AS value"
                + " FROM (SELECT 1 AS one) empty WHERE 1 = 0\n)");
    }

    @Test
    public void shouldDescribeLayersInMetadata() {
        // When
        FlowMetadata metadata = postgres.compile(checkoutFlow(1, 2)).getFlowMetadata();

        // Then
        assertThat(metadata.startingStep()).isEqualTo("Checkout");
        assertThat(metadata.eventDimension()).isEqualTo("Events.eventName");
        assertThat(metadata.outputMode()).isEqualTo(FlowOutputMode.SANKEY);
        assertThat(metadata.joinStrategy()).isEqualTo(FlowJoinStrategy.LATERAL);
        assertThat(metadata.layers())
                .containsExactly("before_step_1", "starting_entities", "after_step_1", "after_step_2");
    }

    @Test
    public void shouldBuildPathsAndIgnoreStepsBeforeForSunburst() {
        // Given
        FlowSpec flow = checkoutFlow(2, 1).toBuilder().outputMode(FlowOutputMode.SUNBURST).build();

        // When
        CompiledQuery compiled = postgres.compile(flow);

        // Then
        assertThat(compiled.getSql())
                .contains("starting_entities.event_path || '→' || CAST(events.event_name AS TEXT) AS event_path")
                .doesNotContain("before_step_");
        assertThat(compiled.getFlowMetadata().stepsBefore()).isZero();
        assertThat(compiled.getWarnings()).containsExactly("Sunburst output only walks forward; stepsBefore (2) is ignored");
    }

    @Test
    public void shouldCapStartingEntitiesInStableOrder() {
        // Given
        FlowSpec flow = checkoutFlow(0, 1).toBuilder().entityLimit(100).build();

        // When
        CompiledQuery compiled = postgres.compile(flow);

        // Then
        assertThat(compiled.getSql()).contains("  GROUP BY events.user_id, events.event_name\n  ORDER BY start_time, binding_key\n  LIMIT $2\n)");
        assertThat(compiled.getParams()).containsExactly("checkout", 100);
    }

    @Test
    public void shouldWarnAboutDeepFlowsAndUnnamedStart() {
        // Given
        FlowSpec flow = checkoutFlow(0, 4).toBuilder()
                .startingStep(FlowStartingStep.builder()
                        .filters(List.of(FilterCondition.of("Events.eventName", FilterOperator.EQUALS, "checkout")))
                        .build())
                .build();

        // When
        CompiledQuery compiled = postgres.compile(flow);

        // Then
        assertThat(compiled.getWarnings()).containsExactly(
                "High step depth (4-5) may impact query performance on large datasets",
                "Starting step has no name - using default");
        assertThat(compiled.getFlowMetadata().startingStep()).isEqualTo("Start");
    }

    @Test
    public void shouldReportEveryMissingPiece() {
        // Given
        FlowSpec flow = FlowSpec.builder()
                .bindingKey(MemberMapping.of("Events.userId"))
                .timeDimension(MemberMapping.of("Events.timestamp"))
                .eventDimension("Events.eventName")
                .startingStep(FlowStartingStep.builder().name("Nothing").build())
                .stepsAfter(6)
                .entityLimit(0)
                .build();

        // When
        IncompleteSpecException error = catchThrowableOfType(() -> postgres.compile(flow),
                IncompleteSpecException.class);

        // Then
        assertThat(error.getProblems()).containsExactly(
                "Starting step must have at least one filter",
                "stepsAfter must be between 0 and 5, got: 6",
                "entityLimit must be positive, got: 0");
    }

    @Test
    public void shouldRequireEventDimension() {
        FlowSpec flow = checkoutFlow(0, 1).toBuilder().eventDimension(null).build();

        assertThatThrownBy(() -> postgres.compile(flow))
                .isInstanceOf(IncompleteSpecException.class)
                .hasMessageContaining("Event dimension is required for flow analysis");
    }

    @Test
    public void shouldRejectLateralStrategyOnMySql() {
        FlowSpec flow = checkoutFlow(0, 1).toBuilder().joinStrategy(FlowJoinStrategy.LATERAL).build();

        assertThatThrownBy(() -> compiler(DatabaseEngine.MYSQL).compile(flow))
                .isInstanceOf(IncompleteSpecException.class)
                .hasMessage("Lateral joins are not supported on mysql");
    }

    private static FlowSpec checkoutFlow(int before, int after) {
        return FlowSpec.builder()
                .bindingKey(MemberMapping.of("Events.userId"))
                .timeDimension(MemberMapping.of("Events.timestamp"))
                .eventDimension("Events.eventName")
                .startingStep(FlowStartingStep.builder()
                        .name("Checkout")
                        .filters(List.of(FilterCondition.of("Events.eventName", FilterOperator.EQUALS, "checkout")))
                        .build())
                .stepsBefore(before)
                .stepsAfter(after)
                .build();
    }

    private static FlowQueryCompiler compiler(DatabaseEngine engine) {
        CompilerConfig config = CompilerConfig.builder().engine(engine).build();
        return new FlowQueryCompiler(new CompilationContext(TestSchemas.ecommerce(), config, TestSchemas.FIXED_CLOCK));
    }
}
