package org.carball.cubeql.planner;

import org.carball.cubeql.TestSchemas;
import org.carball.cubeql.exception.PathNotFoundException;
import org.carball.cubeql.model.analysis.PrimaryCubeAnalysis;
import org.carball.cubeql.model.analysis.SelectionReason;
import org.carball.cubeql.model.query.FilterCondition;
import org.carball.cubeql.model.query.FilterOperator;
import org.carball.cubeql.model.query.SemanticQuery;
import org.carball.cubeql.model.schema.SchemaSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class QueryPlannerTest {

    private SchemaSnapshot snapshot;
    private QueryPlanner planner;

    @BeforeEach
    void setUp() {
        snapshot = TestSchemas.ecommerce();
        planner = new QueryPlanner(snapshot, new JoinPathResolver(snapshot.getJoinGraph()));
    }

    @Test
    public void shouldSelectOnlyCubeWhenQueryTouchesOne() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count"))
                .dimensions(List.of("Orders.status"))
                .build();

        // When
        QueryPlan plan = planner.plan(query, true);

        // Then
        assertThat(plan.primaryCubeName()).isEqualTo("Orders");
        assertThat(plan.primaryCube().reason()).isEqualTo(SelectionReason.SINGLE_CUBE);
        assertThat(plan.paths()).isEmpty();
        assertThat(plan.preAggregations()).isEmpty();
    }

    @Test
    public void shouldPreferCubeWithMostRequestedDimensions() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count"))
                .dimensions(List.of("Customers.city"))
                .build();

        // When
        PrimaryCubeAnalysis primary = planner.plan(query, true).primaryCube();

        // Then
        assertThat(primary.selectedCube()).isEqualTo("Customers");
        assertThat(primary.reason()).isEqualTo(SelectionReason.MOST_DIMENSIONS);
        assertThat(primary.explanation()).contains("most requested dimensions (1)");
        assertThat(primary.candidates()).extracting(c -> c.cubeName()).containsExactly("Customers", "Orders");
    }

    @Test
    public void shouldBreakDimensionTieByConnectivity() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Customers.count", "LineItems.count", "Orders.count"))
                .build();

        // When
        PrimaryCubeAnalysis primary = planner.plan(query, true).primaryCube();

        // Then
        assertThat(primary.selectedCube()).isEqualTo("Orders");
        assertThat(primary.reason()).isEqualTo(SelectionReason.MOST_CONNECTED);
    }

    @Test
    public void shouldFallBackToAlphabeticalOrderOnFullTie() {
        SemanticQuery query = SemanticQuery.builder()
                .dimensions(List.of("Tags.label", "Orders.status"))
                .build();

        PrimaryCubeAnalysis primary = planner.plan(query, true).primaryCube();

        assertThat(primary.selectedCube()).isEqualTo("Orders");
        assertThat(primary.reason()).isEqualTo(SelectionReason.ALPHABETICAL_FALLBACK);
    }

    @Test
    public void shouldChooseSamePrimaryRegardlessOfMemberOrder() {
        // Given
        SemanticQuery forward = SemanticQuery.builder()
                .measures(List.of("Orders.count", "Customers.count"))
                .build();
        SemanticQuery backward = SemanticQuery.builder()
                .measures(List.of("Customers.count", "Orders.count"))
                .build();

        // When / Then
        assertThat(planner.plan(forward, true).primaryCubeName())
                .isEqualTo(planner.plan(backward, true).primaryCubeName());
    }

    @Test
    public void shouldCountFilterOnlyCubesAsTouched() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count"))
                .dimensions(List.of("Orders.status"))
                .filters(List.of(FilterCondition.of("Customers.city", FilterOperator.EQUALS, "Paris")))
                .build();

        // When
        QueryPlan plan = planner.plan(query, true);

        // Then
        assertThat(plan.primaryCubeName()).isEqualTo("Orders");
        assertThat(plan.paths()).containsOnlyKeys("Customers");
        assertThat(plan.usage().getFilterMembers()).containsExactly("Customers.city");
    }

    @Test
    public void shouldRecordUnreachableCubesWhenNotStrict() {
        // Given
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count", "Events.count"))
                .build();

        // When
        QueryPlan plan = planner.plan(query, false);

        // Then
        assertThat(plan.primaryCubeName()).isEqualTo("Events");
        assertThat(plan.primaryCube().reason()).isEqualTo(SelectionReason.ALPHABETICAL_FALLBACK);
        assertThat(plan.unresolved()).containsOnlyKeys("Orders");
        assertThat(plan.unresolved().get("Orders")).containsExactly("Events");
        assertThat(plan.warnings()).anyMatch(w -> w.startsWith("No cube can reach every other cube"));
    }

    @Test
    public void shouldFailOnUnreachableCubesWhenStrict() {
        SemanticQuery query = SemanticQuery.builder()
                .measures(List.of("Orders.count", "Events.count"))
                .build();

        assertThatThrownBy(() -> planner.plan(query, true))
                .isInstanceOf(PathNotFoundException.class)
                .hasMessageContaining("from 'Events' to 'Orders'");
    }

    @Test
    public void shouldExpandCalculatedMeasuresToTheirLeaves() {
        // When
        CubeUsage usage = CubeUsage.of(SemanticQuery.builder()
                .measures(List.of("Orders.completionRate"))
                .build(), snapshot);

        // Then
        assertThat(usage.measuresOf("Orders")).containsExactlyInAnyOrder("Orders.completedCount", "Orders.count");
    }
}
