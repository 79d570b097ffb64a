package org.carball.cubeql.model.schema;

import org.carball.cubeql.TestSchemas;
import org.carball.cubeql.exception.SchemaException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

public class SchemaSnapshotTest {

    @Test
    void shouldLookUpQualifiedMembers() {
        SchemaSnapshot snapshot = TestSchemas.ecommerce();

        assertThat(snapshot.isMeasure("Orders.totalAmount")).isTrue();
        assertThat(snapshot.isDimension("Orders.totalAmount")).isFalse();
        assertThat(snapshot.findDimension("Customers.city")).isPresent();
        assertThat(snapshot.findMeasure("count")).isEmpty();
        assertThat(snapshot.hasCube("Nowhere")).isFalse();
    }

    @Test
    void shouldCollectEveryDefinitionProblem() {
        // Given
        Cube broken = Cube.builder()
                .name("Orders")
                .measure(Measure.builder().name("total").type(MeasureType.SUM).build())
                .measure(Measure.builder().name("rate").type(MeasureType.CALCULATED).build())
                .dimension(Dimension.builder().name("total").type(DimensionType.NUMBER).sql("total").build())
                .join(Relationship.builder().name("Ghosts").targetCube("Ghosts").type(RelationshipType.BELONGS_TO).build())
                .join(Relationship.builder().name("Tags").targetCube("Orders").type(RelationshipType.BELONGS_TO_MANY).build())
                .build();

        // When
        SchemaException error = catchThrowableOfType(() -> SchemaSnapshot.of(1, List.of(broken, TestSchemas.tags(),
                TestSchemas.tags())), SchemaException.class);

        // Then
        assertThat(error.getProblems()).containsExactly(
                "Duplicate cube 'Tags'",
                "Cube 'Orders' must declare a sql table",
                "Measure 'Orders.total' is missing sql",
                "Calculated measure 'Orders.rate' needs calculatedSql",
                "Duplicate member 'Orders.total'",
                "Join 'Orders.Ghosts' targets unknown cube 'Ghosts'",
                "Join 'Orders.Ghosts' needs at least one join column",
                "Join 'Orders.Tags' is belongsToMany and needs a junction table with source and target columns");
    }

    @Test
    void shouldRejectUnknownCalculatedReferences() {
        Cube orders = TestSchemas.orders().toBuilder()
                .measure(Measure.builder().name("ghostRate").type(MeasureType.CALCULATED)
                        .calculatedSql("{Orders.count} / {Ghosts.count}").build())
                .build();

        SchemaException error = catchThrowableOfType(() -> SchemaSnapshot.of(1, List.of(orders, TestSchemas.customers(),
                TestSchemas.lineItems(), TestSchemas.products(), TestSchemas.tags())), SchemaException.class);

        assertThat(error.getProblems())
                .containsExactly("Calculated measure 'Orders.ghostRate' references unknown measure 'Ghosts.count'");
    }

    @Test
    void shouldDetectCircularCalculatedMeasures() {
        // Given
        Cube cube = Cube.builder()
                .name("Loop")
                .sqlTable("loop")
                .measure(Measure.builder().name("a").type(MeasureType.CALCULATED).calculatedSql("{b} + 1").build())
                .measure(Measure.builder().name("b").type(MeasureType.CALCULATED).calculatedSql("{a} * 2").build())
                .build();

        // When
        SchemaException error = catchThrowableOfType(() -> SchemaSnapshot.of(1, List.of(cube)), SchemaException.class);

        // Then
        assertThat(error.getProblems())
                .containsExactly("Circular dependency between calculated measures: Loop.a -> Loop.b -> Loop.a");
    }
}
