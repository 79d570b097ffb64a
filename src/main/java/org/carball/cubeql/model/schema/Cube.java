package org.carball.cubeql.model.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder(toBuilder = true)
public class Cube {
    String name;
    String title;
    String description;
    String sqlTable;
    @Singular
    List<Measure> measures;
    @Singular
    List<Dimension> dimensions;
    @Singular
    List<Relationship> joins;

    public Optional<Measure> findMeasure(String memberName) {
        return measures.stream()
                .filter(m -> m.getName().equals(memberName))
                .findFirst();
    }

    public Optional<Dimension> findDimension(String memberName) {
        return dimensions.stream()
                .filter(d -> d.getName().equals(memberName))
                .findFirst();
    }

    public List<Dimension> primaryKeys() {
        return dimensions.stream().filter(Dimension::isPrimaryKey).toList();
    }

    /**
     * SQL alias used for this cube's table in generated queries.
     */
    public String alias() {
        return name.toLowerCase();
    }

    public String qualify(String memberName) {
        return name + "." + memberName;
    }
}
