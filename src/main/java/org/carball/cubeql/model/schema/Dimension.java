package org.carball.cubeql.model.schema;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Dimension {
    String name;
    String title;
    DimensionType type;
    String sql;
    boolean primaryKey;
}
