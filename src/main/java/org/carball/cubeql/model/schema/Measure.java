package org.carball.cubeql.model.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * An aggregatable field. {@code sql} is a column name or an expression where {@code {CUBE}}
 * stands for the cube's alias; calculated measures use {@code calculatedSql} with
 * {@code {measure}} or {@code {Cube.measure}} references instead.
 */
@Value
@Builder(toBuilder = true)
public class Measure {
    String name;
    String title;
    MeasureType type;
    String sql;
    String calculatedSql;
    @Singular
    List<String> filters;
    String format;
}
