package org.carball.cubeql.model.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Link table behind a belongsToMany relationship. {@code sourceColumns} pair the source cube's
 * columns with junction columns, {@code targetColumns} pair junction columns with the target cube's.
 */
@Value
@Builder
public class JunctionTable {
    String table;
    @Singular
    List<JoinColumn> sourceColumns;
    @Singular
    List<JoinColumn> targetColumns;

    /**
     * The same junction seen from the other end of the relationship.
     */
    public JunctionTable reversed() {
        return JunctionTable.builder()
                .table(table)
                .sourceColumns(targetColumns.stream().map(JoinColumn::swapped).collect(Collectors.toList()))
                .targetColumns(sourceColumns.stream().map(JoinColumn::swapped).collect(Collectors.toList()))
                .build();
    }
}
