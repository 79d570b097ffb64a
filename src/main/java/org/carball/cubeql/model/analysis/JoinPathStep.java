package org.carball.cubeql.model.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.carball.cubeql.model.schema.JoinColumn;

import java.util.List;

/**
 * One JOIN emitted for a path. The two halves of a belongsToMany hop both name the junction table.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JoinPathStep(
    String fromCube,
    String toCube,
    String relationship,
    String joinType,
    List<JoinColumn> joinColumns,
    String junctionTable
) {}
