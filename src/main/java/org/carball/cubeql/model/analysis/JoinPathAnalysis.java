package org.carball.cubeql.model.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JoinPathAnalysis(
    String targetCube,
    boolean pathFound,
    List<JoinPathStep> path,
    int pathLength,
    List<String> visitedCubes,
    String error
) {}
