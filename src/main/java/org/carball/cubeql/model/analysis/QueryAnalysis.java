package org.carball.cubeql.model.analysis;

import java.time.Instant;
import java.util.List;

/**
 * Why a standard query was compiled the way it was: which cube anchors the FROM clause, how every
 * other cube is reached, and which cubes are aggregated ahead of the join.
 */
public record QueryAnalysis(
    Instant timestamp,
    int cubeCount,
    List<String> cubesInvolved,
    PrimaryCubeAnalysis primaryCube,
    List<JoinPathAnalysis> joinPaths,
    List<PreAggregationAnalysis> preAggregations,
    QuerySummary querySummary,
    List<String> warnings
) {}
