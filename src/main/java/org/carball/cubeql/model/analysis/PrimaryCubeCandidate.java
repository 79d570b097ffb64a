package org.carball.cubeql.model.analysis;

public record PrimaryCubeCandidate(
    String cubeName,
    int dimensionCount,
    int joinCount,
    boolean canReachAll
) {}
