package org.carball.cubeql.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class PathNotFoundException extends CompilationException {

    private final String fromCube;
    private final String toCube;
    private final List<String> visitedCubes;

    public PathNotFoundException(String fromCube, String toCube, List<String> visitedCubes) {
        super("path_not_found", String.format("No join path found from '%s' to '%s' (visited: %s)",
                fromCube, toCube, String.join(", ", visitedCubes)));
        this.fromCube = fromCube;
        this.toCube = toCube;
        this.visitedCubes = List.copyOf(visitedCubes);
    }
}
