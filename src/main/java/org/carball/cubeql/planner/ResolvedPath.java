package org.carball.cubeql.planner;

import org.carball.cubeql.model.schema.GraphEdge;

import java.util.ArrayList;
import java.util.List;

/**
 * Shortest join path between two cubes, with the cubes the search visited on the way.
 */
public record ResolvedPath(String fromCube, String toCube, List<GraphEdge> edges, List<String> visitedCubes) {

    public int hops() {
        return edges.size();
    }

    /**
     * Cubes along the path, both ends included.
     */
    public List<String> cubes() {
        List<String> cubes = new ArrayList<>();
        cubes.add(fromCube);
        edges.forEach(edge -> cubes.add(edge.toCube()));
        return cubes;
    }

    /**
     * Cubes strictly between the two ends.
     */
    public List<String> intermediateCubes() {
        List<String> cubes = cubes();
        return cubes.size() <= 2 ? List.of() : cubes.subList(1, cubes.size() - 1);
    }

    public boolean hasToManyHop() {
        return edges.stream().anyMatch(edge -> edge.type().isToMany());
    }

    public long manyToManyHops() {
        return edges.stream().filter(GraphEdge::isManyToMany).count();
    }

    public GraphEdge lastEdge() {
        return edges.get(edges.size() - 1);
    }

    /**
     * Physical JOIN clauses this path expands to; belongsToMany hops count twice.
     */
    public int joinSteps() {
        return (int) (edges.size() + manyToManyHops());
    }
}
