package org.carball.cubeql.model.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Undirected adjacency view over every declared relationship, keyed by cube name. Each cube pair
 * keeps one edge: a relationship declared on the walking side wins over the inverse of one
 * declared on the far side, and among several declared ones the first declared wins.
 * Self references are left out because they never help connect two different cubes.
 */
public final class JoinGraph {

    private final Map<String, Map<String, GraphEdge>> adjacency;

    private JoinGraph(Map<String, Map<String, GraphEdge>> adjacency) {
        this.adjacency = adjacency;
    }

    static JoinGraph of(Collection<Cube> cubes) {
        Map<String, Map<String, GraphEdge>> adjacency = new TreeMap<>();
        cubes.forEach(cube -> adjacency.put(cube.getName(), new TreeMap<>()));

        for (Cube cube : cubes) {
            for (Relationship relationship : cube.getJoins()) {
                if (cube.getName().equals(relationship.getTargetCube())) {
                    continue;
                }
                adjacency.get(cube.getName())
                        .putIfAbsent(relationship.getTargetCube(), GraphEdge.forward(cube.getName(), relationship));
            }
        }
        for (Cube cube : cubes) {
            for (Relationship relationship : cube.getJoins()) {
                if (cube.getName().equals(relationship.getTargetCube())) {
                    continue;
                }
                Map<String, GraphEdge> targetEdges = adjacency.get(relationship.getTargetCube());
                if (targetEdges != null) {
                    targetEdges.putIfAbsent(cube.getName(), GraphEdge.backward(cube.getName(), relationship));
                }
            }
        }

        Map<String, Map<String, GraphEdge>> frozen = new TreeMap<>();
        adjacency.forEach((name, edges) -> frozen.put(name, Collections.unmodifiableMap(edges)));
        return new JoinGraph(Collections.unmodifiableMap(frozen));
    }

    /**
     * Edges leaving a cube, ordered by neighbour name.
     */
    public List<GraphEdge> edgesFrom(String cubeName) {
        Map<String, GraphEdge> edges = adjacency.get(cubeName);
        return edges == null ? List.of() : List.copyOf(edges.values());
    }

    public Optional<GraphEdge> edge(String fromCube, String toCube) {
        Map<String, GraphEdge> edges = adjacency.get(fromCube);
        return edges == null ? Optional.empty() : Optional.ofNullable(edges.get(toCube));
    }

    public boolean contains(String cubeName) {
        return adjacency.containsKey(cubeName);
    }
}
