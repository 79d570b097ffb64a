package org.carball.cubeql.planner;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.exception.PathNotFoundException;
import org.carball.cubeql.model.schema.GraphEdge;
import org.carball.cubeql.model.schema.JoinGraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Breadth-first search over the undirected join graph. Among paths with the fewest hops the one
 * with the fewest belongsToMany hops wins, then the one whose cube sequence sorts first.
 * Results are memoised for the lifetime of the resolver, which serves a single compilation.
 */
@Slf4j
public class JoinPathResolver {

    private record Label(List<GraphEdge> edges, List<String> cubes, int manyToMany) {

        Label extend(GraphEdge edge) {
            List<GraphEdge> nextEdges = new ArrayList<>(edges);
            nextEdges.add(edge);
            List<String> nextCubes = new ArrayList<>(cubes);
            nextCubes.add(edge.toCube());
            return new Label(nextEdges, nextCubes, manyToMany + (edge.isManyToMany() ? 1 : 0));
        }

        boolean betterThan(Label other) {
            if (manyToMany != other.manyToMany) {
                return manyToMany < other.manyToMany;
            }
            for (int i = 0; i < cubes.size(); i++) {
                int comparison = cubes.get(i).compareTo(other.cubes.get(i));
                if (comparison != 0) {
                    return comparison < 0;
                }
            }
            return false;
        }
    }

    private record Search(ResolvedPath path, List<String> visitedCubes) {}

    private final JoinGraph graph;
    private final Map<String, Search> memo = new HashMap<>();

    public JoinPathResolver(JoinGraph graph) {
        this.graph = graph;
    }

    /**
     * @throws PathNotFoundException when the target cannot be reached
     */
    public ResolvedPath resolve(String fromCube, String toCube) {
        Search search = search(fromCube, toCube);
        if (search.path() == null) {
            throw new PathNotFoundException(fromCube, toCube, search.visitedCubes());
        }
        return search.path();
    }

    public Optional<ResolvedPath> find(String fromCube, String toCube) {
        return Optional.ofNullable(search(fromCube, toCube).path());
    }

    /**
     * Cubes visited while looking for a path, in discovery order, whether or not one was found.
     */
    public List<String> visitedCubes(String fromCube, String toCube) {
        return search(fromCube, toCube).visitedCubes();
    }

    /**
     * Every cube reachable from the given one, itself included.
     */
    public Set<String> reachableFrom(String cubeName) {
        Set<String> reached = new LinkedHashSet<>();
        List<String> frontier = List.of(cubeName);
        reached.add(cubeName);
        while (!frontier.isEmpty()) {
            List<String> next = new ArrayList<>();
            for (String cube : frontier) {
                for (GraphEdge edge : graph.edgesFrom(cube)) {
                    if (reached.add(edge.toCube())) {
                        next.add(edge.toCube());
                    }
                }
            }
            frontier = next;
        }
        return reached;
    }

    private Search search(String fromCube, String toCube) {
        return memo.computeIfAbsent(fromCube + ":" + toCube, key -> breadthFirst(fromCube, toCube));
    }

    private Search breadthFirst(String fromCube, String toCube) {
        List<String> visited = new ArrayList<>();
        visited.add(fromCube);
        if (fromCube.equals(toCube)) {
            return new Search(new ResolvedPath(fromCube, toCube, List.of(), List.copyOf(visited)), List.copyOf(visited));
        }
        if (!graph.contains(fromCube)) {
            return new Search(null, List.copyOf(visited));
        }

        Set<String> settled = new LinkedHashSet<>(visited);
        Map<String, Label> frontier = new TreeMap<>();
        frontier.put(fromCube, new Label(List.of(), List.of(fromCube), 0));

        while (!frontier.isEmpty()) {
            Map<String, Label> next = new TreeMap<>();
            for (Map.Entry<String, Label> entry : frontier.entrySet()) {
                for (GraphEdge edge : graph.edgesFrom(entry.getKey())) {
                    String neighbour = edge.toCube();
                    if (settled.contains(neighbour)) {
                        continue;
                    }
                    Label candidate = entry.getValue().extend(edge);
                    Label current = next.get(neighbour);
                    if (current == null) {
                        visited.add(neighbour);
                        next.put(neighbour, candidate);
                    } else if (candidate.betterThan(current)) {
                        next.put(neighbour, candidate);
                    }
                }
            }
            settled.addAll(next.keySet());

            Label target = next.get(toCube);
            if (target != null) {
                ResolvedPath path = new ResolvedPath(fromCube, toCube, List.copyOf(target.edges()), List.copyOf(visited));
                log.debug("Join path {} -> {}: {} hop(s) via {}", fromCube, toCube, path.hops(), target.cubes());
                return new Search(path, path.visitedCubes());
            }
            frontier = next;
        }
        log.debug("No join path {} -> {} (visited {})", fromCube, toCube, visited);
        return new Search(null, List.copyOf(visited));
    }
}
