package org.carball.cubeql.planner;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.model.analysis.PrimaryCubeAnalysis;
import org.carball.cubeql.model.analysis.PrimaryCubeCandidate;
import org.carball.cubeql.model.analysis.SelectionReason;
import org.carball.cubeql.model.schema.JoinGraph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Chooses the cube that anchors the FROM clause. Candidates that cannot reach every other touched
 * cube are ruled out; the rest are ranked by requested dimensions, then by relationships to the
 * other touched cubes, then by name.
 */
@Slf4j
public class PrimaryCubeSelector {

    private final JoinGraph graph;
    private final JoinPathResolver resolver;

    public PrimaryCubeSelector(JoinGraph graph, JoinPathResolver resolver) {
        this.graph = graph;
        this.resolver = resolver;
    }

    public PrimaryCubeAnalysis select(CubeUsage usage) {
        Set<String> touched = usage.getCubes();
        if (touched.isEmpty()) {
            throw new IllegalArgumentException("Query does not reference any cube");
        }

        List<PrimaryCubeCandidate> candidates = new ArrayList<>();
        for (String cube : touched) {
            int dimensions = usage.dimensionsOf(cube).size();
            int joins = (int) touched.stream()
                    .filter(other -> !other.equals(cube))
                    .filter(other -> graph.edge(cube, other).isPresent())
                    .count();
            boolean canReachAll = resolver.reachableFrom(cube).containsAll(touched);
            candidates.add(new PrimaryCubeCandidate(cube, dimensions, joins, canReachAll));
        }
        candidates.sort(Comparator.comparing(PrimaryCubeCandidate::cubeName));
        List<PrimaryCubeCandidate> ranked = List.copyOf(candidates);

        if (touched.size() == 1) {
            String only = touched.iterator().next();
            return result(only, SelectionReason.SINGLE_CUBE,
                    only + " is the only cube referenced by the query", ranked);
        }

        List<PrimaryCubeCandidate> reachable = ranked.stream().filter(PrimaryCubeCandidate::canReachAll).toList();
        if (reachable.isEmpty()) {
            String fallback = ranked.get(0).cubeName();
            return result(fallback, SelectionReason.ALPHABETICAL_FALLBACK,
                    "No cube can reach every other cube in the query; " + fallback + " chosen alphabetically", ranked);
        }

        int maxDimensions = reachable.stream().mapToInt(PrimaryCubeCandidate::dimensionCount).max().orElse(0);
        List<PrimaryCubeCandidate> pool = reachable.stream()
                .filter(c -> c.dimensionCount() == maxDimensions)
                .toList();
        if (maxDimensions > 0 && pool.size() == 1) {
            String winner = pool.get(0).cubeName();
            return result(winner, SelectionReason.MOST_DIMENSIONS,
                    String.format("%s has the most requested dimensions (%d)", winner, maxDimensions), ranked);
        }

        int maxJoins = pool.stream().mapToInt(PrimaryCubeCandidate::joinCount).max().orElse(0);
        List<PrimaryCubeCandidate> connected = pool.stream()
                .filter(c -> c.joinCount() == maxJoins)
                .toList();
        if (connected.size() == 1) {
            String winner = connected.get(0).cubeName();
            return result(winner, SelectionReason.MOST_CONNECTED,
                    String.format("%s has the most relationships to other cubes in the query (%d)", winner, maxJoins),
                    ranked);
        }

        String winner = connected.get(0).cubeName();
        return result(winner, SelectionReason.ALPHABETICAL_FALLBACK,
                String.format("%s is alphabetically first among %d equally ranked candidates", winner, connected.size()),
                ranked);
    }

    private PrimaryCubeAnalysis result(String cube, SelectionReason reason, String explanation,
                                       List<PrimaryCubeCandidate> candidates) {
        log.debug("Primary cube {} ({}): {}", cube, reason.value(), explanation);
        return new PrimaryCubeAnalysis(cube, reason, explanation, candidates);
    }
}
