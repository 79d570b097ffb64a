package org.carball.cubeql.planner;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.model.schema.Cube;
import org.carball.cubeql.model.schema.GraphEdge;
import org.carball.cubeql.model.schema.SchemaSnapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Decides which parts of a query are aggregated in CTEs before joining. The resolved paths are
 * merged into one join tree rooted at the primary cube. A to-many hop (hasMany or belongsToMany)
 * whose far side carries measures would repeat the rows on its near side and inflate every
 * aggregate over them, so the whole subtree behind it is aggregated in a CTE keyed by that hop's
 * join columns. The same rule applies again inside each CTE.
 */
@Slf4j
public class PreAggregationPlanner {

    /**
     * The hops joined in the outer query, in join order, and the CTEs those hops reach by root cube.
     */
    public record Layout(List<GraphEdge> joins, Map<String, PreAggregationPlan> preAggregations) {}

    private final SchemaSnapshot snapshot;

    public PreAggregationPlanner(SchemaSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    public Layout plan(String primaryCube, CubeUsage usage, Collection<ResolvedPath> paths) {
        Map<String, List<GraphEdge>> children = joinTree(primaryCube, paths);
        List<GraphEdge> joins = new ArrayList<>();
        List<PreAggregationPlan> plans = new ArrayList<>();
        walk(primaryCube, children, usage, joins, plans);

        Map<String, PreAggregationPlan> byCube = new TreeMap<>();
        plans.forEach(plan -> byCube.put(plan.cubeName(), plan));
        return new Layout(List.copyOf(joins), byCube);
    }

    /**
     * Outgoing hops per cube. Shorter paths are merged first, so a cube keeps the hop of the first
     * path that reaches it and shared prefixes appear once.
     */
    static Map<String, List<GraphEdge>> joinTree(String primaryCube, Collection<ResolvedPath> paths) {
        List<ResolvedPath> ordered = new ArrayList<>(paths);
        ordered.sort(Comparator.comparingInt(ResolvedPath::hops).thenComparing(ResolvedPath::toCube));

        Set<String> reached = new HashSet<>();
        reached.add(primaryCube);
        Map<String, List<GraphEdge>> children = new LinkedHashMap<>();
        for (ResolvedPath path : ordered) {
            for (GraphEdge edge : path.edges()) {
                if (reached.add(edge.toCube())) {
                    children.computeIfAbsent(edge.fromCube(), c -> new ArrayList<>()).add(edge);
                }
            }
        }
        return children;
    }

    /**
     * Collects the hops joined at one level below {@code cube}, opening a CTE at every to-many hop
     * whose subtree aggregates something.
     */
    private void walk(String cube, Map<String, List<GraphEdge>> children, CubeUsage usage,
                      List<GraphEdge> joins, List<PreAggregationPlan> plans) {
        for (GraphEdge edge : children.getOrDefault(cube, List.of())) {
            joins.add(edge);
            if (edge.type().isToMany() && carriesMeasures(edge.toCube(), children, usage)) {
                plans.add(preAggregate(edge, children, usage));
            } else {
                walk(edge.toCube(), children, usage, joins, plans);
            }
        }
    }

    private PreAggregationPlan preAggregate(GraphEdge fanOut, Map<String, List<GraphEdge>> children,
                                            CubeUsage usage) {
        String root = fanOut.toCube();
        List<GraphEdge> innerJoins = new ArrayList<>();
        List<PreAggregationPlan> nested = new ArrayList<>();
        walk(root, children, usage, innerJoins, nested);

        List<String> levelCubes = new ArrayList<>();
        levelCubes.add(root);
        for (GraphEdge edge : innerJoins) {
            if (nested.stream().noneMatch(child -> child.cubeName().equals(edge.toCube()))) {
                levelCubes.add(edge.toCube());
            }
        }
        List<String> measures = new ArrayList<>();
        List<String> dimensions = new ArrayList<>();
        for (String levelCube : levelCubes) {
            measures.addAll(usage.measuresOf(levelCube));
            dimensions.addAll(usage.dimensionsOf(levelCube));
        }

        Cube cube = snapshot.findCube(root).orElseThrow();
        PreAggregationPlan plan = new PreAggregationPlan(
                root,
                cube.alias() + "_agg",
                String.format("%s relationship from %s - requires pre-aggregation to prevent row duplication (fan-out)",
                        fanOut.type().getValue(), fanOut.fromCube()),
                List.copyOf(measures),
                List.copyOf(dimensions),
                fanOut,
                List.copyOf(innerJoins),
                List.copyOf(nested));
        log.debug("Pre-aggregating {} as {} over {}: {}", root, plan.cteAlias(), plan.cubes(), plan.reason());
        return plan;
    }

    private static boolean carriesMeasures(String cube, Map<String, List<GraphEdge>> children, CubeUsage usage) {
        if (!usage.measuresOf(cube).isEmpty()) {
            return true;
        }
        return children.getOrDefault(cube, List.of()).stream()
                .anyMatch(edge -> carriesMeasures(edge.toCube(), children, usage));
    }
}
