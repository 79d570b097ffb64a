package org.carball.cubeql.planner;

import org.carball.cubeql.model.analysis.PrimaryCubeAnalysis;
import org.carball.cubeql.model.schema.GraphEdge;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The planning decisions for one standard query: the anchor cube, a join path to every other
 * touched cube, the hops joined in the outer query and the CTEs aggregated ahead of the join.
 *
 * @param joins           hops joined in the outer query, in join order
 * @param preAggregations outermost CTEs by root cube; nested ones hang off them
 */
public record QueryPlan(
    CubeUsage usage,
    PrimaryCubeAnalysis primaryCube,
    Map<String, ResolvedPath> paths,
    Map<String, List<String>> unresolved,
    List<GraphEdge> joins,
    Map<String, PreAggregationPlan> preAggregations,
    List<String> warnings
) {

    public String primaryCubeName() {
        return primaryCube.selectedCube();
    }

    /**
     * The outermost CTE that aggregates a cube, if any.
     */
    public Optional<PreAggregationPlan> preAggregationFor(String cubeName) {
        return preAggregations.values().stream()
                .filter(plan -> plan.cubes().contains(cubeName))
                .findFirst();
    }

    /**
     * The CTE, at any depth, that joins a cube's table directly.
     */
    public Optional<PreAggregationPlan> owningPreAggregation(String cubeName) {
        return preAggregationFor(cubeName).flatMap(plan -> plan.owning(cubeName));
    }

    public boolean isPreAggregated(String cubeName) {
        return preAggregationFor(cubeName).isPresent();
    }

    /**
     * Every CTE, nested ones before the CTEs that read them.
     */
    public List<PreAggregationPlan> allPreAggregations() {
        List<PreAggregationPlan> all = new ArrayList<>();
        preAggregations.values().forEach(plan -> all.addAll(plan.inDeclarationOrder()));
        return all;
    }
}
