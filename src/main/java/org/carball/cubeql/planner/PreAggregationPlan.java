package org.carball.cubeql.planner;

import org.carball.cubeql.model.schema.GraphEdge;
import org.carball.cubeql.model.schema.JoinColumn;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A CTE that aggregates everything beyond one to-many hop before it is joined. {@code joinEdge}
 * is that hop and the CTE is keyed by the columns it joins on. Cubes reached from the CTE's root
 * without another measure-carrying to-many hop are joined inside the CTE through
 * {@code innerJoins}; each further fan-out becomes a {@code nested} CTE joined there instead.
 *
 * @param measures   measures of the cubes joined directly in this CTE
 * @param dimensions requested dimensions of the cubes joined directly in this CTE
 * @param innerJoins hops joined inside this CTE, in join order, including the hops into nested CTEs
 */
public record PreAggregationPlan(
    String cubeName,
    String cteAlias,
    String reason,
    List<String> measures,
    List<String> dimensions,
    GraphEdge joinEdge,
    List<GraphEdge> innerJoins,
    List<PreAggregationPlan> nested
) {

    /**
     * Column pairs joining the previous cube to the CTE: previous-cube column on the left, CTE key
     * column on the right. For belongsToMany the CTE is keyed by the junction's columns.
     */
    public List<JoinColumn> outerJoinColumns() {
        return joinEdge.isManyToMany() ? joinEdge.junctionTable().getSourceColumns() : joinEdge.joinColumns();
    }

    public List<String> keyColumns() {
        return outerJoinColumns().stream().map(JoinColumn::targetColumn).toList();
    }

    /**
     * Human-readable join keys, e.g. {@code users.id = orders_agg.user_id}.
     */
    public List<String> joinKeyDescriptions(String previousAlias) {
        return outerJoinColumns().stream()
                .map(c -> previousAlias + "." + c.sourceColumn() + " = " + cteAlias + "." + c.targetColumn())
                .toList();
    }

    /**
     * Cubes whose tables are joined directly in this CTE, the root first.
     */
    public Set<String> levelCubes() {
        Set<String> cubes = new LinkedHashSet<>();
        cubes.add(cubeName);
        for (GraphEdge edge : innerJoins) {
            if (nestedRootedAt(edge.toCube()).isEmpty()) {
                cubes.add(edge.toCube());
            }
        }
        return cubes;
    }

    /**
     * Every cube aggregated by this CTE, nested CTEs included.
     */
    public Set<String> cubes() {
        Set<String> cubes = levelCubes();
        nested.forEach(child -> cubes.addAll(child.cubes()));
        return cubes;
    }

    /**
     * Every measure column this CTE outputs.
     */
    public List<String> allMeasures() {
        List<String> all = new ArrayList<>(measures);
        nested.forEach(child -> all.addAll(child.allMeasures()));
        return all;
    }

    public Optional<PreAggregationPlan> nestedRootedAt(String cube) {
        return nested.stream().filter(child -> child.cubeName().equals(cube)).findFirst();
    }

    /**
     * The nested CTE, at any depth, that aggregates a cube.
     */
    public Optional<PreAggregationPlan> nestedContaining(String cube) {
        return nested.stream().filter(child -> child.cubes().contains(cube)).findFirst();
    }

    /**
     * The CTE, this one or a nested one, that joins a cube's table directly.
     */
    public Optional<PreAggregationPlan> owning(String cube) {
        if (levelCubes().contains(cube)) {
            return Optional.of(this);
        }
        return nestedContaining(cube).flatMap(child -> child.owning(cube));
    }

    /**
     * This CTE and its nested ones, innermost first, so each can be declared after the ones it reads.
     */
    public List<PreAggregationPlan> inDeclarationOrder() {
        List<PreAggregationPlan> ordered = new ArrayList<>();
        nested.forEach(child -> ordered.addAll(child.inDeclarationOrder()));
        ordered.add(this);
        return ordered;
    }
}
