package org.carball.cubeql.compiler;

import org.carball.cubeql.model.schema.Cube;
import org.carball.cubeql.model.schema.GraphEdge;
import org.carball.cubeql.model.schema.JoinColumn;
import org.carball.cubeql.planner.PreAggregationPlan;
import org.carball.cubeql.planner.ResolvedPath;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns join hops into JOIN clauses. A pre-aggregated cube is joined through its CTE instead of
 * its table.
 */
public class JoinClauseBuilder {

    /**
     * JOIN lines, one per physical join, and how many there are.
     */
    public record Joins(List<String> clauses, int count) {

        public String sql() {
            return String.join("\n", clauses);
        }
    }

    private final CompilationContext context;

    public JoinClauseBuilder(CompilationContext context) {
        this.context = context;
    }

    /**
     * Joins every cube on the paths directly, shorter paths first.
     */
    public Joins build(String primaryCube, Collection<ResolvedPath> paths) {
        List<ResolvedPath> ordered = new ArrayList<>(paths);
        ordered.sort(Comparator.comparingInt(ResolvedPath::hops).thenComparing(ResolvedPath::toCube));

        Set<String> joined = new HashSet<>();
        joined.add(primaryCube);
        List<GraphEdge> edges = new ArrayList<>();
        for (ResolvedPath path : ordered) {
            for (GraphEdge edge : path.edges()) {
                if (joined.add(edge.toCube())) {
                    edges.add(edge);
                }
            }
        }
        return build(edges, Map.of());
    }

    /**
     * Joins hops in the given order. A hop into a cube that roots one of {@code ctes} joins the CTE
     * instead of the table.
     */
    public Joins build(List<GraphEdge> edges, Map<String, PreAggregationPlan> ctes) {
        List<String> clauses = new ArrayList<>();
        for (GraphEdge edge : edges) {
            PreAggregationPlan plan = ctes.get(edge.toCube());
            if (plan != null) {
                clauses.add(cteJoin(edge, plan));
            } else if (edge.isManyToMany()) {
                clauses.addAll(junctionJoins(edge));
            } else {
                clauses.add(directJoin(edge));
            }
        }
        return new Joins(List.copyOf(clauses), clauses.size());
    }

    private String cteJoin(GraphEdge edge, PreAggregationPlan plan) {
        String previous = alias(edge.fromCube());
        return edge.joinType().keyword() + " " + plan.cteAlias() + " ON "
                + on(previous, plan.cteAlias(), plan.outerJoinColumns());
    }

    private String directJoin(GraphEdge edge) {
        Cube target = context.cube(edge.toCube());
        return edge.joinType().keyword() + " " + target.getSqlTable() + " AS " + target.alias() + " ON "
                + on(alias(edge.fromCube()), target.alias(), edge.joinColumns());
    }

    private List<String> junctionJoins(GraphEdge edge) {
        Cube target = context.cube(edge.toCube());
        String junctionAlias = junctionAlias(edge.toCube());
        String keyword = edge.joinType().keyword();
        return List.of(
                keyword + " " + edge.junctionTable().getTable() + " AS " + junctionAlias + " ON "
                        + on(alias(edge.fromCube()), junctionAlias, edge.junctionTable().getSourceColumns()),
                keyword + " " + target.getSqlTable() + " AS " + target.alias() + " ON "
                        + on(junctionAlias, target.alias(), edge.junctionTable().getTargetColumns()));
    }

    public static String junctionAlias(String targetCube) {
        return "junction_" + targetCube.toLowerCase();
    }

    static String on(String leftAlias, String rightAlias, List<JoinColumn> columns) {
        List<String> conditions = columns.stream()
                .map(c -> leftAlias + "." + c.sourceColumn() + " = " + rightAlias + "." + c.targetColumn())
                .toList();
        return String.join(" AND ", conditions);
    }

    private String alias(String cubeName) {
        return context.cube(cubeName).alias();
    }
}
