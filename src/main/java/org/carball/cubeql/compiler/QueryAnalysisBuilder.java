package org.carball.cubeql.compiler;

import org.carball.cubeql.model.analysis.JoinPathAnalysis;
import org.carball.cubeql.model.analysis.JoinPathStep;
import org.carball.cubeql.model.analysis.PreAggregationAnalysis;
import org.carball.cubeql.model.analysis.QueryAnalysis;
import org.carball.cubeql.model.analysis.QuerySummary;
import org.carball.cubeql.model.analysis.QueryType;
import org.carball.cubeql.model.schema.GraphEdge;
import org.carball.cubeql.planner.PreAggregationPlan;
import org.carball.cubeql.planner.QueryPlan;
import org.carball.cubeql.planner.ResolvedPath;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Describes a query plan for people: the primary cube decision, every join path with the cubes
 * the search visited, the pre-aggregation CTEs and a summary of the query's shape.
 */
public class QueryAnalysisBuilder {

    private final CompilationContext context;

    public QueryAnalysisBuilder(CompilationContext context) {
        this.context = context;
    }

    public QueryAnalysis build(QueryPlan plan, int joinCount, List<String> warnings) {
        List<String> cubes = List.copyOf(plan.usage().getCubes());

        Map<String, JoinPathAnalysis> joinPaths = new TreeMap<>();
        plan.paths().forEach((cube, path) -> joinPaths.put(cube, found(path)));
        plan.unresolved().forEach((cube, visited) -> joinPaths.put(cube, new JoinPathAnalysis(
                cube, false, null, 0, visited,
                String.format("No join path found from '%s' to '%s'. Ensure the target cube has a relationship "
                        + "defined (belongsTo, hasOne, hasMany, or belongsToMany).", plan.primaryCubeName(), cube))));

        List<PreAggregationAnalysis> preAggregations = new ArrayList<>();
        for (PreAggregationPlan preAggregation : plan.allPreAggregations()) {
            String previousAlias = context.cube(preAggregation.joinEdge().fromCube()).alias();
            preAggregations.add(new PreAggregationAnalysis(
                    preAggregation.cubeName(),
                    preAggregation.cteAlias(),
                    preAggregation.reason(),
                    preAggregation.measures(),
                    preAggregation.joinKeyDescriptions(previousAlias)));
        }

        QueryType queryType;
        if (cubes.size() <= 1) {
            queryType = QueryType.SINGLE_CUBE;
        } else if (!preAggregations.isEmpty()) {
            queryType = QueryType.MULTI_CUBE_CTE;
        } else {
            queryType = QueryType.MULTI_CUBE_JOIN;
        }

        return new QueryAnalysis(
                context.getClock().instant(),
                cubes.size(),
                cubes,
                plan.primaryCube(),
                List.copyOf(joinPaths.values()),
                List.copyOf(preAggregations),
                new QuerySummary(queryType, joinCount, preAggregations.size(), !preAggregations.isEmpty()),
                List.copyOf(warnings));
    }

    private JoinPathAnalysis found(ResolvedPath path) {
        List<JoinPathStep> steps = new ArrayList<>();
        for (GraphEdge edge : path.edges()) {
            String relationship = edge.type().getValue();
            String joinType = edge.joinType().value();
            if (edge.isManyToMany()) {
                String junction = edge.junctionTable().getTable();
                steps.add(new JoinPathStep(edge.fromCube(), junction, relationship, joinType,
                        edge.junctionTable().getSourceColumns(), junction));
                steps.add(new JoinPathStep(junction, edge.toCube(), relationship, joinType,
                        edge.junctionTable().getTargetColumns(), junction));
            } else {
                steps.add(new JoinPathStep(edge.fromCube(), edge.toCube(), relationship, joinType,
                        edge.joinColumns(), null));
            }
        }
        return new JoinPathAnalysis(path.toCube(), true, List.copyOf(steps), steps.size(), path.visitedCubes(), null);
    }
}
