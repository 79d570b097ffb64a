package org.carball.cubeql.planner;

import lombok.extern.slf4j.Slf4j;
import org.carball.cubeql.exception.PathNotFoundException;
import org.carball.cubeql.model.analysis.PrimaryCubeAnalysis;
import org.carball.cubeql.model.analysis.PrimaryCubeCandidate;
import org.carball.cubeql.model.query.SemanticQuery;
import org.carball.cubeql.model.schema.SchemaSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Runs primary-cube selection, path resolution and pre-aggregation planning for one query.
 */
@Slf4j
public class QueryPlanner {

    private final SchemaSnapshot snapshot;
    private final JoinPathResolver resolver;
    private final PrimaryCubeSelector selector;
    private final PreAggregationPlanner preAggregationPlanner;

    public QueryPlanner(SchemaSnapshot snapshot, JoinPathResolver resolver) {
        this.snapshot = snapshot;
        this.resolver = resolver;
        this.selector = new PrimaryCubeSelector(snapshot.getJoinGraph(), resolver);
        this.preAggregationPlanner = new PreAggregationPlanner(snapshot);
    }

    /**
     * @param strict when true a missing join path aborts planning; otherwise it is recorded
     * @throws PathNotFoundException in strict mode when a touched cube cannot be reached
     */
    public QueryPlan plan(SemanticQuery query, boolean strict) {
        CubeUsage usage = CubeUsage.of(query, snapshot);
        List<String> warnings = new ArrayList<>();

        PrimaryCubeAnalysis primary = selector.select(usage);
        if (usage.getCubes().size() > 1
                && primary.candidates().stream().noneMatch(PrimaryCubeCandidate::canReachAll)) {
            warnings.add("No cube can reach every other cube in the query; " + primary.selectedCube()
                    + " was chosen alphabetically");
        }

        String primaryCube = primary.selectedCube();
        Map<String, ResolvedPath> paths = new TreeMap<>();
        Map<String, List<String>> unresolved = new TreeMap<>();
        for (String cube : usage.getCubes()) {
            if (cube.equals(primaryCube)) {
                continue;
            }
            Optional<ResolvedPath> path = resolver.find(primaryCube, cube);
            if (path.isPresent()) {
                paths.put(cube, path.get());
            } else if (strict) {
                resolver.resolve(primaryCube, cube);
            } else {
                unresolved.put(cube, resolver.visitedCubes(primaryCube, cube));
            }
        }

        PreAggregationPlanner.Layout layout = preAggregationPlanner.plan(primaryCube, usage, paths.values());
        log.debug("Planned query on {}: {} join path(s), {} pre-aggregation(s)",
                primaryCube, paths.size(), layout.preAggregations().size());

        return new QueryPlan(usage, primary,
                Collections.unmodifiableMap(paths),
                Collections.unmodifiableMap(unresolved),
                layout.joins(),
                Collections.unmodifiableMap(layout.preAggregations()),
                List.copyOf(warnings));
    }

    public JoinPathResolver resolver() {
        return resolver;
    }
}
