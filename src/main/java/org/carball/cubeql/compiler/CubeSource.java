package org.carball.cubeql.compiler;

import org.carball.cubeql.model.query.Filter;
import org.carball.cubeql.model.schema.Cube;
import org.carball.cubeql.model.schema.MemberRef;
import org.carball.cubeql.planner.ResolvedPath;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * FROM clause for the analysis modes: the cube an event stream lives in, joined to any other cube
 * its filters or breakdowns mention.
 */
final class CubeSource {

    private final CompilationContext context;
    private final JoinClauseBuilder joinBuilder;

    CubeSource(CompilationContext context) {
        this.context = context;
        this.joinBuilder = new JoinClauseBuilder(context);
    }

    /**
     * @param indent prefix for JOIN lines after the first line
     * @throws org.carball.cubeql.exception.PathNotFoundException when a mentioned cube cannot be joined
     */
    String from(String cubeName, Collection<String> members, String indent) {
        Cube cube = context.cube(cubeName);
        Set<String> others = new TreeSet<>();
        for (String member : members) {
            if (MemberRef.isQualified(member)) {
                others.add(MemberRef.parse(member).cubeName());
            }
        }
        others.remove(cubeName);

        List<ResolvedPath> paths = new ArrayList<>();
        for (String other : others) {
            paths.add(context.getResolver().resolve(cubeName, other));
        }
        StringBuilder from = new StringBuilder("FROM ").append(cube.getSqlTable()).append(" AS ").append(cube.alias());
        for (String clause : joinBuilder.build(cubeName, paths).clauses()) {
            from.append('\n').append(indent).append(clause);
        }
        return from.toString();
    }

    static Set<String> members(Collection<Filter> filters) {
        Set<String> members = new LinkedHashSet<>();
        if (filters != null) {
            filters.forEach(filter -> filter.forEachCondition(condition -> members.add(condition.getMember())));
        }
        return members;
    }
}
