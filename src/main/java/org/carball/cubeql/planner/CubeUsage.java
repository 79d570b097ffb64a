package org.carball.cubeql.planner;

import lombok.Getter;
import org.carball.cubeql.model.query.Filter;
import org.carball.cubeql.model.query.SemanticQuery;
import org.carball.cubeql.model.query.TimeDimension;
import org.carball.cubeql.model.schema.Measure;
import org.carball.cubeql.model.schema.MeasureReferences;
import org.carball.cubeql.model.schema.MeasureType;
import org.carball.cubeql.model.schema.MemberRef;
import org.carball.cubeql.model.schema.SchemaSnapshot;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Which cubes a query touches and what it needs from each. Calculated measures are expanded to
 * the measures they aggregate, and measures used only in filters are counted too.
 */
@Getter
public final class CubeUsage {

    private final Set<String> cubes = new TreeSet<>();
    private final Map<String, Set<String>> dimensionsByCube = new TreeMap<>();
    private final Map<String, Set<String>> measuresByCube = new TreeMap<>();
    private final Set<String> filterMembers = new LinkedHashSet<>();

    private CubeUsage() {
    }

    public static CubeUsage of(SemanticQuery query, SchemaSnapshot snapshot) {
        CubeUsage usage = new CubeUsage();
        nullSafe(query.getMeasures()).forEach(measure -> usage.addMeasure(measure, snapshot));
        nullSafe(query.getDimensions()).forEach(usage::addDimension);
        for (TimeDimension timeDimension : nullSafe(query.getTimeDimensions())) {
            usage.addDimension(timeDimension.getDimension());
        }
        for (Filter filter : nullSafe(query.getFilters())) {
            filter.forEachCondition(condition -> {
                String member = condition.getMember();
                if (!MemberRef.isQualified(member)) {
                    return;
                }
                usage.filterMembers.add(member);
                if (snapshot.isMeasure(member)) {
                    usage.addMeasure(member, snapshot);
                } else {
                    usage.cubes.add(MemberRef.parse(member).cubeName());
                }
            });
        }
        return usage;
    }

    /**
     * Non-calculated measures a member aggregates, itself included when it is one.
     */
    public static Set<String> leafMeasures(String member, SchemaSnapshot snapshot) {
        Set<String> leaves = new LinkedHashSet<>();
        collectLeaves(member, snapshot, leaves, new LinkedHashSet<>());
        return leaves;
    }

    public Set<String> dimensionsOf(String cubeName) {
        return dimensionsByCube.getOrDefault(cubeName, Set.of());
    }

    public Set<String> measuresOf(String cubeName) {
        return measuresByCube.getOrDefault(cubeName, Set.of());
    }

    public Set<String> getCubes() {
        return Collections.unmodifiableSet(cubes);
    }

    private void addMeasure(String member, SchemaSnapshot snapshot) {
        if (!MemberRef.isQualified(member)) {
            return;
        }
        cubes.add(MemberRef.parse(member).cubeName());
        for (String leaf : leafMeasures(member, snapshot)) {
            String cube = MemberRef.parse(leaf).cubeName();
            cubes.add(cube);
            measuresByCube.computeIfAbsent(cube, c -> new LinkedHashSet<>()).add(leaf);
        }
    }

    private void addDimension(String member) {
        if (!MemberRef.isQualified(member)) {
            return;
        }
        String cube = MemberRef.parse(member).cubeName();
        cubes.add(cube);
        dimensionsByCube.computeIfAbsent(cube, c -> new LinkedHashSet<>()).add(member);
    }

    private static void collectLeaves(String member, SchemaSnapshot snapshot, Set<String> leaves, Set<String> visiting) {
        if (!visiting.add(member)) {
            return;
        }
        Measure measure = snapshot.findMeasure(member).orElse(null);
        if (measure == null) {
            return;
        }
        if (measure.getType() != MeasureType.CALCULATED) {
            leaves.add(member);
            return;
        }
        String cubeName = MemberRef.parse(member).cubeName();
        for (String reference : MeasureReferences.of(cubeName, measure.getCalculatedSql())) {
            collectLeaves(reference, snapshot, leaves, visiting);
        }
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
